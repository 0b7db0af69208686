package com.pagemodel.generator.codegen.pom;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.pagemodel.generator.codegen.role.Role;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the generated-method ledger and the unit aggregate bookkeeping.
 */
class GeneratedMethodLedgerTest {

    @Test
    void testSecondSignatureMakesNameAmbiguous() {
        GeneratedMethodLedger ledger = new GeneratedMethodLedger();
        ledger.register("clickSave", MethodSignature.of());
        ledger.register("clickSave", MethodSignature.of());

        assertThat(ledger.isAmbiguous("clickSave")).isFalse();
        assertThat(ledger.signatureOf("clickSave")).contains(MethodSignature.of());

        ledger.register("clickSave", MethodSignature.of(PomParameter.key(null)));
        ledger.register("clickSave", MethodSignature.of());

        assertThat(ledger.isAmbiguous("clickSave")).isTrue();
        assertThat(ledger.signatureOf("clickSave")).isEmpty();
        assertThat(ledger.conflicts("clickSave", MethodSignature.of())).isTrue();
        assertThat(ledger.conflicts("clickOther", MethodSignature.of())).isFalse();
    }

    @Test
    void testKeyParameterWithLiteralValues() {
        assertThat(PomParameter.key(List.of("One", "T\"wo")).getType()).isEqualTo("\"One\" | \"T\\\"wo\"");
        assertThat(PomParameter.key(null).getType()).isEqualTo("string");
        assertThat(PomParameter.timeOut().toString()).isEqualTo("timeOut: number = 500");
    }

    @Test
    void testUniqueMethodNamesSkipReservedAndLedgerNames() {
        UnitAggregate aggregate = new UnitAggregate("Foo", "Foo.vue", false);
        aggregate.reserve("clickSave");
        aggregate.getLedger().register("clickSave2", MethodSignature.of());

        assertThat(aggregate.reserveUniqueMethodName("clickSave")).isEqualTo("clickSave3");
        assertThat(aggregate.isReserved("clickSave3")).isTrue();
    }

    @Test
    void testStructurallyEqualMembersAreRecordedOnce() {
        UnitAggregate aggregate = new UnitAggregate("Foo", "Foo.vue", false);
        PomExtraMethod method = PomExtraMethod.builder()
                .name("selectPlanOne")
                .pattern("Foo-Plan_One_radio")
                .parameter(PomParameter.annotationText())
                .build();

        assertThat(aggregate.addExtraMethod(method)).isTrue();
        assertThat(aggregate.hasExtraMethod(method.toBuilder().name("selectPlanOne2").build())).isTrue();
        assertThat(aggregate.addExtraMethod(method.toBuilder().name("selectPlanOne2").build())).isFalse();

        PomSpec spec = PomSpec.builder().role(Role.BUTTON).baseName("Save").getterName("SaveButton")
                .actionName("clickSave").pattern("Foo-Save-button").build();
        assertThat(aggregate.registerPrimaryOnce(spec)).isTrue();
        assertThat(aggregate.registerPrimaryOnce(spec)).isFalse();
        assertThat(aggregate.getPrimaries()).hasSize(1);
        assertThat(aggregate.getExtraMethods()).hasSize(1);
    }
}
