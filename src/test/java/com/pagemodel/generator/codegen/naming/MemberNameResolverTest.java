package com.pagemodel.generator.codegen.naming;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.pagemodel.generator.codegen.NameCollisionBehavior;
import com.pagemodel.generator.codegen.TestIdGenerationException;
import com.pagemodel.generator.codegen.pom.MethodSignature;
import com.pagemodel.generator.codegen.pom.PomParameter;
import com.pagemodel.generator.codegen.pom.UnitAggregate;
import com.pagemodel.generator.codegen.role.Role;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MemberNameResolver.
 */
class MemberNameResolverTest {

    private UnitAggregate aggregate;

    @BeforeEach
    void setUp() {
        aggregate = new UnitAggregate("Foo", "Foo.vue", false);
    }

    @Test
    void testBaseNameFallsBackToRole() {
        assertThat(MemberNameResolver.baseName(null, Role.BUTTON)).isEqualTo("Button");
        assertThat(MemberNameResolver.baseName(" -", Role.VSELECT)).isEqualTo("Vselect");
        assertThat(MemberNameResolver.baseName("save-draft", Role.BUTTON)).isEqualTo("SaveDraft");
        assertThat(MemberNameResolver.baseName("2fa code", Role.INPUT)).isEqualTo("Value2faCode");
    }

    @Test
    void testActionVerbs() {
        assertThat(MemberNameResolver.actionName("Home", Role.BUTTON, true)).isEqualTo("goToHome");
        assertThat(MemberNameResolver.actionName("Email", Role.INPUT, false)).isEqualTo("typeEmail");
        assertThat(MemberNameResolver.actionName("Country", Role.VSELECT, false)).isEqualTo("selectCountry");
        assertThat(MemberNameResolver.actionName("", Role.RADIO, false)).isEqualTo("selectRadio");
        assertThat(MemberNameResolver.actionName("Agree", Role.CHECKBOX, false)).isEqualTo("clickAgree");
    }

    @Test
    void testGetterNames() {
        assertThat(MemberNameResolver.getterName("Save", Role.BUTTON, false)).isEqualTo("SaveButton");
        assertThat(MemberNameResolver.getterName("SaveButton", Role.BUTTON, false)).isEqualTo("SaveButton");
        assertThat(MemberNameResolver.getterName("Button3", Role.BUTTON, false)).isEqualTo("Button3");
        assertThat(MemberNameResolver.getterName("RowsByKey", Role.BUTTON, true)).isEqualTo("RowsButton");
    }

    @Test
    void testResolvedNamesAreReserved() {
        ResolvedMemberNames names = resolver(NameCollisionBehavior.SUFFIX).resolve(request("Save").build(), aggregate);

        assertThat(names.getGetterName()).isEqualTo("SaveButton");
        assertThat(names.getActionName()).isEqualTo("clickSave");
        assertThat(names.isMerged()).isFalse();
        assertThat(aggregate.isReserved("SaveButton")).isTrue();
        assertThat(aggregate.isReserved("clickSave")).isTrue();
    }

    @Test
    void testWarnPolicySuffixesLikeSuffixPolicy() {
        MemberNameResolver resolver = resolver(NameCollisionBehavior.WARN);
        resolver.resolve(request("Save").build(), aggregate);

        ResolvedMemberNames second = resolver.resolve(request("Save").build(), aggregate);

        assertThat(second.getGetterName()).isEqualTo("Save2Button");
        assertThat(second.getActionName()).isEqualTo("clickSave2");
    }

    @Test
    void testLedgerSignatureConflict() {
        aggregate.getLedger().register("clickSave", MethodSignature.of(PomParameter.text()));

        ResolvedMemberNames names = resolver(NameCollisionBehavior.SUFFIX)
                .resolve(request("Save").signature(MethodSignature.of()).build(), aggregate);

        assertThat(names.getActionName()).isEqualTo("clickSave2");
    }

    @Test
    void testSameSignatureInLedgerIsNoConflict() {
        aggregate.getLedger().register("clickSave", MethodSignature.of());

        ResolvedMemberNames names = resolver(NameCollisionBehavior.SUFFIX)
                .resolve(request("Save").signature(MethodSignature.of()).build(), aggregate);

        assertThat(names.getActionName()).isEqualTo("clickSave");
    }

    @Test
    void testKeyedGetterKeepsMarkerWhenPlainGetterIsTaken() {
        MemberNameResolver resolver = resolver(NameCollisionBehavior.SUFFIX);
        resolver.resolve(request("Rows").build(), aggregate);

        ResolvedMemberNames keyed = resolver.resolve(request("Rows").keyed(true).build(), aggregate);

        assertThat(keyed.getGetterName()).isEqualTo("RowsByKeyButton");
        assertThat(keyed.getActionName()).isEqualTo("clickRowsByKey");
    }

    @Test
    void testKeyedEntriesNeverMerge() {
        MemberNameResolver resolver = resolver(NameCollisionBehavior.SUFFIX);
        ResolvedMemberNames first = resolver.resolve(request("Open").keyed(true).mergeKey("click:hint:Open").build(),
                aggregate);
        aggregate.indexPrimary(spec(first, "click:hint:Open"));

        ResolvedMemberNames second = resolver.resolve(request("Open").keyed(true).mergeKey("click:hint:Open").build(),
                aggregate);

        assertThat(second.isMerged()).isFalse();
        assertThat(second.getActionName()).isEqualTo("clickOpen2ByKey");
    }

    @Test
    void testSameMergeKeyMerges() {
        MemberNameResolver resolver = resolver(NameCollisionBehavior.ERROR);
        ResolvedMemberNames first = resolver.resolve(request("Open").mergeKey("click:hint:Open").build(), aggregate);
        aggregate.indexPrimary(spec(first, "click:hint:Open"));

        ResolvedMemberNames second = resolver.resolve(
                request("Open").mergeKey("click:hint:Open").pattern("Foo-Open-2-button").build(), aggregate);

        assertThat(second.isMerged()).isTrue();
        assertThat(second.getActionName()).isEqualTo("clickOpen");
        assertThat(second.getMergedInto().getAlternatePatterns()).containsExactly("Foo-Open-2-button");
    }

    @Test
    void testErrorPolicyTriesAlternateHint() {
        MemberNameResolver resolver = resolver(NameCollisionBehavior.ERROR);
        resolver.resolve(request("Save").build(), aggregate);

        ResolvedMemberNames names = resolver.resolve(request("Save").alternateHint("Save details").build(), aggregate);

        assertThat(names.getActionName()).isEqualTo("clickSaveDetails");
    }

    @Test
    void testSuffixLoopIsBounded() {
        MemberNameResolver resolver = new MemberNameResolver(NameCollisionBehavior.SUFFIX, 2);
        resolver.resolve(request(null).build(), aggregate);
        resolver.resolve(request(null).build(), aggregate);

        assertThatThrownBy(() -> resolver.resolve(request(null).build(), aggregate))
                .isInstanceOf(TestIdGenerationException.class)
                .hasMessageContaining("No free numeric suffix up to 2");
    }

    private static MemberNameResolver resolver(NameCollisionBehavior behavior) {
        return new MemberNameResolver(behavior, 1000);
    }

    private static NameRequest.NameRequestBuilder request(String hint) {
        return NameRequest.builder()
                .hint(hint)
                .role(Role.BUTTON)
                .unitName("Foo")
                .fileName("Foo.vue");
    }

    private static com.pagemodel.generator.codegen.pom.PomSpec spec(ResolvedMemberNames names, String mergeKey) {
        return com.pagemodel.generator.codegen.pom.PomSpec.builder()
                .role(Role.BUTTON)
                .baseName(names.getBaseName())
                .getterName(names.getGetterName())
                .actionName(names.getActionName())
                .pattern("Foo-Open-button")
                .mergeKey(mergeKey)
                .build();
    }
}
