package com.pagemodel.generator.codegen.testid;

import org.junit.jupiter.api.Test;

import com.pagemodel.generator.codegen.EngineConfig;
import com.pagemodel.generator.codegen.ExistingIdBehavior;
import com.pagemodel.generator.codegen.TestIdEngine;
import com.pagemodel.generator.codegen.TestIdGenerationException;
import com.pagemodel.generator.codegen.pom.PomSpec;
import com.pagemodel.generator.codegen.pom.UnitAggregate;
import com.pagemodel.generator.model.ElementNode;
import com.pagemodel.generator.model.RootNode;
import com.pagemodel.generator.parser.TemplateParser;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for handling identifiers the author already wrote.
 */
class ExistingIdentifierPolicyTest {

    private static final String KEYED_ROW = "<ul><li v-for=\"item in items\" :key=\"item.id\">"
            + "<button %s @click=\"open(item)\">o</button></li></ul>";

    @Test
    void testLiteralIsEchoedVerbatim() {
        RootNode root = parse("<button data-testid=\"custom-save\" @click=\"save\">Save</button>");

        UnitAggregate foo = compile(ExistingIdBehavior.PRESERVE, root);

        assertThat(foo.getAllIdentifiers()).containsExactly("custom-save");
        assertThat(foo.getEntries().get(0).isFromExisting()).isTrue();
        assertThat(foo.getEmittedPrimaries().get(0).getActionName()).isEqualTo("clickSave");
        assertThat(root.firstElement().attributeValue("data-testid")).isEqualTo("custom-save");
    }

    @Test
    void testBoundStringLiteralIsPreserved() {
        UnitAggregate foo = compile(ExistingIdBehavior.PRESERVE,
                parse("<button :data-testid=\"'custom-save'\" @click=\"save\">Save</button>"));

        assertThat(foo.getAllIdentifiers()).containsExactly("custom-save");
    }

    @Test
    void testSingleKeyedTemplateIsPreserved() {
        UnitAggregate foo = compile(ExistingIdBehavior.PRESERVE,
                parse(String.format(KEYED_ROW, ":data-testid=\"`row-${item.id}`\"")));

        PomSpec spec = foo.getEmittedPrimaries().get(0);
        assertThat(spec.getIdentifier().isTemplate()).isTrue();
        assertThat(spec.getIdentifier().getText()).isEqualTo("row-${item.id}");
        assertThat(spec.getPattern()).isEqualTo("row-${key}");
    }

    @Test
    void testTemplateWithoutRequiredKeyThrows() {
        assertThatThrownBy(() -> compile(ExistingIdBehavior.PRESERVE,
                parse(String.format(KEYED_ROW, ":data-testid=\"`row-${index}`\""))))
                .isInstanceOf(TestIdGenerationException.class)
                .hasMessageContaining("${item.id}");
    }

    @Test
    void testMultipleSubstitutionsThrow() {
        assertThatThrownBy(() -> compile(ExistingIdBehavior.PRESERVE,
                parse(String.format(KEYED_ROW, ":data-testid=\"`row-${item.id}-${item.kind}`\""))))
                .isInstanceOf(TestIdGenerationException.class)
                .hasMessageContaining("multiple interpolations")
                .isInstanceOfSatisfying(TestIdGenerationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(TestIdGenerationException.Kind.EXISTING_ID_NOT_PRESERVABLE));
    }

    @Test
    void testDynamicExpressionThrows() {
        assertThatThrownBy(() -> compile(ExistingIdBehavior.PRESERVE,
                parse("<button :data-testid=\"buttonId\" @click=\"save\">Save</button>")))
                .isInstanceOf(TestIdGenerationException.class)
                .hasMessageContaining("dynamic")
                .hasMessageContaining("Foo");
    }

    @Test
    void testErrorPolicyRejectsAnyExistingIdentifier() {
        assertThatThrownBy(() -> compile(ExistingIdBehavior.ERROR,
                parse("<button data-testid=\"custom-save\" @click=\"save\">Save</button>")))
                .isInstanceOf(TestIdGenerationException.class)
                .hasMessageContaining("existingIdBehavior=\"error\"")
                .isInstanceOfSatisfying(TestIdGenerationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(TestIdGenerationException.Kind.EXISTING_ID_FORBIDDEN));
    }

    @Test
    void testOverwriteReplacesExistingIdentifier() {
        RootNode root = parse("<button :data-testid=\"buttonId\" @click=\"save\">Save</button>");

        UnitAggregate foo = compile(ExistingIdBehavior.OVERWRITE, root);

        ElementNode button = root.firstElement();
        assertThat(foo.getAllIdentifiers()).containsExactly("Foo-Save-button");
        assertThat(button.findBinding("data-testid")).isNull();
        assertThat(button.attributeValue("data-testid")).isEqualTo("Foo-Save-button");
    }

    @Test
    void testExistingIdentifierOnInteractiveTagBecomesMember() {
        UnitAggregate foo = compile(ExistingIdBehavior.PRESERVE,
                parse("<form><input id=\"user-name\" data-testid=\"login-user\"></form>"));

        PomSpec spec = foo.getEmittedPrimaries().get(0);
        assertThat(spec.getIdentifier().getText()).isEqualTo("login-user");
        assertThat(spec.getActionName()).isEqualTo("typeUserName");
    }

    @Test
    void testExistingIdentifierOnNonInteractiveTagIsIgnored() {
        UnitAggregate foo = compile(ExistingIdBehavior.PRESERVE, parse("<div data-testid=\"panel\"><p>x</p></div>"));

        assertThat(foo.getEntries()).isEmpty();
    }

    private static RootNode parse(String template) {
        return TemplateParser.parseTemplate("Foo.vue", template);
    }

    private static UnitAggregate compile(ExistingIdBehavior behavior, RootNode root) {
        EngineConfig config = EngineConfig.builder().existingIdBehavior(behavior).build();
        return new TestIdEngine(config).compile("Foo", "Foo.vue", root).orElseThrow();
    }
}
