package com.pagemodel.generator.codegen;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.pagemodel.generator.codegen.pom.GeneratedIdentifierEntry;
import com.pagemodel.generator.codegen.pom.PomExtraMethod;
import com.pagemodel.generator.codegen.pom.PomSpec;
import com.pagemodel.generator.codegen.pom.UnitAggregate;
import com.pagemodel.generator.codegen.role.RoleConfig;
import com.pagemodel.generator.codegen.routing.RouteNameTargetResolver;
import com.pagemodel.generator.model.ElementNode;
import com.pagemodel.generator.model.RootNode;
import com.pagemodel.generator.parser.TemplateParser;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TestIdEngine: identifier synthesis and page-object members of a unit.
 */
class TestIdEngineTest {

    @Test
    void testClickHandlerNamesMembers() {
        UnitAggregate foo = compile(EngineConfig.defaults(), "<button @click=\"() => save()\">Save</button>");

        PomSpec spec = single(foo.getEmittedPrimaries());
        assertThat(spec.getActionName()).isEqualTo("clickSave");
        assertThat(spec.getGetterName()).isEqualTo("SaveButton");
        assertThat(spec.getIdentifier().getText()).isEqualTo("Foo-Save-button");
        assertThat(spec.getParameters()).isEmpty();
        assertThat(foo.getAllIdentifiers()).containsExactly("Foo-Save-button");
    }

    @Test
    void testIdentifierIsWrittenToTheElement() {
        RootNode root = TemplateParser.parseTemplate("Foo.vue", "<button @click=\"onSave\">Save</button>");

        new TestIdEngine(EngineConfig.defaults()).compile("Foo", "Foo.vue", root);

        assertThat(root.firstElement().attributeValue("data-testid")).isEqualTo("Foo-Save-button");
    }

    @Test
    void testCustomIdentifierAttribute() {
        EngineConfig config = EngineConfig.builder().identifierAttributeName("data-qa").build();
        RootNode root = TemplateParser.parseTemplate("Foo.vue", "<button @click=\"save\">Save</button>");

        new TestIdEngine(config).compile("Foo", "Foo.vue", root);

        assertThat(root.firstElement().attributeValue("data-qa")).isEqualTo("Foo-Save-button");
        assertThat(root.firstElement().findAttribute("data-testid")).isNull();
    }

    @Test
    void testHintlessButtonsAreSuffixed() {
        UnitAggregate foo = compile(EngineConfig.defaults(),
                "<div><button @click=\"\">A</button><button @click=\"\">B</button></div>");

        assertThat(foo.getEmittedPrimaries()).extracting(PomSpec::getGetterName).containsExactly("Button", "Button2");
        assertThat(foo.getEmittedPrimaries()).extracting(PomSpec::getActionName)
                .containsExactly("clickButton", "clickButton2");
    }

    @Test
    void testCollisionUnderErrorPolicyNamesBothMembers() {
        EngineConfig config = EngineConfig.builder().nameCollisionBehavior(NameCollisionBehavior.ERROR).build();

        assertThatThrownBy(() -> compile(config,
                "<div><button @click=\"\">A</button><button @click=\"\">B</button></div>"))
                .isInstanceOf(TestIdGenerationException.class)
                .hasMessageContaining("getter=Button")
                .hasMessageContaining("method=clickButton")
                .hasMessageContaining("Foo")
                .isInstanceOfSatisfying(TestIdGenerationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(TestIdGenerationException.Kind.NAME_COLLISION));
    }

    @Test
    void testErrorPolicyFallsBackToRoleSuffixedHint() {
        EngineConfig config = EngineConfig.builder().nameCollisionBehavior(NameCollisionBehavior.ERROR).build();

        UnitAggregate foo = compile(config,
                "<div><checkbox @click=\"close\">A</checkbox><button @click=\"close\">B</button></div>");

        assertThat(foo.getEmittedPrimaries()).extracting(PomSpec::getActionName)
                .containsExactly("clickClose", "clickCloseButton");
        assertThat(foo.getEmittedPrimaries()).extracting(PomSpec::getGetterName)
                .containsExactly("CloseCheckbox", "CloseButton");
    }

    @Test
    void testSameNavigationTargetIsMerged() {
        EngineConfig config = EngineConfig.builder()
                .navigationTargetResolver(new RouteNameTargetResolver(Map.of("Home", "HomePage")))
                .build();

        UnitAggregate foo = compile(config, "<nav>"
                + "<router-link :to=\"{ name: 'Home' }\">Home</router-link>"
                + "<router-link :to=\"{ name: 'Home' }\">Go home</router-link>"
                + "</nav>");

        PomSpec spec = single(foo.getEmittedPrimaries());
        assertThat(spec.getActionName()).isEqualTo("goToHome");
        assertThat(spec.getTarget()).isEqualTo("HomePage");
        assertThat(spec.getPattern()).isEqualTo("Foo-Home-routerlink");
        assertThat(spec.getAlternatePatterns()).containsExactly("Foo-Home-Go-home-routerlink");
        assertThat(foo.getEntries()).hasSize(2);
        assertThat(foo.getAllIdentifiers()).containsExactly("Foo-Home-Go-home-routerlink", "Foo-Home-routerlink");
    }

    @Test
    void testDifferentTargetsAreNotMerged() {
        EngineConfig config = EngineConfig.builder()
                .navigationTargetResolver(new RouteNameTargetResolver(Map.of("Home", "HomePage")))
                .build();

        UnitAggregate foo = compile(config, "<nav>"
                + "<router-link :to=\"{ name: 'Home' }\">Home</router-link>"
                + "<router-link :to=\"'/home'\">Home</router-link>"
                + "</nav>");

        assertThat(foo.getEmittedPrimaries()).hasSize(2);
    }

    @Test
    void testKeyedClickInsideLoop() {
        UnitAggregate foo = compile(EngineConfig.defaults(),
                "<ul><li v-for=\"item in items\" :key=\"item.id\"><button @click=\"remove(item)\">x</button></li></ul>");

        PomSpec spec = single(foo.getEmittedPrimaries());
        assertThat(spec.getIdentifier().getText()).isEqualTo("Foo-${item.id}-Remove-button");
        assertThat(spec.getPattern()).isEqualTo("Foo-${key}-Remove-button");
        assertThat(spec.getActionName()).isEqualTo("clickRemoveByKey");
        assertThat(spec.getGetterName()).isEqualTo("RemoveButton");
        assertThat(spec.hasParameter("key")).isTrue();
    }

    @Test
    void testKeyedDynamicLinkFallsBackToRoleName() {
        UnitAggregate foo = compile(EngineConfig.defaults(),
                "<ul><li v-for=\"item in items\" :key=\"item.id\"><router-link :to=\"item.route\">Open</router-link></li></ul>");

        PomSpec spec = single(foo.getEmittedPrimaries());
        assertThat(spec.getIdentifier().getText()).isEqualTo("Foo-${item.id}-routerlink");
        assertThat(spec.getTarget()).isNull();
        assertThat(spec.getActionName()).isEqualTo("clickButtonByKey");
        // role-name base plus role suffix once the key marker is dropped
        assertThat(spec.getGetterName()).isEqualTo("ButtonButton");
        assertThat(spec.hasParameter("key")).isTrue();
    }

    @Test
    void testStaticLoopValuesExpandToMethods() {
        UnitAggregate foo = compile(EngineConfig.defaults(),
                "<div><button v-for=\"tab in ['Save', 'Cancel']\" :key=\"tab\" @click=\"choose(tab)\">{{ tab }}</button></div>");

        assertThat(foo.getEmittedPrimaries()).isEmpty();
        assertThat(foo.getExtraMethods()).extracting(PomExtraMethod::getName)
                .containsExactly("clickSaveButton", "clickCancelButton");
        assertThat(foo.getExtraMethods()).extracting(PomExtraMethod::getKeyLiteral).containsExactly("Save", "Cancel");
    }

    @Test
    void testRadioWithLiteralOptionsExpands() {
        EngineConfig config = EngineConfig.builder().nativeWrapper("RadioGroup", RoleConfig.of("radio")).build();

        UnitAggregate foo = compile(config,
                "<div><RadioGroup v-model=\"plan\" :options=\"['One', 'Two']\" /></div>");

        assertThat(foo.getEmittedPrimaries()).isEmpty();
        assertThat(foo.getExtraMethods()).extracting(PomExtraMethod::getName)
                .containsExactly("selectPlanOne", "selectPlanTwo");
        assertThat(foo.getExtraMethods()).extracting(PomExtraMethod::getPattern)
                .containsExactly("Foo-Plan_One_radio", "Foo-Plan_Two_radio");
    }

    @Test
    void testRadioWithDynamicOptionsGetsOneMethod() {
        EngineConfig config = EngineConfig.builder().nativeWrapper("RadioGroup", RoleConfig.of("radio")).build();

        UnitAggregate foo = compile(config, "<div><RadioGroup v-model=\"plan\" :options=\"planOptions\" /></div>");

        assertThat(foo.getEmittedPrimaries()).isEmpty();
        PomExtraMethod method = single(foo.getExtraMethods());
        assertThat(method.getName()).isEqualTo("selectPlan");
        assertThat(method.getPattern()).isEqualTo("Foo-Plan_${value}_radio");
    }

    @Test
    void testWrapperWithModel() {
        EngineConfig config = EngineConfig.builder()
                .nativeWrapper("TextField", RoleConfig.of("input"))
                .nativeWrapper("Choice", RoleConfig.builder().role("select").requiresOptionPrefix(true).build())
                .build();
        RootNode root = TemplateParser.parseTemplate("Foo.vue",
                "<div><TextField v-model=\"email\" /><Choice v-model=\"country\" /></div>");

        UnitAggregate foo = new TestIdEngine(config).compile("Foo", "Foo.vue", root).orElseThrow();

        assertThat(foo.getEmittedPrimaries()).extracting(PomSpec::getActionName)
                .containsExactly("typeEmail", "selectCountry");
        assertThat(foo.getAllIdentifiers()).containsExactly("Foo-Country-select", "Foo-Email-input");
        ElementNode choice = (ElementNode) root.firstElement().getChildren().get(1);
        assertThat(choice.attributeValue(EngineConfig.OPTION_PREFIX_ATTRIBUTE)).isEqualTo("Foo-Country");
        assertThat(foo.getEmittedPrimaries().get(0).getParameters()).extracting(p -> p.getName())
                .containsExactly("text", "annotationText");
    }

    @Test
    void testConditionalBranchGivesHint() {
        UnitAggregate foo = compile(EngineConfig.defaults(), "<div>"
                + "<section v-if=\"tab === 'details'\"><button @click=\"\">Go</button></section>"
                + "</div>");

        assertThat(single(foo.getEmittedPrimaries()).getActionName()).isEqualTo("clickDetails");
    }

    @Test
    void testSubmitUsesIdOrName() {
        UnitAggregate foo = compile(EngineConfig.defaults(),
                "<form><button type=\"submit\" name=\"sign_in\">Go</button></form>");

        assertThat(foo.getAllIdentifiers()).containsExactly("Foo-SignIn-button");
    }

    @Test
    void testSubmitWithoutIdentityThrows() {
        assertThatThrownBy(() -> compile(EngineConfig.defaults(), "<form><button type=\"submit\">!!</button></form>"))
                .isInstanceOf(TestIdGenerationException.class)
                .hasMessageContaining("Foo")
                .hasMessageContaining("Fix:");
    }

    @Test
    void testPlainElementsAreLeftAlone() {
        RootNode root = TemplateParser.parseTemplate("Foo.vue", "<div><p>Text</p><span :title=\"x\" /></div>");

        UnitAggregate foo = new TestIdEngine(EngineConfig.defaults()).compile("Foo", "Foo.vue", root).orElseThrow();

        assertThat(foo.getEntries()).isEmpty();
        assertThat(root.firstElement().findAttribute("data-testid")).isNull();
    }

    @Test
    void testExcludedUnitIsSkipped() {
        TestIdEngine engine = new TestIdEngine(EngineConfig.builder().excludedUnit("Foo").build());
        RootNode root = TemplateParser.parseTemplate("Foo.vue", "<button @click=\"save\">Save</button>");

        assertThat(engine.compile("Foo", "Foo.vue", root)).isEmpty();
        assertThat(engine.getRegistry().get("Foo")).isNull();
        assertThat(root.firstElement().findAttribute("data-testid")).isNull();
    }

    @Test
    void testRecompilingUnchangedSourceIsIdempotent() {
        String template = "<div>"
                + "<button @click=\"save\">Save</button>"
                + "<button @click=\"\">A</button><button @click=\"\">B</button>"
                + "<li v-for=\"row in rows\" :key=\"row.id\"><button @click=\"open(row)\">o</button></li>"
                + "<button v-for=\"t in ['A', 'B']\" :key=\"t\" @click=\"pick(t)\">{{ t }}</button>"
                + "</div>";
        TestIdEngine engine = new TestIdEngine(EngineConfig.defaults());

        UnitAggregate first = engine.compile("Foo", "Foo.vue", TemplateParser.parseTemplate("Foo.vue", template))
                .orElseThrow();
        UnitAggregate second = engine.compile("Foo", "Foo.vue", TemplateParser.parseTemplate("Foo.vue", template))
                .orElseThrow();

        assertThat(second).isNotSameAs(first);
        assertThat(second.getPrimaries()).isEqualTo(first.getPrimaries());
        assertThat(second.getExtraMethods()).isEqualTo(first.getExtraMethods());
        assertThat(second.getAllIdentifiers()).isEqualTo(first.getAllIdentifiers());
        assertThat(engine.getRegistry().all()).hasSize(1);
    }

    @Test
    void testRecompilingTransformedTreeKeepsIdentifiers() {
        RootNode root = TemplateParser.parseTemplate("Foo.vue", "<div>"
                + "<button @click=\"save\">Save</button>"
                + "<li v-for=\"row in rows\" :key=\"row.id\"><button @click=\"open(row)\">o</button></li>"
                + "</div>");
        TestIdEngine engine = new TestIdEngine(EngineConfig.defaults());

        UnitAggregate first = engine.compile("Foo", "Foo.vue", root).orElseThrow();
        UnitAggregate second = engine.compile("Foo", "Foo.vue", root).orElseThrow();

        assertThat(second.getAllIdentifiers()).isEqualTo(first.getAllIdentifiers());
        assertThat(second.getEmittedPrimaries()).extracting(PomSpec::getActionName)
                .isEqualTo(List.of("clickSave", "clickOpenByKey"));
        assertThat(second.getEntries()).allMatch(GeneratedIdentifierEntry::isFromExisting);
    }

    @Test
    void testViewsAreDetectedByDirectory() {
        TestIdEngine engine = new TestIdEngine(EngineConfig.builder().viewsDir(java.nio.file.Path.of("src/views")).build());

        assertThat(engine.isView("src/views/Home.vue")).isTrue();
        assertThat(engine.isView("src/components/Home.vue")).isFalse();
    }

    private static UnitAggregate compile(EngineConfig config, String template) {
        RootNode root = TemplateParser.parseTemplate("Foo.vue", template);
        return new TestIdEngine(config).compile("Foo", "Foo.vue", root).orElseThrow();
    }

    private static <T> T single(List<T> values) {
        assertThat(values).hasSize(1);
        return values.get(0);
    }
}
