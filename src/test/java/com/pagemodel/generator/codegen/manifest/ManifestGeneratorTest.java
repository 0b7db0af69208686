package com.pagemodel.generator.codegen.manifest;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.pagemodel.generator.codegen.EngineConfig;
import com.pagemodel.generator.codegen.TestIdEngine;
import com.pagemodel.generator.codegen.pom.UnitAggregate;
import com.pagemodel.generator.codegen.role.RoleConfig;
import com.pagemodel.generator.parser.TemplateParser;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ManifestGenerator.
 */
class ManifestGeneratorTest {

    private final ManifestGenerator generator = new ManifestGenerator();

    @Test
    void testRenderTestIdManifest() throws IOException {
        String json = generator.renderTestIdManifest(List.of(
                compile("Foo", "<div><button @click=\"save\">Save</button><button @click=\"cancel\">x</button></div>"),
                compile("Bar", "<button @click=\"open\">Open</button>")));

        assertThat(json).contains("\"Foo\": [\"Foo-Cancel-button\", \"Foo-Save-button\"],");
        assertThat(json).contains("\"Bar\": [\"Bar-Open-button\"]");
        assertThat(json.trim()).startsWith("{").endsWith("}");
    }

    @Test
    void testRenderEmptyManifest() throws IOException {
        assertThat(generator.renderTestIdManifest(List.of()).replaceAll("\\s", "")).isEqualTo("{}");
    }

    @Test
    void testRenderPageObjectModel() throws IOException {
        TestIdEngine engine = new TestIdEngine(EngineConfig.builder()
                .nativeWrapper("RadioGroup", RoleConfig.of("radio"))
                .build());
        UnitAggregate foo = engine.compile("Foo", "src/Foo.vue", TemplateParser.parseTemplate("Foo.vue",
                "<div><button @click=\"save\">Save \"now\"</button>"
                        + "<RadioGroup v-model=\"plan\" :options=\"['One', 'Two']\" /></div>")).orElseThrow();

        String json = generator.renderPageObjectModel(List.of(foo));

        assertThat(json).contains("\"name\": \"Foo\"");
        assertThat(json).contains("\"file\": \"src/Foo.vue\"");
        assertThat(json).contains("\"view\": false");
        assertThat(json).contains("\"usedComponents\": [\"button\", \"RadioGroup\"]");
        assertThat(json).contains("\"getter\": \"SaveButton\"");
        assertThat(json).contains("\"action\": \"clickSave\"");
        assertThat(json).contains("\"emitPrimary\": false");
        assertThat(json).contains("\"name\": \"selectPlanOne\"");
        assertThat(json).contains("\"parameters\": [\"annotationText: string = \\\"\\\"\"]");
        assertThat(json).contains("\"keyLiteral\": null");
        assertThat(json).contains("{ \"name\": \"clickSave\", \"signature\": \"\", \"ambiguous\": false }");
    }

    private static UnitAggregate compile(String unit, String template) {
        return new TestIdEngine(EngineConfig.defaults())
                .compile(unit, unit + ".vue", TemplateParser.parseTemplate(unit + ".vue", template))
                .orElseThrow();
    }
}
