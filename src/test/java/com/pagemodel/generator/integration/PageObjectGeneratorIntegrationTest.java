package com.pagemodel.generator.integration;

import com.pagemodel.generator.codegen.EngineConfig;
import com.pagemodel.generator.codegen.GeneratorConfig;
import com.pagemodel.generator.codegen.GeneratorResult;
import com.pagemodel.generator.codegen.PageObjectGenerator;
import com.pagemodel.generator.codegen.manifest.ManifestGenerator;
import com.pagemodel.generator.codegen.routing.RouteNameTargetResolver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete generation process.
 */
class PageObjectGeneratorIntegrationTest {

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private Path viewsDir;
    private Path componentsDir;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        sourceDir = tempDir.resolve("src");
        viewsDir = sourceDir.resolve("views");
        componentsDir = sourceDir.resolve("components");
        outputDir = tempDir.resolve("out");
        Files.createDirectories(viewsDir);
        Files.createDirectories(componentsDir);

        Files.writeString(viewsDir.resolve("HomePage.vue"), """
                <template>
                  <div>
                    <router-link :to="{ name: 'Settings' }">Settings</router-link>
                    <EmailField v-model="email" />
                    <button @click="save">Save</button>
                  </div>
                </template>
                <script setup>
                const email = ref('')
                </script>
                """);
        Files.writeString(componentsDir.resolve("SettingsPage.vue"), """
                <template>
                  <section>
                    <button @click="() => reset()">Reset</button>
                  </section>
                </template>
                """);
        Files.writeString(componentsDir.resolve("EmailField.vue"), """
                <template>
                  <input v-bind="$attrs" />
                </template>
                """);
        Files.writeString(componentsDir.resolve("Legacy.vue"), """
                <script>
                export default { render: () => null }
                </script>
                """);
    }

    @Test
    void testGenerateFromComponentTree() throws IOException {
        GeneratorResult result = new PageObjectGenerator(config(false)).generate();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getComponentsScanned()).isEqualTo(4);
        assertThat(result.getUnitsCompiled()).isEqualTo(3);
        assertThat(result.getViewsCompiled()).isEqualTo(1);
        assertThat(result.getIdentifiersGenerated()).isEqualTo(4);
        assertThat(result.getIdentifiersPreserved()).isZero();
        assertThat(result.getPrimaryMembers()).isEqualTo(4);
        assertThat(result.getExtraMethods()).isZero();

        String manifest = Files.readString(outputDir.resolve(ManifestGenerator.TEST_ID_MANIFEST));
        assertThat(manifest).contains(
                "\"HomePage\": [\"HomePage-Email-input\", \"HomePage-Save-button\", \"HomePage-Settings-routerlink\"]");
        assertThat(manifest).contains("\"SettingsPage\": [\"SettingsPage-Reset-button\"]");
        assertThat(manifest).contains("\"EmailField\": []");
        assertThat(manifest).doesNotContain("Legacy");

        String model = Files.readString(outputDir.resolve(ManifestGenerator.PAGE_OBJECT_MODEL));
        assertThat(model).contains("\"action\": \"goToSettings\"");
        assertThat(model).contains("\"target\": \"SettingsPage\"");
        assertThat(model).contains("\"action\": \"typeEmail\"");
        assertThat(model).contains("\"view\": true");
    }

    @Test
    void testExistingOutputIsKeptWithoutForce() throws IOException {
        assertThat(new PageObjectGenerator(config(false)).generate().isSuccess()).isTrue();

        GeneratorResult second = new PageObjectGenerator(config(false)).generate();
        assertThat(second.isSuccess()).isFalse();
        assertThat(second.getErrorMessage()).contains("already exists");

        assertThat(new PageObjectGenerator(config(true)).generate().isSuccess()).isTrue();
    }

    @Test
    void testFailingUnitStopsGeneration() throws IOException {
        Files.writeString(componentsDir.resolve("Broken.vue"),
                "<template><form><button type=\"submit\"></button></form></template>");

        GeneratorResult result = new PageObjectGenerator(config(false)).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailingUnit()).isEqualTo("Broken");
        assertThat(result.getErrorMessage()).contains("Fix:");
        assertThat(Files.exists(outputDir.resolve(ManifestGenerator.TEST_ID_MANIFEST))).isFalse();
    }

    @Test
    void testMalformedTemplateFailsUnit() throws IOException {
        Files.writeString(componentsDir.resolve("Bad.vue"), "<template><div><span></div></template>");

        GeneratorResult result = new PageObjectGenerator(config(false)).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailingUnit()).isEqualTo("Bad");
    }

    @Test
    void testEmptySourceDirectory() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));
        GeneratorConfig config = GeneratorConfig.builder()
                .sourceDir(empty)
                .outputDir(outputDir)
                .engineConfig(EngineConfig.defaults())
                .build();

        GeneratorResult result = new PageObjectGenerator(config).generate();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("No .vue files");
    }

    private GeneratorConfig config(boolean force) {
        return GeneratorConfig.builder()
                .sourceDir(sourceDir)
                .outputDir(outputDir)
                .force(force)
                .engineConfig(EngineConfig.builder()
                        .viewsDir(viewsDir)
                        .componentsDir(componentsDir)
                        .navigationTargetResolver(new RouteNameTargetResolver(Map.of("Settings", "SettingsPage")))
                        .build())
                .build();
    }
}
