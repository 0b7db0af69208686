package com.pagemodel.generator.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pagemodel.generator.codegen.manifest.ManifestGenerator;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the "generate" command line.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        sourceDir = Files.createDirectories(tempDir.resolve("src"));
        outputDir = tempDir.resolve("out");
        Files.writeString(sourceDir.resolve("Profile.vue"), """
                <template>
                  <form>
                    <Toggle v-model="newsletter" />
                    <router-link :to="{ name: 'user home' }">Back</router-link>
                  </form>
                </template>
                """);
    }

    @Test
    void testGenerateWithWrappersAndRoutes() throws IOException {
        Path wrappers = tempDir.resolve("wrappers.txt");
        Files.writeString(wrappers, "# wrappers\nToggle = toggle\n");
        Path routes = tempDir.resolve("routes.txt");
        Files.writeString(routes, "User Home = UserHomePage\n");

        int exitCode = execute("--source-dir", sourceDir.toString(), "-o", outputDir.toString(),
                "--wrappers-file", wrappers.toString(), "--routes-file", routes.toString(),
                "--name-collision-behavior", "error", "--existing-id-behavior", "overwrite");

        assertThat(exitCode).isZero();
        String manifest = Files.readString(outputDir.resolve(ManifestGenerator.TEST_ID_MANIFEST));
        assertThat(manifest).contains("\"Profile-Newsletter-toggle\"");
        assertThat(manifest).contains("\"Profile-UserHome-Back-routerlink\"");
        assertThat(Files.readString(outputDir.resolve(ManifestGenerator.PAGE_OBJECT_MODEL)))
                .contains("\"target\": \"UserHomePage\"");
    }

    @Test
    void testExcludedUnitIsNotWritten() throws IOException {
        Files.writeString(sourceDir.resolve("Other.vue"), "<template><button @click=\"go\">Go</button></template>");

        int exitCode = execute("-s", sourceDir.toString(), "-o", outputDir.toString(), "--exclude", "Profile");

        assertThat(exitCode).isZero();
        String manifest = Files.readString(outputDir.resolve(ManifestGenerator.TEST_ID_MANIFEST));
        assertThat(manifest).contains("\"Other\"").doesNotContain("\"Profile\"");
    }

    @Test
    void testMissingSourceDirectoryFails() {
        int exitCode = execute("-s", tempDir.resolve("missing").toString(), "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.exists(outputDir)).isFalse();
    }

    @Test
    void testInvalidWrappersFileFails() throws IOException {
        Path wrappers = tempDir.resolve("wrappers.txt");
        Files.writeString(wrappers, "Toggle toggle\n");

        int exitCode = execute("-s", sourceDir.toString(), "-o", outputDir.toString(), "-w", wrappers.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testExistingOutputRequiresForce() {
        assertThat(execute("-s", sourceDir.toString(), "-o", outputDir.toString())).isZero();

        assertThat(execute("-s", sourceDir.toString(), "-o", outputDir.toString())).isEqualTo(1);
        assertThat(execute("-s", sourceDir.toString(), "-o", outputDir.toString(), "--force")).isZero();
    }

    @Test
    void testUnknownEnumValueIsRejected() {
        int exitCode = execute("-s", sourceDir.toString(), "--name-collision-behavior", "rename");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    private static int execute(String... args) {
        return new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
