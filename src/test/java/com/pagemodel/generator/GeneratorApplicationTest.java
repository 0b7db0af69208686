package com.pagemodel.generator;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GeneratorApplication.
 */
class GeneratorApplicationTest {

    @Test
    void testVersionExitsCleanly() {
        assertThat(GeneratorApplication.execute("--version")).isZero();
    }

    @Test
    void testMissingRequiredOptionIsUsageError() {
        assertThat(GeneratorApplication.execute()).isEqualTo(2);
    }

    @Test
    void testEnumOptionsAreCaseInsensitive(@TempDir Path tempDir)
            throws Exception {
        Files.writeString(tempDir.resolve("Foo.vue"),
                "<template><button @click=\"save\">Save</button></template>");

        int exitCode = GeneratorApplication.execute("-s", tempDir.toString(), "-o", tempDir.resolve("out").toString(),
                "--existing-id-behavior", "Overwrite", "--name-collision-behavior", "warn");

        assertThat(exitCode).isZero();
    }
}
