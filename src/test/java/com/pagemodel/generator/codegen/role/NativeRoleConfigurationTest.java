package com.pagemodel.generator.codegen.role;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pagemodel.generator.model.ElementNode;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for role resolution and single-root inference.
 */
class NativeRoleConfigurationTest {

    @TempDir
    Path componentsDir;

    @Test
    void testConfiguredEntryWins() {
        NativeRoleConfiguration configuration = new NativeRoleConfiguration(
                Map.of("SearchBox", RoleConfig.of("vselect")), tag -> Optional.of("input"));

        ResolvedRole role = new RoleResolver(configuration).resolve(element("SearchBox"));

        assertThat(role.getRole()).isEqualTo(Role.VSELECT);
        assertThat(role.getTagSuffix()).isEqualTo("-vselect");
        assertThat(role.isWrapper()).isTrue();
    }

    @Test
    void testInferenceFromComponentDefinition() throws IOException {
        Files.writeString(componentsDir.resolve("EmailField.vue"),
                "<template>\n  <input class=\"field\" v-bind=\"$attrs\" />\n</template>\n<script setup></script>\n");
        Files.writeString(componentsDir.resolve("CountryPicker.vue"),
                "<template><select><option>NL</option></select></template>");
        Files.writeString(componentsDir.resolve("Card.vue"), "<template><div><input></div></template>");

        NativeRoleConfiguration configuration = new NativeRoleConfiguration(Map.of(),
                new SfcRootTagReader(componentsDir));

        assertThat(configuration.resolve("EmailField").getRole()).isEqualTo("input");
        assertThat(configuration.resolve("CountryPicker").getRole()).isEqualTo("select");
        assertThat(configuration.resolve("Card")).isNull();
        assertThat(configuration.resolve("Missing")).isNull();
    }

    @Test
    void testInferenceOutcomeIsCached() {
        List<String> reads = new ArrayList<>();
        NativeRoleConfiguration configuration = new NativeRoleConfiguration(Map.of(), tag -> {
            reads.add(tag);
            return tag.equals("NameField") ? Optional.of("textarea") : Optional.empty();
        });

        configuration.resolve("NameField");
        configuration.resolve("NameField");
        configuration.resolve("Panel");
        configuration.resolve("Panel");

        assertThat(reads).containsExactly("NameField", "Panel");
        assertThat(configuration.find("NameField").getRole()).isEqualTo("input");
        assertThat(configuration.find("Panel")).isNull();
    }

    @Test
    void testLowerCaseTagsAreNotInferred() {
        List<String> reads = new ArrayList<>();
        NativeRoleConfiguration configuration = new NativeRoleConfiguration(Map.of(), tag -> {
            reads.add(tag);
            return Optional.of("input");
        });

        ResolvedRole role = new RoleResolver(configuration).resolve(element("router-link"));

        assertThat(reads).isEmpty();
        assertThat(role.getRawRole()).isEqualTo("routerlink");
        assertThat(role.getRole()).isEqualTo(Role.BUTTON);
        assertThat(role.isRecognizedInteractive()).isFalse();
    }

    @Test
    void testRoleLookupIsCaseInsensitive() {
        assertThat(Role.fromId("Radio")).isEqualTo(Role.RADIO);
        assertThat(Role.normalize("routerlink")).isEqualTo(Role.BUTTON);
        assertThat(Role.isRecognized("toggle")).isTrue();
        assertThat(Role.INPUT.getSuffix()).isEqualTo("Input");
    }

    private static ElementNode element(String tag) {
        return ElementNode.builder().tag(tag).build();
    }
}
