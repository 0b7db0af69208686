package com.pagemodel.generator.mapping;

import org.junit.jupiter.api.Test;

import com.pagemodel.generator.codegen.role.RoleConfig;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MappingParser.
 */
class MappingParserTest {

    private final MappingParser parser = new MappingParser();

    @Test
    void testParseRoleOnlyWrapper() {
        MappingDocument doc = parser.parseWrappers(List.of("CustomInput = input"));

        assertThat(doc.getAllEntries()).hasSize(1);
        MappingEntry entry = doc.getAllEntries().get(0);
        assertThat(entry.getType()).isEqualTo(MappingEntry.MappingType.WRAPPER);
        assertThat(entry.getSource()).isEqualTo("CustomInput");
        assertThat(entry.getTarget()).isEqualTo("input");
        assertThat(entry.getLine()).isEqualTo(1);
    }

    @Test
    void testParseWrapperOptions() {
        MappingDocument doc = parser.parseWrappers(List.of(
                "ToggleField = toggle, valueAttribute=name",
                "RadioGroup = radio, optionPrefix"));

        Map<String, RoleConfig> configs = doc.toRoleConfigs();
        assertThat(configs.get("ToggleField").getValueAttribute()).isEqualTo("name");
        assertThat(configs.get("ToggleField").isRequiresOptionPrefix()).isFalse();
        assertThat(configs.get("RadioGroup").getRole()).isEqualTo("radio");
        assertThat(configs.get("RadioGroup").isRequiresOptionPrefix()).isTrue();
    }

    @Test
    void testSkipCommentsAndEmptyLines() {
        MappingDocument doc = parser.parseWrappers(List.of(
                "# This is a comment",
                "",
                "CustomInput = input",
                "   ",
                "# Another comment"));

        assertThat(doc.getAllEntries()).hasSize(1);
        assertThat(doc.hasErrors()).isFalse();
    }

    @Test
    void testLaterWrapperLineWins() {
        MappingDocument doc = parser.parseWrappers(List.of("Field = input", "Field = select"));

        assertThat(doc.toRoleConfigs().get("Field").getRole()).isEqualTo("select");
    }

    @Test
    void testUnknownRoleIsAWarning() {
        MappingDocument doc = parser.parseWrappers(List.of("DatePicker = datepicker"));

        assertThat(doc.hasErrors()).isFalse();
        assertThat(doc.getWarnings()).hasSize(1);
        assertThat(doc.getWarnings().get(0)).contains("datepicker");
    }

    @Test
    void testInvalidLinesAreErrors() {
        MappingDocument doc = parser.parseWrappers(List.of(
                "not a mapping",
                "Field = input, colour=red",
                "Field2 = input"));

        assertThat(doc.getErrors()).hasSize(2);
        assertThat(doc.getErrors().get(0)).startsWith("Line 1:");
        assertThat(doc.getErrors().get(1)).contains("Unknown wrapper option");
        assertThat(doc.getAllEntries()).hasSize(1);
    }

    @Test
    void testParseRoutes() {
        MappingDocument doc = parser.parseRoutes(List.of(
                "# route name = unit",
                "Tenant Details = TenantDetailsPage",
                "home = HomePage"));

        Map<String, String> targets = doc.toRouteTargets();
        assertThat(targets).containsEntry("TenantDetails", "TenantDetailsPage");
        assertThat(targets).containsEntry("Home", "HomePage");
    }

    @Test
    void testInvalidRouteTarget() {
        MappingDocument doc = parser.parseRoutes(List.of("Home = Home Page"));

        assertThat(doc.hasErrors()).isTrue();
        assertThat(doc.toRouteTargets()).isEmpty();
    }
}
