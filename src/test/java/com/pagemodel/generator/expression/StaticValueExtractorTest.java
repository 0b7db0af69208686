package com.pagemodel.generator.expression;

import org.junit.jupiter.api.Test;

import com.pagemodel.generator.codegen.routing.RouteLocation;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StaticValueExtractor.
 */
class StaticValueExtractorTest {

    private final ExpressionClassifier classifier = new ExpressionClassifier();

    @Test
    void testStringArrayIsDeduplicated() {
        assertThat(StaticValueExtractor.staticStringArray(parse("['One', `Two`, 'One', ' ']")))
                .containsExactly("One", "Two");
    }

    @Test
    void testNonLiteralElementMakesArrayDynamic() {
        assertThat(StaticValueExtractor.staticStringArray(parse("['One', other]"))).isNull();
        assertThat(StaticValueExtractor.staticStringArray(parse("[`a${b}`]"))).isNull();
        assertThat(StaticValueExtractor.staticStringArray(parse("items"))).isNull();
    }

    @Test
    void testOptionLabelsFromObjects() {
        assertThat(StaticValueExtractor.staticOptionLabels(
                parse("[{ label: 'Monthly', value: 1 }, { text: 'Yearly' }]")))
                .containsExactly("Monthly", "Yearly");
        assertThat(StaticValueExtractor.staticOptionLabels(parse("[{ value: 1 }]"))).isNull();
    }

    @Test
    void testRouteLocation() {
        RouteLocation named = StaticValueExtractor.routeLocation(parse("{ name: 'Tenant Details', params: { id } }"));
        assertThat(named.getName()).isEqualTo("Tenant Details");
        assertThat(named.getParamKeys()).containsExactly("id");

        RouteLocation path = StaticValueExtractor.routeLocation(parse("'/settings'"));
        assertThat(path.getPath()).isEqualTo("/settings");

        assertThat(StaticValueExtractor.routeLocation(parse("route"))).isNull();
    }

    @Test
    void testConstantExpressions() {
        assertThat(StaticValueExtractor.isConstant(parse("['a', 'b']"))).isTrue();
        assertThat(StaticValueExtractor.isConstant(parse("[{ label: 'a' }]"))).isTrue();
        assertThat(StaticValueExtractor.isConstant(parse("options"))).isFalse();
        assertThat(StaticValueExtractor.isConstant(parse("['a', b]"))).isFalse();
    }

    @Test
    void testTemplateTextNormalization() {
        assertThat(TemplateText.normalizeSubstitutions("Foo-${item.id}-button")).isEqualTo("Foo-${key}-button");
        assertThat(TemplateText.countSubstitutions("row-${a}-${b}")).isEqualTo(2);
        assertThat(TemplateText.countSubstitutions("plain")).isZero();
    }

    private com.pagemodel.generator.expression.ast.JsNode parse(String source) {
        return classifier.tryParseExpression(source);
    }
}
