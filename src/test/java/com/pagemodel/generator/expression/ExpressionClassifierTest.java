package com.pagemodel.generator.expression;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExpressionClassifier.
 */
class ExpressionClassifierTest {

    private final ExpressionClassifier classifier = new ExpressionClassifier();

    @Test
    void testArrowCallYieldsCallee() {
        NamingSignal signal = classifier.classify("() => save()");

        assertThat(signal.getKind()).isEqualTo(NamingSignal.Kind.CALL);
        assertThat(signal.getName()).isEqualTo("save");
    }

    @Test
    void testEmittedEventWinsOverOuterCall() {
        NamingSignal signal = classifier.classify("() => { track(); emit('close') }");

        assertThat(signal.getKind()).isEqualTo(NamingSignal.Kind.EMITTED_EVENT);
        assertThat(signal.getName()).isEqualTo("close");
    }

    @Test
    void testDollarEmitIsRecognized() {
        assertThat(classifier.clickHandlerName("$emit('update:open', false)")).isEqualTo("update:open");
    }

    @Test
    void testRefValueAssignmentNamesTheRef() {
        NamingSignal signal = classifier.classify("isOpen.value = true");

        assertThat(signal.getKind()).isEqualTo(NamingSignal.Kind.ASSIGNMENT);
        assertThat(signal.getName()).isEqualTo("isOpen");
        assertThat(signal.getArgumentSuffix()).isEqualTo("True");
    }

    @Test
    void testMemberChainTail() {
        NamingSignal signal = classifier.classify("store.actions.refresh");

        assertThat(signal.getKind()).isEqualTo(NamingSignal.Kind.REFERENCE);
        assertThat(signal.getName()).isEqualTo("refresh");
    }

    @Test
    void testLiteralArgumentsBecomeStableSuffix() {
        assertThat(classifier.classify("setTab('details')").getArgumentSuffix()).isEqualTo("Details");
        assertThat(classifier.classify("setTab(Tabs.DETAILS)").getArgumentSuffix()).isEqualTo("Details");
        assertThat(classifier.classify("setTab(Mode, 2)").getArgumentSuffix()).isEqualTo("ModeValue2");
    }

    @Test
    void testLowerCamelArgumentsAreNotStable() {
        NamingSignal signal = classifier.classify("setTab(tabName)");

        assertThat(signal.getName()).isEqualTo("setTab");
        assertThat(signal.getArgumentSuffix()).isNull();
    }

    @Test
    void testUnparsableOrEmptySourceYieldsNull() {
        assertThat(classifier.classify("")).isNull();
        assertThat(classifier.classify("save(")).isNull();
        assertThat(classifier.clickHandlerName("=>")).isEmpty();
    }

    @Test
    void testHandlerBindingHints() {
        assertThat(classifier.handlerBindingHint("onSubmit")).isEqualTo("OnSubmit");
        assertThat(classifier.handlerBindingHint("() => filter('Active')")).isEqualTo("FilterActive");
        assertThat(classifier.handlerBindingHint("() => selected = 'Info'")).isEqualTo("SetSelectedInfo");
        assertThat(classifier.handlerBindingHint("42")).isNull();
    }

    @Test
    void testValueBindingName() {
        assertThat(classifier.valueBindingName("form.email")).isEqualTo("email");
        assertThat(classifier.valueBindingName("query")).isEqualTo("query");
        assertThat(classifier.valueBindingName("getLabel(item)")).isEqualTo("getLabel");
    }

    @Test
    void testStableConditionHintTakesLastIdentifierish() {
        assertThat(classifier.stableConditionHint("tab === 'details'")).isEqualTo("details");
        assertThat(classifier.stableConditionHint("count > 2")).isEqualTo("count");
        assertThat(classifier.stableConditionHint("  ")).isNull();
    }
}
