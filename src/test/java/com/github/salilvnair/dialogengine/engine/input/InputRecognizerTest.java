package com.github.salilvnair.dialogengine.engine.input;

import com.github.salilvnair.dialogengine.config.DialogEngineConfig;
import com.github.salilvnair.dialogengine.engine.step.InputStep;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InputRecognizerTest {

    private static final List<String> COLORS = List.of("red", "green", "blue");

    private final InputRecognizer recognizer = new InputRecognizer(new ChoiceFormatter(new DialogEngineConfig()));

    @Test
    void numberFindsFirstNumberInText() {
        assertEquals(Optional.of(42.0d), recognizer.number("I am 42 years old", InputStep.NumberFormat.FLOAT));
        assertEquals(Optional.of(3.5d), recognizer.number("3,5", InputStep.NumberFormat.FLOAT));
        assertEquals(Optional.of(15L), recognizer.number("15.3", InputStep.NumberFormat.INTEGER));
        assertTrue(recognizer.number("none", InputStep.NumberFormat.FLOAT).isEmpty());
    }

    @Test
    void confirmUnderstandsWordsOrdinalsAndLabels() {
        assertEquals(Optional.of(true), recognizer.confirm("yes", "en-us"));
        assertEquals(Optional.of(true), recognizer.confirm("Sure thing", "en-us"));
        assertEquals(Optional.of(true), recognizer.confirm("1", "en-us"));
        assertEquals(Optional.of(false), recognizer.confirm("nope", "en-us"));
        assertEquals(Optional.of(false), recognizer.confirm("2", "en-us"));
        assertEquals(Optional.of(true), recognizer.confirm("sí", "es"));
    }

    @Test
    void confirmIsEmptyWhenAmbiguousOrUnrelated() {
        assertTrue(recognizer.confirm("yes and no", "en-us").isEmpty());
        assertTrue(recognizer.confirm("asdasd", "en-us").isEmpty());
    }

    @Test
    void choiceMatchesLabelOrdinalOrSingleMention() {
        assertEquals(Optional.of("blue"), recognizer.choice("Blue", COLORS));
        assertEquals(Optional.of("green"), recognizer.choice("2", COLORS));
        assertEquals(Optional.of("red"), recognizer.choice("red please", COLORS));
    }

    @Test
    void choiceIsEmptyForOutOfRangeOrAmbiguousAnswers() {
        assertTrue(recognizer.choice("4", COLORS).isEmpty());
        assertTrue(recognizer.choice("red or blue", COLORS).isEmpty());
        assertTrue(recognizer.choice("purple", COLORS).isEmpty());
    }

    @Test
    void choiceIgnoresOrdinalsBeyondIntRange() {
        assertTrue(recognizer.choice("99999999999", COLORS).isEmpty());
    }

    @Test
    void blankAnswerIsNeverRecognized() {
        InputStep text = InputStep.text("Name?", "user.name").build();

        assertTrue(recognizer.recognize(text, "  ", List.of(), "en-us").isEmpty());
        assertEquals(Optional.of("Ann"), recognizer.recognize(text, "Ann", List.of(), "en-us"));
    }
}
