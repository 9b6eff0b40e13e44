package com.github.salilvnair.dialogengine.engine.step;

import lombok.Builder;

import java.util.List;

/**
 * Prompts for a value and suspends until the user answers.
 *
 * @param value        initial value expression; when it yields a value the prompt is skipped
 * @param validations  boolean expressions over {@code turn.value}, all must hold
 * @param maxTurnCount rejected answers allowed before {@code defaultValue} is used
 */
@Builder
public record InputStep(
        InputKind inputKind,
        String prompt,
        String unrecognizedPrompt,
        String invalidPrompt,
        String property,
        String value,
        List<String> validations,
        Integer maxTurnCount,
        String defaultValue,
        boolean alwaysPrompt,
        List<String> choices,
        String choicesProperty,
        NumberFormat outputFormat,
        ChoiceStyle style
) implements DialogStep {

    public enum InputKind {
        TEXT,
        NUMBER,
        CONFIRM,
        CHOICE
    }

    public enum NumberFormat {
        INTEGER,
        FLOAT
    }

    public enum ChoiceStyle {
        INLINE,
        LIST,
        NONE
    }

    public InputStep {
        inputKind = inputKind == null ? InputKind.TEXT : inputKind;
        validations = validations == null ? List.of() : List.copyOf(validations);
        choices = choices == null ? List.of() : List.copyOf(choices);
        outputFormat = outputFormat == null ? NumberFormat.FLOAT : outputFormat;
        style = style == null ? ChoiceStyle.INLINE : style;
    }

    public static InputStepBuilder text(String prompt, String property) {
        return builder().inputKind(InputKind.TEXT).prompt(prompt).property(property);
    }

    public static InputStepBuilder number(String prompt, String property) {
        return builder().inputKind(InputKind.NUMBER).prompt(prompt).property(property);
    }

    public static InputStepBuilder confirm(String prompt, String property) {
        return builder().inputKind(InputKind.CONFIRM).prompt(prompt).property(property);
    }

    public static InputStepBuilder choice(String prompt, String property, List<String> choices) {
        return builder().inputKind(InputKind.CHOICE).prompt(prompt).property(property).choices(choices);
    }

    @Override
    public StepKind kind() {
        return StepKind.INPUT;
    }
}
