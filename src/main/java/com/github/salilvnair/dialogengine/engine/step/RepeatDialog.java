package com.github.salilvnair.dialogengine.engine.step;

public record RepeatDialog() implements DialogStep {

    @Override
    public StepKind kind() {
        return StepKind.REPEAT_DIALOG;
    }
}
