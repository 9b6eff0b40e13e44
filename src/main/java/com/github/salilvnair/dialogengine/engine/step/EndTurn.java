package com.github.salilvnair.dialogengine.engine.step;

public record EndTurn() implements DialogStep {

    @Override
    public StepKind kind() {
        return StepKind.END_TURN;
    }
}
