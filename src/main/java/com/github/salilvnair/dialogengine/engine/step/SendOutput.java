package com.github.salilvnair.dialogengine.engine.step;

import java.util.Objects;

public record SendOutput(String template) implements DialogStep {

    public SendOutput {
        Objects.requireNonNull(template, "template");
    }

    public static SendOutput of(String template) {
        return new SendOutput(template);
    }

    @Override
    public StepKind kind() {
        return StepKind.SEND_OUTPUT;
    }
}
