package com.github.salilvnair.dialogengine.engine.step.handler.core;

public sealed interface StepResult permits StepResult.Continue, StepResult.Suspend, StepResult.AwaitInput {

    /** Run the next step. */
    record Continue() implements StepResult {}

    /** End the turn; the cursor resumes after this step. */
    record Suspend() implements StepResult {}

    /** End the turn; the cursor stays on this step until an answer arrives. */
    record AwaitInput() implements StepResult {}
}
