package com.github.salilvnair.dialogengine.engine.step;

import java.util.List;
import java.util.Map;

/**
 * Immutable step configuration. Each kind carries its own parameters; nested step
 * lists are exposed through {@link #branches()} so they can be registered in the
 * dialog's step-list arena.
 */
public sealed interface DialogStep permits SendOutput, SetProperty, DeleteProperty, InitProperty, EditArray,
        IfCondition, SwitchCondition, Foreach, ForeachPage, BeginDialog, ReplaceDialog, EndDialog,
        RepeatDialog, EndTurn, EmitEvent, EditSteps, InputStep, TraceActivity {

    StepKind kind();

    default Map<String, List<DialogStep>> branches() {
        return Map.of();
    }
}
