package com.github.salilvnair.dialogengine.engine.step;

public enum StepKind {
    SEND_OUTPUT,
    SET_PROPERTY,
    DELETE_PROPERTY,
    INIT_PROPERTY,
    EDIT_ARRAY,
    IF_CONDITION,
    SWITCH_CONDITION,
    FOREACH,
    FOREACH_PAGE,
    BEGIN_DIALOG,
    REPLACE_DIALOG,
    END_DIALOG,
    REPEAT_DIALOG,
    END_TURN,
    EMIT_EVENT,
    EDIT_STEPS,
    INPUT,
    TRACE_ACTIVITY
}
