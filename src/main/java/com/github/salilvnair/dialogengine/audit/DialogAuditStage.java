package com.github.salilvnair.dialogengine.audit;

public enum DialogAuditStage {
    TURN_STARTED,
    RULE_MATCHED,
    EVENT_BUBBLED,
    BUBBLE_EXHAUSTED,
    DIALOG_BEGIN,
    DIALOG_END,
    DIALOG_CANCELLED,
    TURN_SUSPENDED,
    STACK_COMPLETED,
    TURN_FAULTED,
    STEP_ERROR,
    STEP_HOOK_ERROR;

    public String value() {
        return name();
    }
}
