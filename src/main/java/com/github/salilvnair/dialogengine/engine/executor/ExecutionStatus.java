package com.github.salilvnair.dialogengine.engine.executor;

public enum ExecutionStatus {
    /** The stack is non-empty and waits for the next activity. */
    WAITING,
    /** The stack emptied during the turn. */
    COMPLETED
}
