package com.github.salilvnair.dialogengine.engine.model;

public enum TurnStatus {
    /** Execution is parked waiting for the next inbound activity. */
    SUSPENDED,
    /** The root dialog ended and the stack is empty. */
    STACK_COMPLETED
}
