package com.github.salilvnair.dialogengine.engine.exception;

public enum ErrorCategory {
    CONFIGURATION,
    EVALUATION,
    TRANSPORT,
    INTERNAL
}
