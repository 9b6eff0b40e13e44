package com.github.salilvnair.dialogengine.engine.exception;

public enum DialogEngineErrorCode {

    // =========================
    // Dialog configuration errors
    // =========================
    DIALOG_NOT_FOUND(
            "Referenced dialog is not registered",
            ErrorCategory.CONFIGURATION,
            false
    ),

    DUPLICATE_DIALOG_ID(
            "Dialog id is bound to more than one definition",
            ErrorCategory.CONFIGURATION,
            false
    ),

    INVALID_STEP(
            "Step is not valid for its kind",
            ErrorCategory.CONFIGURATION,
            false
    ),

    INVALID_RULE(
            "Rule trigger is not valid",
            ErrorCategory.CONFIGURATION,
            false
    ),

    INVALID_MEMORY_PATH(
            "Memory path is malformed",
            ErrorCategory.CONFIGURATION,
            false
    ),

    UNKNOWN_MEMORY_SCOPE(
            "Memory path does not start with a known scope",
            ErrorCategory.CONFIGURATION,
            false
    ),

    MISSING_STEP_HANDLER(
            "No handler registered for step kind",
            ErrorCategory.CONFIGURATION,
            false
    ),

    DUPLICATE_STEP_HANDLER(
            "More than one handler registered for step kind",
            ErrorCategory.CONFIGURATION,
            false
    ),

    MISSING_TRIGGER_RESOLVER(
            "No resolver registered for rule trigger type",
            ErrorCategory.CONFIGURATION,
            false
    ),

    INVALID_TURN_REQUEST(
            "Turn request requires a conversation key and an activity",
            ErrorCategory.CONFIGURATION,
            false
    ),

    // =========================
    // Step evaluation errors
    // =========================
    EXPRESSION_EVALUATION_FAILED(
            "Expression evaluation failed",
            ErrorCategory.EVALUATION,
            false
    ),

    NOT_A_SEQUENCE(
            "Value is not a sequence",
            ErrorCategory.EVALUATION,
            false
    ),

    MEMORY_WRITE_FAILED(
            "Memory path cannot be written",
            ErrorCategory.EVALUATION,
            false
    ),

    STEP_LIMIT_EXCEEDED(
            "Turn exceeded the maximum number of executed steps",
            ErrorCategory.EVALUATION,
            false
    ),

    STEP_EXECUTION_FAILED(
            "Step execution failed",
            ErrorCategory.EVALUATION,
            false
    ),

    // =========================
    // Collaborator errors
    // =========================
    ACTIVITY_SEND_FAILED(
            "Outbound activity could not be delivered",
            ErrorCategory.TRANSPORT,
            true
    ),

    RECOGNIZER_FAILED(
            "Recognizer call failed",
            ErrorCategory.TRANSPORT,
            true
    ),

    STATE_LOAD_FAILED(
            "Failed to load conversation state",
            ErrorCategory.TRANSPORT,
            true
    ),

    STATE_SAVE_FAILED(
            "Failed to persist conversation state",
            ErrorCategory.TRANSPORT,
            true
    ),

    // =========================
    // Fallback
    // =========================
    TURN_CANCELLED(
            "Turn was cancelled before reaching a clean boundary",
            ErrorCategory.INTERNAL,
            true
    ),

    INTERNAL_ERROR(
            "Internal engine error",
            ErrorCategory.INTERNAL,
            false
    );

    private final String defaultMessage;
    private final ErrorCategory category;
    private final boolean recoverable;

    DialogEngineErrorCode(String defaultMessage, ErrorCategory category, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.category = category;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory category() {
        return category;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
