package com.github.salilvnair.dialogengine.engine.rule;

public enum TriggerType {
    /** Named intents of a recognized-intent event. */
    INTENT,
    /** Named dialog events, built-in or emitted. */
    EVENT,
    /** Utterances without a confident intent. */
    UNKNOWN_INTENT
}
