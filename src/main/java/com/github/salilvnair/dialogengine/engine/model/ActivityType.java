package com.github.salilvnair.dialogengine.engine.model;

public enum ActivityType {
    MESSAGE,
    EVENT,
    CONVERSATION_UPDATE,
    TRACE
}
