package com.github.salilvnair.dialogengine.engine.constants;

public final class DialogEvents {

    private DialogEvents() {
    }

    public static final String BEGIN_DIALOG = "beginDialog";
    public static final String RECOGNIZED_INTENT = "recognizedIntent";
    public static final String UNKNOWN_INTENT = "unknownIntent";
    public static final String CONVERSATION_UPDATE = "conversationUpdate";
    public static final String ACTIVITY_RECEIVED = "activityReceived";
}
