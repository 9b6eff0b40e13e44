package com.github.salilvnair.dialogengine.engine.constants;

public final class MemoryKeys {

    private MemoryKeys() {
    }

    public static final String TURN_ACTIVITY = "turn.activity";
    public static final String TURN_LOCALE = "turn.locale";
    public static final String TURN_RECOGNIZED = "turn.recognized";
    public static final String TURN_DIALOG_EVENT = "turn.dialogEvent";
    public static final String TURN_VALUE = "turn.value";
    public static final String TURN_LAST_RESULT = "turn.lastResult";

    public static final String DIALOG_OPTIONS = "options";
    public static final String DIALOG_RESULT = "dialog.result";
    public static final String DIALOG_INDEX = "dialog.index";
    public static final String DIALOG_VALUE = "dialog.value";
    public static final String DIALOG_PAGE = "dialog.page";
}
