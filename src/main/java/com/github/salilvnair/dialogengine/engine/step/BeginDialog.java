package com.github.salilvnair.dialogengine.engine.step;

import com.github.salilvnair.dialogengine.engine.dialog.Dialog;

import java.util.Map;

/**
 * Pushes a child dialog, either registered by id or given inline.
 *
 * @param options        option name to expression, evaluated against the caller's memory
 * @param resultProperty caller path that receives the child's result, may be null
 */
public record BeginDialog(String dialogId, Dialog dialog, Map<String, String> options, String resultProperty)
        implements DialogStep {

    public BeginDialog {
        options = options == null ? Map.of() : Map.copyOf(options);
        if (dialogId == null && dialog != null) {
            dialogId = dialog.getId();
        }
    }

    public static BeginDialog of(String dialogId) {
        return new BeginDialog(dialogId, null, Map.of(), null);
    }

    public static BeginDialog of(Dialog dialog) {
        return new BeginDialog(null, dialog, Map.of(), null);
    }

    public static BeginDialog of(String dialogId, String resultProperty) {
        return new BeginDialog(dialogId, null, Map.of(), resultProperty);
    }

    @Override
    public StepKind kind() {
        return StepKind.BEGIN_DIALOG;
    }
}
