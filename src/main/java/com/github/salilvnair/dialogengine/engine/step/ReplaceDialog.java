package com.github.salilvnair.dialogengine.engine.step;

import com.github.salilvnair.dialogengine.engine.dialog.Dialog;

import java.util.Map;

public record ReplaceDialog(String dialogId, Dialog dialog, Map<String, String> options) implements DialogStep {

    public ReplaceDialog {
        options = options == null ? Map.of() : Map.copyOf(options);
        if (dialogId == null && dialog != null) {
            dialogId = dialog.getId();
        }
    }

    public static ReplaceDialog of(String dialogId) {
        return new ReplaceDialog(dialogId, null, Map.of());
    }

    public static ReplaceDialog of(Dialog dialog) {
        return new ReplaceDialog(null, dialog, Map.of());
    }

    @Override
    public StepKind kind() {
        return StepKind.REPLACE_DIALOG;
    }
}
