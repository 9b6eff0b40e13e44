package com.github.salilvnair.dialogengine.engine.dialog;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.rule.DialogRule;
import com.github.salilvnair.dialogengine.engine.rule.TriggerType;
import com.github.salilvnair.dialogengine.engine.step.BeginDialog;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.EditArray;
import com.github.salilvnair.dialogengine.engine.step.ForeachPage;
import com.github.salilvnair.dialogengine.engine.step.InputStep;
import com.github.salilvnair.dialogengine.engine.step.ReplaceDialog;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every dialog reachable from a root, indexed by id and validated once.
 */
@Slf4j
public final class DialogSet {

    @Getter
    private final Dialog root;
    private final Map<String, Dialog> dialogs = new LinkedHashMap<>();

    public DialogSet(Dialog root) {
        if (root == null) {
            throw new DialogEngineException(DialogEngineErrorCode.DIALOG_NOT_FOUND, "Root dialog is required");
        }
        this.root = root;
        collect(root);
        dialogs.values().forEach(this::validate);
        log.info("Dialog set for root '{}' registered {} dialog(s): {}", root.getId(), dialogs.size(), dialogs.keySet());
    }

    public Dialog find(String dialogId) {
        Dialog dialog = dialogs.get(dialogId);
        if (dialog == null) {
            throw new DialogEngineException(DialogEngineErrorCode.DIALOG_NOT_FOUND,
                    "Dialog '" + dialogId + "' is not registered");
        }
        return dialog;
    }

    public boolean contains(String dialogId) {
        return dialogs.containsKey(dialogId);
    }

    public Collection<Dialog> all() {
        return dialogs.values();
    }

    private void collect(Dialog start) {
        Deque<Dialog> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            Dialog dialog = queue.poll();
            Dialog existing = dialogs.putIfAbsent(dialog.getId(), dialog);
            if (existing != null) {
                if (existing != dialog) {
                    throw new DialogEngineException(DialogEngineErrorCode.DUPLICATE_DIALOG_ID,
                            "Dialog id '" + dialog.getId() + "' is bound to more than one definition");
                }
                continue;
            }
            queue.addAll(dialog.getDialogs());
            for (List<DialogStep> list : dialog.stepLists().values()) {
                for (DialogStep step : list) {
                    if (step instanceof BeginDialog begin && begin.dialog() != null) {
                        queue.add(begin.dialog());
                    }
                    else if (step instanceof ReplaceDialog replace && replace.dialog() != null) {
                        queue.add(replace.dialog());
                    }
                }
            }
        }
    }

    private void validate(Dialog dialog) {
        for (DialogRule rule : dialog.getRules()) {
            if (rule.triggerType() == null) {
                throw invalidRule(dialog, "rule without trigger type");
            }
            if (rule.triggerType() != TriggerType.UNKNOWN_INTENT && rule.names().isEmpty()) {
                throw invalidRule(dialog, rule.triggerType() + " rule must name at least one trigger");
            }
        }
        for (Map.Entry<String, List<DialogStep>> entry : dialog.stepLists().entrySet()) {
            for (DialogStep step : entry.getValue()) {
                validateStep(dialog, entry.getKey(), step);
            }
        }
    }

    private void validateStep(Dialog dialog, String listId, DialogStep step) {
        if (step instanceof BeginDialog begin) {
            requireDialog(dialog, begin.dialogId());
        }
        else if (step instanceof ReplaceDialog replace) {
            requireDialog(dialog, replace.dialogId());
        }
        else if (step instanceof ForeachPage page && page.pageSize() < 1) {
            throw invalidStep(dialog, listId, "foreach-page size must be positive, was " + page.pageSize());
        }
        else if (step instanceof InputStep input) {
            if (input.property() == null || input.property().isBlank()) {
                throw invalidStep(dialog, listId, "input step requires a property");
            }
            if (input.inputKind() == InputStep.InputKind.CHOICE
                    && input.choices().isEmpty() && input.choicesProperty() == null) {
                throw invalidStep(dialog, listId, "choice input requires choices or a choices property");
            }
        }
        else if (step instanceof EditArray edit && edit.changeType() == null) {
            throw invalidStep(dialog, listId, "edit-array requires a change type");
        }
    }

    private void requireDialog(Dialog owner, String dialogId) {
        if (dialogId == null || !dialogs.containsKey(dialogId)) {
            throw new DialogEngineException(DialogEngineErrorCode.DIALOG_NOT_FOUND,
                    "Dialog '" + owner.getId() + "' references unknown dialog '" + dialogId + "'");
        }
    }

    private DialogEngineException invalidRule(Dialog dialog, String message) {
        return new DialogEngineException(DialogEngineErrorCode.INVALID_RULE,
                "Dialog '" + dialog.getId() + "': " + message);
    }

    private DialogEngineException invalidStep(Dialog dialog, String listId, String message) {
        return new DialogEngineException(DialogEngineErrorCode.INVALID_STEP,
                "Dialog '" + dialog.getId() + "' list '" + listId + "': " + message);
    }
}
