package com.github.salilvnair.dialogengine.engine.dialog;

import com.github.salilvnair.dialogengine.engine.constants.MemoryKeys;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.rule.DialogRule;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.intent.Recognizer;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable dialog definition.
 * <p>
 * Every step list (the dialog's own steps, each rule's steps and every nested branch)
 * is registered under a stable id when the dialog is built, so a persisted cursor only
 * needs {@link StepRef}s.
 */
@Getter
public final class Dialog {

    public static final String STEPS_LIST = "steps";

    private final String id;
    private final List<DialogStep> steps;
    private final List<DialogRule> rules;
    private final List<Dialog> dialogs;
    private final Recognizer recognizer;
    private final boolean autoEndDialog;
    private final String defaultResultProperty;

    @Getter(AccessLevel.NONE)
    private final Map<String, List<DialogStep>> stepLists = new LinkedHashMap<>();

    @Builder
    private Dialog(String id,
                   @Singular List<DialogStep> steps,
                   @Singular List<DialogRule> rules,
                   @Singular List<Dialog> dialogs,
                   Recognizer recognizer,
                   Boolean autoEndDialog,
                   String defaultResultProperty) {
        if (id == null || id.isBlank()) {
            throw new DialogEngineException(DialogEngineErrorCode.INVALID_STEP, "Dialog id is required");
        }
        this.id = id;
        this.steps = List.copyOf(steps);
        this.rules = List.copyOf(rules);
        this.dialogs = List.copyOf(dialogs);
        this.recognizer = recognizer;
        this.autoEndDialog = autoEndDialog == null || autoEndDialog;
        this.defaultResultProperty = defaultResultProperty == null ? MemoryKeys.DIALOG_RESULT : defaultResultProperty;
        register(STEPS_LIST, this.steps);
        for (int i = 0; i < this.rules.size(); i++) {
            register(ruleListId(i), this.rules.get(i).steps());
        }
    }

    public static String ruleListId(int ruleIndex) {
        return "rules[" + ruleIndex + "]";
    }

    public static String branchListId(StepRef owner, String branch) {
        return owner.listId() + "/" + owner.index() + "." + branch;
    }

    public String ruleListId(DialogRule rule) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i) == rule) {
                return ruleListId(i);
            }
        }
        throw new DialogEngineException(DialogEngineErrorCode.INVALID_RULE,
                "Rule is not registered on dialog '" + id + "'");
    }

    public List<DialogStep> stepList(String listId) {
        List<DialogStep> list = stepLists.get(listId);
        if (list == null) {
            throw new DialogEngineException(DialogEngineErrorCode.INVALID_STEP,
                    "Dialog '" + id + "' has no step list '" + listId + "'");
        }
        return list;
    }

    public DialogStep step(StepRef ref) {
        List<DialogStep> list = stepList(ref.listId());
        if (ref.index() < 0 || ref.index() >= list.size()) {
            throw new DialogEngineException(DialogEngineErrorCode.INVALID_STEP,
                    "Dialog '" + id + "' has no step " + ref.index() + " in '" + ref.listId() + "'");
        }
        return list.get(ref.index());
    }

    public List<StepRef> refs(String listId) {
        int size = stepList(listId).size();
        List<StepRef> refs = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            refs.add(StepRef.of(listId, i));
        }
        return refs;
    }

    public List<StepRef> branchRefs(StepRef owner, String branch) {
        return refs(branchListId(owner, branch));
    }

    public Map<String, List<DialogStep>> stepLists() {
        return Collections.unmodifiableMap(stepLists);
    }

    private void register(String listId, List<DialogStep> list) {
        stepLists.put(listId, list);
        for (int i = 0; i < list.size(); i++) {
            StepRef owner = StepRef.of(listId, i);
            for (Map.Entry<String, List<DialogStep>> branch : list.get(i).branches().entrySet()) {
                register(branchListId(owner, branch.getKey()), branch.getValue());
            }
        }
    }

    @Override
    public String toString() {
        return "Dialog[" + id + "]";
    }
}
