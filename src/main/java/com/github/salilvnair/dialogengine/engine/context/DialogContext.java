package com.github.salilvnair.dialogengine.engine.context;

import com.github.salilvnair.dialogengine.engine.dialog.Dialog;
import com.github.salilvnair.dialogengine.engine.dialog.DialogInstance;
import com.github.salilvnair.dialogengine.engine.dialog.DialogSet;
import com.github.salilvnair.dialogengine.engine.dialog.DialogStack;
import com.github.salilvnair.dialogengine.engine.dialog.StepFrame;
import com.github.salilvnair.dialogengine.engine.dialog.StepRef;
import com.github.salilvnair.dialogengine.engine.memory.DialogMemory;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime view of one conversation during a turn.
 * <p>
 * The active instance is the top of the stack, except while an ancestor runs the
 * steps of a rule it consumed through bubbling. Memory's {@code dialog} and
 * {@code this} scopes always follow the active instance.
 */
@Getter
public class DialogContext {

    private final String conversationKey;
    private final DialogSet dialogs;
    private final DialogStack stack;
    private final DialogMemory memory;
    private final TurnContext turn;

    private int activeIndex;
    private StepFrame currentFrame;
    private StepRef currentRef;
    @Setter
    private Object completedResult;

    public DialogContext(String conversationKey, DialogSet dialogs, DialogStack stack,
                         DialogMemory memory, TurnContext turn) {
        this.conversationKey = conversationKey;
        this.dialogs = dialogs;
        this.stack = stack;
        this.memory = memory;
        this.turn = turn;
        activateTop();
    }

    public DialogInstance activeInstance() {
        return activeIndex < 0 ? null : stack.get(activeIndex);
    }

    public Dialog activeDialog() {
        return dialogOf(activeInstance());
    }

    public Dialog dialogOf(DialogInstance instance) {
        return dialogs.find(instance.getDialogId());
    }

    public boolean isActiveOnTop() {
        return activeIndex == stack.depth() - 1;
    }

    public void activate(int index) {
        this.activeIndex = index;
        memory.bind(activeInstance());
    }

    public void activateTop() {
        activate(stack.depth() - 1);
    }

    public void push(DialogInstance instance) {
        stack.push(instance);
        activateTop();
    }

    /**
     * Removes the active instance, which must be on top, and activates the new top.
     */
    public DialogInstance popActive() {
        DialogInstance popped = stack.pop();
        activateTop();
        return popped;
    }

    /**
     * Drops every instance above the active one. Used when an interrupting ancestor
     * changes the stack.
     */
    public List<DialogInstance> cancelAboveActive() {
        List<DialogInstance> cancelled = new ArrayList<>();
        while (stack.depth() - 1 > activeIndex) {
            cancelled.add(stack.pop());
        }
        return cancelled;
    }

    public void enterStep(StepFrame frame, StepRef ref) {
        this.currentFrame = frame;
        this.currentRef = ref;
    }
}
