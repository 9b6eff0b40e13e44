package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.Dialog;
import com.github.salilvnair.dialogengine.engine.dialog.LoopState;
import com.github.salilvnair.dialogengine.engine.dialog.StepFrame;
import com.github.salilvnair.dialogengine.engine.helper.SequenceValues;
import com.github.salilvnair.dialogengine.engine.memory.DialogMemory;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.Foreach;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.LoopStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.util.JsonUtil;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the body once per element. The list is re-read before every iteration, so the
 * body may grow or shrink it.
 */
@Component
public class ForeachStepHandler implements LoopStepHandler {

    @Override
    public StepKind kind() {
        return StepKind.FOREACH;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        Foreach foreach = (Foreach) step;
        List<Object> items = SequenceValues.asList(context.getMemory().get(foreach.listProperty()), foreach.listProperty());
        String bodyListId = Dialog.branchListId(context.getCurrentRef(), Foreach.BODY_BRANCH);
        if (items.isEmpty() || foreach.steps().isEmpty()) {
            return new StepResult.Continue();
        }
        LoopState loop = LoopState.builder()
                .kind(StepKind.FOREACH)
                .listProperty(foreach.listProperty())
                .indexProperty(foreach.indexProperty())
                .valueProperty(foreach.valueProperty())
                .pageSize(1)
                .offset(0)
                .bodyListId(bodyListId)
                .build();
        bind(context.getMemory(), loop, items);
        context.activeInstance().pushFrame(StepFrame.loop(context.activeDialog().refs(bodyListId), loop));
        return new StepResult.Continue();
    }

    @Override
    public boolean nextIteration(DialogContext context, StepFrame frame) {
        LoopState loop = frame.getLoop();
        List<Object> items = SequenceValues.asList(context.getMemory().get(loop.getListProperty()), loop.getListProperty());
        int next = loop.getOffset() + 1;
        if (next >= items.size()) {
            return false;
        }
        loop.setOffset(next);
        bind(context.getMemory(), loop, items);
        frame.replacePending(context.activeDialog().refs(loop.getBodyListId()));
        return true;
    }

    private void bind(DialogMemory memory, LoopState loop, List<Object> items) {
        memory.set(loop.getIndexProperty(), loop.getOffset());
        memory.set(loop.getValueProperty(), JsonUtil.deepCopy(items.get(loop.getOffset())));
    }
}
