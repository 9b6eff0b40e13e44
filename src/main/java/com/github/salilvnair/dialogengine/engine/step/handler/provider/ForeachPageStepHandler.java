package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.Dialog;
import com.github.salilvnair.dialogengine.engine.dialog.LoopState;
import com.github.salilvnair.dialogengine.engine.dialog.StepFrame;
import com.github.salilvnair.dialogengine.engine.helper.SequenceValues;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.ForeachPage;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.LoopStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.util.JsonUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the body once per page of {@code pageSize} consecutive elements; the last page
 * may be shorter.
 */
@Component
public class ForeachPageStepHandler implements LoopStepHandler {

    @Override
    public StepKind kind() {
        return StepKind.FOREACH_PAGE;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        ForeachPage foreachPage = (ForeachPage) step;
        List<Object> items = SequenceValues.asList(context.getMemory().get(foreachPage.listProperty()), foreachPage.listProperty());
        String bodyListId = Dialog.branchListId(context.getCurrentRef(), ForeachPage.BODY_BRANCH);
        if (items.isEmpty() || foreachPage.steps().isEmpty()) {
            return new StepResult.Continue();
        }
        LoopState loop = LoopState.builder()
                .kind(StepKind.FOREACH_PAGE)
                .listProperty(foreachPage.listProperty())
                .valueProperty(foreachPage.valueProperty())
                .pageSize(foreachPage.pageSize())
                .offset(0)
                .bodyListId(bodyListId)
                .build();
        context.getMemory().set(loop.getValueProperty(), page(items, 0, loop.getPageSize()));
        context.activeInstance().pushFrame(StepFrame.loop(context.activeDialog().refs(bodyListId), loop));
        return new StepResult.Continue();
    }

    @Override
    public boolean nextIteration(DialogContext context, StepFrame frame) {
        LoopState loop = frame.getLoop();
        List<Object> items = SequenceValues.asList(context.getMemory().get(loop.getListProperty()), loop.getListProperty());
        long nextOffset = (long) loop.getOffset() + loop.getPageSize();
        if (nextOffset >= items.size()) {
            return false;
        }
        int next = (int) nextOffset;
        loop.setOffset(next);
        context.getMemory().set(loop.getValueProperty(), page(items, next, loop.getPageSize()));
        frame.replacePending(context.activeDialog().refs(loop.getBodyListId()));
        return true;
    }

    static List<Object> page(List<?> items, int offset, int pageSize) {
        int end = (int) Math.min(items.size(), (long) offset + pageSize);
        List<Object> page = new ArrayList<>(Math.max(0, end - offset));
        for (int i = offset; i < end; i++) {
            page.add(JsonUtil.deepCopy(items.get(i)));
        }
        return page;
    }
}
