package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.dialog.StepFrame;
import com.github.salilvnair.dialogengine.engine.dialog.StepRef;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.EditSteps;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EditStepsStepHandler implements StepHandler {

    @Override
    public StepKind kind() {
        return StepKind.EDIT_STEPS;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        EditSteps editSteps = (EditSteps) step;
        StepFrame frame = context.getCurrentFrame();
        List<StepRef> refs = context.activeDialog().branchRefs(context.getCurrentRef(), EditSteps.STEPS_BRANCH);
        switch (editSteps.changeType()) {
            case REPLACE_SEQUENCE -> frame.replacePending(refs);
            case INSERT_STEPS -> frame.insertFront(refs);
            case APPEND_STEPS -> frame.append(refs);
            case END_SEQUENCE -> frame.replacePending(List.of());
        }
        return new StepResult.Continue();
    }
}
