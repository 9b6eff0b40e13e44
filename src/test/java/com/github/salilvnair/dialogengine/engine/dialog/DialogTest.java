package com.github.salilvnair.dialogengine.engine.dialog;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.rule.DialogRule;
import com.github.salilvnair.dialogengine.engine.step.Foreach;
import com.github.salilvnair.dialogengine.engine.step.IfCondition;
import com.github.salilvnair.dialogengine.engine.step.SendOutput;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.dialogengine.support.TestConstants.ROOT_DIALOG;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialogTest {

    private final Dialog dialog = Dialog.builder()
            .id(ROOT_DIALOG)
            .step(SendOutput.of("first"))
            .step(IfCondition.of("true",
                    List.of(Foreach.of("dialog.items", List.of(SendOutput.of("item")))),
                    List.of(SendOutput.of("else"))))
            .rule(DialogRule.unknownIntent(List.of(SendOutput.of("rule"))))
            .build();

    @Test
    void registersEveryNestedStepListUnderStableId() {
        assertTrue(dialog.stepLists().keySet().containsAll(List.of(
                "steps", "steps/1.then", "steps/1.else", "steps/1.then/0.body", "rules[0]")));
        assertEquals("item", ((SendOutput) dialog.step(StepRef.of("steps/1.then/0.body", 0))).template());
    }

    @Test
    void refsEnumerateList() {
        assertEquals(List.of(StepRef.of("steps", 0), StepRef.of("steps", 1)), dialog.refs(Dialog.STEPS_LIST));
        assertEquals("rules[0]", dialog.ruleListId(dialog.getRules().get(0)));
    }

    @Test
    void unknownRefsFail() {
        assertThrows(DialogEngineException.class, () -> dialog.step(StepRef.of("steps", 5)));
        assertThrows(DialogEngineException.class, () -> dialog.stepList("steps/9.then"));
    }

    @Test
    void idIsRequired() {
        DialogEngineException error = assertThrows(DialogEngineException.class, () -> Dialog.builder().id(" ").build());

        assertTrue(error.is(DialogEngineErrorCode.INVALID_STEP));
    }

    @Test
    void autoEndDefaultsToTrue() {
        assertTrue(dialog.isAutoEndDialog());
        assertEquals("dialog.result", dialog.getDefaultResultProperty());
    }
}
