package com.github.salilvnair.dialogengine.engine.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.dialogengine.audit.AuditService;
import com.github.salilvnair.dialogengine.audit.DialogAuditStage;
import com.github.salilvnair.dialogengine.config.DialogEngineConfig;
import com.github.salilvnair.dialogengine.engine.dialog.Dialog;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;
import com.github.salilvnair.dialogengine.engine.hook.DialogStepHook;
import com.github.salilvnair.dialogengine.engine.model.Activity;
import com.github.salilvnair.dialogengine.engine.model.ConversationSnapshot;
import com.github.salilvnair.dialogengine.engine.model.TurnRequest;
import com.github.salilvnair.dialogengine.engine.model.TurnResult;
import com.github.salilvnair.dialogengine.engine.model.TurnStatus;
import com.github.salilvnair.dialogengine.engine.rule.DialogRule;
import com.github.salilvnair.dialogengine.engine.step.BeginDialog;
import com.github.salilvnair.dialogengine.engine.step.EmitEvent;
import com.github.salilvnair.dialogengine.engine.step.EndDialog;
import com.github.salilvnair.dialogengine.engine.step.Foreach;
import com.github.salilvnair.dialogengine.engine.step.IfCondition;
import com.github.salilvnair.dialogengine.engine.step.InputStep;
import com.github.salilvnair.dialogengine.engine.step.RepeatDialog;
import com.github.salilvnair.dialogengine.engine.step.ReplaceDialog;
import com.github.salilvnair.dialogengine.engine.step.SendOutput;
import com.github.salilvnair.dialogengine.engine.step.SetProperty;
import com.github.salilvnair.dialogengine.intent.RegexRecognizer;
import com.github.salilvnair.dialogengine.service.DialogStateStore;
import com.github.salilvnair.dialogengine.service.InMemoryDialogStateStore;
import com.github.salilvnair.dialogengine.support.DialogEngineTestSupport;
import com.github.salilvnair.dialogengine.transport.LoggingActivitySender;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.github.salilvnair.dialogengine.support.TestConstants.CHILD_DIALOG;
import static com.github.salilvnair.dialogengine.support.TestConstants.CONVERSATION_KEY;
import static com.github.salilvnair.dialogengine.support.TestConstants.GREETING;
import static com.github.salilvnair.dialogengine.support.TestConstants.GREETING_CARLOS;
import static com.github.salilvnair.dialogengine.support.TestConstants.OTHER_CONVERSATION_KEY;
import static com.github.salilvnair.dialogengine.support.TestConstants.PROMPT_NAME;
import static com.github.salilvnair.dialogengine.support.TestConstants.ROOT_DIALOG;
import static com.github.salilvnair.dialogengine.support.TestConstants.USER_NAME;
import static com.github.salilvnair.dialogengine.support.TestConstants.USER_TEXT_CARLOS;
import static com.github.salilvnair.dialogengine.support.TestConstants.USER_TEXT_HI;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DialogManagerTest {

    @Test
    void replacedDialogStartsWithFreshStateAndReturnsToOriginalCaller() {
        Dialog childB = Dialog.builder()
                .id("childB")
                .step(IfCondition.of("dialog.fromA == null",
                        List.of(SendOutput.of("B starts clean")),
                        List.of(SendOutput.of("B sees A's state"))))
                .step(EndDialog.of("'b-result'"))
                .build();
        Dialog childA = Dialog.builder()
                .id("childA")
                .step(SetProperty.of("dialog.fromA", "'a'"))
                .step(ReplaceDialog.of(childB))
                .step(SendOutput.of("A should never resume"))
                .build();
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .step(new BeginDialog(null, childA, Map.of(), "dialog.answer"))
                .step(SendOutput.of("Result: {dialog.answer}"))
                .build();

        new DialogEngineTestSupport().flow(root)
                .send(USER_TEXT_HI)
                .assertReply("B starts clean")
                .assertReply("Result: b-result")
                .assertResult(result -> assertEquals(TurnStatus.STACK_COMPLETED, result.status()));
    }

    @Test
    void childDialogScopeIsIsolatedFromCaller() {
        Dialog child = Dialog.builder()
                .id(CHILD_DIALOG)
                .step(IfCondition.of("dialog.secret == null",
                        List.of(SendOutput.of("child scope is empty")),
                        List.of(SendOutput.of("child sees {dialog.secret}"))))
                .step(SetProperty.of("dialog.secret", "'child'"))
                .build();
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .step(SetProperty.of("dialog.secret", "'root'"))
                .step(BeginDialog.of(child))
                .step(SendOutput.of("root sees {dialog.secret}"))
                .build();

        new DialogEngineTestSupport().flow(root)
                .send(USER_TEXT_HI)
                .assertReply("child scope is empty")
                .assertReply("root sees root");
    }

    @Test
    void stackDepthFollowsBeginAndEnd() {
        Dialog child = Dialog.builder()
                .id(CHILD_DIALOG)
                .step(InputStep.text(PROMPT_NAME, USER_NAME).build())
                .build();
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .autoEndDialog(false)
                .step(BeginDialog.of(child))
                .step(SendOutput.of(GREETING))
                .build();

        new DialogEngineTestSupport().flow(root)
                .send(USER_TEXT_HI)
                .assertReply(PROMPT_NAME)
                .assertResult(result -> {
                    assertEquals(TurnStatus.SUSPENDED, result.status());
                    assertEquals(2, result.stackDepth());
                })
                .send(USER_TEXT_CARLOS)
                .assertReply(GREETING_CARLOS)
                .assertResult(result -> {
                    assertEquals(TurnStatus.SUSPENDED, result.status());
                    assertEquals(1, result.stackDepth());
                });
    }

    @Test
    void endDialogValueLandsInResultPropertyOfCaller() {
        Dialog child = Dialog.builder()
                .id(CHILD_DIALOG)
                .step(EndDialog.of("21 * 2"))
                .build();
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .step(BeginDialog.of(CHILD_DIALOG, "conversation.answer"))
                .step(SendOutput.of("The answer is {conversation.answer}"))
                .dialog(child)
                .build();

        new DialogEngineTestSupport().flow(root)
                .send(USER_TEXT_HI)
                .assertReply("The answer is 42");
    }

    @Test
    void beginDialogOptionsAreEvaluatedAgainstCaller() {
        Dialog child = Dialog.builder()
                .id(CHILD_DIALOG)
                .step(SendOutput.of("Hi {dialog.options.name}"))
                .build();
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .step(SetProperty.of("dialog.who", "'Ann'"))
                .step(new BeginDialog(null, child, Map.of("name", "dialog.who"), null))
                .build();

        new DialogEngineTestSupport().flow(root)
                .send(USER_TEXT_HI)
                .assertReply("Hi Ann");
    }

    @Test
    void rootEndReportsCompletedResult() {
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .step(SetProperty.of("dialog.result", "'done'"))
                .build();

        TurnResult result = new DialogEngineTestSupport().manager(root)
                .process(CONVERSATION_KEY, Activity.message(USER_TEXT_HI));

        assertEquals(TurnStatus.STACK_COMPLETED, result.status());
        assertEquals("done", result.result());
        assertEquals(0, result.stackDepth());
    }

    @Test
    void completedConversationStartsOverOnNextTurn() {
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .step(SendOutput.of("turn {turn.activity.text}"))
                .build();

        new DialogEngineTestSupport().flow(root)
                .send("one")
                .assertReply("turn one")
                .send("two")
                .assertReply("turn two");
    }

    @Test
    void ruleConsumingTheUtteranceRepromptsPendingInput() {
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .recognizer(RegexRecognizer.of("HelpIntent", "help"))
                .rule(DialogRule.intent("HelpIntent", List.of(SendOutput.of("I can remember your name."))))
                .rule(DialogRule.unknownIntent(List.of(
                        InputStep.text(PROMPT_NAME, USER_NAME).build(),
                        SendOutput.of(GREETING))))
                .build();

        new DialogEngineTestSupport().flow(root)
                .send(USER_TEXT_HI)
                .assertReply(PROMPT_NAME)
                .send("help")
                .assertReply("I can remember your name.")
                .assertReply(PROMPT_NAME)
                .send(USER_TEXT_CARLOS)
                .assertReply(GREETING_CARLOS);
    }

    @Test
    void higherPriorityRuleWins() {
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .recognizer(RegexRecognizer.of("HelpIntent", "help"))
                .rule(DialogRule.intent("HelpIntent", List.of(SendOutput.of("low"))))
                .rule(DialogRule.intent("HelpIntent", List.of(SendOutput.of("high"))).withPriority(5))
                .build();

        new DialogEngineTestSupport().flow(root)
                .send("help")
                .assertReply("high");
    }

    @Test
    void unconsumedBubbledEventIsNotFatal() {
        AuditService audit = mock(AuditService.class);
        Dialog child = Dialog.builder()
                .id(CHILD_DIALOG)
                .step(EmitEvent.of("NobodyListens", true))
                .step(SendOutput.of("still here"))
                .build();
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .step(BeginDialog.of(child))
                .build();

        DialogEngineTestSupport support = new DialogEngineTestSupport(new DialogEngineConfig(),
                new InMemoryDialogStateStore(new ObjectMapper()), audit, new LoggingActivitySender(), List.of());
        support.flow(root)
                .send(USER_TEXT_HI)
                .assertReply("still here");

        verify(audit).audit(eq(DialogAuditStage.BUBBLE_EXHAUSTED), eq(CONVERSATION_KEY), anyMap());
    }

    @Test
    void runawayTurnHitsStepLimitAndPersistsNothing() {
        DialogEngineConfig config = new DialogEngineConfig();
        config.setMaxStepsPerTurn(5);
        DialogStateStore store = new InMemoryDialogStateStore(new ObjectMapper());
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .step(SendOutput.of("again"))
                .step(new RepeatDialog())
                .build();
        DialogEngineTestSupport support = new DialogEngineTestSupport(config, store,
                mock(AuditService.class), new LoggingActivitySender(), List.of());

        DialogEngineException error = assertThrows(DialogEngineException.class,
                () -> support.manager(root).process(CONVERSATION_KEY, Activity.message(USER_TEXT_HI)));

        assertTrue(error.is(DialogEngineErrorCode.STEP_LIMIT_EXCEEDED));
        assertTrue(store.load(CONVERSATION_KEY).isEmpty());
    }

    @Test
    void foreachOverScalarFailsTheTurnWithStepMetadata() {
        DialogStateStore store = new InMemoryDialogStateStore(new ObjectMapper());
        AuditService audit = mock(AuditService.class);
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .step(SetProperty.of("dialog.items", "'abc'"))
                .step(Foreach.of("dialog.items", List.of(SendOutput.of("{dialog.value}"))))
                .build();
        DialogEngineTestSupport support = new DialogEngineTestSupport(new DialogEngineConfig(), store,
                audit, new LoggingActivitySender(), List.of());

        DialogEngineException error = assertThrows(DialogEngineException.class,
                () -> support.manager(root).process(CONVERSATION_KEY, Activity.message(USER_TEXT_HI)));

        assertTrue(error.is(DialogEngineErrorCode.NOT_A_SEQUENCE));
        assertEquals("FOREACH", error.getMetaData().get("stepKind"));
        assertEquals(ROOT_DIALOG, error.getMetaData().get("dialogId"));
        assertEquals(1, error.getMetaData().get("stepIndex"));
        assertTrue(store.load(CONVERSATION_KEY).isEmpty());
        verify(audit).audit(eq(DialogAuditStage.STEP_ERROR), eq(CONVERSATION_KEY), anyMap());
        verify(audit).audit(eq(DialogAuditStage.TURN_FAULTED), eq(CONVERSATION_KEY), anyMap());
    }

    @Test
    void failedTurnLeavesPreviousSnapshotUntouched() {
        DialogStateStore store = new InMemoryDialogStateStore(new ObjectMapper());
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .autoEndDialog(false)
                .rule(DialogRule.unknownIntent(List.of(
                        SetProperty.of("conversation.count", "(conversation.count ?: 0) + 1"),
                        IfCondition.of("turn.activity.text == 'fail'",
                                List.of(Foreach.of("conversation.count", List.of()))))))
                .build();
        DialogManager manager = new DialogEngineTestSupport(new DialogEngineConfig(), store,
                mock(AuditService.class), new LoggingActivitySender(), List.of()).manager(root);

        manager.process(CONVERSATION_KEY, Activity.message(USER_TEXT_HI));
        assertThrows(DialogEngineException.class,
                () -> manager.process(CONVERSATION_KEY, Activity.message("fail")));

        ConversationSnapshot snapshot = store.load(CONVERSATION_KEY).orElseThrow();
        assertEquals(1, snapshot.getConversationState().get("count"));
    }

    @Test
    void failingHookDoesNotFailTheTurn() {
        DialogStepHook hook = mock(DialogStepHook.class);
        when(hook.supports(any(), any())).thenReturn(true);
        doThrow(new IllegalStateException("hook down")).when(hook).beforeStep(any(), any());
        AuditService audit = mock(AuditService.class);
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .step(SendOutput.of("ok"))
                .build();
        DialogEngineTestSupport support = new DialogEngineTestSupport(new DialogEngineConfig(),
                new InMemoryDialogStateStore(new ObjectMapper()), audit, new LoggingActivitySender(), List.of(hook));

        support.flow(root)
                .send(USER_TEXT_HI)
                .assertReply("ok");

        verify(audit).audit(eq(DialogAuditStage.STEP_HOOK_ERROR), eq(CONVERSATION_KEY), anyMap());
        verify(hook).afterStep(any(), any(), any());
    }

    @Test
    void conversationsKeepSeparateState() {
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .rule(DialogRule.unknownIntent(List.of(
                        InputStep.text(PROMPT_NAME, USER_NAME).build(),
                        SendOutput.of(GREETING))))
                .build();
        DialogManager manager = new DialogEngineTestSupport().manager(root);

        manager.process(CONVERSATION_KEY, Activity.message(USER_TEXT_HI));
        manager.process(OTHER_CONVERSATION_KEY, Activity.message(USER_TEXT_HI));
        TurnResult first = manager.process(CONVERSATION_KEY, Activity.message(USER_TEXT_CARLOS));
        TurnResult second = manager.process(OTHER_CONVERSATION_KEY, Activity.message("Ana"));

        assertEquals(List.of(GREETING_CARLOS), first.replyTexts());
        assertEquals(List.of("Hello Ana, nice to meet you!"), second.replyTexts());
    }

    @Test
    void resetDropsStoredConversation() {
        Dialog root = Dialog.builder()
                .id(ROOT_DIALOG)
                .step(InputStep.text(PROMPT_NAME, USER_NAME).build())
                .step(SendOutput.of(GREETING))
                .build();
        DialogManager manager = new DialogEngineTestSupport().manager(root);

        manager.process(CONVERSATION_KEY, Activity.message(USER_TEXT_HI));
        manager.reset(CONVERSATION_KEY);
        TurnResult restarted = manager.process(CONVERSATION_KEY, Activity.message(USER_TEXT_CARLOS));

        assertEquals(List.of(PROMPT_NAME), restarted.replyTexts());
    }

    @Test
    void rejectsRequestWithoutConversationKey() {
        DialogManager manager = new DialogEngineTestSupport().manager(Dialog.builder().id(ROOT_DIALOG).build());

        DialogEngineException error = assertThrows(DialogEngineException.class,
                () -> manager.process(TurnRequest.builder().conversationKey(" ").activity(Activity.message(USER_TEXT_HI)).build()));
        assertTrue(error.is(DialogEngineErrorCode.INVALID_TURN_REQUEST));

        DialogEngineException missingActivity = assertThrows(DialogEngineException.class,
                () -> manager.process(TurnRequest.builder().conversationKey(CONVERSATION_KEY).build()));
        assertTrue(missingActivity.is(DialogEngineErrorCode.INVALID_TURN_REQUEST));
    }

    @Test
    void emptyRootCompletesImmediately() {
        TurnResult result = new DialogEngineTestSupport()
                .manager(Dialog.builder().id(ROOT_DIALOG).build())
                .process(CONVERSATION_KEY, Activity.message(USER_TEXT_HI));

        assertEquals(TurnStatus.STACK_COMPLETED, result.status());
        assertNull(result.result());
        assertTrue(result.replies().isEmpty());
    }
}
