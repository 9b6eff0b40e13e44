package com.github.salilvnair.dialogengine.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.dialogengine.audit.AuditService;
import com.github.salilvnair.dialogengine.audit.LoggingAuditService;
import com.github.salilvnair.dialogengine.config.DialogEngineConfig;
import com.github.salilvnair.dialogengine.engine.dialog.Dialog;
import com.github.salilvnair.dialogengine.engine.dialog.DialogLifecycle;
import com.github.salilvnair.dialogengine.engine.event.EventBubbler;
import com.github.salilvnair.dialogengine.engine.event.EventDispatcher;
import com.github.salilvnair.dialogengine.engine.executor.StepExecutor;
import com.github.salilvnair.dialogengine.engine.factory.DialogManagerFactory;
import com.github.salilvnair.dialogengine.engine.hook.DialogStepHook;
import com.github.salilvnair.dialogengine.engine.hook.LoggingStepHook;
import com.github.salilvnair.dialogengine.engine.input.ChoiceFormatter;
import com.github.salilvnair.dialogengine.engine.input.InputRecognizer;
import com.github.salilvnair.dialogengine.engine.provider.DialogManager;
import com.github.salilvnair.dialogengine.engine.rule.RuleMatcher;
import com.github.salilvnair.dialogengine.engine.rule.factory.RuleTriggerResolverFactory;
import com.github.salilvnair.dialogengine.engine.rule.provider.EventTriggerResolver;
import com.github.salilvnair.dialogengine.engine.rule.provider.IntentTriggerResolver;
import com.github.salilvnair.dialogengine.engine.rule.provider.UnknownIntentTriggerResolver;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.factory.StepHandlerFactory;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.BeginDialogStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.DeletePropertyStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.EditArrayStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.EditStepsStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.EmitEventStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.EndDialogStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.EndTurnStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.ForeachPageStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.ForeachStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.IfConditionStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.InitPropertyStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.InputStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.RepeatDialogStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.ReplaceDialogStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.SendOutputStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.SetPropertyStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.SwitchConditionStepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.provider.TraceActivityStepHandler;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import com.github.salilvnair.dialogengine.expression.SpelExpressionEvaluator;
import com.github.salilvnair.dialogengine.service.DialogStateStore;
import com.github.salilvnair.dialogengine.service.InMemoryDialogStateStore;
import com.github.salilvnair.dialogengine.template.LanguageGenerator;
import com.github.salilvnair.dialogengine.template.ThymeleafLanguageGenerator;
import com.github.salilvnair.dialogengine.transport.ActivitySender;
import com.github.salilvnair.dialogengine.transport.LoggingActivitySender;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires the engine by hand, the way the auto-configuration would, so tests run
 * without an application context.
 */
@Getter
public final class DialogEngineTestSupport {

    private final DialogEngineConfig config;
    private final ExpressionEvaluator expressionEvaluator = new SpelExpressionEvaluator();
    private final LanguageGenerator languageGenerator = new ThymeleafLanguageGenerator();
    private final DialogStateStore stateStore;
    private final AuditService audit;
    private final ActivitySender activitySender;
    private final EventBubbler eventBubbler;
    private final EventDispatcher eventDispatcher;
    private final DialogLifecycle dialogLifecycle;
    private final StepHandlerFactory stepHandlerFactory;
    private final StepExecutor stepExecutor;
    private final DialogManagerFactory dialogManagerFactory;

    public DialogEngineTestSupport() {
        this(new DialogEngineConfig());
    }

    public DialogEngineTestSupport(DialogEngineConfig config) {
        this(config, new InMemoryDialogStateStore(new ObjectMapper()), new LoggingAuditService(),
                new LoggingActivitySender(), List.of(new LoggingStepHook()));
    }

    public DialogEngineTestSupport(DialogEngineConfig config,
                                   DialogStateStore stateStore,
                                   AuditService audit,
                                   ActivitySender activitySender,
                                   List<DialogStepHook> stepHooks) {
        this.config = config;
        this.stateStore = stateStore;
        this.audit = audit;
        this.activitySender = activitySender;

        RuleTriggerResolverFactory triggerResolverFactory = new RuleTriggerResolverFactory(List.of(
                new IntentTriggerResolver(), new EventTriggerResolver(), new UnknownIntentTriggerResolver()));
        RuleMatcher ruleMatcher = new RuleMatcher(triggerResolverFactory, expressionEvaluator);
        this.eventBubbler = new EventBubbler(ruleMatcher, audit);
        this.eventDispatcher = new EventDispatcher(eventBubbler, config);
        this.dialogLifecycle = new DialogLifecycle(eventDispatcher, audit);

        ChoiceFormatter choiceFormatter = new ChoiceFormatter(config);
        List<StepHandler> handlers = new ArrayList<>();
        handlers.add(new SendOutputStepHandler(languageGenerator));
        handlers.add(new SetPropertyStepHandler(expressionEvaluator));
        handlers.add(new DeletePropertyStepHandler());
        handlers.add(new InitPropertyStepHandler());
        handlers.add(new EditArrayStepHandler(expressionEvaluator));
        handlers.add(new IfConditionStepHandler(expressionEvaluator));
        handlers.add(new SwitchConditionStepHandler(expressionEvaluator));
        handlers.add(new ForeachStepHandler());
        handlers.add(new ForeachPageStepHandler());
        handlers.add(new BeginDialogStepHandler(dialogLifecycle, expressionEvaluator));
        handlers.add(new ReplaceDialogStepHandler(dialogLifecycle, expressionEvaluator));
        handlers.add(new EndDialogStepHandler(dialogLifecycle, expressionEvaluator));
        handlers.add(new RepeatDialogStepHandler(dialogLifecycle));
        handlers.add(new EndTurnStepHandler());
        handlers.add(new EmitEventStepHandler(eventBubbler, expressionEvaluator));
        handlers.add(new EditStepsStepHandler());
        handlers.add(new InputStepHandler(expressionEvaluator, languageGenerator,
                new InputRecognizer(choiceFormatter), choiceFormatter));
        handlers.add(new TraceActivityStepHandler(config, expressionEvaluator));
        this.stepHandlerFactory = new StepHandlerFactory(handlers);
        this.stepHandlerFactory.init();

        this.stepExecutor = new StepExecutor(stepHandlerFactory, dialogLifecycle, config, stepHooks, audit);
        this.dialogManagerFactory = new DialogManagerFactory(dialogLifecycle, eventDispatcher, stepExecutor,
                stateStore, activitySender, audit, config);
    }

    public DialogManager manager(Dialog root) {
        return dialogManagerFactory.create(root);
    }

    public DialogTestFlow flow(Dialog root) {
        return new DialogTestFlow(manager(root), TestConstants.CONVERSATION_KEY);
    }
}
