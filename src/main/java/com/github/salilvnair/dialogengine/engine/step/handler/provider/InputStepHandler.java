package com.github.salilvnair.dialogengine.engine.step.handler.provider;

import com.github.salilvnair.dialogengine.engine.constants.MemoryKeys;
import com.github.salilvnair.dialogengine.engine.context.DialogContext;
import com.github.salilvnair.dialogengine.engine.context.TurnContext;
import com.github.salilvnair.dialogengine.engine.dialog.DialogInstance;
import com.github.salilvnair.dialogengine.engine.dialog.InputState;
import com.github.salilvnair.dialogengine.engine.dialog.StepRef;
import com.github.salilvnair.dialogengine.engine.helper.SequenceValues;
import com.github.salilvnair.dialogengine.engine.input.ChoiceFormatter;
import com.github.salilvnair.dialogengine.engine.input.InputRecognizer;
import com.github.salilvnair.dialogengine.engine.memory.DialogMemory;
import com.github.salilvnair.dialogengine.engine.model.Activity;
import com.github.salilvnair.dialogengine.engine.step.DialogStep;
import com.github.salilvnair.dialogengine.engine.step.InputStep;
import com.github.salilvnair.dialogengine.engine.step.StepKind;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepHandler;
import com.github.salilvnair.dialogengine.engine.step.handler.core.StepResult;
import com.github.salilvnair.dialogengine.expression.ExpressionEvaluator;
import com.github.salilvnair.dialogengine.template.LanguageGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Text, number, confirm and choice prompts.
 * <p>
 * The first visit prompts and parks the cursor on the step. Later visits read the
 * turn's message, unless a rule already consumed it, in which case the prompt is
 * repeated. The instance remembers which step is waiting and how many answers it
 * rejected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputStepHandler implements StepHandler {

    private final ExpressionEvaluator expressionEvaluator;
    private final LanguageGenerator languageGenerator;
    private final InputRecognizer inputRecognizer;
    private final ChoiceFormatter choiceFormatter;

    @Override
    public StepKind kind() {
        return StepKind.INPUT;
    }

    @Override
    public StepResult execute(DialogContext context, DialogStep step) {
        InputStep input = (InputStep) step;
        DialogInstance instance = context.activeInstance();
        StepRef ref = context.getCurrentRef();
        InputState waiting = instance.getPendingInput();

        if (waiting != null && ref.equals(waiting.getStepRef())) {
            return continuePrompt(context, input, instance, waiting);
        }

        DialogMemory memory = context.getMemory();
        Object initial = input.value() != null
                ? expressionEvaluator.evaluate(input.value(), memory)
                : memory.get(input.property());
        if (!input.alwaysPrompt() && initial != null) {
            memory.set(input.property(), initial);
            return new StepResult.Continue();
        }
        instance.setPendingInput(new InputState(ref, 0));
        prompt(context, input, input.prompt());
        return new StepResult.AwaitInput();
    }

    private StepResult continuePrompt(DialogContext context, InputStep input, DialogInstance instance, InputState waiting) {
        TurnContext turn = context.getTurn();
        DialogMemory memory = context.getMemory();
        Activity activity = turn.getActivity();
        if (!activity.isMessage() || turn.isActivityConsumed()) {
            // interrupted by a rule, ask again
            prompt(context, input, input.prompt());
            return new StepResult.AwaitInput();
        }
        turn.setActivityConsumed(true);
        waiting.setTurnCount(waiting.getTurnCount() + 1);

        Optional<Object> recognized = inputRecognizer.recognize(input, activity.getText(), choices(context, input), turn.getLocale());
        String retryPrompt;
        if (recognized.isPresent()) {
            memory.set(MemoryKeys.TURN_VALUE, recognized.get());
            if (valid(input, memory)) {
                memory.set(input.property(), recognized.get());
                instance.setPendingInput(null);
                return new StepResult.Continue();
            }
            retryPrompt = firstNonNull(input.invalidPrompt(), input.unrecognizedPrompt(), input.prompt());
        } else {
            retryPrompt = firstNonNull(input.unrecognizedPrompt(), input.prompt());
        }

        if (input.maxTurnCount() != null && waiting.getTurnCount() >= input.maxTurnCount()) {
            instance.setPendingInput(null);
            if (input.defaultValue() != null) {
                Object fallback = expressionEvaluator.evaluate(input.defaultValue(), memory);
                memory.set(input.property(), fallback);
                log.debug("Input {} gave up after {} turns, using default {}", input.property(), waiting.getTurnCount(), fallback);
            }
            return new StepResult.Continue();
        }
        prompt(context, input, retryPrompt);
        return new StepResult.AwaitInput();
    }

    private boolean valid(InputStep input, DialogMemory memory) {
        for (String validation : input.validations()) {
            if (!expressionEvaluator.evaluateCondition(validation, memory)) {
                return false;
            }
        }
        return true;
    }

    private void prompt(DialogContext context, InputStep input, String template) {
        String text = template == null ? "" : languageGenerator.resolve(template, context.getMemory());
        if (input.inputKind() == InputStep.InputKind.CONFIRM || input.inputKind() == InputStep.InputKind.CHOICE) {
            text = choiceFormatter.appendChoices(text, choices(context, input), input.style(), context.getTurn().getLocale());
        }
        context.getTurn().send(Activity.message(text));
    }

    private List<String> choices(DialogContext context, InputStep input) {
        if (input.inputKind() == InputStep.InputKind.CONFIRM) {
            return choiceFormatter.confirmChoices(context.getTurn().getLocale());
        }
        if (input.choicesProperty() == null) {
            return input.choices();
        }
        List<String> choices = new ArrayList<>();
        Object stored = context.getMemory().get(input.choicesProperty());
        for (Object choice : SequenceValues.asList(stored, input.choicesProperty())) {
            if (choice != null) {
                choices.add(choice.toString());
            }
        }
        return choices;
    }

    private static String firstNonNull(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
