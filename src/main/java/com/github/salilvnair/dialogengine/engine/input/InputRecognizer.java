package com.github.salilvnair.dialogengine.engine.input;

import com.github.salilvnair.dialogengine.config.DialogEngineConfig.ChoiceFormat;
import com.github.salilvnair.dialogengine.engine.step.InputStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an answer utterance into the typed value of an input step.
 */
@Component
@RequiredArgsConstructor
public class InputRecognizer {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:[.,]\\d+)?");
    private static final int MAX_ORDINAL_DIGITS = 9;
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[\\s\\p{Punct}]+");

    private final ChoiceFormatter choiceFormatter;

    /**
     * @param choices the choices offered, used by {@code CHOICE} inputs
     * @return the recognized value, or empty when the utterance does not fit the input kind
     */
    public Optional<Object> recognize(InputStep input, String text, List<String> choices, String locale) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return switch (input.inputKind()) {
            case TEXT -> Optional.of(text);
            case NUMBER -> number(text, input.outputFormat());
            case CONFIRM -> confirm(text, locale).map(Object.class::cast);
            case CHOICE -> choice(text, choices).map(Object.class::cast);
        };
    }

    Optional<Object> number(String text, InputStep.NumberFormat outputFormat) {
        Matcher matcher = NUMBER.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        double value = Double.parseDouble(matcher.group().replace(',', '.'));
        if (outputFormat == InputStep.NumberFormat.INTEGER) {
            return Optional.of((long) value);
        }
        return Optional.of(value);
    }

    Optional<Boolean> confirm(String text, String locale) {
        ChoiceFormat format = choiceFormatter.formatFor(locale);
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if ("1".equals(normalized)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("2".equals(normalized)) {
            return Optional.of(Boolean.FALSE);
        }
        List<String> yesWords = words(format.getYesWords(), format.getYes());
        List<String> noWords = words(format.getNoWords(), format.getNo());
        boolean yes = yesWords.contains(normalized);
        boolean no = noWords.contains(normalized);
        if (!yes && !no) {
            for (String token : WORD_SEPARATOR.split(normalized)) {
                yes |= yesWords.contains(token);
                no |= noWords.contains(token);
            }
        }
        if (yes == no) {
            return Optional.empty();
        }
        return Optional.of(yes);
    }

    /**
     * Exact label (ignoring case), then ordinal, then a single label mentioned in the text.
     */
    Optional<String> choice(String text, List<String> choices) {
        String trimmed = text.trim();
        for (String choice : choices) {
            if (choice.equalsIgnoreCase(trimmed)) {
                return Optional.of(choice);
            }
        }
        if (trimmed.matches("\\d+")) {
            if (trimmed.length() > MAX_ORDINAL_DIGITS) {
                return Optional.empty();
            }
            int ordinal = Integer.parseInt(trimmed);
            return ordinal >= 1 && ordinal <= choices.size() ? Optional.of(choices.get(ordinal - 1)) : Optional.empty();
        }
        String lower = " " + String.join(" ", WORD_SEPARATOR.split(trimmed.toLowerCase(Locale.ROOT))) + " ";
        List<String> mentioned = new ArrayList<>();
        for (String choice : choices) {
            if (lower.contains(" " + choice.toLowerCase(Locale.ROOT) + " ")) {
                mentioned.add(choice);
            }
        }
        return mentioned.size() == 1 ? Optional.of(mentioned.get(0)) : Optional.empty();
    }

    private static List<String> words(List<String> configured, String label) {
        List<String> words = new ArrayList<>();
        configured.forEach(word -> words.add(word.toLowerCase(Locale.ROOT)));
        if (label != null) {
            words.add(label.toLowerCase(Locale.ROOT));
        }
        return words;
    }
}
