package com.github.salilvnair.dialogengine.engine.input;

import com.github.salilvnair.dialogengine.config.DialogEngineConfig;
import com.github.salilvnair.dialogengine.config.DialogEngineConfig.ChoiceFormat;
import com.github.salilvnair.dialogengine.engine.step.InputStep.ChoiceStyle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Locale-aware rendering of choice lists appended to input prompts.
 * <p>
 * The per-locale formats are copied once at construction and never change afterwards.
 */
@Component
public class ChoiceFormatter {

    private static final String FALLBACK_LANGUAGE = "en";

    private final Map<String, ChoiceFormat> formats;
    private final String defaultLocale;

    public ChoiceFormatter(DialogEngineConfig config) {
        Map<String, ChoiceFormat> copy = new LinkedHashMap<>();
        config.getChoiceFormats().forEach((locale, format) -> copy.put(normalize(locale), format));
        this.formats = Map.copyOf(copy);
        this.defaultLocale = normalize(config.getDefaultLocale());
    }

    /**
     * Exact locale, then its language, then the configured default, then English.
     */
    public ChoiceFormat formatFor(String locale) {
        for (String candidate : List.of(normalize(locale), language(locale),
                defaultLocale, language(defaultLocale), FALLBACK_LANGUAGE)) {
            ChoiceFormat format = formats.get(candidate);
            if (format != null) {
                return format;
            }
        }
        return new ChoiceFormat();
    }

    public List<String> confirmChoices(String locale) {
        ChoiceFormat format = formatFor(locale);
        return List.of(format.getYes(), format.getNo());
    }

    public String appendChoices(String prompt, List<String> choices, ChoiceStyle style, String locale) {
        if (choices == null || choices.isEmpty() || style == ChoiceStyle.NONE) {
            return prompt;
        }
        ChoiceFormat format = formatFor(locale);
        if (style == ChoiceStyle.LIST) {
            StringBuilder text = new StringBuilder(prompt == null ? "" : prompt).append("\n");
            for (int i = 0; i < choices.size(); i++) {
                text.append("\n   ").append(i + 1).append(". ").append(choices.get(i));
            }
            return text.toString();
        }
        String inline = inline(choices, format);
        return prompt == null || prompt.isEmpty() ? inline : prompt + " " + inline;
    }

    String inline(List<String> choices, ChoiceFormat format) {
        List<String> labels = new ArrayList<>(choices.size());
        for (int i = 0; i < choices.size(); i++) {
            labels.add(format.isIncludeNumbers() ? "(" + (i + 1) + ") " + choices.get(i) : choices.get(i));
        }
        if (labels.size() == 1) {
            return labels.get(0);
        }
        if (labels.size() == 2) {
            return labels.get(0) + format.getInlineOr() + labels.get(1);
        }
        String head = String.join(format.getInlineSeparator(), labels.subList(0, labels.size() - 1));
        return head + format.getInlineOrMore() + labels.get(labels.size() - 1);
    }

    private static String normalize(String locale) {
        return locale == null ? "" : locale.trim().replace('_', '-').toLowerCase(Locale.ROOT);
    }

    private static String language(String locale) {
        String normalized = normalize(locale);
        int dash = normalized.indexOf('-');
        return dash < 0 ? normalized : normalized.substring(0, dash);
    }
}
