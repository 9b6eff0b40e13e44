package com.github.salilvnair.dialogengine.intent;

import com.github.salilvnair.dialogengine.engine.model.RecognizerResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Intent name to pattern, checked in registration order. First match wins with score 1.0.
 */
public class RegexRecognizer implements Recognizer {

    private final Map<String, Pattern> intents;

    public RegexRecognizer(Map<String, String> intents) {
        this.intents = new LinkedHashMap<>();
        intents.forEach((intent, regex) -> this.intents.put(intent, Pattern.compile(regex, Pattern.CASE_INSENSITIVE)));
    }

    public static RegexRecognizer of(String intent, String regex) {
        return new RegexRecognizer(Map.of(intent, regex));
    }

    public static RegexRecognizer of(String intent1, String regex1, String intent2, String regex2) {
        Map<String, String> intents = new LinkedHashMap<>();
        intents.put(intent1, regex1);
        intents.put(intent2, regex2);
        return new RegexRecognizer(intents);
    }

    @Override
    public RecognizerResult recognize(String utterance, String locale) {
        if (utterance == null || utterance.isBlank()) {
            return RecognizerResult.none(utterance);
        }
        for (Map.Entry<String, Pattern> intent : intents.entrySet()) {
            if (intent.getValue().matcher(utterance).find()) {
                return new RecognizerResult(utterance, intent.getKey(), 1.0d, Map.of());
            }
        }
        return RecognizerResult.none(utterance);
    }
}
