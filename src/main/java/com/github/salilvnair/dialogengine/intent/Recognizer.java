package com.github.salilvnair.dialogengine.intent;

import com.github.salilvnair.dialogengine.engine.model.RecognizerResult;

public interface Recognizer {

    /**
     * @return the best intent, or a result without intent when nothing matched
     */
    RecognizerResult recognize(String utterance, String locale);
}
