package com.github.salilvnair.dialogengine.engine.model;

import java.util.List;

public record TurnResult(
        String conversationKey,
        TurnStatus status,
        List<Activity> replies,
        Object result,
        int stackDepth
) {

    public TurnResult {
        replies = replies == null ? List.of() : List.copyOf(replies);
    }

    public List<String> replyTexts() {
        return replies.stream()
                .filter(Activity::isMessage)
                .map(Activity::getText)
                .toList();
    }
}
