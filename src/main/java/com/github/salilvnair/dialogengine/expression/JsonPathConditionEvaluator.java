package com.github.salilvnair.dialogengine.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.dialogengine.util.JsonPathUtil;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conditions written as JSONPath over the memory scopes, e.g. {@code $.user.age >= 21}
 * or {@code $.dialog.todo[?(@ == 2)]}.
 */
public final class JsonPathConditionEvaluator {

    private static final Pattern BINARY_PATTERN = Pattern.compile("^\\s*(\\$[^\\n<>=!]+?)\\s*(>=|<=|!=|==|>|<)\\s*(.+?)\\s*$");

    private JsonPathConditionEvaluator() {}

    public static boolean evaluate(JsonNode scopes, String expression) {
        if (scopes == null || expression == null || expression.isBlank()) {
            return false;
        }
        String expr = expression.trim();

        Matcher binary = BINARY_PATTERN.matcher(expr);
        if (binary.matches()) {
            List<Object> pathMatches = JsonPathUtil.search(scopes, binary.group(1).trim());
            return !pathMatches.isEmpty()
                    && compare(pathMatches.get(0), parseLiteral(binary.group(3).trim()), binary.group(2).trim());
        }

        List<Object> matches = JsonPathUtil.search(scopes, expr);
        if (matches.size() == 1 && matches.get(0) instanceof Boolean b) {
            return b;
        }
        return matches.stream().anyMatch(Objects::nonNull);
    }

    private static Object parseLiteral(String raw) {
        if ("true".equalsIgnoreCase(raw)) return true;
        if ("false".equalsIgnoreCase(raw)) return false;
        if ("null".equalsIgnoreCase(raw)) return null;

        if ((raw.startsWith("\"") && raw.endsWith("\"")) || (raw.startsWith("'") && raw.endsWith("'"))) {
            return raw.substring(1, raw.length() - 1);
        }

        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            return raw;
        }
    }

    private static boolean compare(Object actual, Object expected, String op) {
        if (actual == null) {
            return expected == null ? "==".equals(op) : "!=".equals(op);
        }

        if (actual instanceof Number a && expected instanceof Number e) {
            double av = a.doubleValue();
            double ev = e.doubleValue();

            return switch (op) {
                case "==" -> av == ev;
                case "!=" -> av != ev;
                case ">=" -> av >= ev;
                case "<=" -> av <= ev;
                case ">" -> av > ev;
                case "<" -> av < ev;
                default -> false;
            };
        }

        if (Objects.equals(actual, expected)) {
            return "==".equals(op);
        }
        return "!=".equals(op);
    }
}
