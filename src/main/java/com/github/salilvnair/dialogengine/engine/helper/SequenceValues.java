package com.github.salilvnair.dialogengine.engine.helper;

import com.github.salilvnair.dialogengine.engine.exception.DialogEngineErrorCode;
import com.github.salilvnair.dialogengine.engine.exception.DialogEngineException;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class SequenceValues {

    private SequenceValues() {
    }

    /**
     * Reads a memory value as a list. {@code null} is an empty sequence.
     *
     * @throws DialogEngineException {@code NOT_A_SEQUENCE} for anything that is not a
     *                               list, array or iterable
     */
    public static List<Object> asList(Object value, String property) {
        if (value == null) {
            return new ArrayList<>();
        }
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> items = new ArrayList<>();
            iterable.forEach(items::add);
            return items;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items;
        }
        throw new DialogEngineException(DialogEngineErrorCode.NOT_A_SEQUENCE,
                "'" + property + "' holds " + value.getClass().getSimpleName() + ", expected a list");
    }

    /**
     * Equality that treats numbers of different Java types as equal when their values are.
     */
    public static boolean looselyEquals(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            BigDecimal a = toDecimal(l);
            BigDecimal b = toDecimal(r);
            if (a != null && b != null) {
                return a.compareTo(b) == 0;
            }
        }
        return Objects.equals(left, right);
    }

    /**
     * Compares an evaluated value with a literal written in a definition: booleans
     * ignore case, numbers compare numerically, everything else by its string form.
     */
    public static boolean matchesLiteral(Object value, String literal) {
        if (value == null || literal == null) {
            return value == null && (literal == null || "null".equals(literal));
        }
        if (value instanceof Boolean) {
            return value.toString().equalsIgnoreCase(literal.trim());
        }
        if (value instanceof Number number) {
            BigDecimal actual = toDecimal(number);
            try {
                return actual != null && actual.compareTo(new BigDecimal(literal.trim())) == 0;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return value.toString().equals(literal);
    }

    private static BigDecimal toDecimal(Number number) {
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            // NaN and infinities
            return null;
        }
    }
}
