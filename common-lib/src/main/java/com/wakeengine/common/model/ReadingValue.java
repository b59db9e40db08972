package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Observed value of a single condition signal: a number, a text, a list of texts
 * or a boolean flag.
 *
 * <p>Serialises to and from the bare JSON value ({@code 72}, {@code "rain"},
 * {@code ["gym","exam"]}, {@code true}). Whole numbers render without a fraction
 * in {@link #asText()} so that {@code contains} predicates see {@code "60"}, not {@code "60.0"}.
 */
public final class ReadingValue {

    public enum Kind { NUMBER, TEXT, TEXT_LIST, FLAG }

    private final Kind kind;
    private final Object value;

    private ReadingValue(Kind kind, Object value) {
        this.kind  = kind;
        this.value = value;
    }

    public static ReadingValue number(double value) {
        return new ReadingValue(Kind.NUMBER, value);
    }

    public static ReadingValue text(String value) {
        return new ReadingValue(Kind.TEXT, Objects.requireNonNull(value, "value"));
    }

    public static ReadingValue textList(Collection<String> values) {
        return new ReadingValue(Kind.TEXT_LIST, List.copyOf(values));
    }

    public static ReadingValue flag(boolean value) {
        return new ReadingValue(Kind.FLAG, value);
    }

    /**
     * Wraps a raw JSON-shaped value.
     *
     * @throws IllegalArgumentException when the value has no matching kind
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ReadingValue of(Object raw) {
        if (raw instanceof ReadingValue rv) return rv;
        if (raw instanceof Number n)        return number(n.doubleValue());
        if (raw instanceof String s)        return text(s);
        if (raw instanceof Boolean b)       return flag(b);
        if (raw instanceof Collection<?> c) {
            List<String> items = new ArrayList<>(c.size());
            for (Object item : c) {
                items.add(String.valueOf(item));
            }
            return textList(items);
        }
        throw new IllegalArgumentException("Unsupported reading value: " + raw);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public double asNumber() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("Reading is " + kind + ", not NUMBER");
        }
        return (Double) value;
    }

    @SuppressWarnings("unchecked")
    public List<String> asTextList() {
        if (kind != Kind.TEXT_LIST) {
            throw new IllegalStateException("Reading is " + kind + ", not TEXT_LIST");
        }
        return (List<String>) value;
    }

    /** String form used by {@code contains} and in human-readable reasons. */
    public String asText() {
        if (kind == Kind.NUMBER) {
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        if (kind == Kind.TEXT_LIST) {
            return String.join(",", asTextList());
        }
        return String.valueOf(value);
    }

    @JsonValue
    public Object raw() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReadingValue other)) return false;
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + "(" + asText() + ")";
    }
}
