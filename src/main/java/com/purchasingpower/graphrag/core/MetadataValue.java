package com.purchasingpower.graphrag.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.graphrag.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Typed metadata value. Serialized as its plain JSON form: string, number or string array.
 *
 * @since 1.0.0
 */
public final class MetadataValue {

    public enum Kind { STRING, NUMBER, STRING_LIST }

    private final Kind kind;
    private final String text;
    private final double number;
    private final List<String> list;

    private MetadataValue(Kind kind, String text, double number, List<String> list) {
        this.kind = kind;
        this.text = text;
        this.number = number;
        this.list = list;
    }

    public static MetadataValue of(String text) {
        return new MetadataValue(Kind.STRING, Objects.requireNonNull(text, "text"), 0, null);
    }

    public static MetadataValue of(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new ValidationException("Metadata number must be finite: " + number);
        }
        return new MetadataValue(Kind.NUMBER, null, number, null);
    }

    public static MetadataValue of(Collection<String> values) {
        return new MetadataValue(Kind.STRING_LIST, null, 0, List.copyOf(values));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MetadataValue fromJson(Object raw) {
        if (raw instanceof String s) {
            return of(s);
        }
        if (raw instanceof Number n) {
            return of(n.doubleValue());
        }
        if (raw instanceof Collection<?> c) {
            List<String> values = new ArrayList<>(c.size());
            for (Object item : c) {
                values.add(String.valueOf(item));
            }
            return of(values);
        }
        throw new ValidationException("Unsupported metadata value: " + raw);
    }

    @JsonValue
    public Object toJson() {
        return switch (kind) {
            case STRING -> text;
            case NUMBER -> number;
            case STRING_LIST -> list;
        };
    }

    public Kind kind() {
        return kind;
    }

    public String asString() {
        return switch (kind) {
            case STRING -> text;
            case NUMBER -> String.valueOf(number);
            case STRING_LIST -> String.join(", ", list);
        };
    }

    public double asNumber() {
        if (kind != Kind.NUMBER) {
            throw new ValidationException("Metadata value is not a number: " + kind);
        }
        return number;
    }

    public List<String> asList() {
        return switch (kind) {
            case STRING_LIST -> list;
            case STRING -> List.of(text);
            case NUMBER -> List.of(String.valueOf(number));
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataValue that)) return false;
        return kind == that.kind
            && Double.compare(number, that.number) == 0
            && Objects.equals(text, that.text)
            && Objects.equals(list, that.list);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, number, list);
    }

    @Override
    public String toString() {
        return kind + ":" + toJson();
    }
}
