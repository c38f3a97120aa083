package dev.sfn.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Schema of one decorator option. A null {@code defaultValue} means the option has no
 * default and is absent from the effect when not supplied.
 */
public record OptionSchema(
    ValueKind kind,
    ValueExtractor extractor,
    JsonNode defaultValue
) {
    public static OptionSchema of(ValueKind kind, ValueExtractor extractor) {
        return new OptionSchema(kind, extractor, null);
    }

    public static OptionSchema withDefault(ValueKind kind, ValueExtractor extractor, JsonNode defaultValue) {
        return new OptionSchema(kind, extractor, defaultValue);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
