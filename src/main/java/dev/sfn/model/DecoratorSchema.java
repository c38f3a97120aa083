package dev.sfn.model;

import com.fasterxml.jackson.databind.JsonNode;
import dev.sfn.syntax.Decorator;

import java.util.Map;

/**
 * Schema of a resource decorator: how often it may be applied, which options it takes,
 * and which options its implementation requires once defaults are applied.
 */
public record DecoratorSchema(
    int maxCount,
    Map<String, OptionSchema> options,
    Requirement requirement
) {
    public static final int UNLIMITED = Integer.MAX_VALUE;

    /**
     * Checks the resolved option values; throws
     * {@link dev.sfn.exceptions.UnsupportedOperation} when they are incomplete.
     */
    @FunctionalInterface
    public interface Requirement {
        Requirement NONE = (values, origin) -> {};

        void check(Map<String, JsonNode> values, Decorator origin);
    }
}
