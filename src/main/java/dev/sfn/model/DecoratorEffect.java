package dev.sfn.model;

import com.fasterxml.jackson.databind.JsonNode;
import dev.sfn.syntax.Decorator;

import java.util.Map;

/**
 * A validated decorator application with every option resolved.
 */
public record DecoratorEffect(
    String decoratorName,
    Map<String, JsonNode> values,
    Decorator origin
) {}
