package dev.sfn.model;

import com.fasterxml.jackson.databind.JsonNode;
import dev.sfn.syntax.Expr;

/**
 * Reads a literal syntax node into a JSON value.
 * Implementations throw {@link dev.sfn.exceptions.UnsupportedOperation} for anything
 * that is not a literal of the expected kind.
 */
@FunctionalInterface
public interface ValueExtractor {

    JsonNode extract(Expr node);
}
