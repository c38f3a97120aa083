package dev.sfn.syntax;

import java.util.List;

/**
 * A decorator applied to a function definition, e.g. {@code @schedule(expression="rate(1 day)")}.
 * A decorator written without parentheses has no arguments.
 */
public record Decorator(
    String name,
    List<Expr> args,
    List<Keyword> keywords,
    SourcePosition position
) {}
