package dev.sfn.syntax;

/**
 * A {@code name=value} argument in a call or decorator.
 */
public record Keyword(String name, Expr value, SourcePosition position) {}
