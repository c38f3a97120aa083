package dev.sfn.syntax;

import java.util.List;

/**
 * A top-level function; each one is a candidate state machine.
 */
public record FunctionDef(
    String name,
    List<String> params,
    List<Decorator> decorators,
    List<Stmt> body,
    SourcePosition position
) {}
