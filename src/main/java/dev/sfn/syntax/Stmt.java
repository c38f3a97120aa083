package dev.sfn.syntax;

import java.util.List;

/**
 * Statements of a state machine function body.
 */
public sealed interface Stmt {

    SourcePosition position();

    /** The explicit no-op marker. */
    record Pass(SourcePosition position) implements Stmt {}

    record Assign(Expr target, Expr value, SourcePosition position) implements Stmt {}

    record AugAssign(Expr target, String op, Expr value, SourcePosition position) implements Stmt {}

    record ExprStmt(Expr value, SourcePosition position) implements Stmt {}

    /** {@code elif} chains are represented as a nested {@code If} in {@code orElse}. */
    record If(Expr test, List<Stmt> body, List<Stmt> orElse, SourcePosition position) implements Stmt {}

    record Try(List<Stmt> body, List<ExceptHandler> handlers, SourcePosition position) implements Stmt {}

    /** {@code value} is null for a bare {@code return}. */
    record Return(Expr value, SourcePosition position) implements Stmt {}

    /** {@code exception} is null for a bare {@code raise}. */
    record Raise(Expr exception, SourcePosition position) implements Stmt {}

    /**
     * One {@code except} clause. {@code type} and {@code name} are null when omitted.
     */
    record ExceptHandler(Expr type, String name, List<Stmt> body, SourcePosition position) {}
}
