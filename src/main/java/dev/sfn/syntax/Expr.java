package dev.sfn.syntax;

import java.util.List;

/**
 * Expression nodes of the state machine source language.
 * Only the shapes the compiler recognizes are represented.
 */
public sealed interface Expr {

    SourcePosition position();

    record Str(String value, SourcePosition position) implements Expr {}

    /**
     * Integer literals hold a {@link Long}, or a {@link java.math.BigInteger} beyond its range;
     * everything else a {@link Double}.
     */
    record Num(Number value, SourcePosition position) implements Expr {}

    record Bool(boolean value, SourcePosition position) implements Expr {}

    record NoneLit(SourcePosition position) implements Expr {}

    record Name(String id, SourcePosition position) implements Expr {}

    record DictLit(List<Expr> keys, List<Expr> values, SourcePosition position) implements Expr {}

    record ListLit(List<Expr> elements, SourcePosition position) implements Expr {}

    record TupleLit(List<Expr> elements, SourcePosition position) implements Expr {}

    /** {@code op} is one of {@code -}, {@code +}, {@code not}. */
    record UnaryOp(String op, Expr operand, SourcePosition position) implements Expr {}

    /** {@code op} is {@code and} or {@code or}. */
    record BoolOp(String op, List<Expr> values, SourcePosition position) implements Expr {}

    /** A single (non-chained) comparison; {@code op} includes {@code is not} and {@code not in}. */
    record Compare(Expr left, String op, Expr right, SourcePosition position) implements Expr {}

    record Subscript(Expr value, Expr index, SourcePosition position) implements Expr {}

    record Attribute(Expr value, String attr, SourcePosition position) implements Expr {}

    record Call(Expr func, List<Expr> args, List<Keyword> keywords, SourcePosition position) implements Expr {

        /** Name of the called function when it is a plain identifier, otherwise null. */
        public String funcName() {
            return func instanceof Name name ? name.id() : null;
        }
    }
}
