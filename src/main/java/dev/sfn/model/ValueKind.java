package dev.sfn.model;

import dev.sfn.syntax.Expr;

/**
 * Literal kinds a decorator option may hold.
 */
public enum ValueKind {
    STRING("string", Expr.Str.class),
    BOOLEAN("boolean", Expr.Bool.class),
    DICT("dict", Expr.DictLit.class);

    private final String label;
    private final Class<? extends Expr> syntax;

    ValueKind(String label, Class<? extends Expr> syntax) {
        this.label = label;
        this.syntax = syntax;
    }

    public String label() {
        return label;
    }

    public boolean accepts(Expr node) {
        return syntax.isInstance(node);
    }
}
