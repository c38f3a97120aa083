package dev.sfn.graph;

import dev.sfn.syntax.Expr;

import java.util.List;

/**
 * What an edge means. Exactly one of three forms: the default transition,
 * a Choice branch condition, or an error catcher.
 */
public sealed interface EdgeAttrs {

    Next NEXT = new Next();

    /** Default transition, serialized as {@code Next} (or {@code Default} on a Choice). */
    record Next() implements EdgeAttrs {}

    /** Taken by a Choice state when {@code test} holds. */
    record Condition(Expr test) implements EdgeAttrs {}

    /** Taken when the source state fails with one of {@code errorEquals}. {@code resultPath} may be null. */
    record Catch(List<String> errorEquals, String resultPath) implements EdgeAttrs {

        public boolean catchesAll() {
            return errorEquals.contains(StateNode.ALL_ERRORS);
        }
    }
}
