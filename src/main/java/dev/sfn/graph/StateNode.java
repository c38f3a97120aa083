package dev.sfn.graph;

import dev.sfn.syntax.Expr;
import dev.sfn.syntax.Stmt;

/**
 * A state of the state machine, tied to the statement it was built from.
 * Edges are owned by the {@link StateGraph}.
 */
public sealed interface StateNode {

    String ALL_ERRORS = "States.ALL";

    Stmt origin();

    /** ASL {@code Type} of the state. */
    String type();

    /** Whether the state supports {@code Catch} and {@code Retry}. */
    default boolean canFail() {
        return false;
    }

    /**
     * Static value injection, or a structural placeholder when built from {@code pass}.
     */
    record PassState(Stmt origin) implements StateNode {
        @Override
        public String type() {
            return "Pass";
        }

        public boolean isPlaceholder() {
            return origin instanceof Stmt.Pass;
        }
    }

    /** {@code target} is the assignment target, or null when the result is discarded. */
    record TaskState(Stmt origin, Expr.Call call, Expr target) implements StateNode {
        @Override
        public String type() {
            return "Task";
        }

        @Override
        public boolean canFail() {
            return true;
        }
    }

    record ChoiceState(Stmt.If origin) implements StateNode {
        @Override
        public String type() {
            return "Choice";
        }
    }

    record WaitState(Stmt origin, Expr.Call call) implements StateNode {
        @Override
        public String type() {
            return "Wait";
        }
    }

    record ParallelState(Stmt origin, Expr.Call call, Expr target) implements StateNode {
        @Override
        public String type() {
            return "Parallel";
        }

        @Override
        public boolean canFail() {
            return true;
        }
    }

    record MapState(Stmt origin, Expr.Call call, Expr target) implements StateNode {
        @Override
        public String type() {
            return "Map";
        }

        @Override
        public boolean canFail() {
            return true;
        }
    }

    /** Built from {@code return}, or added as the default of a Choice nothing follows. */
    record SucceedState(Stmt origin) implements StateNode {
        @Override
        public String type() {
            return "Succeed";
        }
    }

    record FailState(Stmt.Raise origin) implements StateNode {
        @Override
        public String type() {
            return "Fail";
        }
    }
}
