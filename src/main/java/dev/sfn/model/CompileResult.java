package dev.sfn.model;

import dev.sfn.syntax.SourcePosition;

/**
 * Outcome of compiling one function.
 */
public sealed interface CompileResult {

    String functionName();

    record Success(CompiledStateMachine stateMachine) implements CompileResult {
        @Override
        public String functionName() {
            return stateMachine.name();
        }
    }

    record Failure(String functionName, String message, SourcePosition position) implements CompileResult {}
}
