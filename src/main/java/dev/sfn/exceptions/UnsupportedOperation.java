package dev.sfn.exceptions;

import dev.sfn.syntax.SourcePosition;

/**
 * Raised for any construct the compiler cannot turn into a state machine: invalid
 * syntax, misused decorators, non-literal values, reserved result paths.
 * <p>
 * Every detected violation is fatal to the function being compiled.
 */
public class UnsupportedOperation extends RuntimeException {

    private final SourcePosition position;

    public UnsupportedOperation(String message, SourcePosition position) {
        super(message);
        this.position = position;
    }

    public SourcePosition position() {
        return position;
    }

    /**
     * Throw unless {@code condition} holds.
     */
    public static void check(boolean condition, String message, SourcePosition position) {
        if (!condition) {
            throw new UnsupportedOperation(message, position);
        }
    }

    @Override
    public String toString() {
        return "UnsupportedOperation at " + position + ": " + getMessage();
    }
}
