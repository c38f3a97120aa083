package dev.sfn.syntax;

/**
 * Location of a syntax node in its source file. Lines are 1-based, columns 0-based.
 */
public record SourcePosition(int line, int column) {

    @Override
    public String toString() {
        return "line %d, column %d".formatted(line, column);
    }
}
