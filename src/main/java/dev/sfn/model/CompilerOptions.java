package dev.sfn.model;

/**
 * Settings that shape how source files are found and compiled.
 */
public record CompilerOptions(
    String dataName,
    String sourceExtension,
    boolean prettyPrint
) {
    public static final String DEFAULT_DATA_NAME = "data";
    public static final String DEFAULT_SOURCE_EXTENSION = ".sfn";
    public static final boolean DEFAULT_PRETTY_PRINT = true;

    public static CompilerOptions defaults() {
        return new CompilerOptions(DEFAULT_DATA_NAME, DEFAULT_SOURCE_EXTENSION, DEFAULT_PRETTY_PRINT);
    }
}
