package dev.sfn.engine;

import dev.sfn.exceptions.UnsupportedOperation;
import dev.sfn.syntax.Expr;
import dev.sfn.syntax.SourcePosition;

import java.util.ArrayDeque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts references into the data object, such as {@code data["a"][0]}, into
 * JSONPath strings such as {@code $['a'][0]}.
 */
public final class DataPaths {

    /** Keys the runtime writes its own metadata under; results may not be stored there. */
    public static final List<String> RESERVED_INPUT_DATA_KEYS = List.of("Result", "ResultPath", "Error", "Cause");

    public static final Pattern INVALID_RESULT_PATH_PATTERN = Pattern.compile(
        "\\['(" + String.join("|", RESERVED_INPUT_DATA_KEYS) + ")'\\]", Pattern.CASE_INSENSITIVE);

    private DataPaths() {}

    /**
     * Whether {@code node} is the data name itself or a chain of subscripts on it.
     */
    public static boolean isReference(Expr node, String dataName) {
        Expr current = node;
        while (current instanceof Expr.Subscript subscript) {
            current = subscript.value();
        }
        return current instanceof Expr.Name name && name.id().equals(dataName);
    }

    /**
     * JSONPath of a data reference. The bare data name maps to {@code $}.
     */
    public static String path(Expr node, String dataName) {
        var keys = new ArrayDeque<Expr>();
        Expr current = node;
        while (current instanceof Expr.Subscript subscript) {
            keys.push(subscript.index());
            current = subscript.value();
        }
        if (!(current instanceof Expr.Name name) || !name.id().equals(dataName)) {
            throw new UnsupportedOperation(
                "Expected a reference into '%s', e.g. %s[\"key\"]".formatted(dataName, dataName), node.position());
        }
        var sb = new StringBuilder("$");
        for (Expr key : keys) {
            sb.append(segment(key));
        }
        return sb.toString();
    }

    /**
     * Path a state result is written to. The target must subscript the data object
     * and must not contain a reserved key.
     */
    public static String resultPath(Expr target, String dataName) {
        if (!(target instanceof Expr.Subscript)) {
            throw new UnsupportedOperation(
                "Only keys of '%s' can be assigned, e.g. %s[\"key\"] = ...".formatted(dataName, dataName),
                target.position());
        }
        return checkResultPath(path(target, dataName), target.position());
    }

    /**
     * Result path for a single top-level key, e.g. the name bound by {@code except ... as name}.
     */
    public static String keyPath(String key, SourcePosition position) {
        return checkResultPath("$" + segment(new Expr.Str(key, position)), position);
    }

    private static String checkResultPath(String path, SourcePosition position) {
        UnsupportedOperation.check(
            !INVALID_RESULT_PATH_PATTERN.matcher(path).find(),
            "Result path is invalid. Check that it does not contain reserved keys: "
                + String.join(", ", RESERVED_INPUT_DATA_KEYS),
            position);
        return path;
    }

    private static String segment(Expr key) {
        if (key instanceof Expr.Str str) {
            String value = str.value();
            UnsupportedOperation.check(!value.isEmpty(), "Data keys must not be empty", key.position());
            UnsupportedOperation.check(value.indexOf('\'') < 0 && value.indexOf('\\') < 0,
                "Data keys must not contain quotes or backslashes: " + value, key.position());
            return "['" + value + "']";
        }
        if (key instanceof Expr.Num num && num.value() instanceof Long index && index >= 0) {
            return "[" + index + "]";
        }
        throw new UnsupportedOperation(
            "Data keys must be string literals or non-negative integer literals", key.position());
    }
}
