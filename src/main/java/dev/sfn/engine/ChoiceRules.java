package dev.sfn.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.sfn.exceptions.UnsupportedOperation;
import dev.sfn.syntax.Expr;

import java.util.Map;

/**
 * Translates {@code if} tests into Choice rules.
 * <p>
 * Supported: comparisons of a data reference with a string, number or boolean literal,
 * {@code is None} / {@code is not None}, a bare data reference (true when the value is
 * boolean true), and {@code not}, {@code and}, {@code or} over those.
 */
public final class ChoiceRules {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private static final Map<String, String> MIRRORED = Map.of(
        "==", "==", "!=", "!=", "<", ">", "<=", ">=", ">", "<", ">=", "<=");
    private static final Map<String, String> ORDERING_SUFFIX = Map.of(
        "<", "LessThan", "<=", "LessThanEquals", ">", "GreaterThan", ">=", "GreaterThanEquals");

    private ChoiceRules() {}

    public static ObjectNode rule(Expr test, String dataName) {
        if (test instanceof Expr.BoolOp boolOp) {
            ArrayNode operands = JSON.arrayNode();
            for (Expr value : boolOp.values()) {
                operands.add(rule(value, dataName));
            }
            ObjectNode node = JSON.objectNode();
            node.set(boolOp.op().equals("and") ? "And" : "Or", operands);
            return node;
        }
        if (test instanceof Expr.UnaryOp unary && unary.op().equals("not")) {
            return not(rule(unary.operand(), dataName));
        }
        if (test instanceof Expr.Compare compare) {
            return comparison(compare, dataName);
        }
        if (test instanceof Expr.Subscript && DataPaths.isReference(test, dataName)) {
            return variable(test, dataName).put("BooleanEquals", true);
        }
        throw unsupported(test);
    }

    private static ObjectNode comparison(Expr.Compare compare, String dataName) {
        Expr reference = compare.left();
        Expr literal = compare.right();
        String op = compare.op();
        if (!DataPaths.isReference(reference, dataName) && DataPaths.isReference(literal, dataName)
                && MIRRORED.containsKey(op)) {
            reference = compare.right();
            literal = compare.left();
            op = MIRRORED.get(op);
        }
        if (!(reference instanceof Expr.Subscript) || !DataPaths.isReference(reference, dataName)) {
            throw unsupported(compare);
        }

        switch (op) {
            case "is", "is not" -> {
                UnsupportedOperation.check(literal instanceof Expr.NoneLit,
                    "'%s' comparisons are only supported against None".formatted(op), literal.position());
                return variable(reference, dataName).put("IsNull", op.equals("is"));
            }
            case "==" -> {
                return equality(reference, literal, dataName);
            }
            case "!=" -> {
                return not(equality(reference, literal, dataName));
            }
            case "<", "<=", ">", ">=" -> {
                String suffix = ORDERING_SUFFIX.get(op);
                if (literal instanceof Expr.Str str) {
                    return variable(reference, dataName).put("String" + suffix, str.value());
                }
                ObjectNode node = variable(reference, dataName);
                node.set("Numeric" + suffix, numeric(literal));
                return node;
            }
            default -> throw unsupported(compare);
        }
    }

    private static ObjectNode equality(Expr reference, Expr literal, String dataName) {
        ObjectNode node = variable(reference, dataName);
        if (literal instanceof Expr.Str str) {
            return node.put("StringEquals", str.value());
        }
        if (literal instanceof Expr.Bool bool) {
            return node.put("BooleanEquals", bool.value());
        }
        if (literal instanceof Expr.NoneLit) {
            return node.put("IsNull", true);
        }
        node.set("NumericEquals", numeric(literal));
        return node;
    }

    private static JsonNode numeric(Expr literal) {
        if (literal instanceof Expr.Num || literal instanceof Expr.UnaryOp) {
            return ValueExtractors.json(literal);
        }
        throw new UnsupportedOperation(
            "Conditions compare against a string, number, boolean or None literal", literal.position());
    }

    private static ObjectNode variable(Expr reference, String dataName) {
        ObjectNode node = JSON.objectNode();
        node.put("Variable", DataPaths.path(reference, dataName));
        return node;
    }

    private static ObjectNode not(ObjectNode rule) {
        ObjectNode node = JSON.objectNode();
        node.set("Not", rule);
        return node;
    }

    private static UnsupportedOperation unsupported(Expr test) {
        return new UnsupportedOperation(
            "Unsupported condition; compare a data reference with a literal", test.position());
    }
}
