package dev.sfn.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.sfn.exceptions.UnsupportedOperation;
import dev.sfn.syntax.Expr;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

/**
 * Reads literal syntax nodes into values. Nothing is evaluated: any node that is not a
 * literal of the expected kind is rejected with its position.
 */
public final class ValueExtractors {

    public static final Set<String> SUBSCRIBE_STATUSES = Set.of("success", "failure");

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;
    private static final String NOT_JSON = "Only JSON-serializable values can be used to update the data object";

    private ValueExtractors() {}

    public static String string(Expr node) {
        if (node instanceof Expr.Str str) {
            return str.value();
        }
        throw expected("a string", node);
    }

    public static boolean bool(Expr node) {
        if (node instanceof Expr.Bool bool) {
            return bool.value();
        }
        throw expected("a boolean", node);
    }

    public static ObjectNode dict(Expr node) {
        if (node instanceof Expr.DictLit) {
            return (ObjectNode) json(node);
        }
        throw expected("a dict", node);
    }

    /**
     * A non-negative integer literal, used for timeouts and concurrency limits.
     */
    public static long integer(Expr node) {
        if (node instanceof Expr.Num num && num.value() instanceof Long value && value >= 0) {
            return value;
        }
        throw expected("a non-negative integer", node);
    }

    /**
     * Status option of {@code @subscribe}: a string that is either success or failure.
     */
    public static String subscribeStatus(Expr node) {
        String value = string(node);
        UnsupportedOperation.check(SUBSCRIBE_STATUSES.contains(value),
            "Status must be one of success|failure. Provided: " + value, node.position());
        return value;
    }

    /**
     * Any literal that survives a strict JSON round trip: strings, finite numbers, booleans,
     * None, lists, tuples and dicts with string keys.
     */
    public static JsonNode json(Expr node) {
        if (node instanceof Expr.Str str) {
            return JSON.textNode(str.value());
        }
        if (node instanceof Expr.Num num) {
            return number(num.value(), node);
        }
        if (node instanceof Expr.UnaryOp unary && !unary.op().equals("not")
                && unary.operand() instanceof Expr.Num num) {
            return number(negateIf(unary.op().equals("-"), num.value()), node);
        }
        if (node instanceof Expr.Bool bool) {
            return JSON.booleanNode(bool.value());
        }
        if (node instanceof Expr.NoneLit) {
            return JSON.nullNode();
        }
        if (node instanceof Expr.ListLit list) {
            return array(list.elements());
        }
        if (node instanceof Expr.TupleLit tuple) {
            return array(tuple.elements());
        }
        if (node instanceof Expr.DictLit dict) {
            ObjectNode object = JSON.objectNode();
            for (int i = 0; i < dict.keys().size(); i++) {
                Expr key = dict.keys().get(i);
                if (!(key instanceof Expr.Str str)) {
                    throw new UnsupportedOperation(NOT_JSON, key.position());
                }
                object.set(str.value(), json(dict.values().get(i)));
            }
            return object;
        }
        throw new UnsupportedOperation(NOT_JSON, node.position());
    }

    /**
     * Task parameters: a dict literal whose values are JSON literals or data references.
     * References are emitted under {@code "<key>.$"} with their path as the value.
     */
    public static ObjectNode parameters(Expr node, String dataName) {
        if (!(node instanceof Expr.DictLit dict)) {
            throw expected("a dict", node);
        }
        ObjectNode object = JSON.objectNode();
        for (int i = 0; i < dict.keys().size(); i++) {
            String key = string(dict.keys().get(i));
            Expr value = dict.values().get(i);
            if (DataPaths.isReference(value, dataName)) {
                object.put(key + ".$", DataPaths.path(value, dataName));
            } else if (value instanceof Expr.DictLit) {
                object.set(key, parameters(value, dataName));
            } else {
                object.set(key, json(value));
            }
        }
        return object;
    }

    private static ArrayNode array(List<Expr> elements) {
        ArrayNode array = JSON.arrayNode();
        for (Expr element : elements) {
            array.add(json(element));
        }
        return array;
    }

    private static Number negateIf(boolean negate, Number value) {
        if (!negate) {
            return value;
        }
        if (value instanceof Long l) {
            return l == Long.MIN_VALUE ? BigInteger.valueOf(l).negate() : (Number) (-l);
        }
        if (value instanceof BigInteger big) {
            BigInteger negated = big.negate();
            return negated.bitLength() < Long.SIZE ? (Number) negated.longValue() : negated;
        }
        return -value.doubleValue();
    }

    private static JsonNode number(Number value, Expr node) {
        if (value instanceof Long l) {
            return integerNode(l);
        }
        if (value instanceof BigInteger big) {
            return JSON.numberNode(big);
        }
        double d = value.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new UnsupportedOperation(NOT_JSON, node.position());
        }
        return JSON.numberNode(d);
    }

    /**
     * Integer JSON node, narrowed to an int node when the value fits.
     */
    public static JsonNode integerNode(long value) {
        return value == (int) value ? JSON.numberNode((int) value) : JSON.numberNode(value);
    }

    private static UnsupportedOperation expected(String kind, Expr node) {
        return new UnsupportedOperation(
            "Expected %s literal, found %s".formatted(kind, node.getClass().getSimpleName()), node.position());
    }
}
