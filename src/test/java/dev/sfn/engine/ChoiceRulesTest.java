package dev.sfn.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.sfn.exceptions.UnsupportedOperation;
import org.junit.jupiter.api.Test;

import static dev.sfn.engine.ValueExtractorsTest.expr;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChoiceRulesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static void assertRule(String test, String expectedJson) throws Exception {
        assertThat(ChoiceRules.rule(expr(test), "data")).isEqualTo(MAPPER.readTree(expectedJson));
    }

    @Test
    void comparesWithLiterals() throws Exception {
        assertRule("data[\"status\"] == \"done\"", """
            {"Variable": "$['status']", "StringEquals": "done"}""");
        assertRule("data[\"count\"] >= 3", """
            {"Variable": "$['count']", "NumericGreaterThanEquals": 3}""");
        assertRule("data[\"ratio\"] < -0.5", """
            {"Variable": "$['ratio']", "NumericLessThan": -0.5}""");
        assertRule("data[\"name\"] <= \"m\"", """
            {"Variable": "$['name']", "StringLessThanEquals": "m"}""");
        assertRule("data[\"flag\"] == False", """
            {"Variable": "$['flag']", "BooleanEquals": false}""");
    }

    @Test
    void mirrorsLiteralOnTheLeft() throws Exception {
        assertRule("10 < data[\"count\"]", """
            {"Variable": "$['count']", "NumericGreaterThan": 10}""");
    }

    @Test
    void comparesWithNone() throws Exception {
        assertRule("data[\"a\"] is None", """
            {"Variable": "$['a']", "IsNull": true}""");
        assertRule("data[\"a\"] is not None", """
            {"Variable": "$['a']", "IsNull": false}""");
        assertRule("data[\"a\"] == None", """
            {"Variable": "$['a']", "IsNull": true}""");
    }

    @Test
    void negatesInequality() throws Exception {
        assertRule("data[\"a\"] != \"x\"", """
            {"Not": {"Variable": "$['a']", "StringEquals": "x"}}""");
    }

    @Test
    void treatsBareReferenceAsBooleanTest() throws Exception {
        assertRule("not data[\"flag\"]", """
            {"Not": {"Variable": "$['flag']", "BooleanEquals": true}}""");
    }

    @Test
    void combinesWithBooleanOperators() throws Exception {
        assertRule("data[\"a\"] == 1 or data[\"b\"] > \"m\" and data[\"c\"]", """
            {"Or": [
              {"Variable": "$['a']", "NumericEquals": 1},
              {"And": [
                {"Variable": "$['b']", "StringGreaterThan": "m"},
                {"Variable": "$['c']", "BooleanEquals": true}
              ]}
            ]}""");
    }

    @Test
    void rejectsComparingTwoReferences() {
        assertThatThrownBy(() -> ChoiceRules.rule(expr("data[\"a\"] == data[\"b\"]"), "data"))
            .isInstanceOf(UnsupportedOperation.class)
            .hasMessage("Conditions compare against a string, number, boolean or None literal");
    }

    @Test
    void rejectsIsAgainstValues() {
        assertThatThrownBy(() -> ChoiceRules.rule(expr("data[\"a\"] is 1"), "data"))
            .hasMessage("'is' comparisons are only supported against None");
    }

    @Test
    void rejectsUnsupportedTests() {
        assertThatThrownBy(() -> ChoiceRules.rule(expr("data[\"a\"] in [\"x\"]"), "data"))
            .hasMessage("Unsupported condition; compare a data reference with a literal");
        assertThatThrownBy(() -> ChoiceRules.rule(expr("1 == 1"), "data"))
            .hasMessage("Unsupported condition; compare a data reference with a literal");
        assertThatThrownBy(() -> ChoiceRules.rule(expr("data"), "data"))
            .hasMessage("Unsupported condition; compare a data reference with a literal");
    }
}
