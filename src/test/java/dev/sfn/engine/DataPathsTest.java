package dev.sfn.engine;

import dev.sfn.exceptions.UnsupportedOperation;
import dev.sfn.syntax.SourcePosition;
import org.junit.jupiter.api.Test;

import static dev.sfn.engine.ValueExtractorsTest.expr;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataPathsTest {

    @Test
    void buildsPathFromNestedSubscripts() {
        assertThat(DataPaths.path(expr("data[\"foo\"][\"bar\"]"), "data")).isEqualTo("$['foo']['bar']");
        assertThat(DataPaths.path(expr("data[\"items\"][0]"), "data")).isEqualTo("$['items'][0]");
        assertThat(DataPaths.path(expr("data"), "data")).isEqualTo("$");
    }

    @Test
    void recognizesReferencesByDataName() {
        assertThat(DataPaths.isReference(expr("data[\"a\"]"), "data")).isTrue();
        assertThat(DataPaths.isReference(expr("state[\"a\"]"), "data")).isFalse();
        assertThat(DataPaths.isReference(expr("state[\"a\"]"), "state")).isTrue();
        assertThat(DataPaths.isReference(expr("\"data\""), "data")).isFalse();
    }

    @Test
    void rejectsReservedKeysInResultPath() {
        assertThatThrownBy(() -> DataPaths.resultPath(expr("data[\"Result\"]"), "data"))
            .isInstanceOf(UnsupportedOperation.class)
            .hasMessage("Result path is invalid. Check that it does not contain reserved keys: "
                + "Result, ResultPath, Error, Cause");
    }

    @Test
    void reservedKeysMatchAtAnyDepthIgnoringCase() {
        assertThatThrownBy(() -> DataPaths.resultPath(expr("data[\"a\"][\"error\"]"), "data"))
            .hasMessageContaining("reserved keys");
        assertThat(DataPaths.resultPath(expr("data[\"Results\"]"), "data")).isEqualTo("$['Results']");
    }

    @Test
    void resultPathMustSubscriptData() {
        assertThatThrownBy(() -> DataPaths.resultPath(expr("data"), "data"))
            .hasMessageContaining("Only keys of 'data' can be assigned");
        assertThatThrownBy(() -> DataPaths.resultPath(expr("other[\"a\"]"), "data"))
            .hasMessageContaining("Expected a reference into 'data'");
    }

    @Test
    void rejectsUnsupportedKeys() {
        assertThatThrownBy(() -> DataPaths.path(expr("data[\"\"]"), "data"))
            .hasMessage("Data keys must not be empty");
        assertThatThrownBy(() -> DataPaths.path(expr("data[\"it's\"]"), "data"))
            .hasMessageContaining("must not contain quotes");
        assertThatThrownBy(() -> DataPaths.path(expr("data[data[\"k\"]]"), "data"))
            .hasMessage("Data keys must be string literals or non-negative integer literals");
    }

    @Test
    void keyPathChecksReservedKeys() {
        var position = new SourcePosition(4, 4);
        assertThat(DataPaths.keyPath("error_info", position)).isEqualTo("$['error_info']");
        assertThatThrownBy(() -> DataPaths.keyPath("Cause", position))
            .isInstanceOf(UnsupportedOperation.class)
            .satisfies(e -> assertThat(((UnsupportedOperation) e).position()).isEqualTo(position));
    }
}
