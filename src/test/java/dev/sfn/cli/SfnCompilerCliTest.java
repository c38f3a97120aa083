package dev.sfn.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SfnCompilerCliTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        var cli = new SfnCompilerCli(
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
        return new CommandLine(cli).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void writesDefinitionsAndResources(@TempDir Path dir) throws Exception {
        Path source = dir.resolve("orders.sfn");
        Files.writeString(source, """
            @export
            @schedule(expression="rate(1 day)")
            def main(data):
                data["started"] = True

            def audit(data):
                task("arn:audit")
            """);
        Path output = dir.resolve("build");

        int exitCode = run("--output-dir", output.toString(), source.toString());

        assertThat(exitCode).isZero();
        assertThat(stderr()).isEmpty();
        assertThat(output.resolve("orders.main.asl.json")).exists();
        assertThat(output.resolve("orders.main.resources.json")).exists();
        assertThat(output.resolve("orders.audit.asl.json")).exists();
        assertThat(output.resolve("orders.audit.resources.json")).doesNotExist();

        var definition = MAPPER.readTree(output.resolve("orders.main.asl.json").toFile());
        assertThat(definition.get("StartAt").asText()).isEqualTo("Pass (4:4)");

        var resources = MAPPER.readTree(output.resolve("orders.main.resources.json").toFile());
        assertThat(resources).hasSize(2);
        assertThat(resources.get(0).get("decorator").asText()).isEqualTo("export");
        assertThat(resources.get(0).at("/values/enabled").asBoolean()).isTrue();
        assertThat(resources.get(1).at("/values/expression").asText()).isEqualTo("rate(1 day)");
        assertThat(resources.get(1).get("line").asInt()).isEqualTo(2);
    }

    @Test
    void printsDefinitionsWithoutOutputDir(@TempDir Path dir) throws Exception {
        Path source = dir.resolve("hello.sfn");
        Files.writeString(source, """
            def main(data):
                data["greeting"] = "hello"
            """);

        int exitCode = run("--compact", source.toString());

        assertThat(exitCode).isZero();
        var document = MAPPER.readTree(stdout());
        assertThat(document.get("module").asText()).isEqualTo("hello");
        assertThat(document.get("stateMachine").asText()).isEqualTo("main");
        assertThat(document.at("/definition/States/Pass (2:4)/Result").asText()).isEqualTo("hello");
        assertThat(document.get("resources")).isEmpty();
        assertThat(stdout().strip()).doesNotContain("\n");
    }

    @Test
    void scansDirectoriesForSourceFiles(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("a.sfn"), "def main(data):\n    pass\n");
        Files.writeString(dir.resolve("b.sfn"), "def main(data):\n    pass\n");
        Files.writeString(dir.resolve("notes.txt"), "not a source file");
        Path output = dir.resolve("out");

        int exitCode = run("--output-dir", output.toString(), dir.toString());

        assertThat(exitCode).isZero();
        try (var files = Files.list(output)) {
            assertThat(files.map(p -> p.getFileName().toString()).sorted())
                .containsExactly("a.main.asl.json", "b.main.asl.json");
        }
    }

    @Test
    void reportsFailuresWithPositionAndKeepsCompiling(@TempDir Path dir) throws Exception {
        Path source = dir.resolve("broken.sfn");
        Files.writeString(source, """
            def bad(data):
                data["Cause"] = "x"

            def good(data):
                data["ok"] = True
            """);
        Path output = dir.resolve("out");

        int exitCode = run("--output-dir", output.toString(), source.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).startsWith(source + ":2:4: Result path is invalid");
        assertThat(output.resolve("broken.good.asl.json")).exists();
        assertThat(output.resolve("broken.bad.asl.json")).doesNotExist();
    }

    @Test
    void reportsSyntaxErrors(@TempDir Path dir) throws Exception {
        Path source = dir.resolve("syntax.sfn");
        Files.writeString(source, "def main(data):\n    while True:\n        pass\n");

        int exitCode = run(source.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains(source + ":2:4: Unsupported statement 'while'");
        assertThat(stdout()).isEmpty();
    }

    @Test
    void rejectsModulesThatWouldOverwriteEachOther(@TempDir Path dir) throws Exception {
        Path first = Files.createDirectories(dir.resolve("a")).resolve("flow.sfn");
        Path second = Files.createDirectories(dir.resolve("b")).resolve("flow.sfn");
        Files.writeString(first, "def main(data):\n    data[\"from\"] = \"a\"\n");
        Files.writeString(second, "def main(data):\n    data[\"from\"] = \"b\"\n");
        Path output = dir.resolve("out");

        int exitCode = run("--output-dir", output.toString(), first.toString(), second.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains(second + ": module 'flow' is also compiled from " + first);
        var definition = MAPPER.readTree(output.resolve("flow.main.asl.json").toFile());
        assertThat(definition.at("/States/Pass (2:4)/Result").asText()).isEqualTo("a");
    }

    @Test
    void failsWhenNoSourcesFound(@TempDir Path dir) {
        int exitCode = run(dir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Error: no source files found");
    }

    @Test
    void honorsCustomDataNameAndExtension(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("flow.py"), """
            def main(state):
                state["a"] = 1
            """);

        int exitCode = run("--data-name", "state", "--extension", ".py", dir.toString());

        assertThat(exitCode).isZero();
        assertThat(MAPPER.readTree(stdout()).at("/definition/States/Pass (2:4)/ResultPath").asText())
            .isEqualTo("$['a']");
    }
}
