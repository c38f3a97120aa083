package dev.sfn.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.sfn.model.CompiledStateMachine;
import dev.sfn.model.DecoratorEffect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes compiled state machines as JSON: the ASL definition, and the decorator effects
 * for the template emitter when there are any.
 */
final class OutputWriter {

    static final String DEFINITION_SUFFIX = ".asl.json";
    static final String RESOURCES_SUFFIX = ".resources.json";

    private static final Logger log = LoggerFactory.getLogger(OutputWriter.class);

    private final ObjectMapper mapper;

    OutputWriter(boolean prettyPrint) {
        this.mapper = new ObjectMapper().configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
    }

    /**
     * Write {@code <module>.<function>.asl.json} and, if needed,
     * {@code <module>.<function>.resources.json} into {@code outputDir}.
     *
     * @return the files written
     */
    List<Path> write(Path outputDir, String moduleName, CompiledStateMachine stateMachine) throws IOException {
        Files.createDirectories(outputDir);
        String stem = moduleName + "." + stateMachine.name();
        var written = new ArrayList<Path>();

        Path definition = outputDir.resolve(stem + DEFINITION_SUFFIX);
        mapper.writeValue(definition.toFile(), stateMachine.definition());
        written.add(definition);

        if (!stateMachine.effects().isEmpty()) {
            Path resources = outputDir.resolve(stem + RESOURCES_SUFFIX);
            mapper.writeValue(resources.toFile(), resources(stateMachine.effects()));
            written.add(resources);
        }
        written.forEach(p -> log.info("Wrote {}", p));
        return written;
    }

    /**
     * Print the definition (and effects, if any) of a state machine to {@code out}.
     */
    void print(PrintStream out, String moduleName, CompiledStateMachine stateMachine) throws IOException {
        ObjectNode document = mapper.createObjectNode();
        document.put("module", moduleName);
        document.put("stateMachine", stateMachine.name());
        document.set("definition", stateMachine.definition());
        document.set("resources", resources(stateMachine.effects()));
        out.println(mapper.writeValueAsString(document));
    }

    ArrayNode resources(List<DecoratorEffect> effects) {
        ArrayNode list = mapper.createArrayNode();
        for (DecoratorEffect effect : effects) {
            ObjectNode entry = list.addObject();
            entry.put("decorator", effect.decoratorName());
            ObjectNode values = entry.putObject("values");
            effect.values().forEach(values::set);
            entry.put("line", effect.origin().position().line());
            entry.put("column", effect.origin().position().column());
        }
        return list;
    }
}
