package dev.sfn.cli;

import ch.qos.logback.classic.Level;
import dev.sfn.engine.SourceLoader;
import dev.sfn.engine.StateMachineCompiler;
import dev.sfn.exceptions.UnsupportedOperation;
import dev.sfn.model.CompileResult;
import dev.sfn.model.CompilerOptions;
import dev.sfn.syntax.SourceModule;
import dev.sfn.syntax.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point: compiles .sfn files into Amazon States Language definitions.
 */
@Command(
    name = "sfn-compile",
    mixinStandardHelpOptions = true,
    description = "Compile state machine source files into Amazon States Language definitions."
)
public class SfnCompilerCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SfnCompilerCli.class);

    @Parameters(arity = "1..*", description = "Source files, or directories containing source files")
    private List<Path> paths;

    @Option(names = "--output-dir", description = "Write definitions here instead of printing them")
    private Path outputDir;

    @Option(names = "--compact", description = "Write JSON without indentation")
    private boolean compact;

    @Option(names = "--verbose", description = "Log compilation progress")
    private boolean verbose;

    @Option(names = "--data-name", defaultValue = CompilerOptions.DEFAULT_DATA_NAME,
        description = "Name of the data parameter of state machine functions (default: ${DEFAULT-VALUE})")
    private String dataName;

    @Option(names = "--extension", defaultValue = CompilerOptions.DEFAULT_SOURCE_EXTENSION,
        description = "Extension of source files in directories (default: ${DEFAULT-VALUE})")
    private String extension;

    private final PrintStream out;
    private final PrintStream err;

    public SfnCompilerCli() {
        this(System.out, System.err);
    }

    SfnCompilerCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() throws IOException {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.sfn")).setLevel(Level.DEBUG);
        }

        var options = new CompilerOptions(dataName, extension, !compact);
        var compiler = new StateMachineCompiler(options);
        var writer = new OutputWriter(options.prettyPrint());

        List<Path> sources = SourceLoader.findSources(paths, options.sourceExtension());
        if (sources.isEmpty()) {
            err.println("Error: no source files found");
            return 1;
        }

        int failures = 0;
        int compiled = 0;
        var modules = new HashMap<String, Path>();
        for (Path source : sources) {
            Path previous = modules.putIfAbsent(SourceLoader.moduleName(source), source);
            if (previous != null && outputDir != null) {
                err.printf("%s: module '%s' is also compiled from %s; its output files would be overwritten%n",
                    source, SourceLoader.moduleName(source), previous);
                failures++;
                continue;
            }

            SourceModule module;
            try {
                module = SourceLoader.loadFromFile(source);
            } catch (UnsupportedOperation e) {
                report(source, e.position(), e.getMessage());
                failures++;
                continue;
            }

            for (CompileResult result : compiler.compile(module)) {
                if (result instanceof CompileResult.Failure failure) {
                    report(source, failure.position(), failure.message());
                    failures++;
                } else if (result instanceof CompileResult.Success success) {
                    if (outputDir != null) {
                        writer.write(outputDir, module.name(), success.stateMachine());
                    } else {
                        writer.print(out, module.name(), success.stateMachine());
                    }
                    compiled++;
                }
            }
        }

        log.info("Compiled {} state machine(s) from {} file(s), {} failure(s)", compiled, sources.size(), failures);
        return failures == 0 ? 0 : 1;
    }

    private void report(Path source, SourcePosition position, String message) {
        err.printf("%s:%d:%d: %s%n", source, position.line(), position.column(), message);
    }
}
