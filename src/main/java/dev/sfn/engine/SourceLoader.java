package dev.sfn.engine;

import dev.sfn.syntax.SourceModule;
import dev.sfn.syntax.SourceParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds and parses state machine source files.
 */
public final class SourceLoader {

    private SourceLoader() {}

    /**
     * Parse a single source file. The module is named after the file without its extension.
     *
     * @throws dev.sfn.exceptions.UnsupportedOperation on invalid syntax
     */
    public static SourceModule loadFromFile(Path path) throws IOException {
        String source = Files.readString(path, StandardCharsets.UTF_8);
        return loadFromString(moduleName(path), source);
    }

    public static SourceModule loadFromString(String moduleName, String source) {
        return SourceParser.parse(moduleName, source);
    }

    /**
     * Expand the given paths into source files: files are taken as they are, directories
     * are scanned (not recursively) for files with {@code extension}, in name order.
     */
    public static List<Path> findSources(List<Path> paths, String extension) throws IOException {
        var sources = new ArrayList<Path>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                try (Stream<Path> files = Files.list(path)) {
                    files.filter(p -> p.getFileName().toString().endsWith(extension))
                         .filter(Files::isRegularFile)
                         .sorted()
                         .forEach(sources::add);
                }
            } else if (Files.isRegularFile(path)) {
                sources.add(path);
            } else {
                throw new IOException("No such file or directory: " + path);
            }
        }
        return sources;
    }

    public static String moduleName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
