package org.daag.deid.csv;

import lombok.SneakyThrows;
import org.daag.deid.core.InvalidConfigurationException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class TableSources {

    /**
     * resolve tables to process from path given on command line
     *
     * @param path a table, or a directory of them
     * @return path itself if it's a file; otherwise the directory's (non-hidden) regular files,
     *         ordered by name
     * @throws InvalidConfigurationException if path doesn't exist or isn't readable
     */
    @SneakyThrows
    public static List<Path> list(Path path) {
        if (!Files.isReadable(path)) {
            throw new InvalidConfigurationException("can't read " + path);
        }
        if (Files.isDirectory(path)) {
            try (Stream<Path> files = Files.list(path)) {
                return files
                    .filter(Files::isRegularFile)
                    .filter(file -> !file.getFileName().toString().startsWith("."))
                    .sorted(Comparator.comparing(file -> file.getFileName().toString()))
                    .collect(Collectors.toList());
            }
        } else {
            return Collections.singletonList(path);
        }
    }
}
