package com.groundtruth.extractor;

import com.groundtruth.core.io.RecordFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates SQLite database files by extension, either a single file or everything under a
 * directory, in a stable order.
 */
public final class DatabaseFinder {
    private DatabaseFinder() {}

    public static final Set<String> EXTENSIONS = Set.of(".db", ".sqlite", ".sqlite3");

    public static List<Path> find(Path root) throws IOException {
        if (Files.isRegularFile(root)) {
            return isDatabase(root) ? List.of(root) : List.of();
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(DatabaseFinder::isDatabase)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public static boolean isDatabase(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    /**
     * {@code <name>.ground_truth.<ext>}; under a directory root the name is the relative
     * path with separators replaced by {@code __}, so equally named databases in different
     * folders do not overwrite each other.
     */
    public static String outputName(Path root, Path database, RecordFormat format) {
        String name;
        if (Files.isRegularFile(root)) {
            name = database.getFileName().toString();
        } else {
            Path relative = root.relativize(database);
            name = String.join("__", toStrings(relative));
        }
        return name + ".ground_truth." + format.extension();
    }

    private static List<String> toStrings(Path path) {
        return Stream.iterate(0, i -> i < path.getNameCount(), i -> i + 1)
                .map(i -> path.getName(i).toString())
                .toList();
    }
}
