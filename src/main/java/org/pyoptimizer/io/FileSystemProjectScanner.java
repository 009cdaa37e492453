package org.pyoptimizer.io;

import org.pyoptimizer.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks a directory tree for {@code .py} files. Hidden directories, byte-code caches,
 * virtual environments and previously emitted {@code *_optimized.py} files are
 * skipped. A file given directly is returned as is.
 */
public class FileSystemProjectScanner implements ProjectScanner {
    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("__pycache__", "venv", ".venv", "site-packages");

    @Override
    public List<Path> discover(Path root) throws IOException {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        if (!Files.isDirectory(root)) {
            throw new IOException("no such file or directory: " + root);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> isScript(path.getFileName().toString()))
                    .filter(path -> !inSkippedDirectory(root, path))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static boolean isScript(String fileName) {
        return fileName.endsWith(".py") && !fileName.endsWith(Configuration.OPTIMIZED_SUFFIX + ".py");
    }

    private static boolean inSkippedDirectory(Path root, Path file) {
        Path relative = root.relativize(file.getParent() == null ? file : file.getParent());
        for (Path part : relative) {
            String name = part.toString();
            if (name.isEmpty()) {
                continue;
            }
            if (SKIPPED_DIRECTORIES.contains(name) || name.startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
