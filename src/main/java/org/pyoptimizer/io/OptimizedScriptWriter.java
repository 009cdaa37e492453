package org.pyoptimizer.io;

import org.pyoptimizer.Configuration;
import org.pyoptimizer.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes {@code <name>_optimized.py} for every outcome that carries optimized text.
 * Without an output directory the file goes next to the original.
 */
public class OptimizedScriptWriter implements ReportSink {
    private static final Logger log = LoggerFactory.getLogger(OptimizedScriptWriter.class);

    private final Path outputDirectory;

    public OptimizedScriptWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    @Override
    public void accept(Outcome outcome) throws IOException {
        if (!outcome.hasTransformedText()) {
            return;
        }
        Path target = targetFor(outcome.path());
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.write(target, outcome.transformedText().getBytes(StandardCharsets.UTF_8));
        log.info("{}: wrote {}", outcome.path(), target);
    }

    /**
     * The path of the optimized version of a script.
     */
    public Path targetFor(Path script) {
        String name = script.getFileName().toString();
        String base = name.endsWith(".py") ? name.substring(0, name.length() - 3) : name;
        String fileName = base + Configuration.OPTIMIZED_SUFFIX + ".py";
        if (outputDirectory != null) {
            return outputDirectory.resolve(fileName);
        }
        Path parent = script.getParent();
        return parent == null ? Path.of(fileName) : parent.resolve(fileName);
    }
}
