package org.pyoptimizer.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FileSystemProjectScannerTest {

    @TempDir
    Path dir;

    private Path touch(String relative) throws IOException {
        Path path = dir.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, "x = 1\n");
        return path;
    }

    @Test
    public void testFindsScriptsRecursivelyInSortedOrder() throws IOException {
        Path b = touch("b.py");
        Path a = touch("pkg/a.py");
        Path top = touch("a.py");
        touch("notes.txt");

        List<Path> found = new FileSystemProjectScanner().discover(dir);
        assertEquals(List.of(top, b, a), found);
    }

    @Test
    public void testSkipsCachesEnvironmentsAndEmittedFiles() throws IOException {
        Path kept = touch("main.py");
        touch("main_optimized.py");
        touch("__pycache__/main.py");
        touch("venv/lib/site.py");
        touch(".git/hooks/hook.py");

        assertEquals(List.of(kept), new FileSystemProjectScanner().discover(dir));
    }

    @Test
    public void testHiddenRootIsStillScanned() throws IOException {
        Path hidden = dir.resolve(".work");
        Files.createDirectories(hidden);
        Path script = hidden.resolve("job.py");
        Files.writeString(script, "pass\n");
        assertEquals(List.of(script), new FileSystemProjectScanner().discover(hidden));
    }

    @Test
    public void testFileIsReturnedAsIs() throws IOException {
        Path script = touch("tool.py");
        assertEquals(List.of(script), new FileSystemProjectScanner().discover(script));
    }

    @Test
    public void testMissingPathIsAnError() {
        IOException e = assertThrows(IOException.class,
                () -> new FileSystemProjectScanner().discover(dir.resolve("missing")));
        assertTrue(e.getMessage().contains("missing"), e.getMessage());
    }
}
