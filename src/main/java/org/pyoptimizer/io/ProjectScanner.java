package org.pyoptimizer.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Finds the scripts to optimize.
 */
public interface ProjectScanner {

    /**
     * @param root a script or a directory
     * @return the scripts, sorted by path
     */
    List<Path> discover(Path root) throws IOException;
}
