package ai.importfix.history;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decides, one path component at a time, whether a directory entry takes part in a scan. Rejecting a directory prunes
 * its whole subtree.
 */
@FunctionalInterface
public interface PathFilter {

    boolean accept(Path parentDir, String name, boolean isDirectory);

    PathFilter ALL = (parentDir, name, isDirectory) -> true;

    /**
     * Descends only into Python packages (directories holding an {@code __init__.py}) and accepts {@code .py} files.
     */
    PathFilter PYTHON_PACKAGES = (parentDir, name, isDirectory) -> {
        if (isDirectory) {
            return !name.startsWith(".")
                    && Files.isRegularFile(parentDir.resolve(name).resolve("__init__.py"));
        }
        return name.endsWith(".py");
    };

    /** Every non-hidden directory and every {@code .py} file. */
    PathFilter PYTHON_SOURCES = (parentDir, name, isDirectory) ->
            !name.startsWith(".") && (isDirectory ? !name.equals("__pycache__") : name.endsWith(".py"));
}
