package ai.importfix.index;

import java.nio.file.Path;

/** A persisted location index could not be read back. Only that location's index is lost. */
public class IndexCorruptionException extends RuntimeException {
    private final Path directory;

    public IndexCorruptionException(Path directory, String message, Throwable cause) {
        super(message, cause);
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }
}
