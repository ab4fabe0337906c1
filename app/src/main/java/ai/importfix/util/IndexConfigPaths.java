package ai.importfix.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolves where symbol indexes are stored per user.
 *
 * Default resolution is platform-aware:
 * - Linux: $XDG_CACHE_HOME/importfix or $HOME/.cache/importfix
 * - macOS: $HOME/Library/Caches/ImportFix
 * - Windows: %LOCALAPPDATA%\\ImportFix
 *
 * For tests and overrides use {@link #forBaseDir(Path)}.
 */
public final class IndexConfigPaths {
    private final Path baseDir;

    private IndexConfigPaths(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir);
    }

    public static IndexConfigPaths defaults() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        Path home = Path.of(System.getProperty("user.home"));

        if (os.contains("win")) {
            String localAppData = System.getenv("LOCALAPPDATA");
            if (localAppData != null && !localAppData.isBlank()) {
                return new IndexConfigPaths(Path.of(localAppData).resolve("ImportFix"));
            }
            return new IndexConfigPaths(home.resolve("AppData").resolve("Local").resolve("ImportFix"));
        }

        if (os.contains("mac") || os.contains("darwin")) {
            return new IndexConfigPaths(home.resolve("Library").resolve("Caches").resolve("ImportFix"));
        }

        String xdg = System.getenv("XDG_CACHE_HOME");
        if (xdg != null && !xdg.isBlank()) {
            return new IndexConfigPaths(Path.of(xdg).resolve("importfix"));
        }
        return new IndexConfigPaths(home.resolve(".cache").resolve("importfix"));
    }

    public static IndexConfigPaths forBaseDir(Path baseDir) {
        return new IndexConfigPaths(baseDir);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /**
     * Directory holding the symbol index for a project, keyed by a name the caller chooses (usually the project
     * directory name).
     */
    public Path getIndexDir(String indexName) {
        return baseDir.resolve("index").resolve(indexName);
    }
}
