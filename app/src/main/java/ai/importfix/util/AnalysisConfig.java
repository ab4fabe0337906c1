package ai.importfix.util;

import java.io.File;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Tunables for abstract interpretation and module lookup.
 *
 * <p>Defaults come from environment variables:
 *
 * <ul>
 *   <li>{@code IMPORTFIX_MAX_CALL_DEPTH}: how deep function calls are followed before returning unknown (default 12).
 *   <li>{@code IMPORTFIX_MAX_FUZZY_MEMBERS}: broadcast results with more members collapse to unknown (default 32).
 *   <li>{@code IMPORTFIX_SEARCH_PATH}: extra module search roots, separated by {@link File#pathSeparator}.
 * </ul>
 *
 * Tests build instances directly through the record constructor.
 */
public record AnalysisConfig(int maxCallDepth, int maxFuzzyMembers, List<Path> searchPaths) {
    private static final Logger logger = LogManager.getLogger(AnalysisConfig.class);

    static final String MAX_CALL_DEPTH_ENV = "IMPORTFIX_MAX_CALL_DEPTH";
    static final String MAX_FUZZY_MEMBERS_ENV = "IMPORTFIX_MAX_FUZZY_MEMBERS";
    static final String SEARCH_PATH_ENV = "IMPORTFIX_SEARCH_PATH";

    public static final int DEFAULT_MAX_CALL_DEPTH = 12;
    public static final int DEFAULT_MAX_FUZZY_MEMBERS = 32;

    private static final AnalysisConfig FROM_ENVIRONMENT = fromEnvironment();

    public AnalysisConfig {
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("maxCallDepth must be positive: " + maxCallDepth);
        }
        if (maxFuzzyMembers < 1) {
            throw new IllegalArgumentException("maxFuzzyMembers must be positive: " + maxFuzzyMembers);
        }
        searchPaths = List.copyOf(searchPaths);
    }

    public static AnalysisConfig defaults() {
        return FROM_ENVIRONMENT;
    }

    public AnalysisConfig withSearchPaths(List<Path> paths) {
        return new AnalysisConfig(maxCallDepth, maxFuzzyMembers, paths);
    }

    private static AnalysisConfig fromEnvironment() {
        int depth = intFromEnv(MAX_CALL_DEPTH_ENV, System.getenv(MAX_CALL_DEPTH_ENV), DEFAULT_MAX_CALL_DEPTH);
        int fuzzy = intFromEnv(MAX_FUZZY_MEMBERS_ENV, System.getenv(MAX_FUZZY_MEMBERS_ENV), DEFAULT_MAX_FUZZY_MEMBERS);
        return new AnalysisConfig(depth, fuzzy, parseSearchPath(System.getenv(SEARCH_PATH_ENV)));
    }

    static int intFromEnv(String name, @Nullable String raw, int defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < 1) {
                logger.warn("{}={} is not positive; using default {}", name, raw, defaultValue);
                return defaultValue;
            }
            logger.info("{} override in effect: {}", name, parsed);
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn("{}={} is not a number; using default {}", name, raw, defaultValue);
            return defaultValue;
        }
    }

    static List<Path> parseSearchPath(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        var paths = Arrays.stream(raw.split(File.pathSeparator))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> Path.of(s).toAbsolutePath().normalize())
                .toList();
        logger.info("{} override in effect; search path: {}", SEARCH_PATH_ENV, paths);
        return paths;
    }
}
