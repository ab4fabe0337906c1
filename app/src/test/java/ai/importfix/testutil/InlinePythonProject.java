package ai.importfix.testutil;

import ai.importfix.analyzer.FileSystemModuleResolver;
import ai.importfix.analyzer.ModuleKey;
import ai.importfix.analyzer.ParseException;
import ai.importfix.analyzer.TreeSitterSourceParser;
import ai.importfix.cfg.CfgBuilder;
import ai.importfix.frame.Frame;
import ai.importfix.frame.ModuleRegistry;
import ai.importfix.lang.PyModule;
import ai.importfix.util.AnalysisConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

/**
 * A throwaway Python source tree under a temporary directory. Sources are written inline; modification times are set
 * explicitly so change detection does not depend on the file system clock.
 */
public final class InlinePythonProject {
    private static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");

    private final Path root;
    private long tick;

    public InlinePythonProject(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path resolve(String relative) {
        return root.resolve(relative);
    }

    /** Writes {@code relative} with the given source and stamps it with a fresh modification time. */
    public Path write(String relative, String source) {
        var file = root.resolve(relative);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, source);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return touch(relative);
    }

    /** Advances the modification time of {@code relative} past every time stamped so far. */
    public Path touch(String relative) {
        tick++;
        return touch(relative, EPOCH.plusSeconds(tick));
    }

    public Path touch(String relative, Instant at) {
        var file = root.resolve(relative);
        try {
            Files.setLastModifiedTime(file, FileTime.from(at));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }

    public void delete(String relative) {
        try {
            Files.delete(root.resolve(relative));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** A registry that resolves absolute imports against this project's root. */
    public ModuleRegistry registry() {
        var config = new AnalysisConfig(
                AnalysisConfig.DEFAULT_MAX_CALL_DEPTH, AnalysisConfig.DEFAULT_MAX_FUZZY_MEMBERS, List.of(root));
        return new ModuleRegistry(
                new FileSystemModuleResolver(config), new CfgBuilder(new TreeSitterSourceParser()), config);
    }

    /** Runs {@code source} as a module named {@code main} living in the project root and returns its frame. */
    public Frame run(ModuleRegistry registry, String source) throws ParseException {
        var graph = registry.builder().build(source);
        var module = PyModule.main("main", ModuleKey.forFile(root.resolve("main.py")));
        return registry.execute(module, graph, root);
    }

    public Frame run(String source) throws ParseException {
        return run(registry(), source);
    }
}
