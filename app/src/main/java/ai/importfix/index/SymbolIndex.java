package ai.importfix.index;

import ai.importfix.analyzer.ModuleKey;
import ai.importfix.analyzer.ModuleSourceType;
import ai.importfix.frame.ModuleRegistry;
import ai.importfix.trie.Trie;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Answers "where can I import X from" across every indexed location.
 *
 * <p>Each directory added becomes a {@link LocationIndex}; a file belongs to the deepest location containing it, so a
 * subpackage added on its own is indexed and updated separately from its ancestors. Every location persists to its own
 * subdirectory of the save directory, named by a hash of the location path.
 */
@NullMarked
public final class SymbolIndex {
    private static final Logger logger = LogManager.getLogger(SymbolIndex.class);

    private final Path saveDir;
    private final ModuleSymbolExtractor extractor;
    private final LocationIndex builtinsIndex;
    private final List<LocationIndex> locationIndices = new ArrayList<>();
    private final Trie<Long, LocationIndex> locationTrie = new Trie<>(0L);
    private final Set<ModuleKey> failedKeys;
    private @Nullable Set<Path> scanned;

    private SymbolIndex(Path saveDir, ModuleRegistry registry, Set<ModuleKey> failedKeys) {
        this.saveDir = saveDir;
        this.extractor = new ModuleSymbolExtractor(registry);
        this.failedKeys = failedKeys;
        this.builtinsIndex = LocationIndex.forBuiltins(this, saveDir);
        locationIndices.add(builtinsIndex);
    }

    /** An empty index that will persist to {@code saveDir}. */
    public static SymbolIndex createIndex(Path saveDir, ModuleRegistry registry) {
        return new SymbolIndex(saveDir, registry, new LinkedHashSet<>());
    }

    /**
     * Loads every location saved under {@code saveDir}. A location whose files cannot be decoded is deleted so the next
     * {@link #addPath} rebuilds it; the others load normally.
     */
    public static SymbolIndex load(Path saveDir, ModuleRegistry registry) throws IOException {
        var index = new SymbolIndex(saveDir, registry, IndexStateIO.loadFailed(saveDir));
        if (!Files.isDirectory(saveDir)) {
            return index;
        }
        List<Path> subdirs;
        try (var entries = Files.list(saveDir)) {
            subdirs = entries.filter(Files::isDirectory).sorted().toList();
        }
        for (var dir : subdirs) {
            try {
                var location = LocationIndex.load(index, dir);
                if (location != null) {
                    index.register(location);
                }
            } catch (IndexCorruptionException e) {
                logger.warn("Discarding corrupted index in {}: {}", dir, e.getMessage());
                MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
            }
        }
        logger.info("Loaded symbol index from {} ({} locations)", saveDir, index.locationIndices.size() - 1);
        return index;
    }

    /** Builds a fresh index of one package tree with import tracking and saves it. */
    public static SymbolIndex buildIndexFromPackage(Path packageDir, Path saveDir, ModuleRegistry registry) {
        var index = createIndex(saveDir, registry);
        int count = index.addPath(packageDir, true);
        logger.info("Indexed {} files under {}", count, packageDir);
        return index;
    }

    /** Candidates across all locations. Lazy; the order carries no meaning. */
    public Stream<CompleteSymbolEntry> findSymbol(String name) {
        return List.copyOf(locationIndices).stream().flatMap(location -> location.findSymbol(name));
    }

    /**
     * Indexes a directory as its own location, or a single file within the location that contains it. An already
     * indexed directory is updated instead. A directory nested in an existing location takes over the files under it.
     *
     * @return number of files scanned, including modules scanned because a scanned file imports them
     */
    public int addPath(Path path, boolean trackImports) {
        var normalized = path.toAbsolutePath().normalize();
        int count = countScans(() -> {
            if (!Files.isDirectory(normalized)) {
                addModuleByKey(ModuleKey.forFile(normalized));
                return;
            }
            var location = locationAt(normalized);
            if (location == null) {
                location = newLocation(normalized, trackImports);
            }
            location.update(normalized);
        });
        save();
        return count;
    }

    /** Scans one file if it changed, creating a location for its directory when no location contains it. */
    public void addFile(Path file) {
        addModuleByKey(ModuleKey.forFile(file));
        save();
    }

    /**
     * Rescans what changed under {@code dir}, including locations nested inside it. Directories not indexed yet are
     * added without import tracking.
     *
     * @return number of files added, changed or removed, including modules scanned because a changed file imports them
     */
    public int update(Path dir) {
        var normalized = dir.toAbsolutePath().normalize();
        var prefix = dirKey(LocationIndex.normalize(normalized));
        int count = countScans(() -> {
            var owning = owningLocation(prefix);
            if (owning == null) {
                addPath(normalized, false);
                owning = locationAt(normalized);
            } else {
                owning.update(normalized);
            }
            for (var location : List.copyOf(locationIndices)) {
                if (location != owning
                        && location.isFileLocation()
                        && (location.location() + File.separator).startsWith(prefix)) {
                    location.update(location.locationPath());
                }
            }
        });
        save();
        return count;
    }

    /** Writes every location that changed, and the failed-module list. */
    public void save() {
        for (var location : locationIndices) {
            location.save();
        }
        saveFailed();
    }

    public List<LocationIndex> locationIndices() {
        return Collections.unmodifiableList(locationIndices);
    }

    public Set<ModuleKey> failedKeys() {
        return Collections.unmodifiableSet(failedKeys);
    }

    /** Forgets that a module failed to load so the next scan retries it. */
    public void clearFailed(ModuleKey key) {
        failedKeys.remove(key);
    }

    boolean isFailed(ModuleKey key) {
        return failedKeys.contains(key);
    }

    void markFailed(ModuleKey key) {
        failedKeys.add(key);
    }

    ModuleSymbolExtractor extractor() {
        return extractor;
    }

    /**
     * Runs {@code action} and returns how many distinct files were scanned or removed while it ran. Nested calls share
     * the outermost call's record.
     */
    int countScans(Runnable action) {
        var log = scanned;
        boolean outermost = log == null;
        if (log == null) {
            log = new HashSet<>();
            scanned = log;
        }
        int before = log.size();
        try {
            action.run();
            return log.size() - before;
        } finally {
            if (outermost) {
                scanned = null;
            }
        }
    }

    void recordScan(Path file) {
        var log = scanned;
        if (log != null) {
            log.add(file.toAbsolutePath().normalize());
        }
    }

    /** Scans a module in whichever location owns it. */
    void addModuleByKey(ModuleKey key) {
        var location = indexFor(key);
        if (location != null) {
            location.addModuleByKey(key, true);
        }
    }

    /**
     * The location that owns a module: builtins for native modules without a file, the deepest containing location
     * for file-backed ones (a new location for the file's directory if none contains it), null for unresolved ones.
     */
    @Nullable
    LocationIndex indexFor(ModuleKey key) {
        if (key.sourceType() == ModuleSourceType.BAD) {
            return null;
        }
        if (!key.isFileBacked()) {
            return builtinsIndex;
        }
        var file = key.path();
        var owning = owningLocation(LocationIndex.normalize(file));
        if (owning != null) {
            return owning;
        }
        var parent = file.toAbsolutePath().normalize().getParent();
        if (parent == null) {
            return null;
        }
        logger.debug("New location {} for {}", parent, key);
        return newLocation(parent, false);
    }

    /** True if {@code dir} is the root of a location other than {@code of}. */
    boolean isOtherLocation(Path dir, LocationIndex of) {
        var location = locationAt(dir);
        return location != null && location != of;
    }

    private @Nullable LocationIndex locationAt(Path dir) {
        var node = locationTrie.getNode(dirKey(LocationIndex.normalize(dir)));
        return node == null ? null : node.storeValue();
    }

    private @Nullable LocationIndex owningLocation(String pathKey) {
        var node = locationTrie.getDeepestStoreNode(pathKey);
        return node == null ? null : node.storeValue();
    }

    /** Creates and registers a location at {@code dir}, taking over what the enclosing location held under it. */
    private LocationIndex newLocation(Path dir, boolean trackImports) {
        var location = LocationIndex.create(this, saveDir.resolve(hashOf(LocationIndex.normalize(dir))), dir,
                trackImports);
        var enclosing = owningLocation(dirKey(LocationIndex.normalize(dir)));
        if (enclosing != null) {
            enclosing.handOver(dir, location);
        }
        register(location);
        logger.debug("New location {}", dir);
        return location;
    }

    private void register(LocationIndex location) {
        if (!location.isFileLocation()) {
            return;
        }
        locationIndices.add(location);
        locationTrie.add(dirKey(location.location()), 1L, location);
    }

    private void saveFailed() {
        try {
            Files.createDirectories(saveDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        IndexStateIO.saveFailed(saveDir, failedKeys);
    }

    private static String dirKey(String location) {
        return location.endsWith(File.separator) ? location : location + File.separator;
    }

    static String hashOf(String location) {
        return Hashing.sha256().hashString(location, StandardCharsets.UTF_8).toString().substring(0, 16);
    }
}
