package ai.importfix.index;

import ai.importfix.analyzer.ModuleKey;
import ai.importfix.analyzer.ModuleSourceType;
import ai.importfix.cfg.CfgNode;
import ai.importfix.cfg.CfgWalker;
import ai.importfix.frame.Builtins;
import ai.importfix.history.FileHistoryTracker;
import ai.importfix.history.PathFilter;
import ai.importfix.trie.TrieFormatException;
import com.google.common.hash.Hashing;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * The part of a {@link SymbolIndex} responsible for one filesystem subtree, or for the interpreter builtins.
 *
 * <p>Maps each name to the modules it can be imported from and to the aliases files bind it under. File locations keep
 * a {@link FileHistoryTracker} so rescans only touch changed files, and persist to their own directory.
 */
@NullMarked
public final class LocationIndex {
    private static final Logger logger = LogManager.getLogger(LocationIndex.class);

    static final String BUILTINS_LOCATION = "builtins";

    /** Non-owning back-pointer used to reach other locations while tracking imports. */
    private final SymbolIndex owner;

    private final Path saveDir;
    private final String location;
    private final boolean fileLocation;
    private final boolean importTracking;
    private final @Nullable FileHistoryTracker history;

    private final Map<String, Map<SymbolEntry.Key, SymbolEntry>> symbols;
    private final Map<String, Map<SymbolAlias.Key, SymbolAlias>> aliases;
    private final Set<ModuleKey> moduleKeys;
    private final Map<ModuleKey, Set<String>> memberNamesByModule = new HashMap<>();
    private final Set<ModuleKey> beingProcessed = new HashSet<>();
    private boolean modifiedSinceSave;

    private LocationIndex(
            SymbolIndex owner,
            Path saveDir,
            String location,
            boolean fileLocation,
            boolean importTracking,
            @Nullable FileHistoryTracker history,
            Map<String, Map<SymbolEntry.Key, SymbolEntry>> symbols,
            Map<String, Map<SymbolAlias.Key, SymbolAlias>> aliases,
            Set<ModuleKey> moduleKeys) {
        this.owner = owner;
        this.saveDir = saveDir;
        this.location = location;
        this.fileLocation = fileLocation;
        this.importTracking = importTracking;
        this.history = history;
        this.symbols = symbols;
        this.aliases = aliases;
        this.moduleKeys = moduleKeys;
        symbols.forEach((name, entries) -> entries.values().forEach(e -> {
            if (!e.isModuleItself()) {
                memberNamesByModule.computeIfAbsent(e.moduleKey(), k -> new HashSet<>()).add(name);
            }
        }));
    }

    /** The interpreter builtins plus whatever native modules get imported. Never persisted. */
    static LocationIndex forBuiltins(SymbolIndex owner, Path saveDir) {
        var index = new LocationIndex(
                owner,
                saveDir.resolve(BUILTINS_LOCATION),
                BUILTINS_LOCATION,
                false,
                false,
                null,
                new HashMap<>(),
                new HashMap<>(),
                new LinkedHashSet<>());
        var key = ModuleKey.builtin("builtins");
        for (var name : Builtins.names()) {
            SymbolType type;
            if (Builtins.TYPES.contains(name) || Builtins.EXCEPTIONS.contains(name)) {
                type = SymbolType.TYPE;
            } else if (Builtins.FUNCTIONS.contains(name)) {
                type = SymbolType.FUNCTION;
            } else {
                type = SymbolType.ASSIGNMENT;
            }
            var entry = index.getOrAddEntry(key, false, name);
            entry.setSymbolType(type);
            entry.setNotYetFoundInModule(false);
        }
        index.modifiedSinceSave = false;
        return index;
    }

    static LocationIndex create(SymbolIndex owner, Path saveDir, Path location, boolean importTracking) {
        var index = new LocationIndex(
                owner,
                saveDir,
                normalize(location),
                true,
                importTracking,
                FileHistoryTracker.create(),
                new HashMap<>(),
                new HashMap<>(),
                new LinkedHashSet<>());
        index.modifiedSinceSave = true;
        return index;
    }

    /**
     * Reads a location index saved in {@code saveDir}.
     *
     * @throws IndexCorruptionException if the saved state cannot be decoded
     */
    static @Nullable LocationIndex load(SymbolIndex owner, Path saveDir) {
        var state = IndexStateIO.loadLocation(saveDir).orElse(null);
        if (state == null) {
            return null;
        }
        FileHistoryTracker history;
        try {
            history = FileHistoryTracker.load(saveDir.resolve(IndexStateIO.HISTORY_FILE));
        } catch (IOException | TrieFormatException e) {
            throw new IndexCorruptionException(saveDir, "Failed to read file history: " + e.getMessage(), e);
        }
        logger.debug("Loaded location index {} ({} names)", state.location(), state.symbols().size());
        return new LocationIndex(
                owner,
                saveDir,
                state.location(),
                state.fileLocation(),
                state.importTracking(),
                history,
                state.symbols(),
                state.aliases(),
                state.moduleKeys());
    }

    static String normalize(Path location) {
        return location.toAbsolutePath().normalize().toString();
    }

    public String location() {
        return location;
    }

    public boolean isFileLocation() {
        return fileLocation;
    }

    public boolean isImportTracking() {
        return importTracking;
    }

    public boolean isModifiedSinceSave() {
        return modifiedSinceSave || history != null && history.isModifiedSinceSave();
    }

    public Set<ModuleKey> moduleKeys() {
        return Collections.unmodifiableSet(moduleKeys);
    }

    Path saveDir() {
        return saveDir;
    }

    Path locationPath() {
        return Path.of(location);
    }

    /** Recorded modification time of a file in this location, or zero. */
    public long timestampOf(Path file) {
        return history == null ? 0L : history.getTimestamp(file);
    }

    /** Entries reached through an alias named {@code name}, then entries defined under that name. */
    public Stream<CompleteSymbolEntry> findSymbol(String name) {
        var viaAliases = Stream.of(name)
                .flatMap(n -> aliases.getOrDefault(n, Map.of()).values().stream())
                .flatMap(alias -> {
                    var target = symbols.getOrDefault(alias.realName(), Map.of())
                            .get(new SymbolEntry.Key(alias.moduleKey(), alias.isModuleItself()));
                    return target == null ? Stream.empty() : Stream.of(new CompleteSymbolEntry(target, name, alias));
                });
        var direct = Stream.of(name)
                .flatMap(n -> symbols.getOrDefault(n, Map.of()).values().stream())
                .map(entry -> new CompleteSymbolEntry(entry, name, null));
        return Stream.concat(viaAliases, direct);
    }

    /**
     * Rescans the files under {@code dir} that changed since they were last seen and drops the ones that are gone.
     * Subdirectories owned by a deeper location are left to that location.
     *
     * @return number of files added, changed or removed
     */
    public int update(Path dir) {
        if (history == null) {
            return 0;
        }
        var tracker = history;
        int count = owner.countScans(() -> {
            var updates = tracker.getFilesInDirModifiedSinceTimestamp(dir, walkFilter(), true);
            while (updates.hasNext()) {
                var update = updates.next();
                owner.recordScan(update.path());
                if (update.isUpdate()) {
                    addModuleByKey(ModuleKey.forFile(update.path()), false);
                } else {
                    removeFile(update.path());
                }
            }
        });
        if (count > 0) {
            logger.debug("{} files changed under {}", count, dir);
        }
        save();
        return count;
    }

    private PathFilter walkFilter() {
        return (parentDir, name, isDirectory) -> PathFilter.PYTHON_PACKAGES.accept(parentDir, name, isDirectory)
                && !(isDirectory && owner.isOtherLocation(parentDir.resolve(name), this));
    }

    /** Scans one file if it changed since it was last seen. */
    public void addFile(Path file) {
        addModuleByKey(ModuleKey.forFile(file), true);
    }

    /**
     * Scans a module and brings its entries up to date.
     *
     * @param checkTimestamp skip file-backed modules whose file has not changed since the last scan
     * @return true if the module was new to this location
     */
    boolean addModuleByKey(ModuleKey key, boolean checkTimestamp) {
        if (owner.isFailed(key) || key.sourceType() == ModuleSourceType.BAD) {
            return false;
        }
        boolean alreadyPresent = moduleKeys.contains(key);
        if (!key.isFileBacked() && alreadyPresent) {
            return false;
        }
        if (checkTimestamp
                && key.isFileBacked()
                && history != null
                && !history.hasFileChangedSinceTimestamp(key.path())) {
            return false;
        }
        if (!beingProcessed.add(key)) {
            return false;
        }
        if (key.isFileBacked()) {
            owner.recordScan(key.path());
        }
        try {
            var extracted = owner.extractor().extract(key).orElse(null);
            if (extracted == null) {
                logger.debug("Could not load module {}", key);
                owner.markFailed(key);
                return false;
            }
            if (extracted.graph() != null && importTracking) {
                processTrackedImports(key, extracted.graph(), key.path().getParent());
            }
            applyMembers(key, extracted);
            if (key.isFileBacked() && history != null) {
                history.updateTimestampForFile(key.path());
            }
            modifiedSinceSave = true;
            return !alreadyPresent;
        } finally {
            beingProcessed.remove(key);
        }
    }

    private void applyMembers(ModuleKey key, ModuleSymbols extracted) {
        var vanished = new HashSet<>(memberNamesByModule.getOrDefault(key, Set.of()));
        extracted.members().forEach((name, value) -> {
            vanished.remove(name);
            var entry = getOrAddEntry(key, false, name);
            entry.setSymbolType(SymbolType.from(value));
            entry.setImported(extracted.importedNames().contains(name));
            entry.setNotYetFoundInModule(false);
        });
        for (var name : vanished) {
            var entry = symbols.getOrDefault(name, Map.of()).get(new SymbolEntry.Key(key, false));
            if (entry == null) {
                continue;
            }
            if (entry.importCount() > 0) {
                entry.setNotYetFoundInModule(true);
            } else {
                removeEntry(name, entry);
            }
        }
        var moduleEntry = getOrAddEntry(key, true, key.basename());
        moduleEntry.setSymbolType(SymbolType.MODULE);
        moduleEntry.setNotYetFoundInModule(false);
    }

    /** Drops a deleted file's entries and the import counts it contributed. */
    public void removeFile(Path file) {
        var key = ModuleKey.forFile(file);
        for (var name : new ArrayList<>(memberNamesByModule.getOrDefault(key, Set.of()))) {
            var entry = symbols.getOrDefault(name, Map.of()).get(new SymbolEntry.Key(key, false));
            if (entry != null) {
                removeEntry(name, entry);
            }
        }
        var moduleEntry = symbols.getOrDefault(key.basename(), Map.of()).get(new SymbolEntry.Key(key, true));
        if (moduleEntry != null) {
            removeEntry(key.basename(), moduleEntry);
        }
        aliases.values().forEach(byKey -> byKey.values().removeIf(a -> a.moduleKey().equals(key)));
        aliases.values().removeIf(Map::isEmpty);
        if (importTracking) {
            var importsFile = importsFileFor(key);
            var previous = IndexStateIO.loadImports(importsFile);
            previous.forEach((imported, names) -> adjustImports(imported, names, -1));
            IndexStateIO.saveImports(importsFile, Map.of());
        }
        moduleKeys.remove(key);
        if (history != null) {
            history.removeFile(file);
        }
        modifiedSinceSave = true;
        logger.debug("Removed {} from {}", file, location);
    }

    /**
     * Gives every module under {@code root} to {@code to}, a location newly created there. The import counts this
     * location's files under {@code root} contributed are withdrawn first; entries and aliases then move with the counts
     * other importers gave them.
     */
    void handOver(Path root, LocationIndex to) {
        var moving = new LinkedHashSet<ModuleKey>();
        for (var key : moduleKeys) {
            if (key.isFileBacked() && key.path().toAbsolutePath().normalize().startsWith(root)) {
                moving.add(key);
            }
        }
        if (moving.isEmpty()) {
            return;
        }
        if (importTracking) {
            for (var key : moving) {
                var importsFile = importsFileFor(key);
                IndexStateIO.loadImports(importsFile).forEach((imported, names) -> adjustImports(imported, names, -1));
                IndexStateIO.saveImports(importsFile, Map.of());
            }
        }
        for (var key : moving) {
            for (var name : new ArrayList<>(memberNamesByModule.getOrDefault(key, Set.of()))) {
                var entry = symbols.getOrDefault(name, Map.of()).get(new SymbolEntry.Key(key, false));
                if (entry != null) {
                    removeEntry(name, entry);
                    to.adopt(name, entry);
                }
            }
            var moduleEntry = symbols.getOrDefault(key.basename(), Map.of()).get(new SymbolEntry.Key(key, true));
            if (moduleEntry != null) {
                removeEntry(key.basename(), moduleEntry);
                to.adopt(key.basename(), moduleEntry);
            }
            moduleKeys.remove(key);
        }
        for (var byName : aliases.entrySet()) {
            var it = byName.getValue().values().iterator();
            while (it.hasNext()) {
                var alias = it.next();
                if (moving.contains(alias.moduleKey())) {
                    it.remove();
                    to.adoptAlias(byName.getKey(), alias);
                }
            }
        }
        aliases.values().removeIf(Map::isEmpty);
        if (history != null) {
            history.removeDirectory(root);
        }
        modifiedSinceSave = true;
        logger.debug("Handed {} modules under {} from {} to a new location", moving.size(), root, location);
    }

    private void adopt(String name, SymbolEntry entry) {
        symbols.computeIfAbsent(name, k -> new LinkedHashMap<>()).put(entry.key(), entry);
        moduleKeys.add(entry.moduleKey());
        if (!entry.isModuleItself()) {
            memberNamesByModule.computeIfAbsent(entry.moduleKey(), k -> new HashSet<>()).add(name);
        }
        modifiedSinceSave = true;
    }

    private void adoptAlias(String asName, SymbolAlias alias) {
        aliases.computeIfAbsent(asName, k -> new LinkedHashMap<>()).put(alias.key(), alias);
        modifiedSinceSave = true;
    }

    /** Collects, per imported module, the names a module's statements import from it. */
    Map<ModuleKey, Set<ImportedName>> trackModules(CfgNode graph, Path directory) {
        var resolver = owner.extractor().registry().resolver();
        var out = new LinkedHashMap<ModuleKey, Set<ImportedName>>();
        CfgWalker.walk(graph, true, node -> {
            if (node instanceof CfgNode.Import imp) {
                var key = resolver.resolve(imp.modulePath(), directory);
                if (key.isLoadable()) {
                    out.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(new ImportedName(null, imp.alias()));
                }
            } else if (node instanceof CfgNode.FromImport from && !from.wildcard()) {
                from.names().forEach((name, alias) -> {
                    var submodule = resolver.resolve(join(from.modulePath(), name), directory);
                    if (submodule.isLoadable()) {
                        out.computeIfAbsent(submodule, k -> new LinkedHashSet<>()).add(new ImportedName(null, alias));
                        return;
                    }
                    var key = resolver.resolve(from.modulePath(), directory);
                    if (key.isLoadable()) {
                        out.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(new ImportedName(name, alias));
                    }
                });
            }
        });
        return out;
    }

    private static String join(String modulePath, String name) {
        return modulePath.endsWith(".") ? modulePath + name : modulePath + "." + name;
    }

    /** Diffs a module's imports against what was recorded for it last time and applies the change to the counts. */
    private void processTrackedImports(ModuleKey source, CfgNode graph, Path directory) {
        var current = trackModules(graph, directory);
        var importsFile = importsFileFor(source);
        var previous = IndexStateIO.loadImports(importsFile);
        boolean changed = false;
        for (var e : current.entrySet()) {
            var imported = e.getKey();
            owner.addModuleByKey(imported);
            var before = previous.remove(imported);
            var added = new LinkedHashSet<>(e.getValue());
            if (before != null) {
                added.removeAll(before);
                var removed = new LinkedHashSet<>(before);
                removed.removeAll(e.getValue());
                changed |= !removed.isEmpty();
                adjustImports(imported, removed, -1);
            }
            changed |= !added.isEmpty();
            adjustImports(imported, added, 1);
        }
        // modules no longer imported at all
        for (var e : previous.entrySet()) {
            adjustImports(e.getKey(), e.getValue(), -1);
            changed = true;
        }
        if (changed) {
            IndexStateIO.saveImports(importsFile, current);
        }
    }

    private void adjustImports(ModuleKey imported, Set<ImportedName> names, int delta) {
        if (names.isEmpty()) {
            return;
        }
        var target = owner.indexFor(imported);
        if (target == null) {
            return;
        }
        for (var name : names) {
            target.updateSymbol(imported, name, delta);
        }
    }

    /** Applies an import-count change for one imported name of a module this location owns. */
    void updateSymbol(ModuleKey key, ImportedName name, int delta) {
        boolean moduleItself = name.value() == null;
        var realName = moduleItself ? key.basename() : name.value();
        var entry = getOrAddEntry(key, moduleItself, realName);
        entry.adjustImportCount(delta);
        if (entry.importCount() <= 0 && entry.isNotYetFoundInModule()) {
            removeEntry(realName, entry);
        }
        var asName = name.asName();
        if (asName != null && !asName.equals(realName)) {
            var byKey = aliases.computeIfAbsent(asName, k -> new LinkedHashMap<>());
            var aliasKey = new SymbolAlias.Key(realName, key, moduleItself);
            var alias = byKey.computeIfAbsent(aliasKey, k -> new SymbolAlias(realName, key, moduleItself, 0));
            alias.adjustImportCount(delta);
            if (alias.importCount() <= 0) {
                byKey.remove(aliasKey);
                if (byKey.isEmpty()) {
                    aliases.remove(asName);
                }
            }
        }
        modifiedSinceSave = true;
    }

    private SymbolEntry getOrAddEntry(ModuleKey key, boolean moduleItself, String name) {
        var byKey = symbols.computeIfAbsent(name, k -> new LinkedHashMap<>());
        var entry = byKey.get(new SymbolEntry.Key(key, moduleItself));
        if (entry == null) {
            entry = new SymbolEntry(SymbolType.UNKNOWN, key, moduleItself, true, false, 0);
            byKey.put(entry.key(), entry);
            moduleKeys.add(key);
            if (!moduleItself) {
                memberNamesByModule.computeIfAbsent(key, k -> new HashSet<>()).add(name);
            }
            modifiedSinceSave = true;
        }
        return entry;
    }

    private void removeEntry(String name, SymbolEntry entry) {
        var byKey = symbols.get(name);
        if (byKey == null || byKey.remove(entry.key()) == null) {
            return;
        }
        if (byKey.isEmpty()) {
            symbols.remove(name);
        }
        if (!entry.isModuleItself()) {
            var names = memberNamesByModule.get(entry.moduleKey());
            if (names != null) {
                names.remove(name);
                if (names.isEmpty()) {
                    memberNamesByModule.remove(entry.moduleKey());
                }
            }
        }
        modifiedSinceSave = true;
    }

    private Path importsFileFor(ModuleKey key) {
        var hash = Hashing.sha256().hashString(key.toString(), StandardCharsets.UTF_8).toString();
        return saveDir.resolve(hash.substring(0, 32) + IndexStateIO.EXTENSION);
    }

    /** Writes the index and its file history if either changed. The builtins location is never written. */
    public void save() {
        if (!fileLocation) {
            return;
        }
        if (modifiedSinceSave) {
            IndexStateIO.saveLocation(
                    new IndexStateIO.LocationState(location, true, importTracking, moduleKeys, symbols, aliases),
                    saveDir);
            modifiedSinceSave = false;
        }
        if (history != null && history.isModifiedSinceSave()) {
            try {
                history.save(saveDir.resolve(IndexStateIO.HISTORY_FILE));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    @Override
    public String toString() {
        return "LocationIndex[" + location + ", " + symbols.size() + " names]";
    }
}
