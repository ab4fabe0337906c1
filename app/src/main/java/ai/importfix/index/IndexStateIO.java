package ai.importfix.index;

import ai.importfix.analyzer.ModuleKey;
import ai.importfix.analyzer.ModuleSourceType;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Persistence for the symbol index using Jackson CBOR.
 *
 * <p>Module keys are written once into a table and referenced by position; entries and aliases are field arrays.
 */
public final class IndexStateIO {
    private static final Logger logger = LogManager.getLogger(IndexStateIO.class);

    private static final ObjectMapper CBOR_MAPPER = new ObjectMapper(new CBORFactory());

    static final String INDEX_FILE = "index.cbor";
    static final String HISTORY_FILE = "fht.cbor";
    static final String FAILED_FILE = "failed.cbor";
    static final String EXTENSION = ".cbor";

    private IndexStateIO() {}

    /* ================= DTOs ================= */

    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"sourceType", "id"})
    public record ModuleKeyDto(ModuleSourceType sourceType, String id) {
        static ModuleKeyDto of(ModuleKey key) {
            return new ModuleKeyDto(key.sourceType(), key.id());
        }

        ModuleKey toKey() {
            return new ModuleKey(sourceType, id);
        }
    }

    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"symbolType", "moduleKey", "moduleItself", "notYetFoundInModule", "imported", "importCount"})
    public record SymbolEntryDto(
            SymbolType symbolType,
            int moduleKey,
            boolean moduleItself,
            boolean notYetFoundInModule,
            boolean imported,
            int importCount) {}

    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"realName", "moduleKey", "moduleItself", "importCount"})
    public record SymbolAliasDto(String realName, int moduleKey, boolean moduleItself, int importCount) {}

    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"location", "fileLocation", "importTracking", "moduleKeys", "symbols", "aliases"})
    public record LocationIndexDto(
            String location,
            boolean fileLocation,
            boolean importTracking,
            List<ModuleKeyDto> moduleKeys,
            Map<String, List<SymbolEntryDto>> symbols,
            Map<String, List<SymbolAliasDto>> aliases) {}

    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"module", "names"})
    public record ModuleImportsDto(ModuleKeyDto module, List<ImportedName> names) {}

    /** In-memory contents of one location index, as written to {@code index.cbor}. */
    record LocationState(
            String location,
            boolean fileLocation,
            boolean importTracking,
            Set<ModuleKey> moduleKeys,
            Map<String, Map<SymbolEntry.Key, SymbolEntry>> symbols,
            Map<String, Map<SymbolAlias.Key, SymbolAlias>> aliases) {}

    /* ================= Location index ================= */

    static void saveLocation(LocationState state, Path dir) {
        var table = new KeyTable(state.moduleKeys());
        var symbols = new LinkedHashMap<String, List<SymbolEntryDto>>();
        state.symbols().forEach((name, entries) -> symbols.put(
                name,
                entries.values().stream()
                        .map(e -> new SymbolEntryDto(
                                e.symbolType(),
                                table.indexOf(e.moduleKey()),
                                e.isModuleItself(),
                                e.isNotYetFoundInModule(),
                                e.isImported(),
                                e.importCount()))
                        .toList()));
        var aliases = new LinkedHashMap<String, List<SymbolAliasDto>>();
        state.aliases().forEach((name, entries) -> aliases.put(
                name,
                entries.values().stream()
                        .map(a -> new SymbolAliasDto(
                                a.realName(), table.indexOf(a.moduleKey()), a.isModuleItself(), a.importCount()))
                        .toList()));
        var dto = new LocationIndexDto(
                state.location(),
                state.fileLocation(),
                state.importTracking(),
                table.keys().stream().map(ModuleKeyDto::of).toList(),
                symbols,
                aliases);
        write(dir.resolve(INDEX_FILE), dto);
        logger.debug("Saved location index {} to {}", state.location(), dir);
    }

    /**
     * Reads a location index written by {@link #saveLocation}.
     *
     * @return empty if the directory holds no index
     * @throws IndexCorruptionException if the file exists but cannot be decoded
     */
    static Optional<LocationState> loadLocation(Path dir) {
        var file = dir.resolve(INDEX_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        LocationIndexDto dto;
        try {
            dto = CBOR_MAPPER.readValue(file.toFile(), LocationIndexDto.class);
        } catch (IOException e) {
            throw new IndexCorruptionException(dir, "Failed to read " + file + ": " + e.getMessage(), e);
        }
        try {
            return Optional.of(fromDto(dto));
        } catch (IndexOutOfBoundsException | NullPointerException e) {
            throw new IndexCorruptionException(dir, "Inconsistent index in " + file, e);
        }
    }

    private static LocationState fromDto(LocationIndexDto dto) {
        var keys = dto.moduleKeys().stream().map(ModuleKeyDto::toKey).toList();
        var symbols = new HashMap<String, Map<SymbolEntry.Key, SymbolEntry>>();
        dto.symbols().forEach((name, entries) -> {
            var byKey = new LinkedHashMap<SymbolEntry.Key, SymbolEntry>();
            for (var e : entries) {
                var entry = new SymbolEntry(
                        e.symbolType(),
                        keys.get(e.moduleKey()),
                        e.moduleItself(),
                        e.notYetFoundInModule(),
                        e.imported(),
                        e.importCount());
                byKey.put(entry.key(), entry);
            }
            symbols.put(name, byKey);
        });
        var aliases = new HashMap<String, Map<SymbolAlias.Key, SymbolAlias>>();
        dto.aliases().forEach((name, entries) -> {
            var byKey = new LinkedHashMap<SymbolAlias.Key, SymbolAlias>();
            for (var a : entries) {
                var alias = new SymbolAlias(a.realName(), keys.get(a.moduleKey()), a.moduleItself(), a.importCount());
                byKey.put(alias.key(), alias);
            }
            aliases.put(name, byKey);
        });
        return new LocationState(
                dto.location(),
                dto.fileLocation(),
                dto.importTracking(),
                new LinkedHashSet<>(keys),
                symbols,
                aliases);
    }

    /* ================= Per-module import sets ================= */

    static Map<ModuleKey, Set<ImportedName>> loadImports(Path file) {
        if (!Files.exists(file)) {
            return new HashMap<>();
        }
        try {
            var dtos = CBOR_MAPPER.readValue(file.toFile(), ModuleImportsDto[].class);
            var out = new HashMap<ModuleKey, Set<ImportedName>>();
            for (var dto : dtos) {
                out.put(dto.module().toKey(), new LinkedHashSet<>(dto.names()));
            }
            return out;
        } catch (MismatchedInputException e) {
            logger.warn("Discarding unreadable import record {}: {}", file, e.getMessage());
            return new HashMap<>();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static void saveImports(Path file, Map<ModuleKey, Set<ImportedName>> imports) {
        if (imports.isEmpty()) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return;
        }
        var dtos = new ArrayList<ModuleImportsDto>();
        imports.forEach((key, names) -> dtos.add(new ModuleImportsDto(ModuleKeyDto.of(key), List.copyOf(names))));
        write(file, dtos);
    }

    /* ================= Failed modules ================= */

    static Set<ModuleKey> loadFailed(Path saveDir) {
        var file = saveDir.resolve(FAILED_FILE);
        if (!Files.exists(file)) {
            return new LinkedHashSet<>();
        }
        try {
            var dtos = CBOR_MAPPER.readValue(file.toFile(), ModuleKeyDto[].class);
            var out = new LinkedHashSet<ModuleKey>();
            for (var dto : dtos) {
                out.add(dto.toKey());
            }
            return out;
        } catch (IOException e) {
            logger.warn("Ignoring unreadable failed-module list {}: {}", file, e.getMessage());
            return new LinkedHashSet<>();
        }
    }

    static void saveFailed(Path saveDir, Set<ModuleKey> failed) {
        write(saveDir.resolve(FAILED_FILE), failed.stream().map(ModuleKeyDto::of).toList());
    }

    private static void write(Path file, Object dto) {
        try {
            var parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            CBOR_MAPPER.writeValue(file.toFile(), dto);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + file, e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Module keys in first-seen order with their positions. */
    private static final class KeyTable {
        private final List<ModuleKey> keys = new ArrayList<>();
        private final Map<ModuleKey, Integer> positions = new HashMap<>();

        KeyTable(Set<ModuleKey> initial) {
            initial.forEach(this::indexOf);
        }

        int indexOf(ModuleKey key) {
            return positions.computeIfAbsent(key, k -> {
                keys.add(k);
                return keys.size() - 1;
            });
        }

        List<ModuleKey> keys() {
            return keys;
        }
    }
}
