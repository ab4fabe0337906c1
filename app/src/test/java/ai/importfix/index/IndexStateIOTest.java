package ai.importfix.index;

import static org.junit.jupiter.api.Assertions.*;

import ai.importfix.analyzer.ModuleKey;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexStateIOTest {

    @TempDir
    Path dir;

    @Test
    void importRecordsRoundTripAndEmptyRecordsAreDeleted() {
        var file = dir.resolve("imports" + IndexStateIO.EXTENSION);
        var imports = new LinkedHashMap<ModuleKey, Set<ImportedName>>();
        imports.put(
                ModuleKey.forFile(Path.of("/src/util.py")),
                new LinkedHashSet<>(List.of(new ImportedName("helper", null), new ImportedName("other", "o"))));
        imports.put(ModuleKey.builtin("os"), Set.of(new ImportedName(null, null)));

        IndexStateIO.saveImports(file, imports);
        assertEquals(imports, IndexStateIO.loadImports(file));

        IndexStateIO.saveImports(file, Map.of());
        assertFalse(Files.exists(file));
        assertTrue(IndexStateIO.loadImports(file).isEmpty());
    }

    @Test
    void failedModulesRoundTrip() {
        assertTrue(IndexStateIO.loadFailed(dir).isEmpty());
        var failed = new LinkedHashSet<>(List.of(ModuleKey.forFile(Path.of("/src/broken.py")), ModuleKey.bad("x")));
        IndexStateIO.saveFailed(dir, failed);
        assertEquals(failed, IndexStateIO.loadFailed(dir));
    }

    @Test
    void missingLocationIsEmptyAndGarbageIsCorruption() throws Exception {
        assertTrue(IndexStateIO.loadLocation(dir).isEmpty());
        Files.write(dir.resolve(IndexStateIO.INDEX_FILE), new byte[] {(byte) 0xff, 0x13, 0x37});
        var e = assertThrows(IndexCorruptionException.class, () -> IndexStateIO.loadLocation(dir));
        assertEquals(dir, e.directory());
    }
}
