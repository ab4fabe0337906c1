package ai.importfix.index;

import static org.junit.jupiter.api.Assertions.*;

import ai.importfix.analyzer.ModuleKey;
import ai.importfix.testutil.InlinePythonProject;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SymbolIndexTest {

    @TempDir
    Path sources;

    @TempDir
    Path saveDir;

    private InlinePythonProject project;

    @BeforeEach
    void setUp() {
        project = new InlinePythonProject(sources);
    }

    private SymbolIndex build() {
        return SymbolIndex.buildIndexFromPackage(project.root(), saveDir, project.registry());
    }

    private SymbolIndex reload() throws Exception {
        return SymbolIndex.load(saveDir, project.registry());
    }

    private static List<CompleteSymbolEntry> find(SymbolIndex index, String name) {
        return index.findSymbol(name).toList();
    }

    private static Optional<CompleteSymbolEntry> from(SymbolIndex index, String name, Path file) {
        var key = ModuleKey.forFile(file);
        return index.findSymbol(name).filter(c -> c.moduleKey().equals(key)).findFirst();
    }

    private static List<CompleteSymbolEntry> definitionsIn(SymbolIndex index, String name, Path file) {
        var key = ModuleKey.forFile(file);
        return index.findSymbol(name).filter(c -> c.moduleKey().equals(key)).toList();
    }

    private LocationIndex location(SymbolIndex index) {
        return index.locationIndices().stream().filter(LocationIndex::isFileLocation).findFirst().orElseThrow();
    }

    @Test
    void indexesMembersWithTheirKinds() {
        project.write("lib/__init__.py", "");
        var shapes = project.write("lib/shapes.py", """
                import os
                class Circle:
                    pass
                def area(c):
                    return 0
                PI = 3.14
                """);
        var index = build();

        assertEquals(SymbolType.TYPE, from(index, "Circle", shapes).orElseThrow().symbolType());
        assertEquals(SymbolType.FUNCTION, from(index, "area", shapes).orElseThrow().symbolType());
        assertEquals(SymbolType.ASSIGNMENT, from(index, "PI", shapes).orElseThrow().symbolType());
        assertTrue(from(index, "os", shapes).orElseThrow().isImported());
        assertFalse(from(index, "Circle", shapes).orElseThrow().isImported());
        assertTrue(from(index, "__name__", shapes).isEmpty());

        var module = from(index, "shapes", shapes).orElseThrow();
        assertTrue(module.isModuleItself());
        assertEquals(SymbolType.MODULE, module.symbolType());
    }

    @Test
    void builtinsAreAlwaysPresent() {
        var index = SymbolIndex.createIndex(saveDir, project.registry());
        var len = find(index, "len");
        assertEquals(1, len.size());
        assertEquals(ModuleKey.builtin("builtins"), len.get(0).moduleKey());
        assertEquals(SymbolType.FUNCTION, len.get(0).symbolType());
        assertEquals(SymbolType.TYPE, find(index, "ValueError").get(0).symbolType());
    }

    @Test
    void updateRescansOnlyChangedFiles() {
        project.write("a.py", "from b import helper\nX = 1\n");
        var b = project.write("b.py", "def helper():\n    return 1\n");
        var index = build();
        long bStamp = location(index).timestampOf(b);
        assertTrue(bStamp > 0);

        project.write("a.py", "from b import helper\nX = 1\nY = 2\n");
        assertEquals(1, index.update(project.root()));
        assertEquals(bStamp, location(index).timestampOf(b));
        assertTrue(from(index, "Y", project.resolve("a.py")).isPresent());
        assertEquals(1, from(index, "helper", b).orElseThrow().importCount());

        assertEquals(0, index.update(project.root()));
    }

    @Test
    void importCountsRankCandidates() {
        project.write("util1.py", "def helper():\n    pass\n");
        project.write("util2.py", "def helper():\n    pass\n");
        for (int i = 1; i <= 5; i++) {
            project.write("user" + i + ".py", "from util1 import helper\n");
        }
        project.write("other.py", "from util2 import helper as hp\n");
        var index = build();

        var byModule = index.findSymbol("helper")
                .filter(c -> !c.isImported())
                .collect(Collectors.toMap(c -> c.moduleKey().basename(), Function.identity()));
        assertEquals(5, byModule.get("util1").importCount());
        assertEquals(1, byModule.get("util2").importCount());

        var viaAlias = index.findSymbol("hp").filter(CompleteSymbolEntry::isAlias).toList();
        assertEquals(1, viaAlias.size());
        assertEquals("helper", viaAlias.get(0).realName());
        assertEquals("util2", viaAlias.get(0).moduleKey().basename());
        assertEquals(1, viaAlias.get(0).importCount());
    }

    @Test
    void vanishedMemberStaysWhileImported() {
        project.write("a.py", "from b import helper\n");
        var b = project.write("b.py", "def helper():\n    pass\n");
        var index = build();

        project.write("b.py", "def other():\n    pass\n");
        index.update(project.root());
        var kept = from(index, "helper", b).orElseThrow();
        assertEquals(1, kept.importCount());
        assertTrue(kept.entry().isNotYetFoundInModule());

        project.write("a.py", "X = 1\n");
        index.update(project.root());
        assertTrue(from(index, "helper", b).isEmpty());
    }

    @Test
    void removedFilesDropTheirEntriesAndImports() {
        project.write("a.py", "from b import helper\n");
        var b = project.write("b.py", "def helper():\n    pass\n");
        var index = build();
        assertEquals(1, from(index, "helper", b).orElseThrow().importCount());

        project.delete("a.py");
        assertEquals(1, index.update(project.root()));
        assertTrue(from(index, "helper", project.resolve("a.py")).isEmpty());
        assertEquals(0, from(index, "helper", b).orElseThrow().importCount());

        project.delete("b.py");
        index.update(project.root());
        assertTrue(from(index, "helper", b).isEmpty());
        assertTrue(from(index, "b", b).isEmpty());
    }

    @Test
    void savedIndexReloads() throws Exception {
        project.write("a.py", "from b import helper as h\n");
        var b = project.write("b.py", "def helper():\n    pass\n");
        build();

        var reloaded = reload();
        var helper = from(reloaded, "helper", b).orElseThrow();
        assertEquals(1, helper.importCount());
        assertEquals(SymbolType.FUNCTION, helper.symbolType());
        assertTrue(reloaded.findSymbol("h").anyMatch(CompleteSymbolEntry::isAlias));
        assertFalse(location(reloaded).isModifiedSinceSave());
        assertEquals(0, reloaded.update(project.root()));

        project.write("b.py", "def helper():\n    pass\nclass Extra:\n    pass\n");
        assertEquals(1, reloaded.update(project.root()));
        assertTrue(from(reloaded, "Extra", b).isPresent());
    }

    @Test
    void corruptedLocationIsDiscardedAndRebuilt() throws Exception {
        var c = project.write("c.py", "class Circle:\n    pass\n");
        build();
        Path locationDir;
        try (var entries = Files.list(saveDir)) {
            locationDir = entries.filter(Files::isDirectory).findFirst().orElseThrow();
        }
        Files.write(locationDir.resolve(IndexStateIO.INDEX_FILE), new byte[] {(byte) 0xff, (byte) 0xff, 0x01});

        var reloaded = reload();
        assertFalse(Files.exists(locationDir));
        assertTrue(from(reloaded, "Circle", c).isEmpty());

        reloaded.addPath(project.root(), true);
        assertTrue(from(reloaded, "Circle", c).isPresent());
    }

    @Test
    void nestedLocationsOwnTheirFiles() {
        project.write("top.py", "T = 1\n");
        project.write("pkg/__init__.py", "");
        var inner = project.write("pkg/inner.py", "I = 1\n");
        var index = SymbolIndex.createIndex(saveDir, project.registry());

        assertEquals(2, index.addPath(project.resolve("pkg"), false));
        index.addPath(project.root(), false);

        assertEquals(1, find(index, "I").size());
        assertEquals(3, index.locationIndices().size());
        var owners = index.locationIndices().stream()
                .filter(l -> l.moduleKeys().contains(ModuleKey.forFile(inner)))
                .toList();
        assertEquals(1, owners.size());
        assertEquals(project.resolve("pkg").toString(), owners.get(0).location());
    }

    @Test
    void subpackageAddedAfterItsAncestorTakesOverItsFiles() {
        project.write("top.py", "from pkg.inner import I\nT = 1\n");
        project.write("pkg/__init__.py", "");
        var inner = project.write("pkg/inner.py", "I = 1\n");
        var index = SymbolIndex.createIndex(saveDir, project.registry());

        index.addPath(project.root(), true);
        assertEquals(1, from(index, "I", inner).orElseThrow().importCount());

        index.addPath(project.resolve("pkg"), false);
        var hits = definitionsIn(index, "I", inner);
        assertEquals(1, hits.size());
        assertEquals(1, hits.get(0).importCount());
        var owners = index.locationIndices().stream()
                .filter(l -> l.moduleKeys().contains(ModuleKey.forFile(inner)))
                .map(LocationIndex::location)
                .toList();
        assertEquals(List.of(project.resolve("pkg").toString()), owners);

        assertEquals(0, index.update(project.root()));
        assertEquals(1, definitionsIn(index, "I", inner).size());
    }

    @Test
    void importedModuleOutsideTheTrackedDirectorySurvivesReload() throws Exception {
        var util = project.write("util.py", "def helper():\n    pass\n");
        project.write("app/main.py", "from util import helper\nhelper()\n");
        var index = SymbolIndex.createIndex(saveDir, project.registry());
        index.addPath(project.resolve("app"), true);
        assertEquals(1, from(index, "helper", util).orElseThrow().importCount());

        var reloaded = reload();
        assertEquals(0, reloaded.update(project.resolve("app")));
        var helper = from(reloaded, "helper", util);
        assertTrue(helper.isPresent());
        assertEquals(1, helper.get().importCount());
    }

    @Test
    void scanCountIncludesModulesScannedThroughImports() {
        project.write("a.py", "import b\nimport c\n");
        project.write("b.py", "X = 1\n");
        project.write("c.py", "Y = 2\n");
        var index = SymbolIndex.createIndex(saveDir, project.registry());

        assertEquals(3, index.addPath(project.root(), true));
        assertEquals(0, index.update(project.root()));
    }

    @Test
    void singleFileOutsideAnyLocationGetsItsOwn() {
        var lone = project.write("scripts/tool.py", "def run():\n    pass\n");
        var index = SymbolIndex.createIndex(saveDir, project.registry());

        index.addFile(lone);
        assertTrue(from(index, "run", lone).isPresent());
        assertEquals(
                List.of(project.resolve("scripts").toString()),
                index.locationIndices().stream()
                        .filter(LocationIndex::isFileLocation)
                        .map(LocationIndex::location)
                        .sorted(Comparator.naturalOrder())
                        .toList());
    }
}
