package ai.importfix.fix;

import static org.junit.jupiter.api.Assertions.*;

import ai.importfix.frame.ModuleRegistry;
import ai.importfix.index.SymbolIndex;
import ai.importfix.scan.UsageContext;
import ai.importfix.testutil.InlinePythonProject;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImportFixGeneratorTest {

    @TempDir
    Path sources;

    @TempDir
    Path saveDir;

    @TempDir
    Path workDir;

    private InlinePythonProject project;
    private ModuleRegistry registry;
    private ImportFixGenerator generator;

    @BeforeEach
    void setUp() {
        project = new InlinePythonProject(sources);
        registry = project.registry();
        generator = new ImportFixGenerator(registry);
    }

    private SymbolIndex build() {
        return SymbolIndex.buildIndexFromPackage(project.root(), saveDir, registry);
    }

    @Test
    void mostImportedCandidateWins() {
        project.write("util1.py", "def helper():\n    pass\n");
        project.write("util2.py", "def helper():\n    pass\n");
        project.write("a.py", "from util1 import helper\n");
        project.write("b.py", "from util1 import helper\n");
        project.write("c.py", "from util2 import helper\n");
        var index = build();

        var fix = generator.fixFor("helper", UsageContext.Raw.INSTANCE, index);
        assertEquals("util1", fix.moduleName());
        assertEquals(project.resolve("util1.py"), fix.modulePath());
        assertEquals("from util1 import helper", fix.importStatement().orElseThrow());
    }

    @Test
    void definitionsRankAboveReExports() {
        project.write("core.py", "class Engine:\n    pass\n");
        project.write("facade.py", "from core import Engine\n");
        var index = build();

        var ranked = generator.rank("Engine", UsageContext.Raw.INSTANCE, index);
        assertEquals(2, ranked.size());
        assertFalse(ranked.get(0).isImported());
        assertEquals("core", ranked.get(0).moduleKey().basename());
    }

    @Test
    void usageDecidesBetweenKinds() {
        project.write("settings.py", "config = {}\n");
        project.write("loader.py", "def config():\n    pass\n");
        project.write("a.py", "from settings import config\n");
        project.write("b.py", "from settings import config\n");
        var index = build();

        var call = new UsageContext.CallContext(List.of(), Map.of());
        assertEquals("loader", generator.fixFor("config", call, index).moduleName());
        assertEquals("settings", generator.fixFor("config", UsageContext.Raw.INSTANCE, index).moduleName());
    }

    @Test
    void aliasedImportsAreReproduced() {
        project.write("mathx.py", "def mean(xs):\n    return 0\n");
        project.write("a.py", "from mathx import mean as avg\n");
        var index = build();

        var fix = generator.fixFor("avg", UsageContext.Raw.INSTANCE, index);
        assertEquals("from mathx import mean as avg", fix.importStatement().orElseThrow());
    }

    @Test
    void submodulesAreImportedFromTheirPackage() {
        project.write("lib/__init__.py", "");
        project.write("lib/shapes.py", "class Circle:\n    pass\n");
        var index = build();

        var fix = generator.fixFor("shapes", new UsageContext.AttributeContext("Circle"), index);
        assertEquals("lib", fix.moduleName());
        assertEquals("shapes", fix.value());
        assertNull(fix.asName());
        assertEquals("from lib import shapes", fix.importStatement().orElseThrow());
    }

    @Test
    void topLevelModuleIsImportedDirectly() {
        project.write("tools.py", "X = 1\n");
        var index = build();

        var fix = generator.fixFor("tools", new UsageContext.AttributeContext("X"), index);
        assertEquals("import tools", fix.importStatement().orElseThrow());
    }

    @Test
    void unknownSymbolsStayUnresolved() {
        var index = build();
        var fix = generator.fixFor("nothing_like_this", UsageContext.Raw.INSTANCE, index);
        assertFalse(fix.isResolved());
        assertTrue(fix.importStatement().isEmpty());
        assertEquals(ImportFix.unresolved("nothing_like_this"), fix);
    }

    @Test
    void builtinsAreNeverProposed() {
        var index = build();
        assertTrue(generator.rank("len", UsageContext.Raw.INSTANCE, index).isEmpty());
    }

    @Test
    void fixesForASourceFileAreSortedByName() throws Exception {
        project.write("shapes.py", "class Square:\n    pass\nclass Circle:\n    pass\n");
        var index = build();

        var fixes = generator.generateFixes("""
                s = Square()
                c = Circle()
                print(undefined_thing)
                """, workDir, index);
        assertEquals(List.of("Circle", "Square", "undefined_thing"), fixes.stream().map(ImportFix::symbol).toList());
        assertEquals("from shapes import Circle", fixes.get(0).importStatement().orElseThrow());
        assertFalse(fixes.get(2).isResolved());
    }
}
