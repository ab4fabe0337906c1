package ai.importfix.scan;

import static org.junit.jupiter.api.Assertions.*;

import ai.importfix.frame.ModuleRegistry;
import ai.importfix.testutil.InlinePythonProject;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SymbolUsageScannerTest {

    @TempDir
    Path root;

    private InlinePythonProject project;
    private ModuleRegistry registry;

    @BeforeEach
    void setUp() {
        project = new InlinePythonProject(root);
        registry = project.registry();
    }

    private Map<String, UsageContext> missing(String source) throws Exception {
        var graph = registry.builder().build(source);
        return new SymbolUsageScanner(registry).missingSymbols(graph, root);
    }

    @Test
    void enclosingBindingsAreVisibleToNestedFunctions() throws Exception {
        var result = missing("""
                def f():
                    x = 1
                    def g():
                        return x + y
                    return g
                """);
        assertEquals(Set.of("y"), result.keySet());
    }

    @Test
    void functionsSeeModuleNamesBoundLater() throws Exception {
        var result = missing("""
                def f():
                    return helper()
                def helper():
                    return 1
                """);
        assertTrue(result.isEmpty());
    }

    @Test
    void moduleLevelUseBeforeBindingIsMissing() throws Exception {
        var result = missing("""
                print(later)
                later = 1
                """);
        assertEquals(Set.of("later"), result.keySet());
    }

    @Test
    void builtinsImportsAndDundersAreNotMissing() throws Exception {
        var result = missing("""
                import os.path
                from collections import OrderedDict as OD
                print(len(os.path.sep), OD, __name__, __file__)
                """);
        assertTrue(result.isEmpty());
    }

    @Test
    void usageContextsAreRecorded() throws Exception {
        var result = missing("""
                foo_unresolved(1, key=2)
                np.array
                table[0]
                plain
                """);
        var call = assertInstanceOf(UsageContext.CallContext.class, result.get("foo_unresolved"));
        assertEquals(1, call.args().size());
        assertEquals(Set.of("key"), call.kwargs().keySet());
        assertEquals(new UsageContext.AttributeContext("array"), result.get("np"));
        assertInstanceOf(UsageContext.SubscriptContext.class, result.get("table"));
        assertSame(UsageContext.Raw.INSTANCE, result.get("plain"));
    }

    @Test
    void severalUsesMergeIntoOneContext() throws Exception {
        var result = missing("""
                np.array([1])
                np.zeros
                np.zeros
                np
                """);
        var np = result.get("np");
        assertTrue(np.hasAttributeAccess());
        assertFalse(np.isCalled());
        assertEquals(2, np.contexts().size());
    }

    @Test
    void scanningTwiceGivesTheSameResult() throws Exception {
        var source = """
                class A(Base):
                    attr = value
                    def m(self):
                        return other + attr
                """;
        var first = missing(source);
        var second = missing(source);
        assertEquals(first, second);
        assertEquals(Set.of("Base", "value", "other", "attr"), first.keySet());
    }

    @Test
    void parametersComprehensionsAndLambdasBindLocally() throws Exception {
        var result = missing("""
                def f(a, *rest, **kw):
                    squares = [i * i for i in rest]
                    g = lambda q: q + a + z
                    return squares, g, kw
                """);
        assertEquals(Set.of("z"), result.keySet());
    }

    @Test
    void exceptionAndLoopTargetsBind() throws Exception {
        var result = missing("""
                for k, v in pairs():
                    print(k, v)
                try:
                    pass
                except OSError as err:
                    print(err)
                with open("f") as fh:
                    fh.read()
                """);
        assertEquals(Set.of("pairs"), result.keySet());
    }

    @Test
    void wildcardImportProvidesPublicNames() throws Exception {
        project.write("shapes.py", """
                __all__ = ["Circle"]
                class Circle:
                    pass
                class Square:
                    pass
                """);
        var result = missing("""
                from shapes import *
                Circle()
                Square()
                """);
        assertEquals(Set.of("Square"), result.keySet());
    }

    @Test
    void nativeWildcardProvidesAnything() throws Exception {
        var result = missing("""
                from os import *
                getcwd()
                """);
        assertTrue(result.isEmpty());
    }

    @Test
    void scopeTreeRecordsChildren() throws Exception {
        var graph = registry.builder().build("""
                class A:
                    def m(self):
                        pass
                def f():
                    pass
                """);
        var scope = new SymbolUsageScanner(registry).scan(graph);
        assertEquals(ScopeInfo.Kind.MODULE, scope.kind());
        assertEquals(Set.of("A", "f"), scope.boundNames());
        var a = scope.child("A").orElseThrow();
        assertEquals(ScopeInfo.Kind.CLASS, a.kind());
        assertTrue(a.child("m").isPresent());
    }
}
