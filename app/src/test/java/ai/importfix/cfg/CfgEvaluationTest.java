package ai.importfix.cfg;

import static org.junit.jupiter.api.Assertions.*;

import ai.importfix.lang.PyInstance;
import ai.importfix.testutil.InlinePythonProject;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.FuzzyBoolean;
import ai.importfix.value.FuzzyValue;
import ai.importfix.value.UnknownValue;
import ai.importfix.value.Value;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CfgEvaluationTest {

    @TempDir
    Path root;

    private InlinePythonProject project;

    @BeforeEach
    void setUp() {
        project = new InlinePythonProject(root);
    }

    private Value eval(String source, String name) throws Exception {
        return project.run(source).getAssignment(name);
    }

    @Test
    void functionCallReturnsItsValue() throws Exception {
        var x = eval("""
                def f():
                    return 1
                x = f()
                """, "x");
        assertEquals(1L, x.value());
    }

    @Test
    void argumentsAndDefaultsAreBound() throws Exception {
        var source = """
                def add(a, b=10):
                    return a + b
                x = add(1)
                y = add(1, b=2)
                """;
        var frame = project.run(source);
        assertEquals(11L, frame.getAssignment("x").value());
        assertEquals(3L, frame.getAssignment("y").value());
    }

    @Test
    void undecidableConditionMergesBranches() throws Exception {
        var source = """
                if flag:
                    a = 1
                else:
                    a = 2
                b = a == 1
                """;
        var frame = project.run(source);
        var a = assertInstanceOf(FuzzyValue.class, frame.getAssignment("a"));
        assertEquals(List.of(1L, 2L), a.members().stream().map(Value::value).toList());
        assertEquals(FuzzyBoolean.MAYBE, frame.getAssignment("b").boolValue());
    }

    @Test
    void decidableConditionTakesOneBranch() throws Exception {
        var a = eval("""
                n = 3
                if n > 2:
                    a = "big"
                else:
                    a = "small"
                """, "a");
        assertEquals("big", a.value());
    }

    @Test
    void bindingOnOnlyOnePathKeepsThatValue() throws Exception {
        var a = eval("""
                if flag:
                    a = 1
                """, "a");
        assertEquals(1L, a.value());
    }

    @Test
    void recursionStopsWithUnknown() throws Exception {
        var x = eval("""
                def f(n):
                    return f(n)
                x = f(1)
                """, "x");
        assertInstanceOf(UnknownValue.class, x);
    }

    @Test
    void closuresSeeEnclosingValuesAtCallTime() throws Exception {
        var source = """
                x = 1
                def f():
                    return x
                x = 2
                y = f()
                """;
        assertEquals(2L, eval(source, "y").value());
    }

    @Test
    void functionLocalsDoNotLeak() throws Exception {
        var frame = project.run("""
                x = 1
                def f():
                    x = 2
                    return x
                y = f()
                """);
        assertEquals(1L, frame.getAssignment("x").value());
        assertEquals(2L, frame.getAssignment("y").value());
    }

    @Test
    void classesInstancesAndMethods() throws Exception {
        var frame = project.run("""
                class Box:
                    def __init__(self, v):
                        self.v = v
                    def get(self):
                        return self.v
                    @property
                    def doubled(self):
                        return self.v * 2
                b = Box(3)
                x = b.get()
                y = b.doubled
                """);
        var b = (ConcreteValue) frame.getAssignment("b");
        assertInstanceOf(PyInstance.class, b.underlying());
        assertEquals(3L, frame.getAssignment("x").value());
        assertEquals(6L, frame.getAssignment("y").value());
    }

    @Test
    void augmentedAssignmentAndUnpacking() throws Exception {
        var frame = project.run("""
                n = 1
                n += 2
                a, b = "x", "y"
                """);
        assertEquals(3L, frame.getAssignment("n").value());
        assertEquals("x", frame.getAssignment("a").value());
        assertEquals("y", frame.getAssignment("b").value());
    }

    @Test
    void importsResolveAgainstTheProject() throws Exception {
        project.write("pkg/__init__.py", "");
        project.write("pkg/mod.py", "X = 5\n");
        var frame = project.run("""
                from pkg.mod import X
                import pkg.mod
                y = pkg.mod.X
                """);
        assertEquals(5L, frame.getAssignment("X").value());
        assertEquals(5L, frame.getAssignment("y").value());
    }

    @Test
    void unresolvedImportsYieldUnknownMembers() throws Exception {
        var frame = project.run("""
                from not_a_real_module import thing
                v = thing.attr
                """);
        assertInstanceOf(UnknownValue.class, frame.getAssignment("thing"));
        assertInstanceOf(UnknownValue.class, frame.getAssignment("v"));
    }

    @Test
    void syntaxErrorsDegradeInsteadOfFailing() throws Exception {
        var frame = project.run("""
                a = 1
                def broken(:
                b = 2
                """);
        assertEquals(1L, frame.getAssignment("a").value());
    }
}
