package ai.importfix.cfg;

import static org.junit.jupiter.api.Assertions.*;

import ai.importfix.analyzer.SyntaxNode;
import ai.importfix.analyzer.TreeSitterSourceParser;
import ai.importfix.ast.Expression;
import ai.importfix.ast.ParameterKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CfgBuilderTest {

    private final CfgBuilder builder = new CfgBuilder(new TreeSitterSourceParser());

    private List<CfgNode> statements(String source) throws Exception {
        var root = builder.build(source);
        if (root instanceof CfgNode.Group g) {
            return g.children();
        }
        return root instanceof CfgNode.NoOp ? List.of() : List.of(root);
    }

    @Test
    void singleStatementIsNotWrapped() throws Exception {
        assertInstanceOf(CfgNode.Assign.class, builder.build("x = 1\n"));
        assertSame(CfgNode.NoOp.INSTANCE, builder.build("pass\n"));
    }

    @Test
    void importsWithAliases() throws Exception {
        var nodes = statements("import a.b as c, d\n");
        assertEquals(List.of(new CfgNode.Import("a.b", "c"), new CfgNode.Import("d", null)), nodes);
    }

    @Test
    void fromImportsKeepRelativeDotsAndAliases() throws Exception {
        var from = assertInstanceOf(CfgNode.FromImport.class, builder.build("from ..pkg import x as y, z\n"));
        assertEquals("..pkg", from.modulePath());
        var expected = new LinkedHashMap<String, String>();
        expected.put("x", "y");
        expected.put("z", null);
        assertEquals(expected, from.names());
        assertFalse(from.wildcard());

        var wildcard = assertInstanceOf(CfgNode.FromImport.class, builder.build("from m import *\n"));
        assertTrue(wildcard.wildcard());
        assertTrue(wildcard.names().isEmpty());
    }

    @Test
    void chainedAssignmentHasEveryTarget() throws Exception {
        var assign = assertInstanceOf(CfgNode.Assign.class, builder.build("a = b = 1\n"));
        assertEquals(List.of(new Expression.Variable("a"), new Expression.Variable("b")), assign.targets());
        assertEquals("=", assign.op());

        var augmented = assertInstanceOf(CfgNode.Assign.class, builder.build("n += 2\n"));
        assertEquals("+=", augmented.op());

        var annotated = assertInstanceOf(CfgNode.Assign.class, builder.build("n: int\n"));
        assertNull(annotated.value());
        assertEquals(new Expression.Variable("int"), annotated.typeHint());
    }

    @Test
    void ifChainEndsInLiteralTrueElse() throws Exception {
        var node = assertInstanceOf(CfgNode.If.class, builder.build("""
                if a:
                    x = 1
                elif b:
                    x = 2
                else:
                    x = 3
                """));
        assertEquals(3, node.branches().size());
        assertEquals(new Expression.Variable("b"), node.branches().get(1).condition());
        assertEquals(new Expression.Literal(true), node.branches().get(2).condition());
    }

    @Test
    void functionDefinitionParametersAndDecorators() throws Exception {
        var def = assertInstanceOf(CfgNode.FunctionDef.class, builder.build("""
                @staticmethod
                def f(a, b: int, c=1, *args, d: str = "x", **kw) -> int:
                    return a
                """));
        assertEquals("f", def.name());
        assertEquals(List.of("a", "b", "c", "args", "d", "kw"), def.params().stream().map(p -> p.name()).toList());
        assertEquals(ParameterKind.VAR_POSITIONAL, def.params().get(3).kind());
        assertEquals(ParameterKind.VAR_KEYWORD, def.params().get(5).kind());
        assertNotNull(def.params().get(2).defaultValue());
        assertEquals(List.of(new Expression.Variable("staticmethod")), def.decorators());
        assertEquals(new Expression.Variable("int"), def.returnHint());
        assertInstanceOf(CfgNode.Return.class, def.body());
    }

    @Test
    void classDefinitionBasesAndKeywords() throws Exception {
        var cls = assertInstanceOf(CfgNode.ClassDef.class, builder.build("""
                class C(Base, metaclass=Meta):
                    x = 1
                """));
        assertEquals(List.of(new Expression.Variable("Base")), cls.bases());
        assertEquals(Map.of("metaclass", new Expression.Variable("Meta")), cls.keywords());
    }

    @Test
    void tryHandlersElseAndFinally() throws Exception {
        var node = assertInstanceOf(CfgNode.Try.class, builder.build("""
                try:
                    a = 1
                except ValueError as e:
                    a = 2
                except:
                    a = 3
                else:
                    a = 4
                finally:
                    b = 5
                """));
        assertEquals(2, node.handlers().size());
        assertEquals(new Expression.Variable("ValueError"), node.handlers().get(0).type());
        assertEquals("e", node.handlers().get(0).name());
        assertNull(node.handlers().get(1).type());
        assertInstanceOf(CfgNode.Assign.class, node.elseBody());
        assertInstanceOf(CfgNode.Assign.class, node.finallyBody());
    }

    @Test
    void withItemsNest() throws Exception {
        var outer = assertInstanceOf(CfgNode.With.class, builder.build("""
                with open(p) as f, lock:
                    pass
                """));
        assertEquals(new Expression.Variable("f"), outer.target());
        var inner = assertInstanceOf(CfgNode.With.class, outer.body());
        assertNull(inner.target());
        assertEquals(new Expression.Variable("lock"), inner.context());
    }

    @Test
    void matchCasesBecomeUndecidableBranches() throws Exception {
        var nodes = statements("""
                match command:
                    case "go":
                        x = 1
                    case _:
                        x = 2
                """);
        var branches = nodes.stream()
                .filter(CfgNode.If.class::isInstance)
                .map(CfgNode.If.class::cast)
                .findFirst()
                .orElseThrow()
                .branches();
        assertEquals(2, branches.size());
    }

    @Test
    void walkerSkipsDefinitionsUnlessAsked() throws Exception {
        var root = builder.build("""
                import os
                def f():
                    import sys
                if x:
                    from a import b
                """);
        var shallow = new ArrayList<CfgNode>();
        CfgWalker.walk(root, false, shallow::add);
        var deep = new ArrayList<CfgNode>();
        CfgWalker.walk(root, true, deep::add);

        assertEquals(2, shallow.stream().filter(n -> n instanceof CfgNode.Import || n instanceof CfgNode.FromImport)
                .count());
        assertEquals(3, deep.stream().filter(n -> n instanceof CfgNode.Import || n instanceof CfgNode.FromImport)
                .count());
    }

    @Test
    void operandlessParameterAndAsPatternDegradeToNoOp() {
        var name = SyntaxNode.leaf("identifier", "f", true, 0, 4).withFieldName("name");
        var typed = new SyntaxNode("typed_parameter", null, List.of(), null, true, 0, 6);
        var params = new SyntaxNode("parameters", "parameters", List.of(typed), null, true, 0, 5);
        var def = new SyntaxNode("function_definition", null, List.of(name, params), null, true, 0, 0);
        assertSame(CfgNode.NoOp.INSTANCE, builder.statement(def));

        var asPattern = new SyntaxNode("as_pattern", null, List.of(), null, true, 2, 7);
        var handler = new SyntaxNode("except_clause", null, List.of(asPattern), null, true, 2, 0);
        var tryNode = new SyntaxNode("try_statement", null, List.of(handler), null, true, 0, 0);
        assertSame(CfgNode.NoOp.INSTANCE, builder.statement(tryNode));
    }
}
