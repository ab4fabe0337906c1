package ai.importfix.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TreeSitterSourceParserTest {

    private final TreeSitterSourceParser parser = new TreeSitterSourceParser();

    @Test
    void buildsNamedTreeWithFields() throws Exception {
        var module = parser.parse("x = foo(1)\n");
        assertEquals("module", module.kind());

        var statement = module.namedChildren().get(0);
        assertEquals("expression_statement", statement.kind());
        var assignment = statement.namedChildren().get(0);
        assertEquals("x", assignment.childByField("left").orElseThrow().text());
        var call = assignment.childByField("right").orElseThrow();
        assertEquals("call", call.kind());
        assertEquals("foo", call.childByField("function").orElseThrow().text());
    }

    @Test
    void positionsAreZeroBased() throws Exception {
        var module = parser.parse("a = 1\n\n  # note\nb = 2\n");
        var second = module.namedChildren().get(1);
        assertEquals(3, second.startLine());
        assertEquals(0, second.startCol());
    }

    @Test
    void commentsAreDropped() throws Exception {
        var module = parser.parse("# leading\nx = 1  # trailing\n");
        assertEquals(1, module.namedChildren().size());
        assertFalse(module.namedChildren().stream().anyMatch(n -> n.is("comment")));
    }

    @Test
    void multiByteTextIsSlicedCorrectly() throws Exception {
        var module = parser.parse("s = \"héllo ✓\"\nt = 1\n");
        var string = module.namedChildren().get(0).namedChildren().get(0).childByField("right").orElseThrow();
        assertEquals("\"héllo ✓\"", string.text());
        var t = module.namedChildren().get(1).namedChildren().get(0).childByField("left").orElseThrow();
        assertEquals("t", t.text());
    }

    @Test
    void syntaxErrorsStillProduceATree() throws Exception {
        var module = parser.parse("def f(:\n    pass\n");
        assertEquals("module", module.kind());
    }
}
