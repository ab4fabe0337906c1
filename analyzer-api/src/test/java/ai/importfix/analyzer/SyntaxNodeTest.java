package ai.importfix.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class SyntaxNodeTest {

    private static SyntaxNode call() {
        var function = SyntaxNode.leaf("identifier", "foo", true, 0, 0).withFieldName("function");
        var open = SyntaxNode.leaf("(", "(", false, 0, 3);
        var arg = SyntaxNode.leaf("identifier", "x", true, 0, 4);
        var close = SyntaxNode.leaf(")", ")", false, 0, 5);
        var args = new SyntaxNode("argument_list", "arguments", List.of(open, arg, close), null, true, 0, 3);
        return new SyntaxNode("call", null, List.of(function, args), null, true, 0, 0);
    }

    @Test
    void fieldLookup() {
        var node = call();
        assertEquals("foo", node.childByField("function").orElseThrow().text());
        assertTrue(node.childByField("missing").isEmpty());
        assertEquals(1, node.childrenByField("arguments").size());
    }

    @Test
    void namedChildrenSkipPunctuation() {
        var args = call().child(1);
        assertEquals(3, args.childCount());
        assertEquals(List.of("x"), args.namedChildren().stream().map(SyntaxNode::text).toList());
        assertTrue(args.hasChildOfKind("("));
        assertTrue(args.firstChildOfKind("identifier").isPresent());
    }

    @Test
    void textJoinsChildrenWithoutGluingWords() {
        assertEquals("foo(x)", call().text());
        var a = SyntaxNode.leaf("identifier", "not", false, 0, 0);
        var b = SyntaxNode.leaf("identifier", "x", true, 0, 4);
        var unary = new SyntaxNode("not_operator", null, List.of(a, b), null, true, 0, 0);
        assertEquals("not x", unary.text());
    }

    @Test
    void leafWithoutValueFallsBackToKind() {
        var node = new SyntaxNode("pass", null, List.of(), null, false, 2, 4);
        assertEquals("pass", node.text());
        assertTrue(node.isLeaf());
        assertEquals("SyntaxNode[pass@3:4]", node.toString());
    }
}
