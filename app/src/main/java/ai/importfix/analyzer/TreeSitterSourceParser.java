package ai.importfix.analyzer;

import ai.importfix.util.SourceContent;
import java.util.ArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterPython;

/**
 * {@link SourceParser} backed by the tree-sitter Python grammar. The native tree is copied into {@link SyntaxNode}s so
 * nothing downstream holds on to parser memory.
 */
@NullMarked
public final class TreeSitterSourceParser implements SourceParser {
    private static final Logger logger = LogManager.getLogger(TreeSitterSourceParser.class);

    private static final String COMMENT = "comment";
    private static final String LINE_CONTINUATION = "line_continuation";
    private static final String STRING = "string";

    private final ThreadLocal<TSParser> parserCache = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        return parser;
    });

    @Override
    public SyntaxNode parse(String source) throws ParseException {
        var content = SourceContent.of(source);
        var tree = parserCache.get().parseString(null, content.text());
        if (tree == null) {
            throw new ParseException("tree-sitter produced no tree");
        }
        var root = tree.getRootNode();
        if (root.isNull()) {
            throw new ParseException("tree-sitter produced an empty tree");
        }
        if (root.hasError()) {
            logger.debug("Source has syntax errors; continuing with a partial tree");
        }
        return convert(root, null, content);
    }

    private SyntaxNode convert(TSNode node, @Nullable String fieldName, SourceContent content) {
        var type = node.getType();
        var point = node.getStartPoint();
        int count = node.getChildCount();
        var children = new ArrayList<SyntaxNode>(count);
        for (int i = 0; i < count; i++) {
            var child = node.getChild(i);
            if (child.isNull() || isDropped(child)) {
                continue;
            }
            children.add(convert(child, node.getFieldNameForChild(i), content));
        }
        String value = null;
        if (count == 0 || STRING.equals(type)) {
            value = content.substringFrom(node);
        }
        return new SyntaxNode(type, fieldName, children, value, node.isNamed(), point.getRow(), point.getColumn());
    }

    private static boolean isDropped(TSNode child) {
        var type = child.getType();
        return COMMENT.equals(type) || LINE_CONTINUATION.equals(type);
    }
}
