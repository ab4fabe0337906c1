package ai.importfix.analyzer;

import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Immutable, parser-neutral view of one concrete syntax tree node.
 *
 * <p>{@code kind} is the grammar's node type (for anonymous tokens the token text itself, e.g. {@code "("} or
 * {@code "not in"}). {@code value} holds the source text for leaves and string literals. {@code fieldName} is the
 * grammar field under which the parent holds this node, if any. Lines and columns are zero-based.
 */
@NullMarked
public record SyntaxNode(
        String kind,
        @Nullable String fieldName,
        List<SyntaxNode> children,
        @Nullable String value,
        boolean named,
        int startLine,
        int startCol) {

    public SyntaxNode {
        children = List.copyOf(children);
    }

    public static SyntaxNode leaf(String kind, String value, boolean named, int line, int col) {
        return new SyntaxNode(kind, null, List.of(), value, named, line, col);
    }

    public SyntaxNode withFieldName(@Nullable String field) {
        return new SyntaxNode(kind, field, children, value, named, startLine, startCol);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean is(String type) {
        return kind.equals(type);
    }

    public SyntaxNode child(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    /** Children that are named grammar nodes, skipping punctuation and keywords. */
    public List<SyntaxNode> namedChildren() {
        return children.stream().filter(SyntaxNode::named).toList();
    }

    public Optional<SyntaxNode> childByField(String field) {
        for (var child : children) {
            if (field.equals(child.fieldName())) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public List<SyntaxNode> childrenByField(String field) {
        return children.stream().filter(c -> field.equals(c.fieldName())).toList();
    }

    public Optional<SyntaxNode> firstChildOfKind(String type) {
        for (var child : children) {
            if (child.is(type)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public boolean hasChildOfKind(String type) {
        return firstChildOfKind(type).isPresent();
    }

    /**
     * Approximate source text for diagnostics. Leaves contribute their value; interior nodes join their
     * children with single spaces where the original spacing is no longer known.
     */
    public String text() {
        if (value != null) {
            return value;
        }
        if (children.isEmpty()) {
            return kind;
        }
        var sb = new StringBuilder();
        for (var child : children) {
            var part = child.text();
            if (!sb.isEmpty() && needsSpace(sb.charAt(sb.length() - 1), part)) {
                sb.append(' ');
            }
            sb.append(part);
        }
        return sb.toString();
    }

    private static boolean needsSpace(char last, String next) {
        if (next.isEmpty()) {
            return false;
        }
        char first = next.charAt(0);
        return Character.isLetterOrDigit(last) && Character.isLetterOrDigit(first)
                || last == '_' && Character.isLetterOrDigit(first)
                || Character.isLetterOrDigit(last) && first == '_';
    }

    @Override
    public String toString() {
        return "SyntaxNode[" + kind + "@" + (startLine + 1) + ":" + startCol + "]";
    }
}
