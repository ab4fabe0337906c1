package ai.importfix.cfg;

import static ai.importfix.cfg.PythonTreeSitterNodeTypes.*;

import ai.importfix.analyzer.SyntaxNode;
import ai.importfix.ast.Expression;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/** Turns string nodes into literals, or into formatted strings when they interpolate. */
final class StringLiterals {

    private StringLiterals() {}

    static Expression string(SyntaxNode node, Function<SyntaxNode, Expression> expressions) {
        var interpolations = interpolations(node, expressions);
        var text = node.text();
        var prefix = prefix(text);
        if (prefix.contains("f") || !interpolations.isEmpty()) {
            return new Expression.FormattedString(interpolations);
        }
        if (prefix.contains("b")) {
            return new Expression.Unknown("bytes");
        }
        var body = unquote(text.substring(prefix.length()));
        return new Expression.Literal(prefix.contains("r") ? body : unescape(body));
    }

    static Expression concatenated(SyntaxNode node, Function<SyntaxNode, Expression> expressions) {
        var parts = new ArrayList<Expression>();
        for (var child : node.namedChildren()) {
            if (child.is(STRING)) {
                parts.add(string(child, expressions));
            }
        }
        var joined = new StringBuilder();
        var interpolations = new ArrayList<Expression>();
        boolean literal = true;
        for (var part : parts) {
            if (part instanceof Expression.Literal l && l.value() instanceof String s) {
                joined.append(s);
            } else {
                literal = false;
                interpolations.addAll(part.children());
            }
        }
        return literal ? new Expression.Literal(joined.toString()) : new Expression.FormattedString(interpolations);
    }

    private static List<Expression> interpolations(SyntaxNode node, Function<SyntaxNode, Expression> expressions) {
        var out = new ArrayList<Expression>();
        for (var child : node.children()) {
            if (child.is(INTERPOLATION)) {
                var expression = child.childByField("expression")
                        .or(() -> child.namedChildren().stream().findFirst());
                expression.ifPresent(e -> out.add(expressions.apply(e)));
            }
        }
        return out;
    }

    private static String prefix(String text) {
        int i = 0;
        while (i < text.length() && text.charAt(i) != '\'' && text.charAt(i) != '"') {
            i++;
        }
        return text.substring(0, i).toLowerCase(Locale.ROOT);
    }

    private static String unquote(String quoted) {
        for (var quote : List.of("\"\"\"", "'''", "\"", "'")) {
            if (quoted.length() >= 2 * quote.length() && quoted.startsWith(quote) && quoted.endsWith(quote)) {
                return quoted.substring(quote.length(), quoted.length() - quote.length());
            }
        }
        return quoted;
    }

    private static String unescape(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        var sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '0' -> sb.append('\0');
                case '\\', '\'', '"' -> sb.append(next);
                case '\n' -> {
                    // line continuation inside the literal
                }
                default -> sb.append('\\').append(next);
            }
        }
        return sb.toString();
    }
}
