package ai.importfix.cfg;

import ai.importfix.analyzer.SyntaxNode;

/** A syntax subtree has an unexpected shape. The builder replaces the subtree with a placeholder and continues. */
final class ParseDegradedException extends RuntimeException {
    private final SyntaxNode node;

    ParseDegradedException(SyntaxNode node, String message) {
        super(message + " in " + node);
        this.node = node;
    }

    SyntaxNode node() {
        return node;
    }
}
