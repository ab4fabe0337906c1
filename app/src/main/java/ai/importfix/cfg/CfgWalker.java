package ai.importfix.cfg;

import java.util.function.Consumer;

/** Pre-order traversal over statement trees. */
public final class CfgWalker {

    private CfgWalker() {}

    /**
     * Visits {@code root} and every statement nested in it.
     *
     * @param intoDefinitions whether to descend into function and class bodies
     */
    public static void walk(CfgNode root, boolean intoDefinitions, Consumer<CfgNode> visitor) {
        visitor.accept(root);
        if (root instanceof CfgNode.Group g) {
            g.children().forEach(c -> walk(c, intoDefinitions, visitor));
        } else if (root instanceof CfgNode.If i) {
            i.branches().forEach(b -> walk(b.body(), intoDefinitions, visitor));
        } else if (root instanceof CfgNode.While w) {
            walk(w.body(), intoDefinitions, visitor);
            walk(w.elseBody(), intoDefinitions, visitor);
        } else if (root instanceof CfgNode.For f) {
            walk(f.body(), intoDefinitions, visitor);
            walk(f.elseBody(), intoDefinitions, visitor);
        } else if (root instanceof CfgNode.Try t) {
            walk(t.body(), intoDefinitions, visitor);
            t.handlers().forEach(h -> walk(h.body(), intoDefinitions, visitor));
            walk(t.elseBody(), intoDefinitions, visitor);
            walk(t.finallyBody(), intoDefinitions, visitor);
        } else if (root instanceof CfgNode.With w) {
            walk(w.body(), intoDefinitions, visitor);
        } else if (intoDefinitions && root instanceof CfgNode.FunctionDef f) {
            walk(f.body(), true, visitor);
        } else if (intoDefinitions && root instanceof CfgNode.ClassDef c) {
            walk(c.body(), true, visitor);
        }
    }
}
