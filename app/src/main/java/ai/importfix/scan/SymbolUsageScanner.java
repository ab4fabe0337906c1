package ai.importfix.scan;

import ai.importfix.ast.Expression;
import ai.importfix.ast.FreeSymbols;
import ai.importfix.ast.Parameter;
import ai.importfix.cfg.CfgNode;
import ai.importfix.frame.Builtins;
import ai.importfix.frame.ModuleRegistry;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Finds the names a module uses without defining or importing them.
 *
 * <p>Each scope records the names it reads before binding them. Class bodies run in place, so their unresolved names
 * are checked against the enclosing scope at the point of the class statement. Function and lambda bodies run later,
 * so their unresolved names are checked against the enclosing scope's complete set of bindings; class scopes are
 * skipped on the way out.
 */
@NullMarked
public final class SymbolUsageScanner {
    private static final Logger logger = LogManager.getLogger(SymbolUsageScanner.class);

    private final ModuleExports exports;

    public SymbolUsageScanner(ModuleRegistry registry) {
        this.exports = new ModuleExports(registry);
    }

    /** Builds the scope tree of a module. */
    public ScopeInfo scan(CfgNode module) {
        var scope = new ScopeInfo(ScopeInfo.Kind.MODULE, "<module>");
        visit(module, scope);
        scope.finish();
        return scope;
    }

    /**
     * Names used but never bound, with how they are used. Builtins, module dunders and names provided by a resolvable
     * wildcard import are not missing.
     *
     * @param fileDir directory of the scanned file, for resolving wildcard imports
     */
    public Map<String, UsageContext> missingSymbols(CfgNode module, Path fileDir) {
        var scope = scan(module);
        var missing = new LinkedHashMap<String, UsageContext>();
        scope.freeNames().forEach((name, context) -> {
            if (Builtins.isBuiltin(name) || Builtins.MODULE_DUNDERS.contains(name)) {
                return;
            }
            if (providedByWildcard(scope, fileDir, name)) {
                return;
            }
            missing.put(name, context);
        });
        logger.debug("{} missing symbols: {}", missing.size(), missing.keySet());
        return missing;
    }

    private boolean providedByWildcard(ScopeInfo scope, Path fileDir, String name) {
        for (var modulePath : scope.wildcardImports()) {
            if (exports.provides(modulePath, fileDir, name)) {
                return true;
            }
        }
        return false;
    }

    private void visit(CfgNode node, ScopeInfo scope) {
        if (node instanceof CfgNode.ExpressionStmt s) {
            use(s.expression(), scope);
        } else if (node instanceof CfgNode.Assign a) {
            if (a.typeHint() != null) {
                use(a.typeHint(), scope);
            }
            if (a.value() == null) {
                return;
            }
            use(a.value(), scope);
            if (!a.op().equals("=")) {
                use(a.targets().get(0), scope);
            }
            a.targets().forEach(t -> bindTarget(t, scope));
        } else if (node instanceof CfgNode.Return r) {
            if (r.value() != null) {
                use(r.value(), scope);
            }
        } else if (node instanceof CfgNode.Import i) {
            scope.bind(i.alias() != null ? i.alias() : i.modulePath().split("\\.")[0]);
        } else if (node instanceof CfgNode.FromImport f) {
            if (f.wildcard()) {
                scope.addWildcard(f.modulePath());
            }
            f.names().forEach((name, alias) -> scope.bind(alias != null ? alias : name));
        } else if (node instanceof CfgNode.If i) {
            for (var branch : i.branches()) {
                use(branch.condition(), scope);
                visit(branch.body(), scope);
            }
        } else if (node instanceof CfgNode.While w) {
            use(w.condition(), scope);
            visit(w.body(), scope);
            visit(w.elseBody(), scope);
        } else if (node instanceof CfgNode.For f) {
            use(f.iterable(), scope);
            bindTarget(f.target(), scope);
            visit(f.body(), scope);
            visit(f.elseBody(), scope);
        } else if (node instanceof CfgNode.Try t) {
            visit(t.body(), scope);
            for (var handler : t.handlers()) {
                if (handler.type() != null) {
                    use(handler.type(), scope);
                }
                if (handler.name() != null) {
                    scope.bind(handler.name());
                }
                visit(handler.body(), scope);
            }
            visit(t.elseBody(), scope);
            visit(t.finallyBody(), scope);
        } else if (node instanceof CfgNode.With w) {
            use(w.context(), scope);
            if (w.target() != null) {
                bindTarget(w.target(), scope);
            }
            visit(w.body(), scope);
        } else if (node instanceof CfgNode.FunctionDef f) {
            f.decorators().forEach(d -> use(d, scope));
            useParameterExpressions(f.params(), scope);
            if (f.returnHint() != null) {
                use(f.returnHint(), scope);
            }
            scope.bind(f.name());
            var body = new ScopeInfo(ScopeInfo.Kind.FUNCTION, f.name());
            f.params().forEach(p -> body.bind(p.name()));
            visit(f.body(), body);
            addDeferredScope(body, scope);
        } else if (node instanceof CfgNode.ClassDef c) {
            c.decorators().forEach(d -> use(d, scope));
            c.bases().forEach(b -> use(b, scope));
            c.keywords().values().forEach(k -> use(k, scope));
            var body = new ScopeInfo(ScopeInfo.Kind.CLASS, c.name());
            visit(c.body(), body);
            body.finish();
            scope.addChild(body);
            body.freeNames().forEach(scope::reference);
            // methods skip the class scope
            body.deferred().forEach(scope::addDeferred);
            scope.bind(c.name());
        } else if (node instanceof CfgNode.Group g) {
            g.children().forEach(child -> visit(child, scope));
        }
    }

    private void addDeferredScope(ScopeInfo child, ScopeInfo parent) {
        child.finish();
        parent.addChild(child);
        parent.addDeferred(child);
    }

    private void use(Expression expression, ScopeInfo scope) {
        FreeSymbols.collect(expression, false).forEach(scope::reference);
        for (var lambda : FreeSymbols.lambdas(expression)) {
            var body = new ScopeInfo(ScopeInfo.Kind.LAMBDA, "<lambda>");
            lambda.params().forEach(p -> body.bind(p.name()));
            use(lambda.body(), body);
            addDeferredScope(body, scope);
        }
        FreeSymbols.namedExpressionTargets(expression).forEach(scope::bind);
    }

    private void useParameterExpressions(List<Parameter> params, ScopeInfo scope) {
        for (var p : params) {
            if (p.defaultValue() != null) {
                use(p.defaultValue(), scope);
            }
            if (p.typeHint() != null) {
                use(p.typeHint(), scope);
            }
        }
    }

    private void bindTarget(@Nullable Expression target, ScopeInfo scope) {
        if (target instanceof Expression.Variable v) {
            scope.bind(v.name());
        } else if (target instanceof Expression.CollectionLiteral pattern) {
            pattern.elements().forEach(e -> bindTarget(e, scope));
        } else if (target instanceof Expression.Starred starred) {
            bindTarget(starred.inner(), scope);
        } else if (target != null) {
            // attribute and subscript targets read their base
            use(target, scope);
        }
    }
}
