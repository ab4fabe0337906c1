package ai.importfix.ast;

import ai.importfix.scan.UsageContext;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the names an expression reads and how each one is used. A name used directly as a callee, attribute base
 * or subscript base is reported with the matching {@link UsageContext}; any other use is raw.
 */
public final class FreeSymbols {

    private FreeSymbols() {}

    /**
     * @param includeDeferred whether to include names read inside lambda bodies, which only run when the lambda is
     *     called
     */
    public static Map<String, UsageContext> collect(Expression expression, boolean includeDeferred) {
        var out = new LinkedHashMap<String, UsageContext>();
        collect(expression, includeDeferred, out);
        return out;
    }

    private static void collect(Expression e, boolean includeDeferred, Map<String, UsageContext> out) {
        if (e instanceof Expression.Variable v) {
            out.merge(v.name(), UsageContext.raw(), UsageContext::merge);
        } else if (e instanceof Expression.Attribute a) {
            if (a.base() instanceof Expression.Variable v) {
                out.merge(v.name(), new UsageContext.AttributeContext(a.name()), UsageContext::merge);
            } else {
                collect(a.base(), includeDeferred, out);
            }
        } else if (e instanceof Expression.Subscript s) {
            if (s.base() instanceof Expression.Variable v) {
                out.merge(v.name(), new UsageContext.SubscriptContext(s.index()), UsageContext::merge);
            } else {
                collect(s.base(), includeDeferred, out);
            }
            collect(s.index(), includeDeferred, out);
        } else if (e instanceof Expression.Call c) {
            if (c.callee() instanceof Expression.Variable v) {
                out.merge(v.name(), new UsageContext.CallContext(c.args(), c.kwargs()), UsageContext::merge);
            } else {
                collect(c.callee(), includeDeferred, out);
            }
            c.args().forEach(arg -> collect(arg, includeDeferred, out));
            c.kwargs().values().forEach(arg -> collect(arg, includeDeferred, out));
        } else if (e instanceof Expression.Lambda l) {
            for (var p : l.params()) {
                if (p.defaultValue() != null) {
                    collect(p.defaultValue(), includeDeferred, out);
                }
            }
            if (includeDeferred) {
                var params = new HashSet<String>();
                l.params().forEach(p -> params.add(p.name()));
                var body = collect(l.body(), true);
                body.forEach((name, ctx) -> {
                    if (!params.contains(name)) {
                        out.merge(name, ctx, UsageContext::merge);
                    }
                });
            }
        } else if (e instanceof Expression.Comprehension c) {
            collectComprehension(c, includeDeferred, out);
        } else {
            e.children().forEach(child -> collect(child, includeDeferred, out));
        }
    }

    // The first iterable is evaluated in the enclosing scope; everything else sees the loop targets.
    private static void collectComprehension(
            Expression.Comprehension c, boolean includeDeferred, Map<String, UsageContext> out) {
        var clauses = c.clauses();
        collect(clauses.get(0).iterable(), includeDeferred, out);
        var bound = new HashSet<String>();
        var inner = new LinkedHashMap<String, UsageContext>();
        for (int i = 0; i < clauses.size(); i++) {
            var clause = clauses.get(i);
            if (i > 0) {
                collectExcluding(clause.iterable(), bound, includeDeferred, inner);
            }
            bound.addAll(Targets.boundNames(clause.target()));
            clause.conditions().forEach(cond -> collectExcluding(cond, bound, includeDeferred, inner));
        }
        collectExcluding(c.element(), bound, includeDeferred, inner);
        if (c.value() != null) {
            collectExcluding(c.value(), bound, includeDeferred, inner);
        }
        UsageContext.mergeInto(out, inner);
    }

    private static void collectExcluding(
            Expression e, Set<String> bound, boolean includeDeferred, Map<String, UsageContext> out) {
        collect(e, includeDeferred).forEach((name, ctx) -> {
            if (!bound.contains(name)) {
                out.merge(name, ctx, UsageContext::merge);
            }
        });
    }

    /** Lambdas reachable from {@code e} without entering another lambda's body. */
    public static List<Expression.Lambda> lambdas(Expression e) {
        var out = new ArrayList<Expression.Lambda>();
        findLambdas(e, out);
        return out;
    }

    private static void findLambdas(Expression e, List<Expression.Lambda> out) {
        if (e instanceof Expression.Lambda l) {
            out.add(l);
            l.params().stream()
                    .filter(p -> p.defaultValue() != null)
                    .forEach(p -> findLambdas(p.defaultValue(), out));
            return;
        }
        e.children().forEach(child -> findLambdas(child, out));
    }

    /** Names bound by assignment expressions in {@code e}, outside lambda bodies. */
    public static Set<String> namedExpressionTargets(Expression e) {
        var out = new LinkedHashSet<String>();
        findNamedTargets(e, out);
        return out;
    }

    private static void findNamedTargets(Expression e, Set<String> out) {
        if (e instanceof Expression.Lambda) {
            return;
        }
        if (e instanceof Expression.NamedExpr n) {
            out.add(n.name());
        }
        e.children().forEach(child -> findNamedTargets(child, out));
    }
}
