package ai.importfix.scan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Names bound and used by one lexical scope, as found by {@link SymbolUsageScanner}.
 *
 * <p>{@link #references()} holds the names the scope's own code read while they were not yet bound in it.
 * {@link #freeNames()} is what the scope leaves for its enclosing scopes to supply, including names from nested
 * functions and lambdas.
 */
public final class ScopeInfo {

    public enum Kind {
        MODULE,
        CLASS,
        FUNCTION,
        LAMBDA
    }

    private final Kind kind;
    private final String name;
    private final Set<String> bound = new LinkedHashSet<>();
    private final Map<String, UsageContext> references = new LinkedHashMap<>();
    private final Map<String, UsageContext> freeNames = new LinkedHashMap<>();
    private final List<ScopeInfo> children = new ArrayList<>();
    // nested function and lambda scopes whose free names are checked against this scope's final bindings
    private final List<ScopeInfo> deferred = new ArrayList<>();
    private final List<String> wildcardImports = new ArrayList<>();

    ScopeInfo(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public Set<String> boundNames() {
        return Collections.unmodifiableSet(bound);
    }

    public Map<String, UsageContext> references() {
        return Collections.unmodifiableMap(references);
    }

    public Map<String, UsageContext> freeNames() {
        return Collections.unmodifiableMap(freeNames);
    }

    public List<ScopeInfo> children() {
        return Collections.unmodifiableList(children);
    }

    /** First nested scope with the given name, e.g. a function or class defined in this scope. */
    public Optional<ScopeInfo> child(String childName) {
        return children.stream().filter(c -> c.name.equals(childName)).findFirst();
    }

    /** Modules imported with {@code from module import *} in this scope, in source order. */
    public List<String> wildcardImports() {
        return Collections.unmodifiableList(wildcardImports);
    }

    boolean isBound(String symbol) {
        return bound.contains(symbol);
    }

    void bind(String symbol) {
        bound.add(symbol);
    }

    void reference(String symbol, UsageContext context) {
        if (!bound.contains(symbol)) {
            references.merge(symbol, context, UsageContext::merge);
        }
    }

    void addChild(ScopeInfo child) {
        children.add(child);
    }

    void addDeferred(ScopeInfo child) {
        deferred.add(child);
    }

    List<ScopeInfo> deferred() {
        return deferred;
    }

    void addWildcard(String modulePath) {
        wildcardImports.add(modulePath);
    }

    /**
     * Computes {@link #freeNames()} once the scope's body has been walked. Functions and lambdas drop names they bind
     * anywhere, since those are their locals; modules keep references made before the binding.
     */
    void finish() {
        freeNames.clear();
        if (kind == Kind.CLASS) {
            freeNames.putAll(references);
            return;
        }
        references.forEach((symbol, context) -> {
            if (kind == Kind.MODULE || !bound.contains(symbol)) {
                freeNames.merge(symbol, context, UsageContext::merge);
            }
        });
        for (var child : deferred) {
            child.freeNames.forEach((symbol, context) -> {
                if (!bound.contains(symbol)) {
                    freeNames.merge(symbol, context, UsageContext::merge);
                }
            });
        }
    }

    @Override
    public String toString() {
        return "ScopeInfo[" + kind + " " + name + ", bound=" + bound + ", free=" + freeNames.keySet() + "]";
    }
}
