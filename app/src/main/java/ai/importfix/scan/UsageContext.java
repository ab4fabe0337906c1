package ai.importfix.scan;

import ai.importfix.ast.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** How a free name is used. Candidate imports are judged against it. */
public sealed interface UsageContext {

    /** Bare reference. */
    record Raw() implements UsageContext {
        public static final Raw INSTANCE = new Raw();
    }

    /** Called, as in {@code name(args, key=value)}. */
    record CallContext(List<Expression> args, Map<String, Expression> kwargs) implements UsageContext {
        public CallContext {
            args = List.copyOf(args);
            kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
        }
    }

    /** Subscripted, as in {@code name[index]}. */
    record SubscriptContext(Expression index) implements UsageContext {}

    /** Attribute read, as in {@code name.attribute}. */
    record AttributeContext(String attribute) implements UsageContext {}

    /** Several distinct non-raw uses. Never nested and never contains {@link Raw}. */
    record MultipleContext(List<UsageContext> contexts) implements UsageContext {
        public MultipleContext {
            contexts = List.copyOf(contexts);
        }
    }

    static UsageContext raw() {
        return Raw.INSTANCE;
    }

    /**
     * Combines two uses of the same name. Raw uses add nothing; nested multiple contexts are flattened and duplicates
     * dropped.
     */
    static UsageContext merge(UsageContext a, UsageContext b) {
        var flat = new ArrayList<UsageContext>();
        addFlattened(flat, a);
        addFlattened(flat, b);
        if (flat.isEmpty()) {
            return Raw.INSTANCE;
        }
        if (flat.size() == 1) {
            return flat.get(0);
        }
        return new MultipleContext(flat);
    }

    private static void addFlattened(List<UsageContext> out, UsageContext context) {
        if (context instanceof MultipleContext multiple) {
            multiple.contexts().forEach(c -> addFlattened(out, c));
        } else if (!(context instanceof Raw) && !out.contains(context)) {
            out.add(context);
        }
    }

    /** Merges {@code from} into {@code into}, name by name. */
    static void mergeInto(Map<String, UsageContext> into, Map<String, UsageContext> from) {
        from.forEach((name, context) -> into.merge(name, context, UsageContext::merge));
    }

    /** True if some use calls the name. */
    default boolean isCalled() {
        return contexts().stream().anyMatch(c -> c instanceof CallContext);
    }

    default boolean isSubscripted() {
        return contexts().stream().anyMatch(c -> c instanceof SubscriptContext);
    }

    default boolean hasAttributeAccess() {
        return contexts().stream().anyMatch(c -> c instanceof AttributeContext);
    }

    /** The individual uses; empty for a raw reference. */
    default List<UsageContext> contexts() {
        if (this instanceof MultipleContext multiple) {
            return multiple.contexts();
        }
        return this instanceof Raw ? List.of() : List.of(this);
    }
}
