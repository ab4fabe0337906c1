package ai.importfix.value;

import ai.importfix.frame.Frame;
import ai.importfix.util.AnalysisConfig;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * One of several possible values. Members are flat (never fuzzy themselves) and unique. Operations broadcast to every
 * member and re-wrap the results.
 */
public final class FuzzyValue implements Value {
    private static final Logger logger = LogManager.getLogger(FuzzyValue.class);

    private final List<Value> members;
    private final @Nullable Object source;

    private FuzzyValue(List<Value> members, @Nullable Object source) {
        this.members = List.copyOf(members);
        this.source = source;
    }

    public static FuzzyValue empty() {
        return new FuzzyValue(List.of(), null);
    }

    /** Merges the given values into one, flattening fuzzy members. A single distinct value is returned as is. */
    public static Value of(Collection<? extends Value> values) {
        return of(values, null, AnalysisConfig.defaults().maxFuzzyMembers());
    }

    /**
     * Like {@link #of(Collection)}, recording where the merge happened and collapsing to an unknown when more than
     * {@code maxMembers} distinct values remain.
     */
    public static Value of(Collection<? extends Value> values, @Nullable Object source, int maxMembers) {
        var flat = new ArrayList<Value>();
        for (var value : values) {
            for (var member : value.members()) {
                if (flat.stream().noneMatch(existing -> sameValue(existing, member))) {
                    flat.add(member);
                }
            }
        }
        if (flat.size() == 1) {
            return flat.get(0);
        }
        if (flat.size() > maxMembers) {
            logger.debug("Collapsing {} possible values to unknown", flat.size());
            return new UnknownValue("<" + flat.size() + " possibilities>");
        }
        return new FuzzyValue(flat, source);
    }

    private static boolean sameValue(Value a, Value b) {
        if (a == b) {
            return true;
        }
        return a instanceof ConcreteValue ca && b instanceof ConcreteValue cb && ca.isLiteral() && cb.isLiteral()
                && ca.underlying().getClass() == cb.underlying().getClass()
                && ca.underlying().equals(cb.underlying());
    }

    @Override
    public List<Value> members() {
        return members;
    }

    public @Nullable Object source() {
        return source;
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    private Value broadcast(Function<Value, Value> op) {
        return of(members.stream().map(op).toList(), source, AnalysisConfig.defaults().maxFuzzyMembers());
    }

    @Override
    public boolean hasAttribute(String name) {
        return members.stream().anyMatch(m -> m.hasAttribute(name));
    }

    @Override
    public Value getAttribute(String name) {
        return broadcast(m -> m.getAttribute(name));
    }

    @Override
    public void setAttribute(String name, Value value) {
        members.forEach(m -> m.setAttribute(name, value));
    }

    @Override
    public FuzzyBoolean valueEquals(Value other) {
        return FuzzyBoolean.unanimous(members.stream().map(m -> m.valueEquals(other)).toList());
    }

    @Override
    public FuzzyBoolean boolValue() {
        return FuzzyBoolean.unanimous(members.stream().map(Value::boolValue).toList());
    }

    @Override
    public Value call(Arguments args, Frame caller) {
        if (members.isEmpty()) {
            logger.debug("Call on an empty set of possible values");
            return empty();
        }
        return broadcast(m -> m.call(args, caller));
    }

    @Override
    public Value getItem(Value index) {
        return broadcast(m -> m.getItem(index));
    }

    @Override
    public void setItem(Value index, Value value) {
        members.forEach(m -> m.setItem(index, value));
    }

    @Override
    public Value iterate() {
        return broadcast(Value::iterate);
    }

    @Override
    public Object value() {
        if (members.size() != 1) {
            throw new AmbiguousValueException("Value is one of " + members.size() + " possibilities: " + describe());
        }
        return members.get(0).value();
    }

    @Override
    public String describe() {
        return members.stream().map(Value::describe).collect(Collectors.joining(" | ", "(", ")"));
    }

    @Override
    public String toString() {
        return "Fuzzy" + members;
    }
}
