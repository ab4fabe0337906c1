package ai.importfix.ast;

import ai.importfix.frame.Frame;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.UnknownValue;
import ai.importfix.value.Value;
import java.util.List;

/** Binds a value to an assignment target: a name, an attribute, a subscript or a (nested) unpacking pattern. */
public final class Targets {

    private Targets() {}

    public static void bind(Expression target, Value value, Frame frame) {
        if (target instanceof Expression.Variable v) {
            frame.assign(v.name(), value);
        } else if (target instanceof Expression.Attribute a) {
            a.base().evaluate(frame).setAttribute(a.name(), value);
        } else if (target instanceof Expression.Subscript s) {
            var container = s.base().evaluate(frame);
            container.setItem(s.index().evaluate(frame), value);
        } else if (target instanceof Expression.CollectionLiteral pattern) {
            unpack(pattern.elements(), value, frame);
        } else if (target instanceof Expression.Starred starred) {
            bind(starred.inner(), new UnknownValue("list"), frame);
        }
        // anything else is not a valid target and binds nothing
    }

    private static void unpack(List<Expression> elements, Value value, Frame frame) {
        int starAt = -1;
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) instanceof Expression.Starred) {
                starAt = i;
                break;
            }
        }
        for (int i = 0; i < elements.size(); i++) {
            var element = elements.get(i);
            if (element instanceof Expression.Starred starred) {
                bind(starred.inner(), new UnknownValue("list"), frame);
                continue;
            }
            // after a starred element, positions count from the end
            long index = starAt >= 0 && i > starAt ? i - elements.size() : i;
            bind(element, value.getItem(ConcreteValue.of(index)), frame);
        }
    }

    /** Names a target binds, ignoring attribute and subscript targets. */
    public static List<String> boundNames(Expression target) {
        if (target instanceof Expression.Variable v) {
            return List.of(v.name());
        }
        if (target instanceof Expression.Starred starred) {
            return boundNames(starred.inner());
        }
        if (target instanceof Expression.CollectionLiteral pattern) {
            return pattern.elements().stream().flatMap(e -> boundNames(e).stream()).toList();
        }
        return List.of();
    }
}
