package ai.importfix.index;

import ai.importfix.lang.BoundMethod;
import ai.importfix.lang.PyClass;
import ai.importfix.lang.PyFunction;
import ai.importfix.lang.PyModule;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.FuzzyValue;
import ai.importfix.value.Value;

/** What kind of thing a module member is, as far as import ranking cares. */
public enum SymbolType {
    TYPE,
    FUNCTION,
    ASSIGNMENT,
    MODULE,
    UNKNOWN,
    AMBIGUOUS;

    public static SymbolType from(Value value) {
        if (value instanceof FuzzyValue fuzzy) {
            var members = fuzzy.members();
            if (members.size() == 1) {
                return from(members.get(0));
            }
            return members.isEmpty() ? UNKNOWN : AMBIGUOUS;
        }
        if (!(value instanceof ConcreteValue concrete)) {
            return UNKNOWN;
        }
        var underlying = concrete.underlying();
        if (underlying instanceof PyClass) {
            return TYPE;
        }
        if (underlying instanceof PyFunction || underlying instanceof BoundMethod) {
            return FUNCTION;
        }
        if (underlying instanceof PyModule) {
            return MODULE;
        }
        return ASSIGNMENT;
    }
}
