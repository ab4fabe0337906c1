package ai.importfix.value;

import java.util.Objects;

/** Truthiness, equality and naming for the plain literal types a {@link ConcreteValue} may hold. */
public final class Literals {

    private Literals() {}

    public static boolean isLiteral(Object o) {
        return o instanceof Long || o instanceof Double || o instanceof String || o instanceof Boolean
                || o instanceof PyConstant;
    }

    public static boolean isNumeric(Object o) {
        return o instanceof Long || o instanceof Double || o instanceof Boolean;
    }

    public static boolean truthiness(Object o) {
        if (o instanceof Boolean b) return b;
        if (o instanceof Long l) return l != 0L;
        if (o instanceof Double d) return d != 0.0;
        if (o instanceof String s) return !s.isEmpty();
        if (o instanceof PyConstant c) return c != PyConstant.NONE;
        return true;
    }

    /** Python equality between literals: numbers compare by value across int, float and bool. */
    public static boolean equal(Object a, Object b) {
        if (isNumeric(a) && isNumeric(b)) {
            if (a instanceof Double || b instanceof Double) {
                return asDouble(a) == asDouble(b);
            }
            return asLong(a) == asLong(b);
        }
        return Objects.equals(a, b);
    }

    public static long asLong(Object o) {
        if (o instanceof Boolean b) return b ? 1L : 0L;
        return ((Number) o).longValue();
    }

    public static double asDouble(Object o) {
        if (o instanceof Boolean b) return b ? 1.0 : 0.0;
        return ((Number) o).doubleValue();
    }

    public static String typeName(Object o) {
        if (o instanceof Boolean) return "bool";
        if (o instanceof Long) return "int";
        if (o instanceof Double) return "float";
        if (o instanceof String) return "str";
        if (o == PyConstant.NONE) return "NoneType";
        if (o == PyConstant.ELLIPSIS) return "ellipsis";
        if (o == PyConstant.NOT_IMPLEMENTED) return "NotImplementedType";
        return o.getClass().getSimpleName();
    }

    public static String repr(Object o) {
        if (o instanceof Boolean b) return b ? "True" : "False";
        if (o instanceof String s) return "'" + s + "'";
        if (o instanceof PyConstant c) return c.repr();
        return String.valueOf(o);
    }
}
