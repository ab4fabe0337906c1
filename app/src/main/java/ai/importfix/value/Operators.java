package ai.importfix.value;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Operator semantics over {@link Value}s. Operations on single literals are folded; operations involving fuzzy
 * values are applied to every combination of members; anything else is unknown.
 */
public final class Operators {

    public static final Set<String> COMPARISONS = Set.of("==", "!=", "<", ">", "<=", ">=", "<>", "in", "not in", "is",
            "is not");

    private Operators() {}

    /** A value whose truthiness is the given fuzzy boolean: a bool literal, or either bool when undecided. */
    public static Value fromFuzzyBoolean(FuzzyBoolean b) {
        return switch (b) {
            case TRUE -> ConcreteValue.ofBoolean(true);
            case FALSE -> ConcreteValue.ofBoolean(false);
            case MAYBE -> FuzzyValue.of(List.of(ConcreteValue.ofBoolean(true), ConcreteValue.ofBoolean(false)));
        };
    }

    public static Value binary(String op, Value left, Value right) {
        if (COMPARISONS.contains(op)) {
            return compare(op, left, right);
        }
        if (left instanceof FuzzyValue || right instanceof FuzzyValue) {
            var results = new ArrayList<Value>();
            for (var l : left.members()) {
                for (var r : right.members()) {
                    results.add(binary(op, l, r));
                }
            }
            return FuzzyValue.of(results);
        }
        if (left instanceof ConcreteValue l && right instanceof ConcreteValue r) {
            var folded = fold(op, l.underlying(), r.underlying());
            if (folded != null) {
                return folded;
            }
        }
        return new UnknownValue(left.describe() + " " + op + " " + right.describe());
    }

    private static @Nullable Value fold(String op, Object l, Object r) {
        try {
            if (l instanceof String ls) {
                if (op.equals("+") && r instanceof String rs) return ConcreteValue.of(ls + rs);
                if (op.equals("*") && (r instanceof Long || r instanceof Boolean)) {
                    return ConcreteValue.of(ls.repeat((int) Math.max(0, Literals.asLong(r))));
                }
                return null;
            }
            if (l instanceof PySequence ls && r instanceof PySequence rs && op.equals("+") && ls.kind() == rs.kind()
                    && ls.kind() != PySequence.Kind.SET) {
                var joined = new ArrayList<Value>(ls.elements());
                joined.addAll(rs.elements());
                return ConcreteValue.of(new PySequence(ls.kind(), joined));
            }
            if (!Literals.isNumeric(l) || !Literals.isNumeric(r)) {
                return null;
            }
            if (l instanceof Double || r instanceof Double || op.equals("/")) {
                return foldDouble(op, Literals.asDouble(l), Literals.asDouble(r));
            }
            return foldLong(op, Literals.asLong(l), Literals.asLong(r));
        } catch (ArithmeticException e) {
            // overflow or division by zero: not representable here
            return null;
        }
    }

    private static @Nullable Value foldLong(String op, long a, long b) {
        Long result = switch (op) {
            case "+" -> Math.addExact(a, b);
            case "-" -> Math.subtractExact(a, b);
            case "*" -> Math.multiplyExact(a, b);
            case "//" -> Math.floorDiv(a, b);
            case "%" -> Math.floorMod(a, b);
            case "**" -> b < 0 ? null : power(a, b);
            case "<<" -> b < 0 || b > 62 ? null : Math.multiplyExact(a, 1L << b);
            case ">>" -> b < 0 ? null : a >> Math.min(b, 63);
            case "&" -> a & b;
            case "|" -> a | b;
            case "^" -> a ^ b;
            default -> null;
        };
        if (result == null) {
            return op.equals("**") && b < 0 ? foldDouble(op, a, b) : null;
        }
        return ConcreteValue.of(result);
    }

    private static long power(long base, long exponent) {
        if (base == 0L || base == 1L) {
            return exponent == 0L ? 1L : base;
        }
        if (base == -1L) {
            return exponent % 2 == 0 ? 1L : -1L;
        }
        long result = 1L;
        for (long i = 0; i < exponent; i++) {
            result = Math.multiplyExact(result, base);
        }
        return result;
    }

    private static @Nullable Value foldDouble(String op, double a, double b) {
        Double result = switch (op) {
            case "+" -> a + b;
            case "-" -> a - b;
            case "*" -> a * b;
            case "/" -> b == 0.0 ? null : a / b;
            case "//" -> b == 0.0 ? null : Math.floor(a / b);
            case "%" -> b == 0.0 ? null : a - b * Math.floor(a / b);
            case "**" -> Math.pow(a, b);
            default -> null;
        };
        return result == null ? null : ConcreteValue.of(result);
    }

    public static Value compare(String op, Value left, Value right) {
        return fromFuzzyBoolean(compareFuzzy(op, left, right));
    }

    static FuzzyBoolean compareFuzzy(String op, Value left, Value right) {
        if (left instanceof FuzzyValue || right instanceof FuzzyValue) {
            var results = new ArrayList<FuzzyBoolean>();
            for (var l : left.members()) {
                for (var r : right.members()) {
                    results.add(compareFuzzy(op, l, r));
                }
            }
            return FuzzyBoolean.unanimous(results);
        }
        return switch (op) {
            case "==" -> left.valueEquals(right);
            case "!=", "<>" -> left.valueEquals(right).invert();
            case "is" -> identical(left, right);
            case "is not" -> identical(left, right).invert();
            case "in" -> contains(right, left);
            case "not in" -> contains(right, left).invert();
            default -> ordering(op, left, right);
        };
    }

    private static FuzzyBoolean identical(Value left, Value right) {
        if (left == right) {
            return FuzzyBoolean.TRUE;
        }
        if (left instanceof ConcreteValue l && right instanceof ConcreteValue r) {
            if (l.underlying() instanceof PyConstant || r.underlying() instanceof PyConstant) {
                return FuzzyBoolean.of(l.underlying() == r.underlying());
            }
            if (!l.isLiteral() && !r.isLiteral()) {
                return FuzzyBoolean.of(l.underlying() == r.underlying());
            }
        }
        return FuzzyBoolean.MAYBE;
    }

    private static FuzzyBoolean contains(Value container, Value needle) {
        if (container instanceof ConcreteValue c) {
            if (c.underlying() instanceof PySequence seq) {
                return seq.containsValue(needle);
            }
            if (c.underlying() instanceof String haystack && needle instanceof ConcreteValue n
                    && n.underlying() instanceof String s) {
                return FuzzyBoolean.of(haystack.contains(s));
            }
        }
        return FuzzyBoolean.MAYBE;
    }

    private static FuzzyBoolean ordering(String op, Value left, Value right) {
        if (!(left instanceof ConcreteValue l) || !(right instanceof ConcreteValue r)) {
            return FuzzyBoolean.MAYBE;
        }
        int cmp;
        if (Literals.isNumeric(l.underlying()) && Literals.isNumeric(r.underlying())) {
            cmp = Double.compare(Literals.asDouble(l.underlying()), Literals.asDouble(r.underlying()));
        } else if (l.underlying() instanceof String ls && r.underlying() instanceof String rs) {
            cmp = ls.compareTo(rs);
        } else {
            return FuzzyBoolean.MAYBE;
        }
        return switch (op) {
            case "<" -> FuzzyBoolean.of(cmp < 0);
            case ">" -> FuzzyBoolean.of(cmp > 0);
            case "<=" -> FuzzyBoolean.of(cmp <= 0);
            case ">=" -> FuzzyBoolean.of(cmp >= 0);
            default -> FuzzyBoolean.MAYBE;
        };
    }

    public static Value unary(String op, Value operand) {
        if (op.equals("not")) {
            return fromFuzzyBoolean(operand.boolValue().invert());
        }
        if (operand instanceof FuzzyValue) {
            return FuzzyValue.of(operand.members().stream().map(m -> unary(op, m)).toList());
        }
        if (operand instanceof ConcreteValue c && Literals.isNumeric(c.underlying())) {
            var u = c.underlying();
            if (u instanceof Double d) {
                switch (op) {
                    case "-":
                        return ConcreteValue.of(-d);
                    case "+":
                        return c;
                    default:
                        break;
                }
            } else {
                long v = Literals.asLong(u);
                switch (op) {
                    case "-":
                        return v == Long.MIN_VALUE ? new UnknownValue("-" + c.describe()) : ConcreteValue.of(-v);
                    case "+":
                        return ConcreteValue.of(v);
                    case "~":
                        return ConcreteValue.of(~v);
                    default:
                        break;
                }
            }
        }
        return new UnknownValue(op + operand.describe());
    }
}
