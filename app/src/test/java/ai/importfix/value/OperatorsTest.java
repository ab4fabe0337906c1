package ai.importfix.value;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class OperatorsTest {

    private static Value lit(Object o) {
        return ConcreteValue.of(o);
    }

    @Test
    void foldsIntegerArithmetic() {
        assertEquals(3L, Operators.binary("+", lit(1L), lit(2L)).value());
        assertEquals(-2L, Operators.binary("//", lit(-7L), lit(4L)).value());
        assertEquals(1L, Operators.binary("%", lit(-7L), lit(4L)).value());
        assertEquals(1024L, Operators.binary("**", lit(2L), lit(10L)).value());
        assertEquals(2.5, Operators.binary("/", lit(5L), lit(2L)).value());
    }

    @Test
    void foldsStringOperations() {
        assertEquals("ab", Operators.binary("+", lit("a"), lit("b")).value());
        assertEquals("xxx", Operators.binary("*", lit("x"), lit(3L)).value());
        assertEquals("", Operators.binary("*", lit("x"), lit(-1L)).value());
    }

    @Test
    void unrepresentableResultsAreUnknown() {
        assertInstanceOf(UnknownValue.class, Operators.binary("//", lit(1L), lit(0L)));
        assertInstanceOf(UnknownValue.class, Operators.binary("/", lit(1L), lit(0L)));
        assertInstanceOf(UnknownValue.class, Operators.binary("*", lit(Long.MAX_VALUE), lit(2L)));
        assertInstanceOf(UnknownValue.class, Operators.unary("-", lit(Long.MIN_VALUE)));
        assertInstanceOf(UnknownValue.class, Operators.binary("+", lit("a"), lit(1L)));
    }

    @Test
    void broadcastsOverEveryCombination() {
        var left = FuzzyValue.of(List.of(lit(1L), lit(2L)));
        var right = FuzzyValue.of(List.of(lit(10L), lit(20L)));
        var sum = assertInstanceOf(FuzzyValue.class, Operators.binary("+", left, right));

        assertEquals(List.of(11L, 21L, 12L, 22L), sum.members().stream().map(Value::value).toList());
    }

    @Test
    void comparisonsProduceBooleans() {
        assertEquals(true, Operators.compare("<", lit(1L), lit(2.5)).value());
        assertEquals(true, Operators.compare("==", lit(1L), lit(1.0)).value());
        assertEquals(false, Operators.compare("!=", lit("a"), lit("a")).value());
        assertEquals(true, Operators.compare("is", ConcreteValue.none(), ConcreteValue.none()).value());
    }

    @Test
    void undecidableComparisonIsEitherBoolean() {
        var unknown = new UnknownValue("x");
        var result = Operators.compare("==", unknown, lit(1L));
        assertEquals(FuzzyBoolean.MAYBE, result.boolValue());
        assertEquals(2, result.members().size());
    }

    @Test
    void comparisonOverFuzzyIsUnanimous() {
        var either = FuzzyValue.of(List.of(lit(3L), lit(4L)));
        assertEquals(true, Operators.compare(">", either, lit(2L)).value());
        assertEquals(FuzzyBoolean.MAYBE, Operators.compare(">", either, lit(3L)).boolValue());
    }

    @Test
    void membership() {
        var list = lit(new PySequence(PySequence.Kind.LIST, List.of(lit(1L), lit(2L))));
        assertEquals(true, Operators.compare("in", lit(2L), list).value());
        assertEquals(true, Operators.compare("not in", lit(3L), list).value());
        assertEquals(true, Operators.compare("in", lit("ell"), lit("hello")).value());
    }

    @Test
    void unaryOperators() {
        assertEquals(-5L, Operators.unary("-", lit(5L)).value());
        assertEquals(-6L, Operators.unary("~", lit(5L)).value());
        assertEquals(true, Operators.unary("not", lit(0L)).value());
        assertEquals(FuzzyBoolean.MAYBE, Operators.unary("not", new UnknownValue("y")).boolValue());
    }
}
