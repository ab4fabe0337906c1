package ai.importfix.value;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class FuzzyValueTest {

    @Test
    void mergeFlattensAndDeduplicatesLiterals() {
        var inner = FuzzyValue.of(List.of(ConcreteValue.of(1L), ConcreteValue.of(2L)));
        var merged = FuzzyValue.of(List.of(inner, ConcreteValue.of(2L), ConcreteValue.of("x")));

        var fuzzy = assertInstanceOf(FuzzyValue.class, merged);
        assertEquals(3, fuzzy.members().size());
        assertTrue(fuzzy.members().stream().noneMatch(m -> m instanceof FuzzyValue));
    }

    @Test
    void intAndBoolAreKeptApart() {
        var merged = FuzzyValue.of(List.of(ConcreteValue.of(1L), ConcreteValue.ofBoolean(true)));
        assertEquals(2, merged.members().size());
    }

    @Test
    void singleDistinctValueIsUnwrapped() {
        var merged = FuzzyValue.of(List.of(ConcreteValue.of(5L), ConcreteValue.of(5L)));
        var concrete = assertInstanceOf(ConcreteValue.class, merged);
        assertEquals(5L, concrete.value());
    }

    @Test
    void valueOfAmbiguousMergeThrows() {
        var merged = FuzzyValue.of(List.of(ConcreteValue.of(1L), ConcreteValue.of(2L)));
        assertThrows(AmbiguousValueException.class, merged::value);
        assertThrows(AmbiguousValueException.class, () -> FuzzyValue.empty().value());
    }

    @Test
    void truthinessIsUnanimousOrMaybe() {
        var allTrue = FuzzyValue.of(List.of(ConcreteValue.of(1L), ConcreteValue.of("s")));
        assertEquals(FuzzyBoolean.TRUE, allTrue.boolValue());

        var mixed = FuzzyValue.of(List.of(ConcreteValue.of(0L), ConcreteValue.of("s")));
        assertEquals(FuzzyBoolean.MAYBE, mixed.boolValue());
        assertThrows(AmbiguousValueException.class, () -> mixed.boolValue().asBoolean());
    }

    @Test
    void tooManyMembersCollapseToUnknown() {
        var values = List.of(ConcreteValue.of(1L), ConcreteValue.of(2L), ConcreteValue.of(3L));
        assertInstanceOf(UnknownValue.class, FuzzyValue.of(values, null, 2));
        assertInstanceOf(FuzzyValue.class, FuzzyValue.of(values, null, 3));
    }

    @Test
    void itemAccessBroadcastsToEveryMember() {
        var first = ConcreteValue.of(new PySequence(PySequence.Kind.LIST, List.of(ConcreteValue.of("a"))));
        var second = ConcreteValue.of(new PySequence(PySequence.Kind.TUPLE, List.of(ConcreteValue.of("b"))));
        var item = FuzzyValue.of(List.of(first, second)).getItem(ConcreteValue.of(0L));

        var fuzzy = assertInstanceOf(FuzzyValue.class, item);
        assertEquals(List.of("a", "b"), fuzzy.members().stream().map(Value::value).toList());
    }

    @Test
    void emptyStaysEmptyUnderBroadcast() {
        var empty = FuzzyValue.empty();
        assertTrue(empty.isEmpty());
        var attribute = assertInstanceOf(FuzzyValue.class, empty.getAttribute("x"));
        assertTrue(attribute.isEmpty());
    }

    @Test
    void fuzzyBooleanAlgebra() {
        assertEquals(FuzzyBoolean.MAYBE, FuzzyBoolean.MAYBE.invert());
        assertEquals(FuzzyBoolean.FALSE, FuzzyBoolean.TRUE.invert());
        assertEquals(FuzzyBoolean.FALSE, FuzzyBoolean.FALSE.and(FuzzyBoolean.MAYBE));
        assertEquals(FuzzyBoolean.TRUE, FuzzyBoolean.TRUE.or(FuzzyBoolean.MAYBE));
        assertEquals(FuzzyBoolean.MAYBE, FuzzyBoolean.TRUE.and(FuzzyBoolean.MAYBE));
    }
}
