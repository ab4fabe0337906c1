package ai.importfix.index;

import static org.junit.jupiter.api.Assertions.*;

import ai.importfix.value.ConcreteValue;
import ai.importfix.value.FuzzyValue;
import ai.importfix.value.UnknownValue;
import java.util.List;
import org.junit.jupiter.api.Test;

class SymbolTypeTest {

    @Test
    void literalsAreAssignments() {
        assertEquals(SymbolType.ASSIGNMENT, SymbolType.from(ConcreteValue.of(1L)));
        assertEquals(SymbolType.ASSIGNMENT, SymbolType.from(ConcreteValue.none()));
    }

    @Test
    void unknownAndEmptyAreUnknown() {
        assertEquals(SymbolType.UNKNOWN, SymbolType.from(new UnknownValue("x")));
        assertEquals(SymbolType.UNKNOWN, SymbolType.from(FuzzyValue.empty()));
    }

    @Test
    void severalPossibilitiesAreAmbiguous() {
        var either = FuzzyValue.of(List.of(ConcreteValue.of(1L), ConcreteValue.of("s")));
        assertEquals(SymbolType.AMBIGUOUS, SymbolType.from(either));
    }
}
