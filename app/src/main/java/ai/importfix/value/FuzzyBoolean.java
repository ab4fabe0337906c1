package ai.importfix.value;

import java.util.Collection;

/** Three-valued truth: a condition may be known true, known false, or undecidable statically. */
public enum FuzzyBoolean {
    TRUE,
    FALSE,
    MAYBE;

    public static FuzzyBoolean of(boolean b) {
        return b ? TRUE : FALSE;
    }

    /** TRUE or FALSE when every element agrees, MAYBE otherwise (including for no elements). */
    public static FuzzyBoolean unanimous(Collection<FuzzyBoolean> values) {
        FuzzyBoolean result = null;
        for (var v : values) {
            if (result == null) {
                result = v;
            } else if (result != v) {
                return MAYBE;
            }
        }
        return result == null ? MAYBE : result;
    }

    public FuzzyBoolean invert() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case MAYBE -> MAYBE;
        };
    }

    public FuzzyBoolean and(FuzzyBoolean other) {
        if (this == FALSE || other == FALSE) return FALSE;
        if (this == TRUE && other == TRUE) return TRUE;
        return MAYBE;
    }

    public FuzzyBoolean or(FuzzyBoolean other) {
        if (this == TRUE || other == TRUE) return TRUE;
        if (this == FALSE && other == FALSE) return FALSE;
        return MAYBE;
    }

    public boolean isTrue() {
        return this == TRUE;
    }

    public boolean isFalse() {
        return this == FALSE;
    }

    public boolean isMaybe() {
        return this == MAYBE;
    }

    /**
     * Converts to a plain boolean.
     *
     * @throws AmbiguousValueException for MAYBE; an ambiguous condition must never be forced onto one branch
     */
    public boolean asBoolean() {
        if (this == MAYBE) {
            throw new AmbiguousValueException("Cannot convert an ambiguous truth value to boolean");
        }
        return this == TRUE;
    }
}
