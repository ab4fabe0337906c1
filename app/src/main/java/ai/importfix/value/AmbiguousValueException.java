package ai.importfix.value;

/** A single concrete value was requested from a value that has none, or more than one. */
public class AmbiguousValueException extends RuntimeException {

    public AmbiguousValueException(String message) {
        super(message);
    }
}
