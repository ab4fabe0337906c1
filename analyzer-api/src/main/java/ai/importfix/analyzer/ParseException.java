package ai.importfix.analyzer;

/** Raised by a {@link SourceParser} that could not produce a tree. */
public class ParseException extends Exception {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
