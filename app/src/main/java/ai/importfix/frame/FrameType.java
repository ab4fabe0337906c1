package ai.importfix.frame;

/** What kind of body a {@link Frame} executes. */
public enum FrameType {
    MODULE,
    CLASS,
    FUNCTION,
    COMPREHENSION
}
