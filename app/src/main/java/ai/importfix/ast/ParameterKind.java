package ai.importfix.ast;

/** How a parameter receives arguments. */
public enum ParameterKind {
    /** An ordinary parameter, bound positionally or by keyword. */
    SINGLE,
    /** {@code *args}: collects leftover positional arguments. */
    VAR_POSITIONAL,
    /** {@code **kwargs}: collects leftover keyword arguments. */
    VAR_KEYWORD
}
