package ai.importfix.ast;

import org.jetbrains.annotations.Nullable;

/** A function or lambda parameter as written: its default and annotation are still unevaluated expressions. */
public record Parameter(
        String name, ParameterKind kind, @Nullable Expression defaultValue, @Nullable Expression typeHint) {

    public static Parameter single(String name) {
        return new Parameter(name, ParameterKind.SINGLE, null, null);
    }
}
