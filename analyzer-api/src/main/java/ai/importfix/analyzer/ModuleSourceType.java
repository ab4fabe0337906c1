package ai.importfix.analyzer;

/** Where a resolved module comes from. */
public enum ModuleSourceType {
    /** Interpreter builtin or native module; identified by its dotted name. */
    BUILTIN,
    /** Compiled extension module; identified by its file path. */
    COMPILED,
    /** Could not be resolved; identified by the requested dotted name. */
    BAD,
    /** Ordinary source module; identified by its absolute file path. */
    NORMAL
}
