package ai.importfix.value;

/** Singleton constants of the language. */
public enum PyConstant {
    NONE("None"),
    ELLIPSIS("Ellipsis"),
    NOT_IMPLEMENTED("NotImplemented");

    private final String repr;

    PyConstant(String repr) {
        this.repr = repr;
    }

    public String repr() {
        return repr;
    }
}
