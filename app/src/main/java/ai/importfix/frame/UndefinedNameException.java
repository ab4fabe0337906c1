package ai.importfix.frame;

/** A name is bound in none of the local, global and builtin namespaces. */
public class UndefinedNameException extends RuntimeException {
    private final String name;

    public UndefinedNameException(String name) {
        super("Name '" + name + "' is not defined");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
