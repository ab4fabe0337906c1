package ai.importfix.analyzer;

import java.nio.file.Path;
import java.util.Comparator;

/**
 * Stable identity of a resolved module. Equality is by source type and id, where id is the absolute file path for
 * file-backed modules and the dotted name for builtin and unresolvable ones. How an import spelled the module is
 * irrelevant.
 */
public record ModuleKey(ModuleSourceType sourceType, String id) implements Comparable<ModuleKey> {

    private static final Comparator<ModuleKey> ORDER =
            Comparator.comparing(ModuleKey::sourceType).thenComparing(ModuleKey::id);

    public static ModuleKey forFile(Path file) {
        return new ModuleKey(ModuleSourceType.NORMAL, file.toAbsolutePath().normalize().toString());
    }

    public static ModuleKey builtin(String name) {
        return new ModuleKey(ModuleSourceType.BUILTIN, name);
    }

    public static ModuleKey bad(String name) {
        return new ModuleKey(ModuleSourceType.BAD, name);
    }

    public boolean isLoadable() {
        return sourceType != ModuleSourceType.BAD;
    }

    public boolean isFileBacked() {
        return sourceType == ModuleSourceType.NORMAL || sourceType == ModuleSourceType.COMPILED;
    }

    public boolean isNative() {
        return sourceType == ModuleSourceType.BUILTIN || sourceType == ModuleSourceType.COMPILED;
    }

    public Path path() {
        if (!isFileBacked()) {
            throw new IllegalStateException("Module " + id + " is not file backed");
        }
        return Path.of(id);
    }

    /**
     * Last component of the module's name. For a package's {@code __init__.py} this is the package directory name.
     */
    public String basename() {
        if (!isFileBacked()) {
            int dot = id.lastIndexOf('.');
            return dot < 0 ? id : id.substring(dot + 1);
        }
        var file = path();
        var fileName = file.getFileName().toString();
        if (fileName.equals("__init__.py") && file.getParent() != null) {
            return file.getParent().getFileName().toString();
        }
        int dot = fileName.indexOf('.');
        return dot < 0 ? fileName : fileName.substring(0, dot);
    }

    @Override
    public int compareTo(ModuleKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sourceType + ":" + id;
    }
}
