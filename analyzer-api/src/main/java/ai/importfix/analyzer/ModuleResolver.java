package ai.importfix.analyzer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/** Resolves import spellings to {@link ModuleKey}s and loads module source. */
public interface ModuleResolver {

    /**
     * Resolves a dotted module name, possibly relative (leading dots), as seen from a file in {@code relativeToDir}.
     * Never throws for unknown modules: those resolve to a {@link ModuleSourceType#BAD} key.
     */
    ModuleKey resolve(String dottedPath, Path relativeToDir);

    /** Reads the source of a file-backed module. */
    String readSource(ModuleKey key) throws IOException;

    /** Dotted import name for the module, when one can be derived. */
    Optional<String> moduleNameFor(ModuleKey key);
}
