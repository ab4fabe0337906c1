package ai.importfix.fix;

import java.nio.file.Path;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * The import proposed for one missing symbol. When no candidate was found only {@code symbol} is set.
 *
 * @param moduleName dotted module to import from, or to import when {@code value} is null
 * @param modulePath file the module lives in; null for native modules
 * @param value member to import from the module; null to import the module itself
 * @param asName binding name when it differs from the imported name
 */
public record ImportFix(
        String symbol,
        @Nullable String moduleName,
        @Nullable Path modulePath,
        @Nullable String value,
        @Nullable String asName) {

    public static ImportFix unresolved(String symbol) {
        return new ImportFix(symbol, null, null, null, null);
    }

    public boolean isResolved() {
        return moduleName != null;
    }

    /** The statement text, e.g. {@code from os import path as p}. */
    public Optional<String> importStatement() {
        if (moduleName == null) {
            return Optional.empty();
        }
        var sb = new StringBuilder();
        if (value == null) {
            sb.append("import ").append(moduleName);
        } else {
            sb.append("from ").append(moduleName).append(" import ").append(value);
        }
        if (asName != null) {
            sb.append(" as ").append(asName);
        }
        return Optional.of(sb.toString());
    }
}
