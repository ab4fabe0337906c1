package ai.importfix.fix;

import ai.importfix.analyzer.ModuleKey;
import ai.importfix.analyzer.ParseException;
import ai.importfix.frame.ModuleRegistry;
import ai.importfix.index.CompleteSymbolEntry;
import ai.importfix.index.SymbolIndex;
import ai.importfix.index.SymbolType;
import ai.importfix.scan.SymbolUsageScanner;
import ai.importfix.scan.UsageContext;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;

/** Proposes one import per missing symbol, choosing among the index's candidates by how the symbol is used. */
@NullMarked
public final class ImportFixGenerator {
    private static final Logger logger = LogManager.getLogger(ImportFixGenerator.class);

    private static final Set<SymbolType> CALLABLE =
            EnumSet.of(SymbolType.TYPE, SymbolType.FUNCTION, SymbolType.UNKNOWN, SymbolType.AMBIGUOUS);
    private static final Set<SymbolType> HAS_ATTRIBUTES = EnumSet.of(SymbolType.MODULE, SymbolType.TYPE);

    private final ModuleRegistry registry;

    public ImportFixGenerator(ModuleRegistry registry) {
        this.registry = registry;
    }

    /** Scans {@code source} for missing symbols and proposes an import for each, in name order. */
    public List<ImportFix> generateFixes(String source, Path fileDir, SymbolIndex index) throws ParseException {
        var graph = registry.builder().build(source);
        var missing = new SymbolUsageScanner(registry).missingSymbols(graph, fileDir);
        return generateFixes(missing, index);
    }

    public List<ImportFix> generateFixes(Map<String, UsageContext> missing, SymbolIndex index) {
        var fixes = new ArrayList<ImportFix>();
        missing.keySet().stream().sorted().forEach(name -> fixes.add(fixFor(name, missing.get(name), index)));
        return fixes;
    }

    /** The best candidate for {@code symbol} as an import, or an unresolved fix when there is none. */
    public ImportFix fixFor(String symbol, UsageContext context, SymbolIndex index) {
        var ranked = rank(symbol, context, index);
        if (ranked.isEmpty()) {
            logger.debug("No import candidates for {}", symbol);
            return ImportFix.unresolved(symbol);
        }
        return toFix(ranked.get(0));
    }

    /** Candidates for {@code symbol}, most plausible first. */
    public List<CompleteSymbolEntry> rank(String symbol, UsageContext context, SymbolIndex index) {
        var builtinsModule = ModuleKey.builtin("builtins");
        return index.findSymbol(symbol)
                .filter(c -> !c.moduleKey().equals(builtinsModule))
                .sorted(Comparator.comparingInt((CompleteSymbolEntry c) -> implausibility(c, context))
                        .thenComparing(CompleteSymbolEntry::isImported)
                        .thenComparing(Comparator.comparingInt(CompleteSymbolEntry::importCount).reversed())
                        .thenComparing(this::moduleName))
                .toList();
    }

    private static int implausibility(CompleteSymbolEntry candidate, UsageContext context) {
        int penalty = 0;
        if (context.isCalled() && !CALLABLE.contains(candidate.symbolType())) {
            penalty++;
        }
        if (context.hasAttributeAccess() && !HAS_ATTRIBUTES.contains(candidate.symbolType())) {
            penalty++;
        }
        return penalty;
    }

    private ImportFix toFix(CompleteSymbolEntry candidate) {
        var symbol = candidate.symbolName();
        var moduleName = moduleName(candidate);
        var key = candidate.moduleKey();
        var path = key.isFileBacked() ? key.path() : null;
        if (!candidate.isModuleItself()) {
            var value = candidate.realName();
            return new ImportFix(symbol, moduleName, path, value, symbol.equals(value) ? null : symbol);
        }
        int dot = moduleName.lastIndexOf('.');
        if (dot < 0) {
            return new ImportFix(symbol, moduleName, path, null, symbol.equals(moduleName) ? null : symbol);
        }
        // "import a.b" binds "a", so a submodule is imported from its package
        var basename = moduleName.substring(dot + 1);
        return new ImportFix(
                symbol, moduleName.substring(0, dot), path, basename, symbol.equals(basename) ? null : symbol);
    }

    private String moduleName(CompleteSymbolEntry candidate) {
        var key = candidate.moduleKey();
        return registry.resolver().moduleNameFor(key).orElseGet(key::basename);
    }
}
