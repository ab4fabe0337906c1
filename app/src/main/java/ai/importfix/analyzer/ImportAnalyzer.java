package ai.importfix.analyzer;

import ai.importfix.cfg.CfgBuilder;
import ai.importfix.fix.ImportFix;
import ai.importfix.fix.ImportFixGenerator;
import ai.importfix.frame.ModuleRegistry;
import ai.importfix.index.SymbolIndex;
import ai.importfix.scan.SymbolUsageScanner;
import ai.importfix.scan.UsageContext;
import ai.importfix.util.AnalysisConfig;
import ai.importfix.util.IndexConfigPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One analysis session: a parser, a module resolver and the module registry they feed. Modules imported during the
 * session are loaded once and shared by every query.
 */
public final class ImportAnalyzer {
    private static final Logger logger = LogManager.getLogger(ImportAnalyzer.class);

    private final ModuleRegistry registry;
    private final ImportFixGenerator fixGenerator;

    public ImportAnalyzer(AnalysisConfig config) {
        this(new TreeSitterSourceParser(), new FileSystemModuleResolver(config), config);
    }

    public ImportAnalyzer(SourceParser parser, ModuleResolver resolver, AnalysisConfig config) {
        this.registry = new ModuleRegistry(resolver, new CfgBuilder(parser), config);
        this.fixGenerator = new ImportFixGenerator(registry);
    }

    public ModuleRegistry registry() {
        return registry;
    }

    /** Names {@code source} uses without defining or importing them, with how each is used. */
    public Map<String, UsageContext> scanMissingSymbols(String source, Path fileDir) throws ParseException {
        var graph = registry.builder().build(source);
        return new SymbolUsageScanner(registry).missingSymbols(graph, fileDir);
    }

    /** Missing symbols of a file on disk. */
    public Map<String, UsageContext> scanMissingSymbols(Path file) throws IOException, ParseException {
        var dir = file.toAbsolutePath().normalize().getParent();
        logger.debug("Scanning {}", file);
        return scanMissingSymbols(Files.readString(file), dir);
    }

    public List<ImportFix> generateFixes(String source, Path fileDir, SymbolIndex index) throws ParseException {
        return fixGenerator.generateFixes(source, fileDir, index);
    }

    /** Loads the index saved in {@code saveDir}, or starts an empty one there. */
    public SymbolIndex openIndex(Path saveDir) throws IOException {
        return SymbolIndex.load(saveDir, registry);
    }

    /** Opens the named index under the per-user cache directory. */
    public SymbolIndex openIndex(String indexName) throws IOException {
        return openIndex(IndexConfigPaths.defaults().getIndexDir(indexName));
    }
}
