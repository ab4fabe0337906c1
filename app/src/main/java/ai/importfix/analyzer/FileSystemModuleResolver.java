package ai.importfix.analyzer;

import ai.importfix.util.AnalysisConfig;
import ai.importfix.util.SourceContent;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Resolves imports against the file system: the importing file's directory first, then the configured search paths.
 * Standard-library and interpreter modules resolve to {@link ModuleSourceType#BUILTIN} keys without touching the disk.
 */
public final class FileSystemModuleResolver implements ModuleResolver {
    private static final Logger logger = LogManager.getLogger(FileSystemModuleResolver.class);

    private static final String INIT_FILE = "__init__.py";

    /** Top-level names treated as native: the interpreter's builtin modules and the standard library. */
    static final Set<String> NATIVE_MODULES = Set.of(
            "__future__", "_thread", "abc", "argparse", "array", "ast", "asyncio", "atexit", "base64", "binascii",
            "bisect", "builtins", "bz2", "calendar", "cmath", "codecs", "collections", "concurrent", "configparser",
            "contextlib", "contextvars", "copy", "csv", "ctypes", "dataclasses", "datetime", "decimal", "difflib",
            "dis", "email", "enum", "errno", "faulthandler", "fcntl", "fnmatch", "fractions", "functools", "gc",
            "getpass", "gettext", "glob", "gzip", "hashlib", "heapq", "hmac", "html", "http", "importlib",
            "inspect", "io", "ipaddress", "itertools", "json", "keyword", "logging", "lzma", "marshal", "math",
            "mimetypes", "mmap", "multiprocessing", "numbers", "operator", "os", "pathlib", "pickle", "platform",
            "posix", "pprint", "queue", "random", "re", "resource", "secrets", "select", "selectors", "shlex",
            "shutil", "signal", "socket", "sqlite3", "ssl", "stat", "statistics", "string", "struct",
            "subprocess", "sys", "tempfile", "textwrap", "threading", "time", "timeit", "token", "tokenize",
            "traceback", "types", "typing", "unicodedata", "unittest", "urllib", "uuid", "warnings", "weakref",
            "xml", "zipfile", "zlib", "zoneinfo");

    private static final List<String> COMPILED_SUFFIXES = List.of(".so", ".pyd");

    private final List<Path> searchPaths;

    public FileSystemModuleResolver(List<Path> searchPaths) {
        this.searchPaths = searchPaths.stream().map(p -> p.toAbsolutePath().normalize()).toList();
    }

    public FileSystemModuleResolver(AnalysisConfig config) {
        this(config.searchPaths());
    }

    @Override
    public ModuleKey resolve(String dottedPath, Path relativeToDir) {
        int dots = 0;
        while (dots < dottedPath.length() && dottedPath.charAt(dots) == '.') {
            dots++;
        }
        var rest = dottedPath.substring(dots);
        var parts = rest.isEmpty() ? List.<String>of() : List.of(rest.split("\\."));
        var fromDir = relativeToDir.toAbsolutePath().normalize();
        if (dots > 0) {
            var base = fromDir;
            for (int i = 1; i < dots && base != null; i++) {
                base = base.getParent();
            }
            if (base != null) {
                var found = findIn(base, parts);
                if (found != null) {
                    return found;
                }
            }
            logger.debug("Unresolvable relative import {} from {}", dottedPath, relativeToDir);
            return ModuleKey.bad(dottedPath);
        }
        var roots = new ArrayList<Path>();
        roots.add(fromDir);
        roots.addAll(searchPaths);
        for (var root : roots) {
            var found = findIn(root, parts);
            if (found != null) {
                return found;
            }
        }
        if (!parts.isEmpty() && NATIVE_MODULES.contains(parts.get(0))) {
            return ModuleKey.builtin(rest);
        }
        logger.debug("Unresolvable import {} from {}", dottedPath, relativeToDir);
        return ModuleKey.bad(dottedPath);
    }

    private @Nullable ModuleKey findIn(Path root, List<String> parts) {
        if (parts.isEmpty()) {
            var init = root.resolve(INIT_FILE);
            return Files.isRegularFile(init) ? ModuleKey.forFile(init) : null;
        }
        var dir = root;
        for (int i = 0; i < parts.size() - 1; i++) {
            dir = dir.resolve(parts.get(i));
        }
        var last = parts.get(parts.size() - 1);
        var packageInit = dir.resolve(last).resolve(INIT_FILE);
        if (Files.isRegularFile(packageInit)) {
            return ModuleKey.forFile(packageInit);
        }
        var source = dir.resolve(last + ".py");
        if (Files.isRegularFile(source)) {
            return ModuleKey.forFile(source);
        }
        return compiledModule(dir, last);
    }

    private @Nullable ModuleKey compiledModule(Path dir, String name) {
        if (!Files.isDirectory(dir)) {
            return null;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, name + ".*")) {
            for (var entry : entries) {
                var fileName = entry.getFileName().toString();
                if (COMPILED_SUFFIXES.stream().anyMatch(fileName::endsWith)) {
                    return new ModuleKey(ModuleSourceType.COMPILED, entry.toAbsolutePath().normalize().toString());
                }
            }
        } catch (IOException e) {
            logger.debug("Cannot list {}: {}", dir, e.getMessage());
        }
        return null;
    }

    @Override
    public String readSource(ModuleKey key) throws IOException {
        if (key.sourceType() != ModuleSourceType.NORMAL) {
            throw new IOException("Module " + key + " has no source");
        }
        return SourceContent.read(key.path()).text();
    }

    /** Dotted name from the enclosing packages: {@code pkg/sub/mod.py} inside two packages is {@code pkg.sub.mod}. */
    @Override
    public Optional<String> moduleNameFor(ModuleKey key) {
        if (!key.isFileBacked()) {
            return Optional.of(key.id());
        }
        var file = key.path();
        var parts = new LinkedList<String>();
        parts.addFirst(key.basename());
        var dir = file.getParent();
        if (file.getFileName().toString().equals(INIT_FILE) && dir != null) {
            dir = dir.getParent();
        }
        while (dir != null && dir.getFileName() != null && Files.isRegularFile(dir.resolve(INIT_FILE))) {
            parts.addFirst(dir.getFileName().toString());
            dir = dir.getParent();
        }
        return Optional.of(String.join(".", parts));
    }
}
