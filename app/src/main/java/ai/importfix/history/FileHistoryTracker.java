package ai.importfix.history;

import ai.importfix.trie.Trie;
import ai.importfix.trie.TrieIO;
import com.google.common.collect.AbstractIterator;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Remembers the modification time each file had when it was last processed, keyed by absolute path in a {@link Trie}.
 * Directory queries use a separator-terminated prefix so {@code /a/b} never matches {@code /a/bc}.
 */
@NullMarked
public final class FileHistoryTracker {
    private static final Logger logger = LogManager.getLogger(FileHistoryTracker.class);

    private static final Long NEVER = 0L;

    private final Trie<Long, Void> timestamps;
    private boolean modifiedSinceSave;

    private FileHistoryTracker(Trie<Long, Void> timestamps) {
        this.timestamps = timestamps;
    }

    public static FileHistoryTracker create() {
        return new FileHistoryTracker(new Trie<>(NEVER));
    }

    /** Loads a tracker written by {@link #save}, or returns an empty one when the file does not exist. */
    public static FileHistoryTracker load(Path file) throws IOException {
        if (!Files.exists(file)) {
            return create();
        }
        return new FileHistoryTracker(TrieIO.load(file, NEVER, TrieIO::decodeLong));
    }

    public void save(Path file) throws IOException {
        TrieIO.save(timestamps, file, v -> v);
        modifiedSinceSave = false;
    }

    public boolean isModifiedSinceSave() {
        return modifiedSinceSave;
    }

    static String fileKey(Path file) {
        return file.toAbsolutePath().normalize().toString();
    }

    static String dirKey(Path dir) {
        var key = fileKey(dir);
        return key.endsWith(File.separator) ? key : key + File.separator;
    }

    /** Last recorded modification time in microseconds, or zero if the file was never recorded. */
    public long getTimestamp(Path file) {
        return timestamps.getValue(fileKey(file));
    }

    public void updateTimestampForFile(Path file, long modifiedMicros) {
        timestamps.add(fileKey(file), modifiedMicros);
        modifiedSinceSave = true;
    }

    /** Records the file's current modification time. Missing files are forgotten instead. */
    public void updateTimestampForFile(Path file) {
        var mtime = modifiedMicros(file);
        if (mtime == null) {
            removeFile(file);
        } else {
            updateTimestampForFile(file, mtime);
        }
    }

    public void removeFile(Path file) {
        if (timestamps.remove(fileKey(file))) {
            modifiedSinceSave = true;
        }
    }

    /** Forgets every file under {@code dir}. */
    public void removeDirectory(Path dir) {
        for (var file : trackedFilesUnder(dir)) {
            removeFile(file);
        }
    }

    public boolean hasFileChangedSinceTimestamp(Path file) {
        return hasFileChangedSinceTimestamp(file, PathFilter.ALL);
    }

    /**
     * True if the file exists, passes the filter, and its modification time is newer than the recorded one (or none is
     * recorded).
     */
    public boolean hasFileChangedSinceTimestamp(Path file, PathFilter filter) {
        var parent = file.toAbsolutePath().getParent();
        if (parent == null || !filter.accept(parent, file.getFileName().toString(), false)) {
            return false;
        }
        var mtime = modifiedMicros(file);
        if (mtime == null) {
            return false;
        }
        return mtime > timestamps.getValue(fileKey(file));
    }

    public List<Path> trackedFilesUnder(Path dir) {
        var out = new ArrayList<Path>();
        timestamps.forEachWithPrefix(dirKey(dir), (key, node) -> out.add(Path.of(key)));
        return out;
    }

    public Set<Path> trackedFiles() {
        return timestamps.toMap().keySet().stream().map(Path::of).collect(Collectors.toSet());
    }

    /**
     * Lazily walks {@code dir}, yielding new or modified files that pass {@code filter}, then the previously tracked
     * files under {@code dir} that are gone or filtered out. The root directory itself is always walked.
     *
     * <p>With {@code autoUpdate}, a yielded file's timestamp is recorded only when the next element is requested, so a
     * consumer that stops early or fails while handling an element will see that file again next time. Removals are
     * forgotten the same way.
     */
    public Iterator<FileUpdate> getFilesInDirModifiedSinceTimestamp(Path dir, PathFilter filter, boolean autoUpdate) {
        return new DirectoryDiff(dir.toAbsolutePath().normalize(), filter, autoUpdate);
    }

    private final class DirectoryDiff extends AbstractIterator<FileUpdate> {
        private final Path root;
        private final PathFilter filter;
        private final boolean autoUpdate;
        private final Deque<Path> pendingDirs = new ArrayDeque<>();
        private final Deque<Path> pendingFiles = new ArrayDeque<>();
        private final Set<String> seen = new HashSet<>();

        private @Nullable Deque<Path> removals;
        private @Nullable FileUpdate lastYielded;

        DirectoryDiff(Path root, PathFilter filter, boolean autoUpdate) {
            this.root = root;
            this.filter = filter;
            this.autoUpdate = autoUpdate;
            if (Files.isDirectory(root)) {
                pendingDirs.push(root);
            } else {
                logger.debug("{} is not a directory; reporting only removals", root);
            }
        }

        @Override
        protected @Nullable FileUpdate computeNext() {
            commitLastYielded();
            while (removals == null) {
                if (!pendingFiles.isEmpty()) {
                    var file = pendingFiles.poll();
                    seen.add(fileKey(file));
                    var mtime = modifiedMicros(file);
                    if (mtime != null && mtime > timestamps.getValue(fileKey(file))) {
                        return emit(new FileUpdate(true, file, mtime));
                    }
                    continue;
                }
                if (!pendingDirs.isEmpty()) {
                    listDirectory(pendingDirs.pop());
                    continue;
                }
                removals = new ArrayDeque<>();
                for (var tracked : trackedFilesUnder(root)) {
                    if (!seen.contains(fileKey(tracked))) {
                        removals.add(tracked);
                    }
                }
            }
            if (!removals.isEmpty()) {
                return emit(new FileUpdate(false, removals.poll(), 0L));
            }
            return endOfData();
        }

        private FileUpdate emit(FileUpdate update) {
            lastYielded = update;
            return update;
        }

        private void commitLastYielded() {
            var update = lastYielded;
            lastYielded = null;
            if (update == null || !autoUpdate) {
                return;
            }
            if (update.isUpdate()) {
                updateTimestampForFile(update.path(), update.modifiedMicros());
            } else {
                removeFile(update.path());
            }
        }

        private void listDirectory(Path dir) {
            List<Path> entries;
            try (var stream = Files.list(dir)) {
                entries = stream.sorted().toList();
            } catch (IOException e) {
                logger.warn("Skipping unreadable directory {}: {}", dir, e.getMessage());
                return;
            }
            var subdirs = new ArrayList<Path>();
            for (var entry : entries) {
                var name = entry.getFileName().toString();
                boolean isDirectory = Files.isDirectory(entry);
                if (!filter.accept(dir, name, isDirectory)) {
                    continue;
                }
                if (isDirectory) {
                    subdirs.add(entry);
                } else if (Files.isRegularFile(entry)) {
                    pendingFiles.add(entry);
                }
            }
            // depth first, in name order
            for (int i = subdirs.size() - 1; i >= 0; i--) {
                pendingDirs.push(subdirs.get(i));
            }
        }
    }

    private static @Nullable Long modifiedMicros(Path file) {
        try {
            return Files.getLastModifiedTime(file).to(TimeUnit.MICROSECONDS);
        } catch (IOException e) {
            logger.debug("Cannot stat {}: {}", file, e.getMessage());
            return null;
        }
    }

    @Override
    public String toString() {
        return "FileHistoryTracker[" + timestamps.toMap().size() + " files]";
    }
}
