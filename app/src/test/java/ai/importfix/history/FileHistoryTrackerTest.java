package ai.importfix.history;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileHistoryTrackerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    Path root;

    private Path write(String relative, Instant modified) throws IOException {
        var file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x = 1\n");
        Files.setLastModifiedTime(file, FileTime.from(modified));
        return file;
    }

    private static List<FileUpdate> drain(FileHistoryTracker tracker, Path dir, PathFilter filter) {
        var out = new ArrayList<FileUpdate>();
        tracker.getFilesInDirModifiedSinceTimestamp(dir, filter, true).forEachRemaining(out::add);
        return out;
    }

    @Test
    void reportsNewFilesOnceThenNothing() throws IOException {
        write("a.py", T0);
        write("pkg/__init__.py", T0);
        write("pkg/b.py", T0);
        var tracker = FileHistoryTracker.create();

        var first = drain(tracker, root, PathFilter.PYTHON_PACKAGES);
        assertEquals(3, first.size());
        assertTrue(first.stream().allMatch(FileUpdate::isUpdate));

        assertTrue(drain(tracker, root, PathFilter.PYTHON_PACKAGES).isEmpty());
        assertTrue(tracker.isModifiedSinceSave());
    }

    @Test
    void reportsOnlyTheModifiedFile() throws IOException {
        var a = write("a.py", T0);
        write("b.py", T0);
        var tracker = FileHistoryTracker.create();
        drain(tracker, root, PathFilter.PYTHON_PACKAGES);

        Files.setLastModifiedTime(a, FileTime.from(T0.plusSeconds(60)));

        var updates = drain(tracker, root, PathFilter.PYTHON_PACKAGES);
        assertEquals(1, updates.size());
        assertEquals(a, updates.get(0).path());
        assertTrue(updates.get(0).isUpdate());
        assertFalse(tracker.hasFileChangedSinceTimestamp(a));
    }

    @Test
    void reportsDeletedPackageSubtree() throws IOException {
        write("pkg/__init__.py", T0);
        write("pkg/b.py", T0);
        write("c.py", T0);
        var tracker = FileHistoryTracker.create();
        drain(tracker, root, PathFilter.PYTHON_PACKAGES);

        // no longer a package: the whole subtree is filtered out
        Files.delete(root.resolve("pkg/__init__.py"));

        var updates = drain(tracker, root, PathFilter.PYTHON_PACKAGES);
        assertEquals(2, updates.size());
        assertTrue(updates.stream().noneMatch(FileUpdate::isUpdate));
        assertEquals(List.of(root.resolve("c.py")), List.copyOf(tracker.trackedFiles()));
    }

    @Test
    void nonPackageDirectoriesAreSkipped() throws IOException {
        write("scripts/tool.py", T0);
        write("main.py", T0);
        var tracker = FileHistoryTracker.create();

        var updates = drain(tracker, root, PathFilter.PYTHON_PACKAGES);
        assertEquals(List.of(root.resolve("main.py")), updates.stream().map(FileUpdate::path).toList());

        var all = drain(FileHistoryTracker.create(), root, PathFilter.PYTHON_SOURCES);
        assertEquals(2, all.size());
    }

    @Test
    void timestampIsRecordedOnlyAfterTheNextElementIsRequested() throws IOException {
        var a = write("a.py", T0);
        write("b.py", T0);
        var tracker = FileHistoryTracker.create();

        var it = tracker.getFilesInDirModifiedSinceTimestamp(root, PathFilter.PYTHON_PACKAGES, true);
        var first = it.next();
        assertEquals(a, first.path());
        assertEquals(0L, tracker.getTimestamp(a));

        it.next();
        assertEquals(first.modifiedMicros(), tracker.getTimestamp(a));
    }

    @Test
    void withoutAutoUpdateNothingIsRecorded() throws IOException {
        write("a.py", T0);
        var tracker = FileHistoryTracker.create();
        tracker.getFilesInDirModifiedSinceTimestamp(root, PathFilter.ALL, false).forEachRemaining(u -> {});

        assertTrue(tracker.trackedFiles().isEmpty());
        assertFalse(tracker.isModifiedSinceSave());
    }

    @Test
    void siblingDirectoryWithSharedPrefixIsNotConfused() throws IOException {
        var inA = write("a/x.py", T0);
        var inAb = write("ab/y.py", T0);
        var tracker = FileHistoryTracker.create();
        tracker.updateTimestampForFile(inA);
        tracker.updateTimestampForFile(inAb);

        assertEquals(List.of(inA), tracker.trackedFilesUnder(root.resolve("a")));
        tracker.removeDirectory(root.resolve("a"));
        assertEquals(List.of(inAb), List.copyOf(tracker.trackedFiles()));
    }

    @Test
    void saveAndLoadRoundTrip(@TempDir Path saveDir) throws IOException {
        var a = write("a.py", T0);
        var tracker = FileHistoryTracker.create();
        tracker.updateTimestampForFile(a);
        var file = saveDir.resolve("fht.cbor");
        tracker.save(file);
        assertFalse(tracker.isModifiedSinceSave());

        var loaded = FileHistoryTracker.load(file);
        assertEquals(tracker.getTimestamp(a), loaded.getTimestamp(a));
        assertFalse(loaded.hasFileChangedSinceTimestamp(a));

        assertTrue(FileHistoryTracker.load(saveDir.resolve("missing.cbor")).trackedFiles().isEmpty());
    }
}
