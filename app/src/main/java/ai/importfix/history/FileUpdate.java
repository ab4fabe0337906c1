package ai.importfix.history;

import java.nio.file.Path;

/**
 * One entry of a directory diff. {@code isUpdate} is true for new or modified files and false for files that
 * disappeared or no longer pass the filter; {@code modifiedMicros} is zero for the latter.
 */
public record FileUpdate(boolean isUpdate, Path path, long modifiedMicros) {}
