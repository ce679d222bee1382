package archive.ingest.server;

import archive.ingest.common.ArchiveException;
import archive.ingest.common.ArchiveFailureKind;
import archive.ingest.common.FileRecord;

import java.util.List;

/**
 * A commit that stopped part-way: files committed before the failure stay committed and are reported here.
 */
public class CommitException extends ArchiveException {
    private final List<FileRecord> committedFiles;

    public CommitException(ArchiveFailureKind kind, String message, Throwable cause, List<FileRecord> committedFiles) {
        super(kind, message, cause);
        this.committedFiles = List.copyOf(committedFiles);
    }

    public List<FileRecord> getCommittedFiles() {
        return committedFiles;
    }
}
