package archive.ingest.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * Status document returned to the client of an archive request, encoded as JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArchiveStatusReply {
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILURE = "FAILURE";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectReader READER = MAPPER.readerFor(ArchiveStatusReply.class);
    private static final ObjectWriter WRITER = MAPPER.writerFor(ArchiveStatusReply.class);

    public final String status;
    public final String failureKind;
    public final String message;
    public final String hostId;
    public final String volumeId;
    public final List<FileEntry> files;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public ArchiveStatusReply(@JsonProperty("status") String status,
                              @JsonProperty("failureKind") String failureKind,
                              @JsonProperty("message") String message,
                              @JsonProperty("hostId") String hostId,
                              @JsonProperty("volumeId") String volumeId,
                              @JsonProperty("files") List<FileEntry> files) {
        this.status = status;
        this.failureKind = failureKind;
        this.message = message;
        this.hostId = hostId;
        this.volumeId = volumeId;
        this.files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Builds the reply for the given outcome. For failures, files committed before the failure are listed.
     *
     * @param outcome outcome of the request
     * @param hostId  ID of the host that handled the request
     * @param volume  target volume, may be null if none was selected
     * @param files   files committed by a successful request (ignored for failures)
     * @return the reply
     */
    public static ArchiveStatusReply of(ArchiveOutcome<?> outcome, String hostId, Volume volume, List<FileRecord> files) {
        String volumeId = volume != null ? volume.getVolumeId() : null;
        if (outcome.isSuccess()) {
            return new ArchiveStatusReply(STATUS_SUCCESS, null, outcome.getMessage(), hostId, volumeId, toEntries(files));
        }
        return new ArchiveStatusReply(STATUS_FAILURE, outcome.getFailureKind().name(), outcome.getMessage(), hostId, volumeId,
                toEntries(outcome.getCommittedBeforeFailure()));
    }

    private static List<FileEntry> toEntries(List<FileRecord> records) {
        List<FileEntry> entries = new ArrayList<>();
        if (records != null) {
            for (FileRecord record : records) {
                entries.add(new FileEntry(record.getFileId(), record.getFileVersion(), record.getRelativePath(),
                        record.getFileSize(), record.getChecksum(), record.getChecksumAlgorithm(),
                        record.getIngestionDate() != null ? record.getIngestionDate().toString() : null));
            }
        }
        return entries;
    }

    public static ArchiveStatusReply fromString(String json) {
        try {
            return READER.readValue(json);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * @return the JSON representation of this reply
     */
    @Override
    public final String toString() {
        try {
            return WRITER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FileEntry {
        public final String fileId;
        public final int fileVersion;
        public final String relativePath;
        public final long fileSize;
        public final String checksum;
        public final String checksumAlgorithm;
        public final String ingestionDate;

        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        public FileEntry(@JsonProperty("fileId") String fileId,
                         @JsonProperty("fileVersion") int fileVersion,
                         @JsonProperty("relativePath") String relativePath,
                         @JsonProperty("fileSize") long fileSize,
                         @JsonProperty("checksum") String checksum,
                         @JsonProperty("checksumAlgorithm") String checksumAlgorithm,
                         @JsonProperty("ingestionDate") String ingestionDate) {
            this.fileId = fileId;
            this.fileVersion = fileVersion;
            this.relativePath = relativePath;
            this.fileSize = fileSize;
            this.checksum = checksum;
            this.checksumAlgorithm = checksumAlgorithm;
            this.ingestionDate = ingestionDate;
        }
    }
}
