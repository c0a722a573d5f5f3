package txengine.state;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable, checksummed capture of state usable for restoration.
 *
 * <p>A snapshot holds the payload as stored (possibly compressed, see
 * {@link #compressionType()}) together with the checksum and size of the
 * uncompressed payload taken at creation time. {@link StateManager#validateSnapshot(String)}
 * recomputes the checksum to detect corruption.
 *
 * <p>Snapshots are created by {@link StateManager#createSnapshot(SnapshotType)}.
 * The payload array is copied on the way in and on the way out.
 *
 * @see StateManager
 * @see SnapshotMetadata
 */
public final class StateSnapshot {

    private final String id;
    private final Instant timestamp;
    private final SnapshotType type;
    private final byte[] data;
    private final String checksum;
    private final long size;
    private final CompressionType compressionType;

    /**
     * Creates a snapshot.
     *
     * @param id the snapshot id
     * @param timestamp when the state was captured
     * @param type full or incremental
     * @param data the stored payload (copied)
     * @param checksum hex digest of the uncompressed payload
     * @param size byte length of the uncompressed payload
     * @param compressionType how {@code data} is encoded
     */
    public StateSnapshot(String id,
                         Instant timestamp,
                         SnapshotType type,
                         byte[] data,
                         String checksum,
                         long size,
                         CompressionType compressionType) {
        this.id = Objects.requireNonNull(id);
        this.timestamp = Objects.requireNonNull(timestamp);
        this.type = Objects.requireNonNull(type);
        this.data = data != null ? data.clone() : new byte[0];
        this.checksum = Objects.requireNonNull(checksum);
        this.size = size;
        this.compressionType = compressionType != null ? compressionType : CompressionType.NONE;
    }

    public String id() {
        return id;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public SnapshotType type() {
        return type;
    }

    /**
     * Returns a copy of the stored payload, still encoded per {@link #compressionType()}.
     *
     * @return the stored payload bytes
     */
    public byte[] data() {
        return data.clone();
    }

    public String checksum() {
        return checksum;
    }

    public long size() {
        return size;
    }

    public CompressionType compressionType() {
        return compressionType;
    }

    /**
     * Returns the snapshot without its payload.
     *
     * @return metadata for this snapshot
     */
    public SnapshotMetadata metadata() {
        return new SnapshotMetadata(id, timestamp, type, size, checksum, compressionType);
    }

    /**
     * Returns a copy of this snapshot carrying a different stored payload and
     * the original checksum. Stores that re-encode payloads use this.
     *
     * @param newData the replacement payload
     * @return a new snapshot
     */
    public StateSnapshot withData(byte[] newData) {
        return new StateSnapshot(id, timestamp, type, newData, checksum, size, compressionType);
    }

    @Override
    public String toString() {
        return "StateSnapshot[id=" + id + ", type=" + type + ", size=" + size
                + ", checksum=" + checksum + ", compression=" + compressionType
                + ", stored=" + data.length + "]";
    }
}
