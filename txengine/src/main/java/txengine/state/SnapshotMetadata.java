package txengine.state;

import java.time.Instant;

/**
 * Everything about a snapshot except its payload; cheap to list and to keep in
 * rollback points.
 *
 * @param id the snapshot id
 * @param timestamp when the snapshot was taken
 * @param type full or incremental
 * @param size byte length of the uncompressed payload
 * @param checksum hex digest of the uncompressed payload
 * @param compressionType how the payload is stored
 */
public record SnapshotMetadata(
        String id,
        Instant timestamp,
        SnapshotType type,
        long size,
        String checksum,
        CompressionType compressionType
) {
}
