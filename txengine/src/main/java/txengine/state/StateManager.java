package txengine.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txengine.IdGenerator;
import txengine.ValidationResult;
import txengine.alert.TransactionAlertLogger;
import txengine.config.EngineConfig;
import txengine.exceptions.SnapshotCorruptedException;
import txengine.exceptions.SnapshotNotFoundException;
import txengine.exceptions.TransactionException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Owns the snapshot lifecycle: create, restore, validate, delete, enumerate.
 *
 * <p>Live state is read and written through the injected {@link StateProvider};
 * snapshots are kept in a {@link SnapshotStore}. Every snapshot carries the
 * digest of its uncompressed payload, and a snapshot whose payload no longer
 * matches that digest is never applied.
 *
 * <p>Thread-safe as long as the store is: concurrent creates and restores only
 * touch their own keys.
 *
 * @see StateSnapshot
 * @see txengine.transaction.Transaction#createCheckpoint(String)
 */
public class StateManager {

    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    private final StateProvider stateProvider;
    private final SnapshotStore store;
    private final TransactionAlertLogger alerts;
    private final CompressionType compression;
    private final String checksumAlgorithm;

    /**
     * Creates a state manager with an in-memory store and default configuration.
     *
     * @param stateProvider reads and writes the live state (must not be null)
     */
    public StateManager(StateProvider stateProvider) {
        this(stateProvider, new InMemorySnapshotStore(),
                new TransactionAlertLogger(EngineConfig.DEFAULTS.alertLevel()), EngineConfig.DEFAULTS);
    }

    /**
     * Creates a state manager.
     *
     * @param stateProvider reads and writes the live state (must not be null)
     * @param store where snapshots are kept (must not be null)
     * @param alerts event logger (must not be null)
     * @param config compression and checksum settings (must not be null)
     */
    public StateManager(StateProvider stateProvider,
                        SnapshotStore store,
                        TransactionAlertLogger alerts,
                        EngineConfig config) {
        this.stateProvider = Objects.requireNonNull(stateProvider);
        this.store = Objects.requireNonNull(store);
        this.alerts = Objects.requireNonNull(alerts);
        this.compression = config.snapshotCompression();
        this.checksumAlgorithm = config.checksumAlgorithm();
    }

    /**
     * Captures the live state and stores it as a new snapshot.
     *
     * @param type full or incremental capture
     * @return the stored snapshot
     * @throws TransactionException if the state cannot be collected or encoded
     */
    public StateSnapshot createSnapshot(SnapshotType type) throws TransactionException {
        String snapshotId = IdGenerator.next(IdGenerator.SNAPSHOT);

        byte[] raw;
        try {
            raw = stateProvider.capture(type);
        } catch (Exception e) {
            log.debug("State capture failed for {}", snapshotId, e);
            throw new TransactionException("Failed to create " + type + " snapshot: " + e.getMessage(), e);
        }
        if (raw == null) {
            raw = new byte[0];
        }

        StateSnapshot snapshot = new StateSnapshot(
                snapshotId,
                Instant.now(),
                type,
                encode(raw),
                checksum(raw),
                raw.length,
                compression
        );
        store.put(snapshot);
        alerts.snapshotCreated(snapshotId, type, raw.length);
        return snapshot;
    }

    /**
     * Validates a snapshot and applies its payload to the live state.
     *
     * @param snapshotId the snapshot to restore
     * @throws SnapshotNotFoundException if no such snapshot exists
     * @throws SnapshotCorruptedException if the payload fails validation; nothing is applied
     * @throws TransactionException if the provider fails to apply the state
     */
    public void restoreFromSnapshot(String snapshotId) throws TransactionException {
        StateSnapshot snapshot = store.get(snapshotId)
                .orElseThrow(() -> new SnapshotNotFoundException(snapshotId));

        ValidationResult validation = validate(snapshot);
        if (!validation.valid()) {
            SnapshotCorruptedException e = new SnapshotCorruptedException(snapshotId, validation.errors());
            alerts.snapshotRestoreFailed(snapshotId, e);
            throw e;
        }

        try {
            stateProvider.apply(snapshot.type(), decode(snapshot));
        } catch (Exception e) {
            alerts.snapshotRestoreFailed(snapshotId, e);
            throw new TransactionException("Failed to restore from snapshot " + snapshotId + ": " + e.getMessage(), e);
        }
        alerts.snapshotRestored(snapshotId);
    }

    /**
     * Recomputes the checksum of a stored snapshot and compares it with the one
     * recorded at creation.
     *
     * @param snapshotId the snapshot to check
     * @return valid if present and intact; otherwise invalid with the reason
     */
    public ValidationResult validateSnapshot(String snapshotId) {
        return store.get(snapshotId)
                .map(this::validate)
                .orElseGet(() -> ValidationResult.invalid("Snapshot not found: " + snapshotId));
    }

    /**
     * Removes a snapshot.
     *
     * @param snapshotId the snapshot to remove
     * @return true if it existed
     */
    public boolean deleteSnapshot(String snapshotId) {
        boolean deleted = store.remove(snapshotId);
        if (deleted) {
            alerts.snapshotDeleted(snapshotId);
        }
        return deleted;
    }

    /**
     * @return all stored snapshots, in the order they were first stored
     */
    public List<StateSnapshot> getSnapshots() {
        return List.copyOf(store.all());
    }

    /**
     * Looks up a snapshot without its payload.
     *
     * @param snapshotId the snapshot
     * @return its metadata, or empty if unknown
     */
    public Optional<SnapshotMetadata> getSnapshotMetadata(String snapshotId) {
        return store.get(snapshotId).map(StateSnapshot::metadata);
    }

    // ---------------- helpers ----------------

    private ValidationResult validate(StateSnapshot snapshot) {
        byte[] raw;
        try {
            raw = decode(snapshot);
        } catch (IOException e) {
            return ValidationResult.invalid("Snapshot payload cannot be decoded: " + e.getMessage());
        }
        if (!checksum(raw).equals(snapshot.checksum())) {
            return ValidationResult.invalid("Snapshot checksum validation failed");
        }
        if (raw.length != snapshot.size()) {
            return ValidationResult.invalid("Snapshot size mismatch: expected "
                    + snapshot.size() + " bytes, found " + raw.length);
        }
        return ValidationResult.ok();
    }

    private String checksum(byte[] raw) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance(checksumAlgorithm).digest(raw));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Checksum algorithm not available: " + checksumAlgorithm, e);
        }
    }

    private byte[] encode(byte[] raw) throws TransactionException {
        if (compression != CompressionType.GZIP) {
            return raw;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(raw);
        } catch (IOException e) {
            throw new TransactionException("Failed to compress snapshot payload", e);
        }
        return out.toByteArray();
    }

    private static byte[] decode(StateSnapshot snapshot) throws IOException {
        byte[] stored = snapshot.data();
        if (snapshot.compressionType() != CompressionType.GZIP) {
            return stored;
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(stored))) {
            return in.readAllBytes();
        }
    }
}
