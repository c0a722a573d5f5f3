package txengine.config;

import txengine.state.CompressionType;

import java.time.Duration;

/**
 * Central configuration for the transaction engine.
 *
 * <p>This class encapsulates all configurable parameters:
 * <ul>
 *   <li>History size and alert level</li>
 *   <li>Whether operation timeouts are enforced</li>
 *   <li>Worker count for parallel rollback strategies</li>
 *   <li>Maximum age of a rollback point before feasibility checks warn</li>
 *   <li>Snapshot compression and checksum algorithm</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code txengine.properties} or
 * {@code txengine.yml} using {@link EngineConfigLoader}.
 *
 * @see EngineConfigLoader
 * @see txengine.engine.TransactionManager#create(txengine.state.StateProvider, EngineConfig)
 */
public final class EngineConfig {

    public static final EngineConfig DEFAULTS = builder().build();

    private final int historySize;
    private final AlertLevel alertLevel;
    private final boolean operationTimeoutEnforced;
    private final int rollbackParallelism;
    private final Duration rollbackMaxAge;
    private final CompressionType snapshotCompression;
    private final String checksumAlgorithm;

    private EngineConfig(Builder b) {
        this.historySize = b.historySize;
        this.alertLevel = b.alertLevel;
        this.operationTimeoutEnforced = b.operationTimeoutEnforced;
        this.rollbackParallelism = b.rollbackParallelism;
        this.rollbackMaxAge = b.rollbackMaxAge;
        this.snapshotCompression = b.snapshotCompression;
        this.checksumAlgorithm = b.checksumAlgorithm;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the maximum number of transaction results kept in history. */
    public int historySize() { return historySize; }

    /** Returns the alert level for event logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    /** Returns true if operation execution runs under its timeout. */
    public boolean operationTimeoutEnforced() { return operationTimeoutEnforced; }

    /** Returns the number of workers used by parallel rollback strategies. */
    public int rollbackParallelism() { return rollbackParallelism; }

    /** Returns the age after which a rollback point is flagged as stale, or ZERO for no limit. */
    public Duration rollbackMaxAge() { return rollbackMaxAge; }

    /** Returns the compression applied to stored snapshot payloads. */
    public CompressionType snapshotCompression() { return snapshotCompression; }

    /** Returns the {@link java.security.MessageDigest} algorithm used for snapshot checksums. */
    public String checksumAlgorithm() { return checksumAlgorithm; }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "historySize=" + historySize +
                ", alertLevel=" + alertLevel +
                ", operationTimeoutEnforced=" + operationTimeoutEnforced +
                ", rollbackParallelism=" + rollbackParallelism +
                ", rollbackMaxAge=" + rollbackMaxAge.toSeconds() + "s" +
                ", snapshotCompression=" + snapshotCompression +
                ", checksumAlgorithm=" + checksumAlgorithm +
                '}';
    }

    /**
     * Builder for constructing {@link EngineConfig} instances.
     */
    public static final class Builder {
        private int historySize = 1000;
        private AlertLevel alertLevel = AlertLevel.WARNING;
        private boolean operationTimeoutEnforced = false;
        private int rollbackParallelism = 4;
        private Duration rollbackMaxAge = Duration.ZERO;
        private CompressionType snapshotCompression = CompressionType.NONE;
        private String checksumAlgorithm = "SHA-256";

        public Builder historySize(int size) {
            if (size <= 0) throw new IllegalArgumentException("historySize must be positive");
            this.historySize = size;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public Builder operationTimeoutEnforced(boolean enforced) {
            this.operationTimeoutEnforced = enforced;
            return this;
        }

        public Builder rollbackParallelism(int workers) {
            if (workers <= 0) throw new IllegalArgumentException("rollbackParallelism must be positive");
            this.rollbackParallelism = workers;
            return this;
        }

        public Builder rollbackMaxAge(Duration maxAge) {
            this.rollbackMaxAge = maxAge;
            return this;
        }

        public Builder rollbackMaxAgeSeconds(long seconds) {
            return rollbackMaxAge(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder snapshotCompression(CompressionType compression) {
            this.snapshotCompression = compression;
            return this;
        }

        public Builder checksumAlgorithm(String algorithm) {
            this.checksumAlgorithm = algorithm;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
