package txengine.transaction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for beginning a transaction or running operations in one.
 *
 * <p>Recognized options:
 * <ul>
 *   <li>{@code createCheckpoint} - take a checkpoint before executing (default false)</li>
 *   <li>{@code metadata} - caller metadata copied into the context and the result</li>
 *   <li>{@code userId} / {@code sessionId} - acting user and session, overriding
 *       the engine's {@link txengine.engine.SessionProvider}</li>
 *   <li>{@code isolationLevel} - label applied to the new transaction (no enforcement)</li>
 * </ul>
 */
public final class TransactionOptions {

    public static final TransactionOptions DEFAULTS = builder().build();

    private final boolean createCheckpoint;
    private final Map<String, Object> metadata;
    private final String userId;
    private final String sessionId;
    private final TransactionIsolationLevel isolationLevel;

    private TransactionOptions(Builder b) {
        this.createCheckpoint = b.createCheckpoint;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.userId = b.userId;
        this.sessionId = b.sessionId;
        this.isolationLevel = b.isolationLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-filled with this instance's values. */
    public Builder toBuilder() {
        return new Builder()
                .createCheckpoint(createCheckpoint)
                .metadata(metadata)
                .userId(userId)
                .sessionId(sessionId)
                .isolationLevel(isolationLevel);
    }

    public boolean createCheckpoint() { return createCheckpoint; }

    public Map<String, Object> metadata() { return metadata; }

    /** Returns the acting user id, or null to defer to the session provider. */
    public String userId() { return userId; }

    /** Returns the session id, or null to defer to the session provider. */
    public String sessionId() { return sessionId; }

    /** Returns the isolation label, or null to keep the transaction default. */
    public TransactionIsolationLevel isolationLevel() { return isolationLevel; }

    @Override
    public String toString() {
        return "TransactionOptions{" +
                "createCheckpoint=" + createCheckpoint +
                ", userId=" + userId +
                ", isolationLevel=" + isolationLevel +
                ", metadata=" + metadata.keySet() +
                '}';
    }

    /**
     * Builder for {@link TransactionOptions}.
     */
    public static final class Builder {
        private boolean createCheckpoint;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String userId;
        private String sessionId;
        private TransactionIsolationLevel isolationLevel;

        public Builder createCheckpoint(boolean createCheckpoint) {
            this.createCheckpoint = createCheckpoint;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder putMetadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder isolationLevel(TransactionIsolationLevel level) {
            this.isolationLevel = level;
            return this;
        }

        public TransactionOptions build() {
            return new TransactionOptions(this);
        }
    }
}
