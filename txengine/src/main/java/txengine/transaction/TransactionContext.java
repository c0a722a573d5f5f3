package txengine.transaction;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable context attached to a transaction at creation and passed to every
 * operation callback.
 *
 * <p>The user and session ids come from the caller or the
 * {@link txengine.engine.SessionProvider}; the engine never invents them, so
 * both may be null.
 *
 * @param transactionId the owning transaction
 * @param userId acting user (may be null)
 * @param sessionId session of the acting user (may be null)
 * @param timestamp when the transaction was created
 * @param metadata free-form caller metadata (unmodifiable)
 */
public record TransactionContext(
        String transactionId,
        String userId,
        String sessionId,
        Instant timestamp,
        Map<String, Object> metadata
) {
    public TransactionContext {
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(timestamp, "timestamp");
        // LinkedHashMap copy: metadata values may legitimately be null
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates a context with no user, session or metadata, stamped now.
     *
     * @param transactionId the owning transaction
     * @return a new context
     */
    public static TransactionContext of(String transactionId) {
        return new TransactionContext(transactionId, null, null, Instant.now(), Map.of());
    }
}
