package txengine.transaction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe, bounded archive of finished transactions.
 *
 * <p>Entries are appended in completion order (oldest first) and never changed
 * afterwards. When the archive exceeds its maximum size the oldest entries are
 * evicted. Reads return copies, so reading never changes what a later read sees.
 *
 * <p>Owned by a {@link txengine.engine.TransactionManager}; independent managers
 * keep independent histories.
 *
 * @see TransactionResult
 */
public final class TransactionHistory {

    private static final int DEFAULT_MAX_SIZE = 1000;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<TransactionResult<?>> entries = new ArrayList<>();
    private volatile int maxSize;

    public TransactionHistory() {
        this(DEFAULT_MAX_SIZE);
    }

    /**
     * @param maxSize maximum number of entries kept, must be positive
     */
    public TransactionHistory(int maxSize) {
        setMaxSize(maxSize);
    }

    /**
     * Appends a result, evicting the oldest entries beyond the maximum size.
     *
     * @return the evicted entries, oldest first (usually none)
     */
    public List<TransactionResult<?>> record(TransactionResult<?> result) {
        Objects.requireNonNull(result);
        lock.writeLock().lock();
        try {
            entries.add(result);
            return trim();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Set the maximum number of entries to keep.
     *
     * @param size the maximum size, must be positive
     * @throws IllegalArgumentException if size is not positive
     */
    public void setMaxSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + size);
        }
        lock.writeLock().lock();
        try {
            this.maxSize = size;
            trim();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    private List<TransactionResult<?>> trim() {
        int excess = entries.size() - maxSize;
        if (excess <= 0) {
            return List.of();
        }
        List<TransactionResult<?>> evicted = new ArrayList<>(entries.subList(0, excess));
        entries.subList(0, excess).clear();
        return evicted;
    }

    /**
     * Get an unmodifiable copy of all entries, oldest first.
     */
    public List<TransactionResult<?>> list() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(entries));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get the entries of one acting user, oldest first.
     */
    public List<TransactionResult<?>> listByUser(String userId) {
        lock.readLock().lock();
        try {
            return entries.stream()
                    .filter(r -> Objects.equals(r.userId(), userId))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Finds the most recent entry for a transaction.
     */
    public Optional<TransactionResult<?>> find(String transactionId) {
        lock.readLock().lock();
        try {
            for (int i = entries.size() - 1; i >= 0; i--) {
                if (entries.get(i).transactionId().equals(transactionId)) {
                    return Optional.of(entries.get(i));
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes entries recorded strictly before {@code cutoff}.
     *
     * @return the removed entries, oldest first
     */
    public List<TransactionResult<?>> removeOlderThan(Instant cutoff) {
        lock.writeLock().lock();
        try {
            List<TransactionResult<?>> removed = new ArrayList<>();
            entries.removeIf(r -> r.timestamp().isBefore(cutoff) && removed.add(r));
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
