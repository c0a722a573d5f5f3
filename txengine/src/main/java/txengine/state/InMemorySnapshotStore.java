package txengine.state;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link SnapshotStore} backed by a {@link ConcurrentHashMap}.
 * {@link #all()} returns snapshots in the order they were first stored;
 * replacing a snapshot keeps its position.
 */
public final class InMemorySnapshotStore implements SnapshotStore {

    private record Entry(long sequence, StateSnapshot snapshot) {}

    private final ConcurrentMap<String, Entry> snapshots = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public void put(StateSnapshot snapshot) {
        snapshots.compute(snapshot.id(), (id, existing) -> existing != null
                ? new Entry(existing.sequence(), snapshot)
                : new Entry(sequence.incrementAndGet(), snapshot));
    }

    @Override
    public Optional<StateSnapshot> get(String id) {
        return Optional.ofNullable(snapshots.get(id)).map(Entry::snapshot);
    }

    @Override
    public boolean remove(String id) {
        return snapshots.remove(id) != null;
    }

    @Override
    public Collection<StateSnapshot> all() {
        return snapshots.values().stream()
                .sorted(Comparator.comparingLong(Entry::sequence))
                .map(Entry::snapshot)
                .toList();
    }
}
