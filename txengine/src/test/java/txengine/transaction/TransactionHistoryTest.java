package txengine.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TransactionHistory")
class TransactionHistoryTest {

    private static TransactionResult<String> entry(String txId, String user, Instant at) {
        return new TransactionResult<>(txId, TransactionStatus.COMMITTED, txId, null, List.of(), List.of(),
                List.of(), user, at, Duration.ZERO, Map.of());
    }

    @Test
    @DisplayName("should keep entries oldest first and evict beyond the limit")
    void shouldEvictOldest() {
        TransactionHistory history = new TransactionHistory(2);
        Instant now = Instant.now();

        history.record(entry("t1", null, now));
        history.record(entry("t2", null, now));
        history.record(entry("t3", null, now));

        assertThat(history.list()).extracting(TransactionResult::transactionId).containsExactly("t2", "t3");
        assertThat(history.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should shrink when the maximum size is lowered")
    void shouldShrink() {
        TransactionHistory history = new TransactionHistory();
        for (int i = 0; i < 5; i++) {
            history.record(entry("t" + i, null, Instant.now()));
        }

        history.setMaxSize(3);

        assertThat(history.list()).extracting(TransactionResult::transactionId).containsExactly("t2", "t3", "t4");
        assertThatThrownBy(() -> history.setMaxSize(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should filter by user and find the latest entry of a transaction")
    void shouldFilterAndFind() {
        TransactionHistory history = new TransactionHistory();
        Instant now = Instant.now();
        history.record(entry("t1", "alice", now));
        history.record(entry("t2", "bob", now));
        history.record(entry("t3", null, now));

        assertThat(history.listByUser("alice")).extracting(TransactionResult::transactionId).containsExactly("t1");
        assertThat(history.listByUser(null)).extracting(TransactionResult::transactionId).containsExactly("t3");
        assertThat(history.find("t2")).isPresent();
        assertThat(history.find("t9")).isEmpty();
    }

    @Test
    @DisplayName("should remove only entries strictly before the cutoff")
    void shouldRemoveOlderThan() {
        TransactionHistory history = new TransactionHistory();
        Instant cutoff = Instant.parse("2024-01-01T00:00:00Z");
        history.record(entry("old", null, cutoff.minusSeconds(1)));
        history.record(entry("exact", null, cutoff));
        history.record(entry("new", null, cutoff.plusSeconds(1)));

        assertThat(history.removeOlderThan(cutoff)).extracting(TransactionResult::transactionId).containsExactly("old");
        assertThat(history.list()).extracting(TransactionResult::transactionId).containsExactly("exact", "new");
    }

    @Test
    @DisplayName("should accept concurrent writers")
    void shouldAcceptConcurrentWriters() throws InterruptedException {
        TransactionHistory history = new TransactionHistory(10_000);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(400);
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            String id = "t" + i;
            expected.add(id);
            pool.execute(() -> {
                history.record(entry(id, null, Instant.now()));
                done.countDown();
            });
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(history.list()).extracting(TransactionResult::transactionId)
                .containsExactlyInAnyOrderElementsOf(expected);
    }
}
