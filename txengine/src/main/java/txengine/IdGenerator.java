package txengine;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates ids of the form {@code <prefix>_<epochMillis>_<suffix>}.
 *
 * <p>The suffix is a base-36 process-wide sequence number followed by random
 * characters, so ids never repeat within a process even when generated in the
 * same millisecond. The format is a convenience, not a wire contract.
 */
public final class IdGenerator {

    public static final String TRANSACTION = "txn";
    public static final String ROLLBACK_POINT = "rbp";
    public static final String SNAPSHOT = "snapshot";
    public static final String STRATEGY = "strategy";
    public static final String MIGRATION = "migration";

    private static final AtomicLong SEQUENCE = new AtomicLong();
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int RANDOM_CHARS = 5;

    private IdGenerator() {}

    /**
     * Generates a new id.
     *
     * @param prefix the id prefix, e.g. {@link #TRANSACTION}
     * @return a process-unique id
     */
    public static String next(String prefix) {
        StringBuilder sb = new StringBuilder(prefix)
                .append('_')
                .append(System.currentTimeMillis())
                .append('_')
                .append(Long.toString(SEQUENCE.incrementAndGet(), 36));
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < RANDOM_CHARS; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
