package txengine.exceptions;

/**
 * Base type for failed id-based lookups.
 *
 * <p>Kept separate from {@link SnapshotCorruptedException} so callers can tell
 * "nothing there" from "something there but damaged".
 */
public abstract class NotFoundException extends TransactionException {

    private final String id;

    protected NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.id = id;
    }

    /** Returns the id that was looked up. */
    public String getId() {
        return id;
    }
}
