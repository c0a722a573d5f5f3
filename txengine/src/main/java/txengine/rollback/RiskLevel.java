package txengine.rollback;

/**
 * Qualitative risk of a rollback step or of data loss when rolling back.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    /** Returns the higher of the two levels. */
    public RiskLevel max(RiskLevel other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
