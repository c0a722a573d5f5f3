package txengine.config;

/**
 * Alert level for transaction event logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link txengine.alert.TransactionAlertLogger}. This can be configured
 * via the {@code txengine.alert.level} property.
 *
 * <p>Log output at each level:
 * <ul>
 *   <li>{@link #DEBUG} - All events: transaction lifecycle, snapshots, checkpoints, migration steps</li>
 *   <li>{@link #WARNING} - Rollbacks, restore problems and errors</li>
 *   <li>{@link #ERROR} - Errors only (failed undo steps, failed restores, failed migrations)</li>
 * </ul>
 *
 * @see EngineConfig#alertLevel()
 */
public enum AlertLevel {
    /**
     * Log all events. Use for development and troubleshooting.
     */
    DEBUG,

    /**
     * Log warnings and errors only. This is the default level.
     */
    WARNING,

    /**
     * Log errors only.
     */
    ERROR
}
