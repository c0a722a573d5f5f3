package txengine.migration;

import txengine.rollback.RollbackPoint;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link txengine.engine.TransactionManager#executeMigration}.
 *
 * <p>Migrations report failure here instead of throwing, so batch tooling can
 * decide on retries by inspecting {@link #success()} and {@link #error()}.
 *
 * @param migrationId the migration run
 * @param success true if every step completed
 * @param completedSteps ids of steps that are still in effect, in completion order;
 *                       empty after a phase rollback
 * @param failedStep id of the step that failed, or null
 * @param rollbackPoints "Before step" checkpoints taken during the run
 * @param error why the failing step failed, or null
 * @param duration wall time of the run
 * @param metadata caller metadata
 */
public record MigrationResult(
        String migrationId,
        boolean success,
        List<String> completedSteps,
        String failedStep,
        List<RollbackPoint> rollbackPoints,
        Throwable error,
        Duration duration,
        Map<String, Object> metadata
) {
    public MigrationResult {
        completedSteps = List.copyOf(completedSteps);
        rollbackPoints = List.copyOf(rollbackPoints);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
