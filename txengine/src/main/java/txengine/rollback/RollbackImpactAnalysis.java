package txengine.rollback;

import java.time.Duration;
import java.util.List;

/**
 * What restoring a rollback point would affect.
 *
 * @param affectedServices names of the state areas that would be overwritten
 * @param affectedUsers distinct users whose later work would be discarded
 * @param dataLossRisk qualitative risk of losing data
 * @param estimatedDowntime rough time to restore
 * @param dependencies rollback points created after this one
 * @param recommendations precautions to take first
 */
public record RollbackImpactAnalysis(
        List<String> affectedServices,
        int affectedUsers,
        RiskLevel dataLossRisk,
        Duration estimatedDowntime,
        List<String> dependencies,
        List<String> recommendations
) {
    public RollbackImpactAnalysis {
        affectedServices = List.copyOf(affectedServices);
        dependencies = List.copyOf(dependencies);
        recommendations = List.copyOf(recommendations);
    }
}
