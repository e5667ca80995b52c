package warden.core.model.authz;

import java.util.List;
import java.util.Map;

/**
 * Result of a composite evaluation across several actions and resources.
 *
 * @param results             per-action result, AND-ed across all resources
 * @param conditionsSatisfied whether all supplemental conditions held
 * @param details             per (action, resource) trace
 */
public record EvaluationResult(
        Map<PermissionAction, Boolean> results, boolean conditionsSatisfied, List<EvaluationDetail> details) {

    public EvaluationResult {
        results = results == null ? Map.of() : Map.copyOf(results);
        details = details == null ? List.of() : List.copyOf(details);
    }

    /**
     * True only when every action was granted and every supplemental condition held.
     */
    public boolean allGranted() {
        return conditionsSatisfied && !results.isEmpty() && results.values().stream().allMatch(Boolean::booleanValue);
    }
}
