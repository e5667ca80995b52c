package warden.core.model.audit;

/**
 * Headline security figures for a time window.
 *
 * @param totalChecks     permission checks in the window
 * @param granted         granted checks
 * @param denied          denied checks
 * @param uniqueUsers     distinct principals checked
 * @param uniqueResources distinct resources checked
 * @param securityScore   {@code 100 - riskScore}
 * @param riskLevel       risk level for the window
 */
public record SecurityMetrics(
        long totalChecks,
        long granted,
        long denied,
        long uniqueUsers,
        long uniqueResources,
        double securityScore,
        RiskLevel riskLevel) {}
