package warden.core.model.audit;

import java.util.List;

/**
 * Risk scoring derived from the denial rate over a time window.
 *
 * @param level           overall risk level
 * @param riskScore       denial rate as a percentage, 0 to 100
 * @param factors         observations that contributed to the score
 * @param recommendations suggested follow-up actions
 */
public record RiskAssessment(RiskLevel level, double riskScore, List<String> factors, List<String> recommendations) {

    public RiskAssessment {
        factors = factors == null ? List.of() : List.copyOf(factors);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
