package warden.core.service.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;

import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.RiskAssessment;
import warden.core.model.audit.RiskLevel;

/**
 * Scores risk from the denial rate across all entries in a window.
 *
 * <p>Above 30% denials the risk is high, above 15% medium, otherwise low.
 */
@ApplicationScoped
public class RiskAssessor {

    static final double HIGH_RISK_RATE = 0.30;
    static final double MEDIUM_RISK_RATE = 0.15;
    static final double ROLE_REVIEW_RATE = 0.20;

    public RiskAssessment assess(List<AuditEntry> entries) {
        final long total = entries.size();
        final long denied = entries.stream().filter(AuditEntry::isDenied).count();
        final double denialRate = total > 0 ? (double) denied / total : 0.0;
        final var level = levelFor(denialRate);

        final var factors = List.of(
                String.format(Locale.ROOT, "Denial rate: %.2f%%", denialRate * 100),
                "Total permission checks: " + total,
                "Denied attempts: " + denied);

        return new RiskAssessment(level, denialRate * 100, factors, recommendations(level, denialRate));
    }

    static RiskLevel levelFor(double denialRate) {
        if (denialRate > HIGH_RISK_RATE) {
            return RiskLevel.HIGH;
        }
        if (denialRate > MEDIUM_RISK_RATE) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static List<String> recommendations(RiskLevel level, double denialRate) {
        final List<String> recommendations = new ArrayList<>();
        if (level == RiskLevel.HIGH) {
            recommendations.add("Review and update permission policies");
            recommendations.add("Investigate users with excessive denied attempts");
            recommendations.add("Consider implementing additional security measures");
        }
        if (denialRate > ROLE_REVIEW_RATE) {
            recommendations.add("Review role assignments and permissions");
            recommendations.add("Provide additional user training on system access");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Continue monitoring security metrics");
            recommendations.add("Regular security audits recommended");
        }
        return recommendations;
    }
}
