package hazop.risk.compliance;

import java.util.List;

public record StandardComplianceSummary(
        RegulatoryStandardId standardId,
        String standardName,
        int totalClauses,
        int compliantCount,
        int partiallyCompliantCount,
        int nonCompliantCount,
        int notApplicableCount,
        int notAssessedCount,
        int compliancePercentage,
        ComplianceStatus overallStatus,
        List<ComplianceGap> gaps
) {
    public StandardComplianceSummary {
        gaps = List.copyOf(gaps);
    }
}
