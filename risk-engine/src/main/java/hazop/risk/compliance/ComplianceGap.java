package hazop.risk.compliance;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;

public record ComplianceGap(
        UUID analysisId,
        RegulatoryStandardId standardId,
        String clauseId,
        String clauseTitle,
        ComplianceStatus status,
        GapSeverity severity,
        List<String> remediation
) {
    static final Comparator<ComplianceGap> BY_SEVERITY = Comparator
            .comparing(ComplianceGap::severity)
            .thenComparing(ComplianceGap::status);

    public ComplianceGap {
        remediation = List.copyOf(remediation);
    }
}
