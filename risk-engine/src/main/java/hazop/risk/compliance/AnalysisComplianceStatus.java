package hazop.risk.compliance;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AnalysisComplianceStatus(
        UUID analysisId,
        String analysisName,
        UUID projectId,
        String analysisStatus,
        int entryCount,
        @JsonProperty("hasLOPA") boolean hasLopa,
        int lopaCount,
        List<RegulatoryStandardId> standardsChecked,
        ComplianceStatus overallStatus,
        int overallPercentage,
        List<StandardComplianceSummary> summaries,
        Instant checkedAt
) {}
