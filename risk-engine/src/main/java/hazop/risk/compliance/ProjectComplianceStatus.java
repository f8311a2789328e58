package hazop.risk.compliance;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ProjectComplianceStatus(
        UUID projectId,
        String projectName,
        int analysisCount,
        int entryCount,
        @JsonProperty("hasLOPA") boolean hasLopa,
        int lopaCount,
        List<RegulatoryStandardId> standardsChecked,
        ComplianceStatus overallStatus,
        int overallPercentage,
        List<StandardComplianceSummary> summaries,
        Instant checkedAt
) {}
