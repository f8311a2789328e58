package hazop.risk.audit;

import hazop.risk.compliance.RegulatoryStandardId;
import hazop.risk.lopa.GapAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
public class ComplianceAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(ComplianceAuditLogger.class);

    public void logComplianceCheck(
            String requestId,
            String userId,
            String scope,
            UUID targetId,
            List<RegulatoryStandardId> standards,
            String outcome,
            int overallPercentage,
            long processingMs
    ) {
        log.info(
                "event=compliance_check request_id={} user_id={} scope={} target_id={} standards={} outcome={} overall_percentage={} processing_ms={}",
                requestId,
                userId,
                scope,
                targetId,
                standards,
                outcome,
                overallPercentage,
                processingMs
        );
    }

    public void logGapAnalysis(String requestId, GapAnalysis analysis, long processingMs) {
        log.info(
                "event=lopa_analysis request_id={} scenario_id={} ipl_count={} total_rrf={} required_rrf={} gap_ratio={} gap_status={} required_sil={} ipl_warnings={} processing_ms={}",
                requestId,
                analysis.id(),
                analysis.ipls().size(),
                analysis.totalRrf(),
                analysis.requiredRrf(),
                analysis.gapRatio(),
                analysis.gapStatus().wireValue(),
                analysis.requiredSil(),
                analysis.warnings().size(),
                processingMs
        );
    }

    public void logMatrixRender(String requestId, String format, String size, int width, int height, long processingMs) {
        log.info(
                "event=risk_matrix_render request_id={} format={} size={} width={} height={} processing_ms={}",
                requestId,
                format,
                size,
                width,
                height,
                processingMs
        );
    }
}
