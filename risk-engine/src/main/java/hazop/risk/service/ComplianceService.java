package hazop.risk.service;

import hazop.risk.access.ProjectAccessPolicy;
import hazop.risk.audit.ComplianceAuditLogger;
import hazop.risk.compliance.AnalysisComplianceStatus;
import hazop.risk.compliance.ComplianceAggregator;
import hazop.risk.compliance.ProjectComplianceStatus;
import hazop.risk.compliance.RegulatoryStandardId;
import hazop.risk.compliance.StandardCatalog;
import hazop.risk.error.NotFoundException;
import hazop.risk.error.RiskEngineException;
import hazop.risk.store.AnalysisRecord;
import hazop.risk.store.RiskRecordStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for compliance checks: parses the standards filter, enforces
 * project access, then delegates to {@link ComplianceAggregator}.
 */
@Service
public class ComplianceService {
    static final String SCOPE_ANALYSIS = "analysis";
    static final String SCOPE_PROJECT = "project";

    private final StandardCatalog catalog;
    private final RiskRecordStore store;
    private final ProjectAccessPolicy accessPolicy;
    private final ComplianceAggregator aggregator;
    private final ComplianceAuditLogger auditLogger;
    private final MeterRegistry meterRegistry;

    public ComplianceService(
            StandardCatalog catalog,
            RiskRecordStore store,
            ProjectAccessPolicy accessPolicy,
            ComplianceAggregator aggregator,
            ComplianceAuditLogger auditLogger,
            MeterRegistry meterRegistry
    ) {
        this.catalog = catalog;
        this.store = store;
        this.accessPolicy = accessPolicy;
        this.aggregator = aggregator;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
    }

    public AnalysisComplianceStatus analysisCompliance(
            String requestId,
            String userId,
            UUID analysisId,
            String standardsFilter
    ) {
        long startNs = System.nanoTime();
        List<RegulatoryStandardId> standards = List.of();
        try {
            standards = catalog.parseFilter(standardsFilter);
            AnalysisRecord analysis = store.findAnalysis(analysisId)
                    .orElseThrow(() -> new NotFoundException("Analysis not found"));
            accessPolicy.checkAccess(userId, analysis.projectId());
            AnalysisComplianceStatus status = aggregator.analysisCompliance(analysisId, standards);
            finish(requestId, userId, SCOPE_ANALYSIS, analysisId, standards,
                    status.overallStatus().wireValue(), status.overallPercentage(), startNs);
            return status;
        } catch (RiskEngineException e) {
            finish(requestId, userId, SCOPE_ANALYSIS, analysisId, standards, e.getErrorCode(), 0, startNs);
            throw e;
        }
    }

    public ProjectComplianceStatus projectCompliance(
            String requestId,
            String userId,
            UUID projectId,
            String standardsFilter
    ) {
        long startNs = System.nanoTime();
        List<RegulatoryStandardId> standards = List.of();
        try {
            standards = catalog.parseFilter(standardsFilter);
            store.findProject(projectId).orElseThrow(() -> new NotFoundException("Project not found"));
            accessPolicy.checkAccess(userId, projectId);
            ProjectComplianceStatus status = aggregator.projectCompliance(projectId, standards);
            finish(requestId, userId, SCOPE_PROJECT, projectId, standards,
                    status.overallStatus().wireValue(), status.overallPercentage(), startNs);
            return status;
        } catch (RiskEngineException e) {
            finish(requestId, userId, SCOPE_PROJECT, projectId, standards, e.getErrorCode(), 0, startNs);
            throw e;
        }
    }

    private void finish(
            String requestId,
            String userId,
            String scope,
            UUID targetId,
            List<RegulatoryStandardId> standards,
            String outcome,
            int percentage,
            long startNs
    ) {
        long processingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        Counter.builder("hazop_compliance_check_total")
                .tag("scope", scope)
                .tag("status", outcome)
                .register(meterRegistry)
                .increment();
        Timer.builder("hazop_compliance_check_latency")
                .tag("scope", scope)
                .publishPercentileHistogram()
                .register(meterRegistry)
                .record(processingMs, TimeUnit.MILLISECONDS);
        auditLogger.logComplianceCheck(requestId, userId, scope, targetId, standards, outcome, percentage, processingMs);
    }
}
