package hazop.risk.compliance;

import hazop.risk.domain.RiskEntry;
import hazop.risk.domain.RiskEntryScorer;
import hazop.risk.error.ComputationException;
import hazop.risk.error.NotFoundException;
import hazop.risk.error.ValidationException;
import hazop.risk.lopa.GapAnalysis;
import hazop.risk.lopa.GapAnalyzer;
import hazop.risk.lopa.GapScenario;
import hazop.risk.store.AnalysisRecord;
import hazop.risk.store.ProjectRecord;
import hazop.risk.store.RiskRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Rolls clause statuses into per-standard summaries for one analysis or a whole
 * project. Reads the record store on every call and keeps nothing between calls.
 */
@Component
public class ComplianceAggregator {
    private static final Logger log = LoggerFactory.getLogger(ComplianceAggregator.class);

    private final RiskRecordStore store;
    private final StandardCatalog catalog;
    private final ClauseEvaluator evaluator;
    private final GapAnalyzer gapAnalyzer;
    private final RiskEntryScorer scorer;
    private final int compliantThreshold;
    private final int partialThreshold;

    public ComplianceAggregator(
            RiskRecordStore store,
            StandardCatalog catalog,
            ClauseEvaluator evaluator,
            GapAnalyzer gapAnalyzer,
            RiskEntryScorer scorer,
            @Value("${hazop.compliance.compliant-threshold:90}") int compliantThreshold,
            @Value("${hazop.compliance.partial-threshold:50}") int partialThreshold
    ) {
        if (partialThreshold <= 0 || compliantThreshold <= partialThreshold || compliantThreshold > 100) {
            throw new IllegalArgumentException("hazop.compliance thresholds must satisfy 0 < partial < compliant <= 100");
        }
        this.store = store;
        this.catalog = catalog;
        this.evaluator = evaluator;
        this.gapAnalyzer = gapAnalyzer;
        this.scorer = scorer;
        this.compliantThreshold = compliantThreshold;
        this.partialThreshold = partialThreshold;
    }

    public AnalysisComplianceStatus analysisCompliance(UUID analysisId, List<RegulatoryStandardId> standards) {
        AnalysisRecord analysis = store.findAnalysis(analysisId)
                .orElseThrow(() -> new NotFoundException("Analysis not found"));
        List<RegulatoryStandardId> checked = orAll(standards);
        AnalysisContext context = contextFor(analysis);

        List<StandardComplianceSummary> summaries = new ArrayList<>();
        for (RegulatoryStandardId id : checked) {
            summaries.add(summarize(analysis.id(), id, context));
        }
        int overall = averagePercentage(summaries);
        return new AnalysisComplianceStatus(
                analysis.id(),
                analysis.name(),
                analysis.projectId(),
                analysis.status(),
                context.entryCount(),
                !context.gapAnalyses().isEmpty(),
                context.gapAnalyses().size(),
                checked,
                overallStatus(summaries, overall),
                overall,
                List.copyOf(summaries),
                Instant.now()
        );
    }

    public ProjectComplianceStatus projectCompliance(UUID projectId, List<RegulatoryStandardId> standards) {
        ProjectRecord project = store.findProject(projectId)
                .orElseThrow(() -> new NotFoundException("Project not found"));
        List<RegulatoryStandardId> checked = orAll(standards);
        List<AnalysisRecord> analyses = store.listAnalyses(projectId);

        int entryCount = 0;
        int lopaCount = 0;
        List<List<StandardComplianceSummary>> perAnalysis = new ArrayList<>();
        for (AnalysisRecord analysis : analyses) {
            AnalysisContext context = contextFor(analysis);
            entryCount += context.entryCount();
            lopaCount += context.gapAnalyses().size();
            List<StandardComplianceSummary> row = new ArrayList<>();
            for (RegulatoryStandardId id : checked) {
                row.add(summarize(analysis.id(), id, context));
            }
            perAnalysis.add(row);
        }

        List<StandardComplianceSummary> summaries = new ArrayList<>();
        for (int i = 0; i < checked.size(); i++) {
            summaries.add(pool(checked.get(i), perAnalysis, i));
        }
        int overall = averagePercentage(summaries);
        return new ProjectComplianceStatus(
                project.id(),
                project.name(),
                analyses.size(),
                entryCount,
                lopaCount > 0,
                lopaCount,
                checked,
                overallStatus(summaries, overall),
                overall,
                List.copyOf(summaries),
                Instant.now()
        );
    }

    StandardComplianceSummary summarize(UUID analysisId, RegulatoryStandardId id, AnalysisContext context) {
        RegulatoryStandard standard = catalog.get(id);
        int[] buckets = new int[ComplianceStatus.values().length];
        List<ComplianceGap> gaps = new ArrayList<>();
        for (RegulatoryClause clause : standard.clauses()) {
            ComplianceStatus status = evaluator.evaluate(id, clause, context);
            buckets[status.ordinal()]++;
            if (status == ComplianceStatus.NON_COMPLIANT || status == ComplianceStatus.PARTIALLY_COMPLIANT) {
                gaps.add(new ComplianceGap(
                        analysisId,
                        id,
                        clause.id(),
                        clause.title(),
                        status,
                        GapSeverity.of(standard.mandatory(), clause.mandatory()),
                        evaluator.remediation(clause, context)
                ));
            }
        }
        int percentage = compliancePercentage(
                buckets[ComplianceStatus.COMPLIANT.ordinal()],
                buckets[ComplianceStatus.PARTIALLY_COMPLIANT.ordinal()],
                standard.clauses().size() - buckets[ComplianceStatus.NOT_APPLICABLE.ordinal()]);
        return summary(id, standard.clauses().size(), buckets, percentage, gaps);
    }

    /**
     * Project roll-up of one standard. Bucket counts and gaps are pooled; the
     * percentage is the mean of the per-analysis percentages so every analysis
     * carries the same weight whatever its not-applicable count.
     */
    private StandardComplianceSummary pool(
            RegulatoryStandardId id,
            List<List<StandardComplianceSummary>> perAnalysis,
            int column
    ) {
        int[] buckets = new int[ComplianceStatus.values().length];
        if (perAnalysis.isEmpty()) {
            int clauseCount = catalog.clausesFor(id).size();
            buckets[ComplianceStatus.NOT_ASSESSED.ordinal()] = clauseCount;
            return summary(id, clauseCount, buckets, 0, List.of());
        }
        int total = 0;
        double percentageSum = 0;
        List<ComplianceGap> gaps = new ArrayList<>();
        for (List<StandardComplianceSummary> row : perAnalysis) {
            StandardComplianceSummary s = row.get(column);
            total += s.totalClauses();
            percentageSum += s.compliancePercentage();
            buckets[ComplianceStatus.COMPLIANT.ordinal()] += s.compliantCount();
            buckets[ComplianceStatus.PARTIALLY_COMPLIANT.ordinal()] += s.partiallyCompliantCount();
            buckets[ComplianceStatus.NON_COMPLIANT.ordinal()] += s.nonCompliantCount();
            buckets[ComplianceStatus.NOT_APPLICABLE.ordinal()] += s.notApplicableCount();
            buckets[ComplianceStatus.NOT_ASSESSED.ordinal()] += s.notAssessedCount();
            gaps.addAll(s.gaps());
        }
        int percentage = (int) Math.round(percentageSum / perAnalysis.size());
        return summary(id, total, buckets, percentage, gaps);
    }

    private StandardComplianceSummary summary(
            RegulatoryStandardId id,
            int totalClauses,
            int[] buckets,
            int percentage,
            List<ComplianceGap> gaps
    ) {
        int compliant = buckets[ComplianceStatus.COMPLIANT.ordinal()];
        int partial = buckets[ComplianceStatus.PARTIALLY_COMPLIANT.ordinal()];
        int nonCompliant = buckets[ComplianceStatus.NON_COMPLIANT.ordinal()];
        ComplianceStatus status = compliant + partial + nonCompliant == 0
                ? ComplianceStatus.NOT_ASSESSED
                : classify(percentage);
        List<ComplianceGap> sorted = new ArrayList<>(gaps);
        sorted.sort(ComplianceGap.BY_SEVERITY);
        return new StandardComplianceSummary(
                id,
                catalog.get(id).name(),
                totalClauses,
                compliant,
                partial,
                nonCompliant,
                buckets[ComplianceStatus.NOT_APPLICABLE.ordinal()],
                buckets[ComplianceStatus.NOT_ASSESSED.ordinal()],
                percentage,
                status,
                sorted
        );
    }

    /**
     * Partial clauses count half. Not-applicable clauses are left out of the
     * denominator; exact halves round up.
     */
    static int compliancePercentage(int compliant, int partial, int applicableClauses) {
        if (applicableClauses <= 0) {
            return 0;
        }
        return (int) Math.round((2.0 * compliant + partial) * 100 / (2.0 * applicableClauses));
    }

    ComplianceStatus classify(int percentage) {
        if (percentage >= compliantThreshold) {
            return ComplianceStatus.COMPLIANT;
        }
        if (percentage >= partialThreshold) {
            return ComplianceStatus.PARTIALLY_COMPLIANT;
        }
        return ComplianceStatus.NON_COMPLIANT;
    }

    private ComplianceStatus overallStatus(List<StandardComplianceSummary> summaries, int overallPercentage) {
        boolean anyAssessed = summaries.stream().anyMatch(s -> s.overallStatus() != ComplianceStatus.NOT_ASSESSED);
        return anyAssessed ? classify(overallPercentage) : ComplianceStatus.NOT_ASSESSED;
    }

    private static int averagePercentage(List<StandardComplianceSummary> summaries) {
        if (summaries.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (StandardComplianceSummary s : summaries) {
            sum += s.compliancePercentage();
        }
        return (int) Math.round(sum / summaries.size());
    }

    private AnalysisContext contextFor(AnalysisRecord analysis) {
        List<RiskEntry> entries = store.listEntries(analysis.id());
        List<GapScenario> scenarios = store.listGapScenarios(analysis.id());
        try {
            List<GapAnalysis> gapAnalyses = new ArrayList<>();
            for (GapScenario scenario : scenarios) {
                gapAnalyses.add(gapAnalyzer.analyze(scenario));
            }
            return AnalysisContext.of(entries, gapAnalyses, scorer);
        } catch (ValidationException e) {
            log.error("Stored records of analysis {} violate engine invariants: {}", analysis.id(), e.getMessage());
            throw new ComputationException("Corrupted risk data in analysis " + analysis.id() + ": " + e.getMessage(), e);
        }
    }

    private static List<RegulatoryStandardId> orAll(List<RegulatoryStandardId> standards) {
        return standards == null || standards.isEmpty()
                ? List.of(RegulatoryStandardId.values())
                : List.copyOf(standards);
    }
}
