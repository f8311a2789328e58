package hazop.risk.compliance;

import com.fasterxml.jackson.databind.ObjectMapper;
import hazop.risk.domain.RiskEntry;
import hazop.risk.domain.RiskEntryScorer;
import hazop.risk.error.ComputationException;
import hazop.risk.error.NotFoundException;
import hazop.risk.lopa.GapAnalyzer;
import hazop.risk.lopa.GapScenario;
import hazop.risk.lopa.Ipl;
import hazop.risk.lopa.IplType;
import hazop.risk.lopa.LopaPolicy;
import hazop.risk.store.AnalysisRecord;
import hazop.risk.store.InMemoryRiskRecordStore;
import hazop.risk.store.ProjectRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComplianceAggregatorTest {
    private static final UUID PROJECT = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID ANALYSIS = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final UUID EMPTY_PROJECT = UUID.fromString("33333333-3333-3333-3333-333333333333");

    private final InMemoryRiskRecordStore store = new InMemoryRiskRecordStore();
    private ComplianceAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = aggregator(List.of());
        store.putProject(new ProjectRecord(PROJECT, "Crude unit revamp"));
        store.putProject(new ProjectRecord(EMPTY_PROJECT, "Greenfield"));
        store.putAnalysis(new AnalysisRecord(ANALYSIS, PROJECT, "Node 1-4 study", "in_review"));
        for (RiskEntry entry : ComplianceFixtures.wellDocumentedStudy()) {
            store.addEntry(ANALYSIS, entry);
        }
    }

    @Test
    void shouldWeightPartialClausesByHalf() {
        assertEquals(80, ComplianceAggregator.compliancePercentage(7, 2, 10));
        assertEquals(0, ComplianceAggregator.compliancePercentage(0, 0, 0));
    }

    @Test
    void shouldRoundExactHalvesUp() {
        assertEquals(58, ComplianceAggregator.compliancePercentage(9, 51, 60));
        assertEquals(38, ComplianceAggregator.compliancePercentage(1, 1, 4));
    }

    @Test
    void shouldLeaveNotApplicableClausesOutOfDenominator() {
        ComplianceAggregator excluding = aggregator(List.of("IEC_61511:8.1", "IEC_61511:11"));

        StandardComplianceSummary summary = excluding
                .analysisCompliance(ANALYSIS, List.of(RegulatoryStandardId.IEC_61511)).summaries().get(0);

        assertEquals(12, summary.totalClauses());
        assertEquals(2, summary.notApplicableCount());
        assertTrue(summary.compliantCount() > 0);
        long expected = Math.round((2.0 * summary.compliantCount() + summary.partiallyCompliantCount()) * 100 / (2.0 * 10));
        assertEquals(expected, summary.compliancePercentage());
    }

    @Test
    void shouldNotAssessStandardWhoseClausesAreAllExcluded() {
        StandardCatalog catalog = new StandardCatalog(new ObjectMapper());
        List<String> excluded = catalog.clausesFor(RegulatoryStandardId.PED).stream()
                .map(clause -> "PED:" + clause.id())
                .toList();

        StandardComplianceSummary summary = aggregator(excluded)
                .analysisCompliance(ANALYSIS, List.of(RegulatoryStandardId.PED)).summaries().get(0);

        assertEquals(summary.totalClauses(), summary.notApplicableCount());
        assertEquals(0, summary.compliancePercentage());
        assertEquals(ComplianceStatus.NOT_ASSESSED, summary.overallStatus());
        assertTrue(summary.gaps().isEmpty());
    }

    @Test
    void shouldSummarizeEveryStandardByDefault() {
        AnalysisComplianceStatus status = aggregator.analysisCompliance(ANALYSIS, null);

        assertEquals(RegulatoryStandardId.values().length, status.summaries().size());
        assertEquals(4, status.entryCount());
        assertFalse(status.hasLopa());
        for (StandardComplianceSummary summary : status.summaries()) {
            int sum = summary.compliantCount() + summary.partiallyCompliantCount() + summary.nonCompliantCount()
                    + summary.notApplicableCount() + summary.notAssessedCount();
            assertEquals(summary.totalClauses(), sum);
            assertTrue(summary.compliancePercentage() >= 0 && summary.compliancePercentage() <= 100);
        }
    }

    @Test
    void shouldRestrictToRequestedStandards() {
        AnalysisComplianceStatus status = aggregator.analysisCompliance(ANALYSIS, List.of(RegulatoryStandardId.IEC_61511));

        assertEquals(1, status.summaries().size());
        assertEquals(RegulatoryStandardId.IEC_61511, status.summaries().get(0).standardId());
        assertEquals(12, status.summaries().get(0).totalClauses());
    }

    @Test
    void shouldBeDeterministicApartFromTimestamp() {
        AnalysisComplianceStatus first = aggregator.analysisCompliance(ANALYSIS, null);
        AnalysisComplianceStatus second = aggregator.analysisCompliance(ANALYSIS, null);

        assertEquals(first.summaries(), second.summaries());
        assertEquals(first.overallPercentage(), second.overallPercentage());
        assertEquals(first.overallStatus(), second.overallStatus());
    }

    @Test
    void shouldNotAssessProjectWithoutAnalyses() {
        ProjectComplianceStatus status = aggregator.projectCompliance(EMPTY_PROJECT, null);

        assertEquals(0, status.analysisCount());
        assertEquals(ComplianceStatus.NOT_ASSESSED, status.overallStatus());
        assertEquals(0, status.overallPercentage());
        assertTrue(status.summaries().stream().allMatch(s -> s.overallStatus() == ComplianceStatus.NOT_ASSESSED));
    }

    @Test
    void shouldPoolAnalysesOfProject() {
        UUID second = UUID.fromString("44444444-4444-4444-4444-444444444444");
        store.putAnalysis(new AnalysisRecord(second, PROJECT, "Node 5 study", "draft"));
        for (RiskEntry entry : ComplianceFixtures.wellDocumentedStudy()) {
            store.addEntry(second, entry);
        }

        ProjectComplianceStatus project = aggregator.projectCompliance(PROJECT, List.of(RegulatoryStandardId.ISO_31000));
        AnalysisComplianceStatus single = aggregator.analysisCompliance(ANALYSIS, List.of(RegulatoryStandardId.ISO_31000));

        assertEquals(2, project.analysisCount());
        assertEquals(8, project.entryCount());
        StandardComplianceSummary pooled = project.summaries().get(0);
        StandardComplianceSummary one = single.summaries().get(0);
        assertEquals(2 * one.totalClauses(), pooled.totalClauses());
        assertEquals(one.compliancePercentage(), pooled.compliancePercentage());
    }

    @Test
    void shouldWeightEachAnalysisEquallyInProjectRollup() {
        UUID sparse = UUID.fromString("66666666-6666-6666-6666-666666666666");
        store.putAnalysis(new AnalysisRecord(sparse, PROJECT, "Node 6 study", "draft"));
        store.addEntry(sparse, ComplianceFixtures.bare("b1", 4, 4));
        store.addEntry(sparse, ComplianceFixtures.bare("b2", 2, 2));
        List<RegulatoryStandardId> iec = List.of(RegulatoryStandardId.IEC_61511);

        StandardComplianceSummary documented = aggregator.analysisCompliance(ANALYSIS, iec).summaries().get(0);
        StandardComplianceSummary bare = aggregator.analysisCompliance(sparse, iec).summaries().get(0);
        StandardComplianceSummary project = aggregator.projectCompliance(PROJECT, iec).summaries().get(0);

        assertNotEquals(documented.compliancePercentage(), bare.compliancePercentage());
        assertEquals(Math.round((documented.compliancePercentage() + bare.compliancePercentage()) / 2.0),
                project.compliancePercentage());
        assertEquals(documented.nonCompliantCount() + bare.nonCompliantCount(), project.nonCompliantCount());
        assertEquals(documented.gaps().size() + bare.gaps().size(), project.gaps().size());
    }

    @Test
    void shouldReportLopaFromStoredScenarios() {
        store.addGapScenario(ANALYSIS, scenario("s1", 0.1, 1e-3, 0.01));

        AnalysisComplianceStatus analysis = aggregator.analysisCompliance(ANALYSIS, null);
        ProjectComplianceStatus project = aggregator.projectCompliance(PROJECT, null);

        assertTrue(analysis.hasLopa());
        assertEquals(1, analysis.lopaCount());
        assertTrue(project.hasLopa());
        assertEquals(1, project.lopaCount());
    }

    @Test
    void shouldGradeLopaClausesFromStoredScenarios() {
        List<RegulatoryStandardId> iec = List.of(RegulatoryStandardId.IEC_61511);
        store.addGapScenario(ANALYSIS, scenario("s1", 0.1, 1e-3, 0.01));

        StandardComplianceSummary adequate = aggregator.analysisCompliance(ANALYSIS, iec).summaries().get(0);
        assertTrue(adequate.gaps().stream().noneMatch(gap -> gap.clauseId().equals("9.2")));

        store.addGapScenario(ANALYSIS, scenario("s2", 1.0, 1e-5, 0.01));
        StandardComplianceSummary inadequate = aggregator.analysisCompliance(ANALYSIS, iec).summaries().get(0);

        ComplianceGap sil = gap(inadequate, "9.2");
        ComplianceGap annex = gap(inadequate, "Annex_A");
        assertEquals(ComplianceStatus.NON_COMPLIANT, sil.status());
        assertEquals(GapSeverity.CRITICAL, sil.severity());
        assertEquals(GapSeverity.MAJOR, annex.severity());
        assertTrue(sil.remediation().contains(RelevanceArea.LOPA.remediation()));
        assertEquals(ANALYSIS, sil.analysisId());
        assertTrue(inadequate.gaps().indexOf(sil) < inadequate.gaps().indexOf(annex));
        assertTrue(inadequate.compliancePercentage() < adequate.compliancePercentage());
    }

    @Test
    void shouldFailOnCorruptedStoredScenario() {
        store.addGapScenario(ANALYSIS, scenario("s1", 0.1, 1e-3, 0));

        assertThrows(ComputationException.class, () -> aggregator.analysisCompliance(ANALYSIS, null));
        assertThrows(ComputationException.class, () -> aggregator.projectCompliance(PROJECT, null));
    }

    @Test
    void shouldListGapsMostSevereFirst() {
        UUID sparse = UUID.fromString("77777777-7777-7777-7777-777777777777");
        store.putAnalysis(new AnalysisRecord(sparse, PROJECT, "Node 7 study", "draft"));
        store.addEntry(sparse, ComplianceFixtures.bare("b1", 4, 4));

        AnalysisComplianceStatus status = aggregator.analysisCompliance(sparse, null);

        for (StandardComplianceSummary summary : status.summaries()) {
            assertEquals(summary.nonCompliantCount() + summary.partiallyCompliantCount(), summary.gaps().size());
            for (int i = 1; i < summary.gaps().size(); i++) {
                assertTrue(summary.gaps().get(i - 1).severity().compareTo(summary.gaps().get(i).severity()) <= 0);
            }
            for (ComplianceGap gap : summary.gaps()) {
                assertFalse(gap.remediation().isEmpty(), gap.clauseId() + " has remediation");
            }
        }
        assertTrue(status.summaries().stream().anyMatch(s -> !s.gaps().isEmpty()));
    }

    @Test
    void shouldDeriveGapSeverityFromMandatoryFlags() {
        assertEquals(GapSeverity.CRITICAL, GapSeverity.of(true, true));
        assertEquals(GapSeverity.MAJOR, GapSeverity.of(true, false));
        assertEquals(GapSeverity.MAJOR, GapSeverity.of(false, true));
        assertEquals(GapSeverity.MINOR, GapSeverity.of(false, false));
    }

    @Test
    void shouldNotAssessAnalysisWithoutEntries() {
        UUID empty = UUID.fromString("55555555-5555-5555-5555-555555555555");
        store.putAnalysis(new AnalysisRecord(empty, PROJECT, "Empty", "draft"));

        AnalysisComplianceStatus status = aggregator.analysisCompliance(empty, null);

        assertEquals(ComplianceStatus.NOT_ASSESSED, status.overallStatus());
        assertEquals(0, status.overallPercentage());
    }

    @Test
    void shouldReportMissingRecords() {
        NotFoundException analysis = assertThrows(NotFoundException.class,
                () -> aggregator.analysisCompliance(UUID.randomUUID(), null));
        NotFoundException project = assertThrows(NotFoundException.class,
                () -> aggregator.projectCompliance(UUID.randomUUID(), null));

        assertEquals("Analysis not found", analysis.getMessage());
        assertEquals("Project not found", project.getMessage());
    }

    @Test
    void shouldFailOnCorruptedStoredEntry() {
        store.addEntry(ANALYSIS, ComplianceFixtures.bare("bad", 9, 2));

        assertThrows(ComputationException.class, () -> aggregator.analysisCompliance(ANALYSIS, null));
    }

    @Test
    void shouldRejectInvertedThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new ComplianceAggregator(
                store, new StandardCatalog(new ObjectMapper()), new ClauseEvaluator(List.of()),
                new GapAnalyzer(LopaPolicy.defaults()), new RiskEntryScorer(), 40, 50));
    }

    private ComplianceAggregator aggregator(List<String> excludedClauses) {
        return new ComplianceAggregator(
                store,
                new StandardCatalog(new ObjectMapper()),
                new ClauseEvaluator(excludedClauses),
                new GapAnalyzer(LopaPolicy.defaults()),
                new RiskEntryScorer(),
                90,
                50
        );
    }

    private static GapScenario scenario(String id, double frequency, double target, double reliefPfd) {
        return new GapScenario(id, "n1", "Overpressure of V-101", "Vessel rupture", frequency,
                "equipment_failure", "Control valve fails open", target,
                List.of(new Ipl("PSV-101", IplType.RELIEF_DEVICE, reliefPfd, true, true, null)));
    }

    private static ComplianceGap gap(StandardComplianceSummary summary, String clauseId) {
        return summary.gaps().stream()
                .filter(gap -> gap.clauseId().equals(clauseId))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no gap for clause " + clauseId));
    }
}
