package hazop.risk.compliance;

import hazop.risk.domain.RiskEntry;
import hazop.risk.domain.RiskEntryScorer;
import hazop.risk.lopa.GapAnalysis;
import hazop.risk.lopa.GapAnalyzer;
import hazop.risk.lopa.GapScenario;
import hazop.risk.lopa.Ipl;
import hazop.risk.lopa.IplType;
import hazop.risk.lopa.LopaPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ClauseEvaluatorTest {
    private final RiskEntryScorer scorer = new RiskEntryScorer();
    private final ClauseEvaluator evaluator = new ClauseEvaluator(List.of());

    @Test
    void shouldNotAssessEmptyAnalysis() {
        RegulatoryClause clause = clause("8.1", RelevanceArea.HAZARD_IDENTIFICATION);

        assertEquals(ComplianceStatus.NOT_ASSESSED,
                evaluator.evaluate(RegulatoryStandardId.IEC_61511, clause, AnalysisContext.of(List.of(), List.of(), scorer)));
    }

    @Test
    void shouldMarkConfiguredClauseNotApplicable() {
        ClauseEvaluator excluding = new ClauseEvaluator(List.of(" IEC_61511:8.1 "));
        AnalysisContext ctx = context(ComplianceFixtures.wellDocumentedStudy(), List.of());

        assertEquals(ComplianceStatus.NOT_APPLICABLE,
                excluding.evaluate(RegulatoryStandardId.IEC_61511, clause("8.1", RelevanceArea.HAZARD_IDENTIFICATION), ctx));
        assertEquals(ComplianceStatus.COMPLIANT,
                excluding.evaluate(RegulatoryStandardId.ISO_31000, clause("8.1", RelevanceArea.HAZARD_IDENTIFICATION), ctx));
    }

    @Test
    void shouldTakeWorstStatusAcrossAreas() {
        List<RiskEntry> entries = List.of(
                ComplianceFixtures.documented("e1", "n1", "more", 2, 2),
                ComplianceFixtures.bare("e2", 2, 2)
        );
        AnalysisContext ctx = context(entries, List.of());

        assertEquals(ComplianceStatus.COMPLIANT, evaluator.evaluateArea(RelevanceArea.RISK_RANKING, ctx));
        assertEquals(ComplianceStatus.PARTIALLY_COMPLIANT, evaluator.evaluateArea(RelevanceArea.SAFEGUARDS, ctx));
        assertEquals(ComplianceStatus.PARTIALLY_COMPLIANT,
                evaluator.evaluate(RegulatoryStandardId.IEC_61511,
                        clause("x", RelevanceArea.RISK_RANKING, RelevanceArea.SAFEGUARDS), ctx));
    }

    @Test
    void shouldRequireLopaForSevereEntries() {
        AnalysisContext ctx = context(List.of(ComplianceFixtures.documented("e1", "n1", "more", 5, 2)), List.of());

        assertEquals(ComplianceStatus.NON_COMPLIANT, evaluator.evaluateArea(RelevanceArea.LOPA, ctx));
        assertEquals(ComplianceStatus.NON_COMPLIANT, evaluator.evaluateArea(RelevanceArea.SIL_DETERMINATION, ctx));
    }

    @Test
    void shouldTreatLopaAsNotApplicableWithoutCandidates() {
        AnalysisContext ctx = context(ComplianceFixtures.wellDocumentedStudy(), List.of());

        assertEquals(ComplianceStatus.NOT_APPLICABLE, evaluator.evaluateArea(RelevanceArea.LOPA, ctx));
        assertEquals(ComplianceStatus.NOT_APPLICABLE,
                evaluator.evaluate(RegulatoryStandardId.IEC_61511, clause("9", RelevanceArea.LOPA), ctx));
    }

    @Test
    void shouldGradeLopaByWorstGapAndSilClaims() {
        GapAnalyzer analyzer = new GapAnalyzer(LopaPolicy.defaults());
        GapAnalysis adequate = analyzer.analyze(new GapScenario("s1", "n1", "Overfill", "Spill", 0.1, null, null, 1e-3,
                List.of(new Ipl("LSHH", IplType.SAFETY_INSTRUMENTED_FUNCTION, 0.01, true, true, null))));
        GapAnalysis inadequate = analyzer.analyze(new GapScenario("s2", "n1", "Overpressure", "Rupture", 1.0, null, null, 1e-5,
                List.of(new Ipl("PSV", IplType.RELIEF_DEVICE, 0.01, true, true, null))));

        AnalysisContext good = context(ComplianceFixtures.wellDocumentedStudy(), List.of(adequate));
        AnalysisContext mixed = context(ComplianceFixtures.wellDocumentedStudy(), List.of(adequate, inadequate));

        assertEquals(ComplianceStatus.COMPLIANT, evaluator.evaluateArea(RelevanceArea.LOPA, good));
        assertEquals(ComplianceStatus.PARTIALLY_COMPLIANT, evaluator.evaluateArea(RelevanceArea.SIL_DETERMINATION, good));
        assertEquals(ComplianceStatus.NON_COMPLIANT, evaluator.evaluateArea(RelevanceArea.LOPA, mixed));
    }

    @Test
    void shouldRecognizeMethodologyAndChangeManagement() {
        AnalysisContext ctx = context(ComplianceFixtures.wellDocumentedStudy(), List.of());

        assertEquals(ComplianceStatus.COMPLIANT, evaluator.evaluateArea(RelevanceArea.METHODOLOGY, ctx));
        assertEquals(ComplianceStatus.COMPLIANT, evaluator.evaluateArea(RelevanceArea.MANAGEMENT_OF_CHANGE, ctx));
        assertEquals(ComplianceStatus.COMPLIANT, evaluator.evaluateArea(RelevanceArea.DOCUMENTATION, ctx));
        assertEquals(ComplianceStatus.NOT_ASSESSED, evaluator.evaluateArea(RelevanceArea.TEAM_COMPOSITION, ctx));
    }

    @Test
    void shouldFlagUncoveredHighRisk() {
        RiskEntry severe = new RiskEntry("e1", "a1", "n1", "more", "temperature", "more temperature",
                null, null, null, null, 5, 5, 5);
        AnalysisContext ctx = context(List.of(severe), List.of());

        assertEquals(ComplianceStatus.NON_COMPLIANT, evaluator.evaluateArea(RelevanceArea.RECOMMENDATIONS, ctx));
        assertEquals(ComplianceStatus.NOT_ASSESSED, evaluator.evaluateArea(RelevanceArea.FOLLOW_UP, ctx));
        assertEquals(ComplianceStatus.NON_COMPLIANT, evaluator.evaluateArea(RelevanceArea.DOCUMENTATION, ctx));
    }

    private AnalysisContext context(List<RiskEntry> entries, List<GapAnalysis> gaps) {
        return AnalysisContext.of(entries, gaps, scorer);
    }

    private static RegulatoryClause clause(String id, RelevanceArea... areas) {
        return new RegulatoryClause(id, "Clause " + id, true, List.of(areas));
    }
}
