package hazop.risk.compliance;

import hazop.risk.lopa.GapAnalysis;
import hazop.risk.lopa.GapStatus;
import hazop.risk.lopa.Ipl;
import hazop.risk.lopa.IplType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Deterministic coverage rules deciding the status of a regulatory clause from
 * the evidence in one analysis.
 */
@Component
public class ClauseEvaluator {
    private static final double HAZARD_ID_COMPLIANT = 0.7;
    private static final double RANKING_COMPLIANT = 0.9;
    private static final double SAFEGUARDS_COMPLIANT = 0.8;
    private static final double SAFEGUARDS_PARTIAL = 0.5;
    private static final double DOCUMENTATION_COMPLIANT = 0.8;
    private static final double DOCUMENTATION_PARTIAL = 0.5;
    private static final double FOLLOW_UP_COMPLIANT = 0.8;
    private static final int METHODOLOGY_MIN_GUIDE_WORDS = 3;

    private final Set<String> excludedClauses;

    public ClauseEvaluator(@Value("${hazop.compliance.excluded-clauses:}") List<String> excludedClauses) {
        this.excludedClauses = Set.copyOf(excludedClauses.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList());
    }

    public ComplianceStatus evaluate(RegulatoryStandardId standard, RegulatoryClause clause, AnalysisContext context) {
        if (excludedClauses.contains(standard.name() + ":" + clause.id())) {
            return ComplianceStatus.NOT_APPLICABLE;
        }
        if (context.empty() || clause.relevance().isEmpty()) {
            return ComplianceStatus.NOT_ASSESSED;
        }

        boolean anyApplicable = false;
        ComplianceStatus worst = null;
        for (RelevanceArea area : clause.relevance()) {
            ComplianceStatus status = evaluateArea(area, context);
            if (status == ComplianceStatus.NOT_APPLICABLE) {
                continue;
            }
            anyApplicable = true;
            if (status.assessed() && (worst == null || status.ordinal() < worst.ordinal())) {
                worst = status;
            }
        }
        if (!anyApplicable) {
            return ComplianceStatus.NOT_APPLICABLE;
        }
        return worst == null ? ComplianceStatus.NOT_ASSESSED : worst;
    }

    /**
     * Remediation steps for a clause that is not met: one per relevance area that
     * evaluates non-compliant or partially compliant.
     */
    public List<String> remediation(RegulatoryClause clause, AnalysisContext context) {
        List<String> steps = new ArrayList<>();
        for (RelevanceArea area : clause.relevance()) {
            ComplianceStatus status = evaluateArea(area, context);
            if (status == ComplianceStatus.NON_COMPLIANT || status == ComplianceStatus.PARTIALLY_COMPLIANT) {
                steps.add(area.remediation());
            }
        }
        return steps;
    }

    ComplianceStatus evaluateArea(RelevanceArea area, AnalysisContext ctx) {
        return switch (area) {
            case HAZARD_IDENTIFICATION -> byShare(ctx, ctx.withCausesAndConsequences(), HAZARD_ID_COMPLIANT, Double.MIN_VALUE);
            case RISK_ASSESSMENT, RISK_RANKING -> byShare(ctx, ctx.withRiskRanking(), RANKING_COMPLIANT, Double.MIN_VALUE);
            case SAFEGUARDS -> byShare(ctx, ctx.withSafeguards(), SAFEGUARDS_COMPLIANT, SAFEGUARDS_PARTIAL);
            case RECOMMENDATIONS -> recommendations(ctx);
            case LOPA -> lopa(ctx);
            case SIL_DETERMINATION -> silDetermination(ctx);
            case DOCUMENTATION -> documentation(ctx);
            case METHODOLOGY -> methodology(ctx);
            case FOLLOW_UP -> followUp(ctx);
            case MANAGEMENT_OF_CHANGE -> ctx.managementOfChangeMentioned()
                    ? ComplianceStatus.COMPLIANT
                    : ComplianceStatus.NOT_ASSESSED;
            case TEAM_COMPOSITION -> ComplianceStatus.NOT_ASSESSED;
        };
    }

    private static ComplianceStatus byShare(AnalysisContext ctx, int count, double compliant, double partial) {
        if (ctx.entryCount() == 0) {
            return ComplianceStatus.NOT_ASSESSED;
        }
        double share = ctx.share(count);
        if (share >= compliant) {
            return ComplianceStatus.COMPLIANT;
        }
        if (share >= partial) {
            return ComplianceStatus.PARTIALLY_COMPLIANT;
        }
        return ComplianceStatus.NON_COMPLIANT;
    }

    private static ComplianceStatus recommendations(AnalysisContext ctx) {
        if (ctx.entryCount() == 0) {
            return ComplianceStatus.NOT_ASSESSED;
        }
        int high = ctx.highRiskCount();
        int covered = ctx.highRiskWithRecommendations();
        if (high == 0 || covered == high) {
            return ComplianceStatus.COMPLIANT;
        }
        return covered > 0 ? ComplianceStatus.PARTIALLY_COMPLIANT : ComplianceStatus.NON_COMPLIANT;
    }

    private static ComplianceStatus lopa(AnalysisContext ctx) {
        List<GapAnalysis> analyses = ctx.gapAnalyses();
        if (analyses.isEmpty()) {
            return withoutGapAnalyses(ctx);
        }
        boolean anyMarginal = false;
        for (GapAnalysis analysis : analyses) {
            if (analysis.gapStatus() == GapStatus.INADEQUATE) {
                return ComplianceStatus.NON_COMPLIANT;
            }
            anyMarginal |= analysis.gapStatus() == GapStatus.MARGINAL;
        }
        return anyMarginal ? ComplianceStatus.PARTIALLY_COMPLIANT : ComplianceStatus.COMPLIANT;
    }

    private static ComplianceStatus silDetermination(AnalysisContext ctx) {
        if (ctx.gapAnalyses().isEmpty()) {
            return withoutGapAnalyses(ctx);
        }
        for (GapAnalysis analysis : ctx.gapAnalyses()) {
            for (Ipl ipl : analysis.ipls()) {
                if (ipl.type() == IplType.SAFETY_INSTRUMENTED_FUNCTION && ipl.sil() == null) {
                    return ComplianceStatus.PARTIALLY_COMPLIANT;
                }
            }
        }
        return ComplianceStatus.COMPLIANT;
    }

    private static ComplianceStatus withoutGapAnalyses(AnalysisContext ctx) {
        return ctx.lopaCandidateCount() > 0 ? ComplianceStatus.NON_COMPLIANT : ComplianceStatus.NOT_APPLICABLE;
    }

    private static ComplianceStatus documentation(AnalysisContext ctx) {
        if (ctx.entryCount() == 0) {
            return ComplianceStatus.NOT_ASSESSED;
        }
        double completeness = (double) ctx.documentedFields()
                / (ctx.entryCount() * AnalysisContext.DOCUMENTED_FIELDS_PER_ENTRY);
        if (completeness >= DOCUMENTATION_COMPLIANT) {
            return ComplianceStatus.COMPLIANT;
        }
        if (completeness >= DOCUMENTATION_PARTIAL) {
            return ComplianceStatus.PARTIALLY_COMPLIANT;
        }
        return ComplianceStatus.NON_COMPLIANT;
    }

    private static ComplianceStatus methodology(AnalysisContext ctx) {
        if (ctx.entryCount() == 0) {
            return ComplianceStatus.NOT_ASSESSED;
        }
        return ctx.guideWordCount() >= METHODOLOGY_MIN_GUIDE_WORDS && ctx.nodeCount() >= 1
                ? ComplianceStatus.COMPLIANT
                : ComplianceStatus.PARTIALLY_COMPLIANT;
    }

    private static ComplianceStatus followUp(AnalysisContext ctx) {
        if (!ctx.anyRecommendation()) {
            return ComplianceStatus.NOT_ASSESSED;
        }
        int total = ctx.mediumOrHighCount();
        if (total == 0 || (double) ctx.mediumOrHighWithRecommendations() / total >= FOLLOW_UP_COMPLIANT) {
            return ComplianceStatus.COMPLIANT;
        }
        return ComplianceStatus.PARTIALLY_COMPLIANT;
    }
}
