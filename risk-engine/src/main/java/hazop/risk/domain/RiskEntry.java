package hazop.risk.domain;

import java.util.List;

/**
 * A HazOp deviation record as supplied by the analysis workflow. Severity and
 * likelihood are null until the entry has been risk-ranked.
 */
public record RiskEntry(
        String id,
        String analysisId,
        String nodeId,
        String guideWord,
        String parameter,
        String deviation,
        List<String> causes,
        List<String> consequences,
        List<String> safeguards,
        List<String> recommendations,
        Integer severity,
        Integer likelihood,
        Integer detectability
) {
    public RiskEntry {
        causes = causes == null ? List.of() : List.copyOf(causes);
        consequences = consequences == null ? List.of() : List.copyOf(consequences);
        safeguards = safeguards == null ? List.of() : List.copyOf(safeguards);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public boolean hasRiskRanking() {
        return severity != null && likelihood != null;
    }
}
