package hazop.risk.compliance;

import hazop.risk.domain.LopaTrigger;
import hazop.risk.domain.RiskBand;
import hazop.risk.domain.RiskEntry;
import hazop.risk.domain.RiskEntryScorer;
import hazop.risk.lopa.GapAnalysis;

import java.util.HashSet;
import java.util.Locale;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Counts over one analysis' entries and gap analyses that the clause rules read.
 */
public record AnalysisContext(
        int entryCount,
        int nodeCount,
        int guideWordCount,
        int withCausesAndConsequences,
        int withRiskRanking,
        int withSafeguards,
        int highRiskCount,
        int highRiskWithRecommendations,
        int mediumOrHighCount,
        int mediumOrHighWithRecommendations,
        int lopaCandidateCount,
        int documentedFields,
        boolean anyRecommendation,
        boolean managementOfChangeMentioned,
        List<GapAnalysis> gapAnalyses
) {
    static final int DOCUMENTED_FIELDS_PER_ENTRY = 4;

    private static final Pattern MOC = Pattern.compile(
            "management of change|\\bmoc\\b|change control", Pattern.CASE_INSENSITIVE);

    public AnalysisContext {
        gapAnalyses = List.copyOf(gapAnalyses);
    }

    public static AnalysisContext of(List<RiskEntry> entries, List<GapAnalysis> gapAnalyses, RiskEntryScorer scorer) {
        Set<String> nodes = new HashSet<>();
        Set<String> guideWords = new HashSet<>();
        int causesAndConsequences = 0;
        int ranked = 0;
        int safeguarded = 0;
        int high = 0;
        int highWithRecs = 0;
        int mediumOrHigh = 0;
        int mediumOrHighWithRecs = 0;
        int lopaCandidates = 0;
        int documented = 0;
        boolean anyRecommendation = false;
        boolean moc = false;

        for (RiskEntry entry : entries) {
            if (entry.nodeId() != null) {
                nodes.add(entry.nodeId());
            }
            if (entry.guideWord() != null) {
                guideWords.add(entry.guideWord().toLowerCase(Locale.ROOT));
            }
            boolean hasRecs = !entry.recommendations().isEmpty();
            if (!entry.causes().isEmpty() && !entry.consequences().isEmpty()) {
                causesAndConsequences++;
            }
            if (!entry.safeguards().isEmpty()) {
                safeguarded++;
            }
            documented += filled(entry);
            anyRecommendation |= hasRecs;
            for (String recommendation : entry.recommendations()) {
                moc |= recommendation != null && MOC.matcher(recommendation).find();
            }

            RiskBand band = scorer.bandOf(entry);
            if (band == null) {
                continue;
            }
            ranked++;
            if (band != RiskBand.LOW) {
                mediumOrHigh++;
                mediumOrHighWithRecs += hasRecs ? 1 : 0;
            }
            if (band == RiskBand.HIGH) {
                high++;
                highWithRecs += hasRecs ? 1 : 0;
            }
            LopaTrigger trigger = scorer.lopaTrigger(entry);
            if (trigger.required() || trigger.recommended()) {
                lopaCandidates++;
            }
        }

        return new AnalysisContext(
                entries.size(),
                nodes.size(),
                guideWords.size(),
                causesAndConsequences,
                ranked,
                safeguarded,
                high,
                highWithRecs,
                mediumOrHigh,
                mediumOrHighWithRecs,
                lopaCandidates,
                documented,
                anyRecommendation,
                moc,
                gapAnalyses
        );
    }

    public boolean empty() {
        return entryCount == 0 && gapAnalyses.isEmpty();
    }

    public double share(int count) {
        return entryCount == 0 ? 0 : (double) count / entryCount;
    }

    private static int filled(RiskEntry entry) {
        int n = 0;
        n += entry.causes().isEmpty() ? 0 : 1;
        n += entry.consequences().isEmpty() ? 0 : 1;
        n += entry.safeguards().isEmpty() ? 0 : 1;
        n += entry.recommendations().isEmpty() ? 0 : 1;
        return n;
    }
}
