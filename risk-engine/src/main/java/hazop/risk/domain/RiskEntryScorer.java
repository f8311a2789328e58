package hazop.risk.domain;

import hazop.risk.error.ValidationException;
import org.springframework.stereotype.Component;

@Component
public class RiskEntryScorer {
    private static final int LOPA_REQUIRED_SEVERITY = 4;

    public int score(int severity, int likelihood, Integer detectability) {
        RiskScale.require("severity", severity);
        RiskScale.require("likelihood", likelihood);
        int detect = detectability == null ? 1 : RiskScale.require("detectability", detectability);
        return severity * likelihood * detect;
    }

    public RiskBand band(int score) {
        for (RiskBand band : RiskBand.values()) {
            if (score >= band.minScore() && score <= band.maxScore()) {
                return band;
            }
        }
        throw ValidationException.forField("score", "score must be between 1 and 125, got " + score);
    }

    /**
     * Scores a ranked entry; null when the entry has no ranking yet.
     */
    public RiskBand bandOf(RiskEntry entry) {
        if (!entry.hasRiskRanking()) {
            return null;
        }
        return band(score(entry.severity(), entry.likelihood(), entry.detectability()));
    }

    public LopaTrigger lopaTrigger(RiskEntry entry) {
        if (!entry.hasRiskRanking()) {
            return new LopaTrigger(false, false, "LOPA not required: entry has no risk ranking");
        }
        int severity = entry.severity();
        if (severity >= LOPA_REQUIRED_SEVERITY) {
            return new LopaTrigger(true, true, "LOPA required: severity level " + severity);
        }
        if (bandOf(entry) == RiskBand.HIGH) {
            return new LopaTrigger(false, true, "LOPA recommended: risk band is high");
        }
        return new LopaTrigger(false, false, "LOPA not required for this risk level");
    }
}
