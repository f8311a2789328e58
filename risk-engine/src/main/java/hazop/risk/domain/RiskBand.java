package hazop.risk.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskBand {
    LOW(1, 20),
    MEDIUM(21, 60),
    HIGH(61, 125);

    private final int minScore;
    private final int maxScore;

    RiskBand(int minScore, int maxScore) {
        this.minScore = minScore;
        this.maxScore = maxScore;
    }

    public int minScore() {
        return minScore;
    }

    public int maxScore() {
        return maxScore;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
