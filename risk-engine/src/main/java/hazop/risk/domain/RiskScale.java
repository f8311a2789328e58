package hazop.risk.domain;

import hazop.risk.error.ValidationException;

import java.util.Map;

/**
 * The shared 1-5 ordinal scale for severity, likelihood and detectability.
 */
public final class RiskScale {
    public static final int MIN = 1;
    public static final int MAX = 5;

    private static final Map<Integer, String> SEVERITY_LABELS = Map.of(
            1, "Negligible",
            2, "Minor",
            3, "Moderate",
            4, "Major",
            5, "Catastrophic"
    );

    private static final Map<Integer, String> LIKELIHOOD_LABELS = Map.of(
            1, "Rare",
            2, "Unlikely",
            3, "Possible",
            4, "Likely",
            5, "Almost Certain"
    );

    private RiskScale() {
    }

    public static boolean inRange(int value) {
        return value >= MIN && value <= MAX;
    }

    public static int require(String field, Integer value) {
        if (value == null) {
            throw ValidationException.forField(field, field + " is required");
        }
        if (!inRange(value)) {
            throw ValidationException.forField(field,
                    field + " must be between " + MIN + " and " + MAX + ", got " + value);
        }
        return value;
    }

    public static String severityLabel(int severity) {
        return SEVERITY_LABELS.get(severity);
    }

    public static String likelihoodLabel(int likelihood) {
        return LIKELIHOOD_LABELS.get(likelihood);
    }
}
