package hazop.risk.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Weight of an unmet clause. Declaration order runs from most to least severe.
 */
public enum GapSeverity {
    CRITICAL,
    MAJOR,
    MINOR;

    static GapSeverity of(boolean mandatoryStandard, boolean mandatoryClause) {
        if (mandatoryStandard && mandatoryClause) {
            return CRITICAL;
        }
        if (mandatoryStandard || mandatoryClause) {
            return MAJOR;
        }
        return MINOR;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
