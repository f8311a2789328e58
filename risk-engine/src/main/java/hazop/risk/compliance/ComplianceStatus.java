package hazop.risk.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Clause and summary status. Declaration order of the three assessed values runs
 * from worst to best and is used to pick the worst area result of a clause.
 */
public enum ComplianceStatus {
    NON_COMPLIANT,
    PARTIALLY_COMPLIANT,
    COMPLIANT,
    NOT_APPLICABLE,
    NOT_ASSESSED;

    public boolean assessed() {
        return this == COMPLIANT || this == PARTIALLY_COMPLIANT || this == NON_COMPLIANT;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
