package hazop.risk.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RelevanceArea {
    HAZARD_IDENTIFICATION("Document causes and consequences for every deviation."),
    RISK_ASSESSMENT("Assign severity and likelihood to every analysis entry."),
    RISK_RANKING("Complete the risk ranking of all entries."),
    SAFEGUARDS("Identify existing safeguards for each hazard scenario."),
    RECOMMENDATIONS("Add recommendations for every high-risk entry."),
    LOPA("Perform LOPA for high-severity scenarios and close any protection gap."),
    SIL_DETERMINATION("Declare a SIL for every safety instrumented function."),
    DOCUMENTATION("Fill in causes, consequences, safeguards and recommendations for each entry."),
    TEAM_COMPOSITION("Record the multidisciplinary study team."),
    METHODOLOGY("Apply at least three guide words across the study nodes."),
    FOLLOW_UP("Assign recommendations to medium and high risk entries and track their closure."),
    MANAGEMENT_OF_CHANGE("Route proposed modifications through management of change.");

    private final String remediation;

    RelevanceArea(String remediation) {
        this.remediation = remediation;
    }

    public String remediation() {
        return remediation;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
