package hazop.risk.api.model;

import hazop.risk.compliance.RegulatoryStandard;
import hazop.risk.compliance.RegulatoryStandardId;

public record StandardInfo(RegulatoryStandardId id, String name, String title, boolean mandatory, int clauseCount) {
    public static StandardInfo of(RegulatoryStandard standard) {
        return new StandardInfo(
                standard.id(),
                standard.name(),
                standard.title(),
                standard.mandatory(),
                standard.clauses().size()
        );
    }
}
