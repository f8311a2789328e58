package hazop.risk.compliance;

import java.util.List;

public record RegulatoryStandard(
        RegulatoryStandardId id,
        String name,
        String title,
        boolean mandatory,
        List<RegulatoryClause> clauses
) {
    public RegulatoryStandard {
        clauses = clauses == null ? List.of() : List.copyOf(clauses);
    }
}
