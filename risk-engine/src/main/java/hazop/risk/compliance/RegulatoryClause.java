package hazop.risk.compliance;

import java.util.List;

public record RegulatoryClause(String id, String title, boolean mandatory, List<RelevanceArea> relevance) {
    public RegulatoryClause {
        relevance = relevance == null ? List.of() : List.copyOf(relevance);
    }
}
