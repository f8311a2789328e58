package hazop.risk.store;

import java.util.UUID;

public record AnalysisRecord(UUID id, UUID projectId, String name, String status) {}
