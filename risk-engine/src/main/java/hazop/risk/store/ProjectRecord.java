package hazop.risk.store;

import java.util.UUID;

public record ProjectRecord(UUID id, String name) {}
