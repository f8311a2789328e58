package hazop.risk.error;

public record FieldViolation(String field, String message) {}
