package hazop.risk.error;

import java.util.List;

/**
 * Input that fails a range or format rule. Carries one violation per offending
 * field so callers can report all of them at once.
 */
public class ValidationException extends RiskEngineException {
    private final List<FieldViolation> violations;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<FieldViolation> violations) {
        super("VALIDATION_ERROR", message);
        this.violations = List.copyOf(violations);
    }

    public static ValidationException forField(String field, String message) {
        return new ValidationException(message, List.of(new FieldViolation(field, message)));
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
