package hazop.risk.error;

public class ForbiddenException extends RiskEngineException {
    public ForbiddenException(String message) {
        super("FORBIDDEN", message);
    }
}
