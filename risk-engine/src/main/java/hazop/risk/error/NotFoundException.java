package hazop.risk.error;

public class NotFoundException extends RiskEngineException {
    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
