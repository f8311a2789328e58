package hazop.risk.error;

public class ComputationException extends RiskEngineException {
    public ComputationException(String message) {
        super("INTERNAL_ERROR", message);
    }

    public ComputationException(String message, Throwable cause) {
        super("INTERNAL_ERROR", message, cause);
    }
}
