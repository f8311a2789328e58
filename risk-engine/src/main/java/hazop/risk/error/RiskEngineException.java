package hazop.risk.error;

public abstract class RiskEngineException extends RuntimeException {
    private final String errorCode;

    protected RiskEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected RiskEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
