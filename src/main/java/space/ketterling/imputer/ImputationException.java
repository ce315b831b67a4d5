package space.ketterling.imputer;

/**
 * Base type for failures raised by the flatten/impute pipeline.
 */
public class ImputationException extends RuntimeException {
    public ImputationException(String message) {
        super(message);
    }

    public ImputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
