package space.ketterling.imputer.engine;

/**
 * A slice whose worker threw. The slice itself is left unmodified.
 */
public record SliceFailure(int index, String timestamp, Throwable cause) {
}
