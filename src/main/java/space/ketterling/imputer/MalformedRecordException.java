package space.ketterling.imputer;

/**
 * A raw observation document could not be parsed or has none of the known
 * shapes. The flattener skips such documents.
 */
public class MalformedRecordException extends ImputationException {
    private final String source;

    public MalformedRecordException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public MalformedRecordException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
