package space.ketterling.imputer;

import java.util.List;

import space.ketterling.imputer.engine.SliceFailure;

/**
 * Raised after a run in which at least one slice failed. The outputs of the run
 * have already been written when this is thrown.
 */
public class ImputationRunException extends ImputationException {
    private final List<SliceFailure> failures;

    public ImputationRunException(List<SliceFailure> failures) {
        super(summary(failures), failures.isEmpty() ? null : failures.get(0).cause());
        this.failures = List.copyOf(failures);
        for (int i = 1; i < failures.size(); i++) {
            addSuppressed(failures.get(i).cause());
        }
    }

    public List<SliceFailure> failures() {
        return failures;
    }

    private static String summary(List<SliceFailure> failures) {
        StringBuilder sb = new StringBuilder();
        sb.append(failures.size()).append(" slice(s) failed:");
        int shown = 0;
        for (SliceFailure f : failures) {
            if (shown++ == 10) {
                sb.append(" ...");
                break;
            }
            sb.append(' ').append(f.timestamp());
        }
        return sb.toString();
    }
}
