package space.ketterling.imputer.model;

/**
 * A cell the imputation worker left missing.
 */
public record ImputationLogEntry(String timestamp, String worker, String stationId, String feature,
        Reason reason, int quorum) {

    public enum Reason {
        INSUFFICIENT_NEIGHBORS("insufficient-neighbors"),
        DEGENERATE_WEIGHTS("degenerate-weights");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    /**
     * Formats the entry as a single log line, e.g.
     * {@code [2024-05-01T01:00:00+08:00][impute-worker-2] C0A520/AirTemperature_Instantaneous insufficient-neighbors (nbr<3)}.
     */
    public String toLine() {
        String detail = reason == Reason.INSUFFICIENT_NEIGHBORS ? "nbr<" + quorum : "sum(w)=0";
        return "[" + timestamp + "][" + worker + "] " + stationId + "/" + feature + " " + reason.code()
                + " (" + detail + ")";
    }
}
