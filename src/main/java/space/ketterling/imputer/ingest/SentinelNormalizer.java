package space.ketterling.imputer.ingest;

import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts the observation network's "no data" placeholder codes into missing
 * values.
 *
 * <p>
 * Matching is exact floating-point equality against a closed list; a legitimate
 * reading such as {@code -9.4} or {@code 0} always passes through.
 * </p>
 */
public final class SentinelNormalizer {
    private static final Set<Double> SENTINELS = Set.of(
            -9.5, -9.8, -9.95,
            -99.5, -99.7, -99.9, -99.95,
            -999.5,
            -9995.0, -9999.5);

    private SentinelNormalizer() {
    }

    public static boolean isSentinel(double v) {
        return SENTINELS.contains(v);
    }

    /**
     * Returns null for sentinels, otherwise the value unchanged.
     */
    public static Double normalize(Double v) {
        if (v == null)
            return null;
        return isSentinel(v) ? null : v;
    }

    /**
     * Reads a raw JSON field as a reading. Null, absent and non-numeric text become
     * missing; numeric text is parsed before the sentinel check.
     */
    public static Double normalize(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return null;
        if (node.isNumber())
            return normalize(node.doubleValue());
        if (node.isTextual())
            return normalize(parseMaybeNumber(node.asText()));
        return null;
    }

    /**
     * Parses a double, returning null if the value is missing or invalid.
     */
    static Double parseMaybeNumber(String s) {
        if (s == null)
            return null;
        s = s.trim();
        if (s.isEmpty())
            return null;
        try {
            double d = Double.parseDouble(s);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
