package space.ketterling.imputer.ingest;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The top-level layouts a raw daily observation document can take.
 */
public enum RawShape {
    /** {@code {"data": [entry, ...]}} */
    WRAPPED,
    /** {@code [entry, ...]} */
    BARE_LIST,
    /** {@code {"StationID": ..., "dts": [...]}} */
    SINGLE_ENTRY;

    /**
     * Detects the layout of a parsed document, or returns null if it matches none.
     */
    public static RawShape detect(JsonNode root) {
        if (root == null)
            return null;
        if (root.isObject() && root.has("data"))
            return WRAPPED;
        if (root.isArray())
            return BARE_LIST;
        if (root.isObject() && root.has("StationID") && root.has("dts"))
            return SINGLE_ENTRY;
        return null;
    }
}
