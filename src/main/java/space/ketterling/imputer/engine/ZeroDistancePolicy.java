package space.ketterling.imputer.engine;

/**
 * How a candidate neighbor at exactly zero distance is weighted.
 */
public enum ZeroDistancePolicy {
    /**
     * Weight 0: a co-located neighbor contributes nothing. If every candidate is
     * co-located the weight sum is zero and the cell is left missing.
     */
    EXCLUDE,
    /**
     * A co-located reading is taken as exact: the estimate is the mean of all
     * co-located candidate values and farther candidates are ignored.
     */
    EXACT
}
