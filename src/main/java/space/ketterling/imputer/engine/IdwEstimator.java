package space.ketterling.imputer.engine;

import java.util.OptionalDouble;

/**
 * Inverse-distance-weighted average with weight {@code 1 / d^power}.
 */
public final class IdwEstimator {
    private final double power;
    private final ZeroDistancePolicy zeroDistance;

    public IdwEstimator(double power, ZeroDistancePolicy zeroDistance) {
        this.power = power;
        this.zeroDistance = zeroDistance;
    }

    public double weight(double distanceKm) {
        return distanceKm > 0 ? 1.0 / Math.pow(distanceKm, power) : 0.0;
    }

    /**
     * Estimates a value from the first {@code n} candidates.
     *
     * @return the estimate, or empty when the weights sum to zero
     */
    public OptionalDouble estimate(double[] values, double[] distancesKm, int n) {
        if (zeroDistance == ZeroDistancePolicy.EXACT) {
            double sum = 0;
            int colocated = 0;
            for (int i = 0; i < n; i++) {
                if (distancesKm[i] <= 0) {
                    sum += values[i];
                    colocated++;
                }
            }
            if (colocated > 0)
                return OptionalDouble.of(sum / colocated);
        }

        double num = 0;
        double den = 0;
        for (int i = 0; i < n; i++) {
            double w = weight(distancesKm[i]);
            num += values[i] * w;
            den += w;
        }
        if (!(den > 0) || Double.isInfinite(den))
            return OptionalDouble.empty();
        double est = num / den;
        return Double.isFinite(est) ? OptionalDouble.of(est) : OptionalDouble.empty();
    }

    public double power() {
        return power;
    }

    public ZeroDistancePolicy zeroDistance() {
        return zeroDistance;
    }
}
