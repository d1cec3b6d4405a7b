package com.fleetsentinel.core.stats;

/**
 * Mean and population standard deviation of a trailing metric window.
 *
 * <p>
 * Non-finite values (NaN, ±infinity) are dropped before anything is computed
 * so that one corrupt sample cannot skew the mean or collapse the variance.
 * {@link #getCount()} reports the number of values actually used.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowStatistics {

    private static final WindowStatistics EMPTY = new WindowStatistics(0, 0.0, 0.0);

    private final int count;
    private final double mean;
    private final double stdDev;

    private WindowStatistics(int count, double mean, double stdDev) {
        this.count = count;
        this.mean = mean;
        this.stdDev = stdDev;
    }

    /**
     * Compute statistics over the finite members of {@code values}.
     *
     * @param values window values; {@code null} is treated as empty
     * @return statistics; count 0 with mean and standard deviation 0 when no
     *         finite value is present
     */
    public static WindowStatistics of(double[] values) {
        if (values == null || values.length == 0) {
            return EMPTY;
        }

        int n = 0;
        double sum = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                sum += v;
                n++;
            }
        }
        if (n == 0) {
            return EMPTY;
        }
        double mean = sum / n;

        double sumSquaredDiff = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                double diff = v - mean;
                sumSquaredDiff += diff * diff;
            }
        }
        return new WindowStatistics(n, mean, Math.sqrt(sumSquaredDiff / n));
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    /**
     * Standardised distance of {@code value} from the window mean.
     *
     * <p>
     * With a zero standard deviation any non-zero deviation yields a signed
     * infinity and a zero deviation yields 0.
     * </p>
     *
     * @param value value under test
     * @return {@code (value - mean) / stdDev}
     */
    public double deviationScore(double value) {
        double deviation = value - mean;
        if (stdDev == 0) {
            if (deviation == 0) {
                return 0.0;
            }
            return deviation > 0 ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        }
        return deviation / stdDev;
    }

    @Override
    public String toString() {
        return "WindowStatistics{count=" + count + ", mean=" + mean + ", stdDev=" + stdDev + '}';
    }
}
