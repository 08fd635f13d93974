package com.geoshard.domain.model;

/**
 * Balance metrics over per-shard loads.
 */
public final class LoadStatistics {

    private LoadStatistics() {
    }

    /**
     * Population standard deviation: sqrt of the mean squared deviation from the mean.
     * Zero for an empty array.
     */
    public static double standardDeviation(long[] loads) {
        if (loads.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (long load : loads) {
            sum += load;
        }
        double mean = sum / loads.length;

        double squaredDeviations = 0.0;
        for (long load : loads) {
            double deviation = load - mean;
            squaredDeviations += deviation * deviation;
        }
        return Math.sqrt(squaredDeviations / loads.length);
    }
}
