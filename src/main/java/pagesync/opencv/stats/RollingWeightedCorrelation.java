package pagesync.opencv.stats;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Rolling weighted Pearson's correlation coefficient r over the latest {@code windowSize} batches
 * of paired observations, with a significance test against the null hypothesis r = 0.
 *
 * <p>Each retained batch keeps its own sums. The running sums always equal the sums over the
 * retained batches: a batch is added once when it is committed and subtracted once, with the very
 * same values, when it is evicted. The running sums are recomputed from the per-batch sums every
 * {@value #RECOMPUTE_INTERVAL} evictions so that rounding errors do not pile up.
 *
 * <p>Only positive association counts as evidence, so r is clipped to [0, 1].
 */
@Slf4j
public class RollingWeightedCorrelation {

    static final int RECOMPUTE_INTERVAL = 1024;

    private final Integer windowSize;
    private final RingBuffer<WeightedSums> batches;
    private WeightedSums sums = WeightedSums.ZERO;
    private int evictions = 0;

    public RollingWeightedCorrelation() {
        this(null);
    }

    /**
     * @param windowSize the number of retained batches, {@code null} for unbounded
     * @throws IllegalArgumentException if the window size is less than one
     */
    public RollingWeightedCorrelation(Integer windowSize) {
        if (windowSize != null && windowSize < 1) {
            throw new IllegalArgumentException("The window size must not be less than one, got " + windowSize);
        }
        this.windowSize = windowSize;
        this.batches = new RingBuffer<>(windowSize);
    }

    public void reset() {
        batches.clear();
        sums = WeightedSums.ZERO;
        evictions = 0;
    }

    /**
     * Computes r and its p-value over the retained batches plus the given one.
     *
     * @param xs      observations of the first variable
     * @param ys      observations of the second variable
     * @param weights non-negative observation weights
     * @param commit  whether the batch becomes part of the window; when {@code false} nothing
     *                changes and only the hypothetical result is returned
     * @throws IllegalArgumentException if the arrays differ in length or a weight is negative or
     *                                  not finite
     */
    public CorrelationResult observe(double[] xs, double[] ys, double[] weights, boolean commit) {
        if (xs.length != ys.length || ys.length != weights.length) {
            throw new IllegalArgumentException(String.format(
                    "Arrays containing bivariate observations must have the same length, got %d, %d and %d",
                    xs.length, ys.length, weights.length));
        }
        for (double weight : weights) {
            if (!(weight >= 0) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("Observation weights must be finite and non-negative, got " + weight);
            }
        }

        WeightedSums batch = WeightedSums.of(xs, ys, weights);
        WeightedSums updated = sums;
        if (batches.isFull()) {
            updated = updated.minus(batches.peekOldest());
        }
        updated = updated.plus(batch);
        CorrelationResult result = correlate(updated);

        if (commit) {
            WeightedSums evicted = batches.push(batch);
            sums = updated;
            if (evicted != null && ++evictions % RECOMPUTE_INTERVAL == 0) {
                recomputeSums();
            }
        }
        return result;
    }

    public CorrelationResult observe(double[] xs, double[] ys, double[] weights) {
        return observe(xs, ys, weights, true);
    }

    public Integer getWindowSize() {
        return windowSize;
    }

    /**
     * The number of retained batches.
     */
    public int getWindowLength() {
        return batches.size();
    }

    public WeightedSums getSums() {
        return sums;
    }

    void recomputeSums() {
        WeightedSums recomputed = WeightedSums.ZERO;
        for (WeightedSums batch : batches) {
            recomputed = recomputed.plus(batch);
        }
        log.trace("recomputed sums " + sums + " -> " + recomputed);
        sums = recomputed;
    }

    static CorrelationResult correlate(WeightedSums sums) {
        double weightsSum = sums.getWeights();
        double degreesOfFreedom = weightsSum - 2;
        if (!(degreesOfFreedom > 0)) {
            return CorrelationResult.NO_EVIDENCE;
        }

        double meanX = sums.getX() / weightsSum;
        double stdX = Math.sqrt(Math.max(0, sums.getX2() / weightsSum - meanX * meanX));
        double meanY = sums.getY() / weightsSum;
        double stdY = Math.sqrt(Math.max(0, sums.getY2() / weightsSum - meanY * meanY));
        double covariance = sums.getXy() / weightsSum - meanX * meanY;
        if (!(stdX > 0 && stdY > 0)) {
            return CorrelationResult.NO_EVIDENCE;
        }

        double r = Math.max(0, Math.min(1, covariance / (stdX * stdY)));
        if (r >= 1) {
            return new CorrelationResult(1, 0);
        }
        double t = r * Math.sqrt(degreesOfFreedom) / Math.sqrt(1 - r * r);
        TDistribution distribution = new TDistribution((RandomGenerator) null, degreesOfFreedom);
        double p = 2 * distribution.cumulativeProbability(-Math.abs(t));
        return new CorrelationResult(r, Math.max(0, Math.min(1, p)));
    }
}
