package pagesync.opencv.stats;

import lombok.Getter;

/**
 * The six sums a weighted Pearson correlation needs: Σw·x, Σw·x², Σw·y, Σw·y², Σw and Σw·x·y.
 */
@Getter
public final class WeightedSums {

    public static final WeightedSums ZERO = new WeightedSums(0, 0, 0, 0, 0, 0);

    private final double x;
    private final double x2;
    private final double y;
    private final double y2;
    private final double weights;
    private final double xy;

    WeightedSums(double x, double x2, double y, double y2, double weights, double xy) {
        this.x = x;
        this.x2 = x2;
        this.y = y;
        this.y2 = y2;
        this.weights = weights;
        this.xy = xy;
    }

    public static WeightedSums of(double[] xs, double[] ys, double[] ws) {
        double x = 0, x2 = 0, y = 0, y2 = 0, weights = 0, xy = 0;
        for (int i = 0; i < ws.length; i++) {
            double w = ws[i];
            x += w * xs[i];
            x2 += w * xs[i] * xs[i];
            y += w * ys[i];
            y2 += w * ys[i] * ys[i];
            weights += w;
            xy += w * xs[i] * ys[i];
        }
        return new WeightedSums(x, x2, y, y2, weights, xy);
    }

    public WeightedSums plus(WeightedSums other) {
        return new WeightedSums(x + other.x, x2 + other.x2, y + other.y, y2 + other.y2,
                weights + other.weights, xy + other.xy);
    }

    public WeightedSums minus(WeightedSums other) {
        return new WeightedSums(x - other.x, x2 - other.x2, y - other.y, y2 - other.y2,
                weights - other.weights, xy - other.xy);
    }

    public boolean isZero() {
        return x == 0 && x2 == 0 && y == 0 && y2 == 0 && weights == 0 && xy == 0;
    }

    @Override
    public String toString() {
        return String.format("Σw=%.3f Σwx=%.3f Σwx²=%.3f Σwy=%.3f Σwy²=%.3f Σwxy=%.3f",
                weights, x, x2, y, y2, xy);
    }
}
