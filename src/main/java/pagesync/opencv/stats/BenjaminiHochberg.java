package pagesync.opencv.stats;

import java.util.Arrays;
import java.util.Comparator;

/**
 * False discovery rate control after Benjamini and Hochberg (1995), "Controlling the false
 * discovery rate: a practical and powerful approach to multiple testing".
 */
public final class BenjaminiHochberg {

    private BenjaminiHochberg() {
    }

    /**
     * Adjusts p-values of hypotheses tested together into q-values.
     *
     * @return q-values in the order of {@code pValues}
     */
    public static double[] adjust(double[] pValues) {
        int n = pValues.length;
        Integer[] descending = new Integer[n];
        for (int i = 0; i < n; i++) {
            descending[i] = i;
        }
        Arrays.sort(descending, Comparator.comparingDouble((Integer i) -> pValues[i]).reversed());

        double[] qValues = new double[n];
        double accumulated = Double.POSITIVE_INFINITY;
        for (int position = 0; position < n; position++) {
            int rank = n - position;
            int original = descending[position];
            accumulated = Math.min(accumulated, pValues[original] * n / rank);
            qValues[original] = Math.max(0, Math.min(1, accumulated));
        }
        return qValues;
    }
}
