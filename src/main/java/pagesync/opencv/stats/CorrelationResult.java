package pagesync.opencv.stats;

import lombok.Value;

/**
 * A correlation coefficient and the p-value of the test against zero correlation.
 */
@Value
public class CorrelationResult {

    public static final CorrelationResult NO_EVIDENCE = new CorrelationResult(0, 0);

    double correlation;
    double pValue;
}
