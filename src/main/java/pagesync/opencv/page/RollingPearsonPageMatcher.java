package pagesync.opencv.page;

import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import pagesync.opencv.frame.Frame;
import pagesync.opencv.frame.Screen;
import pagesync.opencv.quadrangle.ConvexQuadrangle;
import pagesync.opencv.quadrangle.TrackedQuadrangle;
import pagesync.opencv.stats.BenjaminiHochberg;
import pagesync.opencv.stats.CorrelationResult;
import pagesync.opencv.stats.RollingWeightedCorrelation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Page matcher based on a rolling weighted Pearson's correlation coefficient r.
 *
 * <p>Every frame, a random sample X of pixel intensities is taken from each screen, and a sample Y
 * from the same positions of every page aligned with the screen. The smaller of the two alpha
 * values weighs each pixel. A rolling window of consecutive frames increases the sample size. The
 * page with the largest r is a candidate; it is detected when its r reaches the correlation
 * threshold and the test of r = 0, corrected for testing all pages at once, is significant.
 *
 * <p>Each (screen, page) pair has its own window, but only the window of the candidate page
 * advances in a frame. A gap in frame numbers clears all windows.
 */
@Slf4j
public class RollingPearsonPageMatcher implements PageMatcher {

    private final List<DocumentPage> pages;
    private final PageAligner aligner;
    private final Integer windowSize;
    private final int sampleSize;
    private final double correlationThreshold;
    private final double significanceLevel;
    private final boolean parallel;
    private final Random random;

    private final Map<Integer, RollingWeightedCorrelation[]> correlations = new HashMap<>();
    private Integer previousFrameNumber;

    /**
     * @param pages                the candidate pages
     * @param aligner              maps pages into screen coordinates
     * @param windowSize           the number of frames in a rolling window, {@code null} for unbounded
     * @param sampleSize           the number of pixels sampled from a screen per frame
     * @param correlationThreshold the minimum r of a detected page
     * @param significanceLevel    the maximum q-value of a detected page
     * @param parallel             evaluate the pages of a screen in parallel
     * @param random               source of the pixel samples
     */
    public RollingPearsonPageMatcher(Collection<DocumentPage> pages, PageAligner aligner, Integer windowSize,
                                     int sampleSize, double correlationThreshold, double significanceLevel,
                                     boolean parallel, Random random) {
        if (pages.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate page is required");
        }
        if (windowSize != null && windowSize < 1) {
            throw new IllegalArgumentException("The window size must not be less than one, got " + windowSize);
        }
        if (sampleSize < 1) {
            throw new IllegalArgumentException("The sample size must not be less than one, got " + sampleSize);
        }
        this.pages = new ArrayList<>(pages);
        this.aligner = aligner;
        this.windowSize = windowSize;
        this.sampleSize = sampleSize;
        this.correlationThreshold = correlationThreshold;
        this.significanceLevel = significanceLevel;
        this.parallel = parallel;
        this.random = random;
    }

    @Override
    public Map<ConvexQuadrangle, Optional<DocumentPage>> detect(Frame frame,
                                                                Collection<TrackedQuadrangle> appeared,
                                                                Collection<TrackedQuadrangle> existing,
                                                                Collection<TrackedQuadrangle> disappeared) {
        for (TrackedQuadrangle screen : disappeared) {
            correlations.remove(screen.getMovingQuadrangle().getId());
        }

        if (previousFrameNumber != null && frame.getNumber() != previousFrameNumber + 1) {
            log.debug("discontinuity between frames " + previousFrameNumber + " and " + frame.getNumber()
                    + ", clearing " + correlations.size() + " rolling windows");
            for (RollingWeightedCorrelation[] trackCorrelations : correlations.values()) {
                for (RollingWeightedCorrelation correlation : trackCorrelations) {
                    correlation.reset();
                }
            }
        }
        previousFrameNumber = frame.getNumber();

        Map<ConvexQuadrangle, Optional<DocumentPage>> detectedPages = new LinkedHashMap<>();
        List<TrackedQuadrangle> screens = new ArrayList<>(appeared);
        screens.addAll(existing);
        for (TrackedQuadrangle tracked : screens) {
            Screen screen = new Screen(frame, tracked.getQuadrangle());
            RollingWeightedCorrelation[] trackCorrelations = correlations.computeIfAbsent(
                    tracked.getMovingQuadrangle().getId(), id -> newCorrelations());
            try {
                DocumentPage page = detectPage(screen, trackCorrelations);
                detectedPages.put(tracked.getQuadrangle(), Optional.ofNullable(page));
            } finally {
                screen.release();
            }
        }
        return detectedPages;
    }

    RollingWeightedCorrelation[] getCorrelations(int trackId) {
        return correlations.get(trackId);
    }

    int getTrackCount() {
        return correlations.size();
    }

    private RollingWeightedCorrelation[] newCorrelations() {
        RollingWeightedCorrelation[] trackCorrelations = new RollingWeightedCorrelation[pages.size()];
        for (int i = 0; i < trackCorrelations.length; i++) {
            trackCorrelations[i] = new RollingWeightedCorrelation(windowSize);
        }
        return trackCorrelations;
    }

    private DocumentPage detectPage(Screen screen, RollingWeightedCorrelation[] trackCorrelations) {
        int[] rows = new int[sampleSize];
        int[] columns = new int[sampleSize];
        for (int i = 0; i < sampleSize; i++) {
            rows[i] = random.nextInt(screen.getHeight());
            columns[i] = random.nextInt(screen.getWidth());
        }

        double[] screenPixels = new double[sampleSize];
        double[] screenAlpha = new double[sampleSize];
        samplePixels(screen.getImage(), rows, columns, screenPixels, screenAlpha);

        int numPages = pages.size();
        CorrelationResult[] results = new CorrelationResult[numPages];
        double[][] pagePixels = new double[numPages][];
        double[][] pixelWeights = new double[numPages][];
        IntStream pageIndexes = IntStream.range(0, numPages);
        (parallel ? pageIndexes.parallel() : pageIndexes).forEach(pageIndex -> {
            DocumentPage page = pages.get(pageIndex);
            double[] pixels = new double[sampleSize];
            double[] alpha = new double[sampleSize];
            Mat pageImage = aligner.align(screen, page);
            try {
                if (pageImage.width() != screen.getWidth() || pageImage.height() != screen.getHeight()) {
                    throw new IllegalStateException(String.format("Page %s aligned to %dx%d, screen is %dx%d",
                            page, pageImage.width(), pageImage.height(), screen.getWidth(), screen.getHeight()));
                }
                samplePixels(pageImage, rows, columns, pixels, alpha);
            } finally {
                if (pageImage != page.getImage()) {
                    pageImage.release();
                }
            }

            double[] weights = new double[sampleSize];
            for (int i = 0; i < sampleSize; i++) {
                weights[i] = Math.min(screenAlpha[i], alpha[i]) / 255.0;
            }
            pagePixels[pageIndex] = pixels;
            pixelWeights[pageIndex] = weights;
            results[pageIndex] = trackCorrelations[pageIndex].observe(screenPixels, pixels, weights, false);
        });

        int best = 0;
        double[] pValues = new double[numPages];
        for (int pageIndex = 0; pageIndex < numPages; pageIndex++) {
            pValues[pageIndex] = results[pageIndex].getPValue();
            if (results[pageIndex].getCorrelation() > results[best].getCorrelation()) {
                best = pageIndex;
            }
        }
        double correlation = results[best].getCorrelation();
        double qValue = BenjaminiHochberg.adjust(pValues)[best];
        DocumentPage candidate = pages.get(best);
        trackCorrelations[best].observe(screenPixels, pagePixels[best], pixelWeights[best], true);

        log.trace(String.format("%s: best page %s (r=%.4f, q=%.4g)", screen, candidate, correlation, qValue));
        if (qValue <= significanceLevel && correlation >= correlationThreshold) {
            return candidate;
        }
        return null;
    }

    /**
     * Reads the intensity and the alpha of an RGBA image at the given positions.
     */
    static void samplePixels(Mat rgbaImage, int[] rows, int[] columns, double[] intensities, double[] alphas) {
        Mat intensity = new Mat();
        Imgproc.cvtColor(rgbaImage, intensity, Imgproc.COLOR_RGBA2GRAY);
        Mat alpha = new Mat();
        Core.extractChannel(rgbaImage, alpha, 3);
        int width = rgbaImage.width();
        byte[] intensityData = new byte[(int) intensity.total()];
        byte[] alphaData = new byte[(int) alpha.total()];
        intensity.get(0, 0, intensityData);
        alpha.get(0, 0, alphaData);
        intensity.release();
        alpha.release();

        for (int i = 0; i < rows.length; i++) {
            int offset = rows[i] * width + columns[i];
            intensities[i] = intensityData[offset] & 0xFF;
            alphas[i] = alphaData[offset] & 0xFF;
        }
    }
}
