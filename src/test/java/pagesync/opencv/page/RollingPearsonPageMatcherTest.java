package pagesync.opencv.page;

import nu.pattern.OpenCV;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import pagesync.opencv.TestImages;
import pagesync.opencv.frame.Frame;
import pagesync.opencv.quadrangle.ConvexQuadrangle;
import pagesync.opencv.quadrangle.QuadrangleTracker;
import pagesync.opencv.quadrangle.RTreeDequeQuadrangleTracker;
import pagesync.opencv.quadrangle.TrackerUpdate;
import pagesync.opencv.stats.RollingWeightedCorrelation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RollingPearsonPageMatcherTest {

    private static final int WIDTH = 64;
    private static final int HEIGHT = 48;
    private static final ConvexQuadrangle SCREEN = ConvexQuadrangle.ofRectangle(0, 0, WIDTH, HEIGHT);

    private Mat frameImage;
    private List<DocumentPage> pages;
    private DocumentPage shownPage;

    @BeforeAll
    static void loadOpenCv() {
        OpenCV.loadLocally();
    }

    @BeforeEach
    void setUp() {
        Random random = new Random(1234);
        int[] frameIntensities = TestImages.uniformNoise(random, WIDTH, HEIGHT);
        frameImage = TestImages.gray(frameIntensities, WIDTH, HEIGHT);

        List<Mat> images = new ArrayList<>();
        images.add(TestImages.gray(TestImages.uniformNoise(random, WIDTH, HEIGHT), WIDTH, HEIGHT));
        images.add(TestImages.gray(TestImages.withGaussianNoise(random, frameIntensities, 20), WIDTH, HEIGHT));
        images.add(TestImages.gray(TestImages.uniformNoise(random, WIDTH, HEIGHT), WIDTH, HEIGHT));
        images.add(TestImages.gray(TestImages.uniformNoise(random, WIDTH, HEIGHT), WIDTH, HEIGHT));
        pages = Document.fromImages("noise", images).getPages();
        shownPage = pages.get(1);
    }

    private RollingPearsonPageMatcher matcher(double correlationThreshold, boolean parallel) {
        return new RollingPearsonPageMatcher(pages, new ResizingPageAligner(Imgproc.INTER_AREA), 5, 200,
                correlationThreshold, 0.05, parallel, new Random(99));
    }

    private Frame frame(int number) {
        return new Frame(number, frameImage.clone());
    }

    @Test
    void detectsPageShownInScreen() {
        RollingPearsonPageMatcher matcher = matcher(0.9, false);
        QuadrangleTracker tracker = new RTreeDequeQuadrangleTracker(2);
        for (int number = 1; number <= 5; number++) {
            TrackerUpdate update = tracker.update(Collections.singletonList(SCREEN));
            Map<ConvexQuadrangle, Optional<DocumentPage>> detected = matcher.detect(frame(number), update);
            assertThat(detected).containsOnlyKeys(SCREEN);
            assertThat(detected.get(SCREEN)).contains(shownPage);
        }
    }

    @Test
    void correlationBelowThresholdIsNotDetected() {
        RollingPearsonPageMatcher matcher = matcher(0.99, false);
        QuadrangleTracker tracker = new RTreeDequeQuadrangleTracker(2);
        for (int number = 1; number <= 5; number++) {
            TrackerUpdate update = tracker.update(Collections.singletonList(SCREEN));
            assertThat(matcher.detect(frame(number), update).get(SCREEN)).isEmpty();
        }
    }

    @Test
    void onlyTheBestPageAdvancesItsWindow() {
        RollingPearsonPageMatcher matcher = matcher(0.9, false);
        QuadrangleTracker tracker = new RTreeDequeQuadrangleTracker(2);
        int trackId = 0;
        for (int number = 1; number <= 7; number++) {
            TrackerUpdate update = tracker.update(Collections.singletonList(SCREEN));
            if (number == 1) {
                trackId = update.getAppeared().get(0).getMovingQuadrangle().getId();
            }
            matcher.detect(frame(number), update);
        }
        RollingWeightedCorrelation[] correlations = matcher.getCorrelations(trackId);
        assertThat(correlations).hasSize(pages.size());
        assertThat(correlations[1].getWindowLength()).isEqualTo(5);
        assertThat(correlations[0].getWindowLength()).isZero();
        assertThat(correlations[2].getWindowLength()).isZero();
        assertThat(correlations[3].getWindowLength()).isZero();
    }

    @Test
    void gapInFrameNumbersClearsWindows() {
        RollingPearsonPageMatcher matcher = matcher(0.9, false);
        QuadrangleTracker tracker = new RTreeDequeQuadrangleTracker(2);
        TrackerUpdate update = tracker.update(Collections.singletonList(SCREEN));
        int trackId = update.getAppeared().get(0).getMovingQuadrangle().getId();
        matcher.detect(frame(1), update);
        matcher.detect(frame(2), tracker.update(Collections.singletonList(SCREEN)));
        matcher.detect(frame(3), tracker.update(Collections.singletonList(SCREEN)));
        assertThat(matcher.getCorrelations(trackId)[1].getWindowLength()).isEqualTo(3);

        matcher.detect(frame(5), tracker.update(Collections.singletonList(SCREEN)));
        assertThat(matcher.getCorrelations(trackId)[1].getWindowLength()).isEqualTo(1);
    }

    @Test
    void disappearedScreenForgetsItsWindows() {
        RollingPearsonPageMatcher matcher = matcher(0.9, false);
        QuadrangleTracker tracker = new RTreeDequeQuadrangleTracker(2);
        matcher.detect(frame(1), tracker.update(Collections.singletonList(SCREEN)));
        assertThat(matcher.getTrackCount()).isEqualTo(1);

        TrackerUpdate update = tracker.update(Collections.emptyList());
        assertThat(matcher.detect(frame(2), update)).isEmpty();
        assertThat(matcher.getTrackCount()).isZero();
    }

    @Test
    void parallelEvaluationGivesTheSameVerdicts() {
        RollingPearsonPageMatcher sequential = matcher(0.9, false);
        RollingPearsonPageMatcher parallel = matcher(0.9, true);
        QuadrangleTracker sequentialTracker = new RTreeDequeQuadrangleTracker(2);
        QuadrangleTracker parallelTracker = new RTreeDequeQuadrangleTracker(2);
        for (int number = 1; number <= 3; number++) {
            Map<ConvexQuadrangle, Optional<DocumentPage>> expected =
                    sequential.detect(frame(number), sequentialTracker.update(Collections.singletonList(SCREEN)));
            Map<ConvexQuadrangle, Optional<DocumentPage>> actual =
                    parallel.detect(frame(number), parallelTracker.update(Collections.singletonList(SCREEN)));
            assertThat(actual).isEqualTo(expected);
        }
    }

    @Test
    void misalignedPageImageIsReleasedOnFailure() {
        Mat[] aligned = new Mat[1];
        PageAligner wrongSize = (screen, page) -> {
            aligned[0] = new Mat(HEIGHT / 2, WIDTH / 2, page.getImage().type());
            return aligned[0];
        };
        RollingPearsonPageMatcher matcher = new RollingPearsonPageMatcher(pages.subList(0, 1), wrongSize, 5, 10,
                0.9, 0.05, false, new Random(1));
        TrackerUpdate update = new RTreeDequeQuadrangleTracker(2).update(Collections.singletonList(SCREEN));

        assertThatThrownBy(() -> matcher.detect(frame(1), update)).isInstanceOf(IllegalStateException.class);
        assertThat(aligned[0].empty()).isTrue();
    }

    @Test
    void samplesIntensityAndAlpha() {
        Mat image = TestImages.gray(new int[]{0, 50, 100, 200}, 2, 2);
        double[] intensities = new double[2];
        double[] alphas = new double[2];
        RollingPearsonPageMatcher.samplePixels(image, new int[]{0, 1}, new int[]{1, 1}, intensities, alphas);
        assertThat(intensities).containsExactly(50, 200);
        assertThat(alphas).containsExactly(255, 255);
    }

    @Test
    void rejectsInvalidSettings() {
        ResizingPageAligner aligner = new ResizingPageAligner(Imgproc.INTER_AREA);
        assertThatThrownBy(() -> new RollingPearsonPageMatcher(Collections.emptyList(), aligner, 5, 10, 0.5, 0.05,
                false, new Random())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RollingPearsonPageMatcher(pages, aligner, 0, 10, 0.5, 0.05,
                false, new Random())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RollingPearsonPageMatcher(pages, aligner, 5, 0, 0.5, 0.05,
                false, new Random())).isInstanceOf(IllegalArgumentException.class);
    }
}
