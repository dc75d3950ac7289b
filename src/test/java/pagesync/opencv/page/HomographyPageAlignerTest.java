package pagesync.opencv.page;

import nu.pattern.OpenCV;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import pagesync.opencv.frame.Frame;
import pagesync.opencv.frame.Screen;
import pagesync.opencv.quadrangle.ConvexQuadrangle;
import pagesync.opencv.quadrangle.QuadrangleTracker;
import pagesync.opencv.quadrangle.RTreeDequeQuadrangleTracker;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HomographyPageAlignerTest {

    private static final int WIDTH = 320;
    private static final int HEIGHT = 240;

    @BeforeAll
    static void loadOpenCv() {
        OpenCV.loadLocally();
    }

    private static Mat blocks(long seed) {
        Random random = new Random(seed);
        Mat image = new Mat(HEIGHT, WIDTH, CvType.CV_8UC4, new Scalar(255, 255, 255, 255));
        for (int i = 0; i < 60; i++) {
            int x = random.nextInt(WIDTH - 20);
            int y = random.nextInt(HEIGHT - 20);
            int shade = random.nextInt(200);
            Imgproc.rectangle(image, new Point(x, y), new Point(x + 5 + random.nextInt(30), y + 5 + random.nextInt(30)),
                    new Scalar(shade, shade, shade, 255), -1);
        }
        return image;
    }

    private static HomographyPageAligner aligner(FeatureExtractor featureExtractor) {
        return new HomographyPageAligner(featureExtractor, "BruteForce-Hamming", 0.15, Calib3d.RANSAC,
                Imgproc.INTER_LINEAR);
    }

    @Test
    void identicalImagesGiveIdentityHomography() {
        Mat image = blocks(21);
        Frame frame = new Frame(1, image.clone());
        Screen screen = new Screen(frame, ConvexQuadrangle.ofRectangle(0, 0, WIDTH, HEIGHT));
        DocumentPage page = Document.fromImages("blocks", Collections.singletonList(image)).getPages().get(0);
        FeatureExtractor featureExtractor = new FeatureExtractor(500, false, 4);

        Mat transform = aligner(featureExtractor).findHomography(screen, page);
        double scale = transform.get(2, 2)[0];
        assertThat(transform.get(0, 0)[0] / scale).isCloseTo(1, within(0.02));
        assertThat(transform.get(0, 1)[0] / scale).isCloseTo(0, within(0.02));
        assertThat(transform.get(0, 2)[0] / scale).isCloseTo(0, within(1.0));
        assertThat(transform.get(1, 0)[0] / scale).isCloseTo(0, within(0.02));
        assertThat(transform.get(1, 1)[0] / scale).isCloseTo(1, within(0.02));
        assertThat(transform.get(1, 2)[0] / scale).isCloseTo(0, within(1.0));
        assertThat(transform.get(2, 0)[0] / scale).isCloseTo(0, within(1e-4));
        assertThat(transform.get(2, 1)[0] / scale).isCloseTo(0, within(1e-4));
        assertThat(featureExtractor.getCache().size()).isEqualTo(2);
        assertThat(featureExtractor.getCache().contains(page.getKey())).isTrue();
        assertThat(featureExtractor.getCache().contains(screen.getKey())).isTrue();
    }

    @Test
    void featurelessImagesFallBackToIdentity() {
        Mat blank = new Mat(HEIGHT, WIDTH, CvType.CV_8UC4, new Scalar(128, 128, 128, 255));
        Frame frame = new Frame(1, blank.clone());
        Screen screen = new Screen(frame, ConvexQuadrangle.ofRectangle(0, 0, WIDTH / 2.0, HEIGHT / 2.0));
        DocumentPage page = Document.fromImages("blank", Collections.singletonList(blank)).getPages().get(0);

        HomographyPageAligner aligner = aligner(new FeatureExtractor(500, false, 4));
        Mat transform = aligner.findHomography(screen, page);
        assertThat(transform.get(0, 0)[0]).isEqualTo(1.0);
        assertThat(transform.get(0, 1)[0]).isEqualTo(0.0);

        Mat aligned = aligner.align(screen, page);
        assertThat(aligned.width()).isEqualTo(screen.getWidth());
        assertThat(aligned.height()).isEqualTo(screen.getHeight());
        assertThat(aligned.get(10, 10)).containsExactly(128, 128, 128, 255);
    }

    @Test
    void singleEntryCacheKeepsScreenFeaturesUsable() {
        Mat image = blocks(21);
        Frame frame = new Frame(1, image.clone());
        Screen screen = new Screen(frame, ConvexQuadrangle.ofRectangle(20, 10, 280, 220));
        DocumentPage page = Document.fromImages("blocks", Collections.singletonList(image)).getPages().get(0);
        FeatureExtractor featureExtractor = new FeatureExtractor(500, false, 1);

        ImageFeatures screenFeatures = featureExtractor.extract(screen.getKey(), screen.getImage());
        int keypoints = screenFeatures.size();
        assertThat(keypoints).isGreaterThan(4);
        featureExtractor.extract(page.getKey(), page.getImage());
        assertThat(featureExtractor.getCache().contains(screen.getKey())).isFalse();
        assertThat(screenFeatures.size()).isEqualTo(keypoints);
        assertThat(screenFeatures.getDescriptors().rows()).isEqualTo(keypoints);

        // page coordinates map to screen coordinates by (x - 20, y - 10)
        Mat transform = aligner(new FeatureExtractor(500, false, 1)).findHomography(screen, page);
        double scale = transform.get(2, 2)[0];
        assertThat(transform.get(0, 0)[0] / scale).isCloseTo(1, within(0.02));
        assertThat(transform.get(1, 1)[0] / scale).isCloseTo(1, within(0.02));
        assertThat(transform.get(0, 2)[0] / scale).isCloseTo(-20, within(1.0));
        assertThat(transform.get(1, 2)[0] / scale).isCloseTo(-10, within(1.0));
    }

    @Test
    void pageMatcherDetectsPageThroughHomography() {
        Mat image = blocks(21);
        List<DocumentPage> pages = Document.fromImages("blocks", Arrays.asList(image, blocks(22))).getPages();
        ConvexQuadrangle screen = ConvexQuadrangle.ofRectangle(20, 10, 280, 220);
        RollingPearsonPageMatcher matcher = new RollingPearsonPageMatcher(pages,
                aligner(new FeatureExtractor(500, false, 1)), 3, 500, 0.8, 0.05, true, new Random(3));
        QuadrangleTracker tracker = new RTreeDequeQuadrangleTracker(2);

        for (int number = 1; number <= 3; number++) {
            Map<ConvexQuadrangle, Optional<DocumentPage>> detected =
                    matcher.detect(new Frame(number, image.clone()), tracker.update(Collections.singletonList(screen)));
            assertThat(detected.get(screen)).contains(pages.get(0));
        }
    }

    @Test
    void rejectsInvalidGoodMatchPercentage() {
        FeatureExtractor featureExtractor = new FeatureExtractor(100, false, 1);
        assertThatThrownBy(() -> new HomographyPageAligner(featureExtractor, "BruteForce-Hamming", 0, Calib3d.RANSAC,
                Imgproc.INTER_LINEAR)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HomographyPageAligner(featureExtractor, "BruteForce-Hamming", 1.5, Calib3d.RANSAC,
                Imgproc.INTER_LINEAR)).isInstanceOf(IllegalArgumentException.class);
    }
}
