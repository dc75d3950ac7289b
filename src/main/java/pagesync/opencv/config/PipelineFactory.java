package pagesync.opencv.config;

import lombok.extern.slf4j.Slf4j;
import pagesync.opencv.page.Document;
import pagesync.opencv.page.DocumentPage;
import pagesync.opencv.page.FeatureExtractor;
import pagesync.opencv.page.HomographyPageAligner;
import pagesync.opencv.page.OpenCvConstants;
import pagesync.opencv.page.PageAligner;
import pagesync.opencv.page.PageMatcher;
import pagesync.opencv.page.ResizingPageAligner;
import pagesync.opencv.page.RollingPearsonPageMatcher;
import pagesync.opencv.quadrangle.ConvexQuadrangle;
import pagesync.opencv.quadrangle.QuadrangleTracker;
import pagesync.opencv.quadrangle.RTreeDequeQuadrangleTracker;
import pagesync.opencv.screen.ContourScreenDetector;
import pagesync.opencv.screen.ScreenDetector;
import pagesync.opencv.screen.StaticScreenDetector;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds the pipeline components described by a {@link Config}.
 */
@Slf4j
public final class PipelineFactory {

    private PipelineFactory() {
    }

    public static ScreenDetector screenDetector(Config.Detector detector) {
        switch (detector.getType().toLowerCase()) {
            case "static":
                List<ConvexQuadrangle> screens = new ArrayList<>();
                for (Config.ScreenConfig screen : detector.getScreens()) {
                    screens.add(screen.toQuadrangle());
                }
                log.debug("static screen detector with " + screens.size() + " screens");
                return new StaticScreenDetector(screens);
            case "contour":
                return new ContourScreenDetector(detector.getThreshold(), detector.getMinArea());
            default:
                throw new IllegalArgumentException("Unknown screen detector type " + detector.getType());
        }
    }

    public static QuadrangleTracker tracker(Config.Tracker tracker) {
        return new RTreeDequeQuadrangleTracker(tracker.getWindowSize());
    }

    public static List<Document> documents(List<Config.DocumentConfig> documents) {
        List<Document> result = new ArrayList<>();
        for (Config.DocumentConfig document : documents) {
            result.add(Document.fromImageFiles(document.getTitle(), document.getAuthor(), document.getPages()));
        }
        return result;
    }

    public static PageAligner pageAligner(Config.PageMatcher settings) {
        int interpolation = OpenCvConstants.interpolation(settings.getRescaleInterpolation());
        if (!settings.isUseHomography()) {
            return new ResizingPageAligner(interpolation);
        }
        boolean floatDescriptors = settings.getDescriptorMatcherType().toLowerCase().startsWith("flann");
        FeatureExtractor featureExtractor = new FeatureExtractor(
                settings.getNumFeatures(), floatDescriptors, settings.getFeatureCacheSize());
        return new HomographyPageAligner(featureExtractor, settings.getDescriptorMatcherType(),
                settings.getGoodMatchPercentage(),
                OpenCvConstants.homographyMethod(settings.getFindHomographyMethod()), interpolation);
    }

    public static PageMatcher pageMatcher(Config.PageMatcher settings, List<Document> documents) {
        List<DocumentPage> pages = new ArrayList<>();
        for (Document document : documents) {
            pages.addAll(document.getPages());
        }
        Random random = settings.getSeed() == null ? new Random() : new Random(settings.getSeed());
        log.debug("page matcher over " + pages.size() + " pages from " + documents.size() + " documents");
        return new RollingPearsonPageMatcher(pages, pageAligner(settings), settings.getWindowSize(),
                settings.getSampleSize(), settings.getCorrelationThreshold(), settings.getSignificanceLevel(),
                settings.isParallel(), random);
    }
}
