package pagesync.opencv.page;

import lombok.extern.slf4j.Slf4j;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.DMatch;
import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDMatch;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.features2d.DescriptorMatcher;
import org.opencv.imgproc.Imgproc;
import pagesync.opencv.frame.Screen;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Aligns a page with a screen by a homography estimated from matched ORB features. Falls back to
 * the identity when too few features match.
 */
@Slf4j
public class HomographyPageAligner implements PageAligner {

    private static final int MIN_MATCHES = 4;
    private static final double RANSAC_REPROJECTION_THRESHOLD = 3.0;
    private static final Scalar TRANSPARENT = new Scalar(0, 0, 0, 0);

    private final FeatureExtractor featureExtractor;
    private final DescriptorMatcher matcher;
    private final double goodMatchPercentage;
    private final int homographyMethod;
    private final int interpolation;

    public HomographyPageAligner(FeatureExtractor featureExtractor, String descriptorMatcherType,
                                 double goodMatchPercentage, int homographyMethod, int interpolation) {
        if (goodMatchPercentage <= 0 || goodMatchPercentage > 1) {
            throw new IllegalArgumentException("The good match percentage must be in (0, 1], got " + goodMatchPercentage);
        }
        this.featureExtractor = featureExtractor;
        this.matcher = DescriptorMatcher.create(descriptorMatcherType);
        this.goodMatchPercentage = goodMatchPercentage;
        this.homographyMethod = homographyMethod;
        this.interpolation = interpolation;
    }

    @Override
    public Mat align(Screen screen, DocumentPage page) {
        Mat transform = findHomography(screen, page);
        Mat aligned = new Mat();
        Imgproc.warpPerspective(page.getImage(), aligned, transform,
                new Size(screen.getWidth(), screen.getHeight()), interpolation, Core.BORDER_CONSTANT, TRANSPARENT);
        transform.release();
        return aligned;
    }

    /**
     * Homography taking page coordinates to screen coordinates.
     */
    Mat findHomography(Screen screen, DocumentPage page) {
        ImageFeatures screenFeatures = featureExtractor.extract(screen.getKey(), screen.getImage());
        ImageFeatures pageFeatures = featureExtractor.extract(page.getKey(), page.getImage());

        if (screenFeatures.size() >= MIN_MATCHES && pageFeatures.size() >= MIN_MATCHES) {
            MatOfDMatch matchMat = new MatOfDMatch();
            matcher.match(pageFeatures.getDescriptors(), screenFeatures.getDescriptors(), matchMat);
            DMatch[] matches = matchMat.toArray();
            matchMat.release();
            Arrays.sort(matches, Comparator.comparingDouble(m -> m.distance));
            int numGoodMatches = (int) (matches.length * goodMatchPercentage);

            if (numGoodMatches >= MIN_MATCHES) {
                KeyPoint[] pageKeypoints = pageFeatures.getKeypoints().toArray();
                KeyPoint[] screenKeypoints = screenFeatures.getKeypoints().toArray();
                Point[] pagePoints = new Point[numGoodMatches];
                Point[] screenPoints = new Point[numGoodMatches];
                for (int i = 0; i < numGoodMatches; i++) {
                    pagePoints[i] = pageKeypoints[matches[i].queryIdx].pt;
                    screenPoints[i] = screenKeypoints[matches[i].trainIdx].pt;
                }
                MatOfPoint2f source = new MatOfPoint2f(pagePoints);
                MatOfPoint2f destination = new MatOfPoint2f(screenPoints);
                Mat transform = Calib3d.findHomography(source, destination, homographyMethod, RANSAC_REPROJECTION_THRESHOLD);
                source.release();
                destination.release();
                if (!transform.empty()) {
                    log.trace("homography " + page + " -> " + screen + " from " + numGoodMatches + " matches");
                    return transform;
                }
                transform.release();
            }
        }
        log.trace("no homography " + page + " -> " + screen + ", using identity");
        return Mat.eye(3, 3, CvType.CV_64F);
    }
}
