package pagesync.opencv.page;

import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.features2d.ORB;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts ORB features from RGBA images, ignoring keypoints on fully transparent pixels. Results
 * are kept in an owned {@link BoundedCache} under a caller-supplied key.
 *
 * <p>Evicted features are not released: a caller may still be matching them, possibly on another
 * thread. Their native memory is freed when they are garbage-collected.
 */
@Slf4j
public class FeatureExtractor {

    private final ORB detector;
    private final boolean floatDescriptors;
    private final BoundedCache<String, ImageFeatures> cache;

    /**
     * @param numFeatures      the maximum number of ORB keypoints per image
     * @param floatDescriptors convert descriptors to {@code CV_32F}, as FLANN-based matchers need
     * @param cacheSize        the maximum number of cached images
     */
    public FeatureExtractor(int numFeatures, boolean floatDescriptors, int cacheSize) {
        this.detector = ORB.create(numFeatures);
        this.floatDescriptors = floatDescriptors;
        this.cache = new BoundedCache<>(cacheSize,
                features -> log.trace("evicted features with " + features.size() + " keypoints"));
    }

    public ImageFeatures extract(String key, Mat rgbaImage) {
        return cache.get(key, k -> compute(rgbaImage));
    }

    BoundedCache<String, ImageFeatures> getCache() {
        return cache;
    }

    private ImageFeatures compute(Mat rgbaImage) {
        Mat intensity = new Mat();
        Imgproc.cvtColor(rgbaImage, intensity, Imgproc.COLOR_RGBA2GRAY);
        Mat alpha = new Mat();
        Core.extractChannel(rgbaImage, alpha, 3);

        MatOfKeyPoint detected = new MatOfKeyPoint();
        detector.detect(intensity, detected);
        List<KeyPoint> opaque = new ArrayList<>();
        for (KeyPoint keypoint : detected.toArray()) {
            if (alpha.get((int) keypoint.pt.y, (int) keypoint.pt.x)[0] > 0) {
                opaque.add(keypoint);
            }
        }
        detected.release();

        MatOfKeyPoint keypoints = new MatOfKeyPoint();
        keypoints.fromList(opaque);
        Mat descriptors = new Mat();
        if (!opaque.isEmpty()) {
            detector.compute(intensity, keypoints, descriptors);
            if (floatDescriptors && !descriptors.empty()) {
                descriptors.convertTo(descriptors, CvType.CV_32F);
            }
        }
        intensity.release();
        alpha.release();
        log.trace("extracted " + keypoints.total() + " keypoints");
        return new ImageFeatures(keypoints, descriptors);
    }
}
