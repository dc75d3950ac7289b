package pagesync.opencv.page;

import lombok.Getter;
import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;

/**
 * Local features of an image: keypoints and their descriptors. The descriptors are empty when no
 * keypoints were found.
 */
@Getter
public class ImageFeatures {

    private final MatOfKeyPoint keypoints;
    private final Mat descriptors;

    public ImageFeatures(MatOfKeyPoint keypoints, Mat descriptors) {
        this.keypoints = keypoints;
        this.descriptors = descriptors;
    }

    public int size() {
        return (int) keypoints.total();
    }
}
