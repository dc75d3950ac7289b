package pagesync.opencv.screen;

import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import pagesync.opencv.frame.Frame;
import pagesync.opencv.quadrangle.ConvexQuadrangle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import static org.opencv.imgproc.Imgproc.COLOR_RGBA2GRAY;

/**
 * Finds lit screens as bright convex quadrilateral blobs: blurred grayscale image, binary
 * threshold, external contours, polygon approximation.
 */
@Slf4j
public class ContourScreenDetector implements ScreenDetector {

    private static final double APPROXIMATION_EPSILON = 0.02;

    private final int threshold;
    private final double minArea;

    /**
     * @param threshold intensity above which a pixel belongs to a lit screen
     * @param minArea   the minimum area of a screen in pixels
     */
    public ContourScreenDetector(int threshold, double minArea) {
        this.threshold = threshold;
        this.minArea = minArea;
    }

    @Override
    public List<ConvexQuadrangle> detect(Frame frame) {
        Mat gray = new Mat();
        Imgproc.cvtColor(frame.getImage(), gray, COLOR_RGBA2GRAY);
        Imgproc.GaussianBlur(gray, gray, new Size(7, 7), 0);
        Imgproc.threshold(gray, gray, threshold, 255, Imgproc.THRESH_BINARY);

        Mat hierarchy = new Mat();
        List<MatOfPoint> contours = new ArrayList<>();
        Imgproc.findContours(gray, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);

        List<ConvexQuadrangle> screens = new ArrayList<>();
        for (MatOfPoint contour : contours) {
            MatOfPoint2f curve = new MatOfPoint2f(contour.toArray());
            MatOfPoint2f approx = new MatOfPoint2f();
            Imgproc.approxPolyDP(curve, approx, APPROXIMATION_EPSILON * Imgproc.arcLength(curve, true), true);
            Point[] corners = approx.toArray();
            if (corners.length == 4 && Imgproc.contourArea(approx) >= minArea
                    && Imgproc.isContourConvex(new MatOfPoint(corners))) {
                screens.add(toQuadrangle(corners));
            }
            curve.release();
            approx.release();
            contour.release();
        }
        log.trace(frame + ": " + screens.size() + " screens out of " + contours.size() + " contours");

        hierarchy.release();
        gray.release();
        return screens;
    }

    /**
     * Labels corners by their position: the top two by x, then the bottom two by x.
     */
    static ConvexQuadrangle toQuadrangle(Point[] corners) {
        Point[] sorted = corners.clone();
        Arrays.sort(sorted, Comparator.comparingDouble((Point p) -> p.y).thenComparingDouble(p -> p.x));
        Point[] top = {sorted[0], sorted[1]};
        Point[] bottom = {sorted[2], sorted[3]};
        Arrays.sort(top, Comparator.comparingDouble(p -> p.x));
        Arrays.sort(bottom, Comparator.comparingDouble(p -> p.x));
        return new ConvexQuadrangle(top[0], top[1], bottom[0], bottom[1]);
    }
}
