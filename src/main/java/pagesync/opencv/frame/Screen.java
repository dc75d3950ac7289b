package pagesync.opencv.frame;

import lombok.Getter;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import pagesync.opencv.quadrangle.ConvexQuadrangle;

/**
 * The part of a frame inside a projection screen. The image is the frame region perspective-warped
 * to an upright rectangle; parts of the screen outside the frame are fully transparent.
 */
public class Screen {

    static final Scalar TRANSPARENT = new Scalar(0, 0, 0, 0);

    @Getter
    private final Frame frame;
    @Getter
    private final ConvexQuadrangle coordinates;
    @Getter
    private final int width;
    @Getter
    private final int height;
    private Mat image;

    public Screen(Frame frame, ConvexQuadrangle coordinates) {
        this.frame = frame;
        this.coordinates = coordinates;
        this.width = Math.max(1, (int) Math.round(Math.max(
                distance(coordinates.getTopLeft(), coordinates.getTopRight()),
                distance(coordinates.getBottomLeft(), coordinates.getBottomRight()))));
        this.height = Math.max(1, (int) Math.round(Math.max(
                distance(coordinates.getTopLeft(), coordinates.getBottomLeft()),
                distance(coordinates.getTopRight(), coordinates.getBottomRight()))));
    }

    /**
     * RGBA image data of the screen, {@code height} rows by {@code width} columns. Computed once.
     */
    public synchronized Mat getImage() {
        if (image == null) {
            MatOfPoint2f source = new MatOfPoint2f(
                    coordinates.getTopLeft(), coordinates.getTopRight(),
                    coordinates.getBottomRight(), coordinates.getBottomLeft());
            MatOfPoint2f destination = new MatOfPoint2f(
                    new Point(0, 0), new Point(width, 0),
                    new Point(width, height), new Point(0, height));
            Mat transform = Imgproc.getPerspectiveTransform(source, destination);
            image = new Mat();
            Imgproc.warpPerspective(frame.getImage(), image, transform, new Size(width, height),
                    Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, TRANSPARENT);
            source.release();
            destination.release();
            transform.release();
        }
        return image;
    }

    /**
     * Identifies this screen for caching purposes: the frame number and the screen corners.
     */
    public String getKey() {
        return frame.getNumber() + ":" + coordinates;
    }

    public synchronized void release() {
        if (image != null) {
            image.release();
            image = null;
        }
    }

    private static double distance(Point a, Point b) {
        return Math.hypot(a.x - b.x, a.y - b.y);
    }

    @Override
    public String toString() {
        return "screen " + coordinates + " in " + frame;
    }
}
