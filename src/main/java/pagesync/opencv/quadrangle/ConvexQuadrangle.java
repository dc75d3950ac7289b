package pagesync.opencv.quadrangle;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

import java.util.Locale;

/**
 * An immutable convex quadrangle in frame coordinates. Two quadrangles are equal when their
 * corners are equal.
 *
 * <p>Areas are computed by OpenCV, so the native library must be loaded before {@link #area()},
 * {@link #intersectionArea(ConvexQuadrangle)} or {@link #unionArea(ConvexQuadrangle)} is called.
 */
@Getter
@EqualsAndHashCode(of = {"topLeft", "topRight", "bottomLeft", "bottomRight"})
public final class ConvexQuadrangle {

    private final Point topLeft;
    private final Point topRight;
    private final Point bottomLeft;
    private final Point bottomRight;
    private final BoundingBox boundingBox;

    @Getter(lombok.AccessLevel.NONE)
    private volatile double area = -1;

    public ConvexQuadrangle(Point topLeft, Point topRight, Point bottomLeft, Point bottomRight) {
        this.topLeft = topLeft.clone();
        this.topRight = topRight.clone();
        this.bottomLeft = bottomLeft.clone();
        this.bottomRight = bottomRight.clone();
        this.boundingBox = new BoundingBox(
                Math.min(Math.min(topLeft.x, topRight.x), Math.min(bottomLeft.x, bottomRight.x)),
                Math.min(Math.min(topLeft.y, topRight.y), Math.min(bottomLeft.y, bottomRight.y)),
                Math.max(Math.max(topLeft.x, topRight.x), Math.max(bottomLeft.x, bottomRight.x)),
                Math.max(Math.max(topLeft.y, topRight.y), Math.max(bottomLeft.y, bottomRight.y)));
    }

    /**
     * Axis-aligned rectangle spanning {@code (x, y)} to {@code (x + width, y + height)}.
     */
    public static ConvexQuadrangle ofRectangle(double x, double y, double width, double height) {
        return new ConvexQuadrangle(
                new Point(x, y), new Point(x + width, y),
                new Point(x, y + height), new Point(x + width, y + height));
    }

    public Point getTopLeftBound() {
        return new Point(boundingBox.getMinX(), boundingBox.getMinY());
    }

    public Point getBottomRightBound() {
        return new Point(boundingBox.getMaxX(), boundingBox.getMaxY());
    }

    public double area() {
        double a = area;
        if (a < 0) {
            MatOfPoint2f contour = toContour();
            a = Math.abs(Imgproc.contourArea(contour));
            contour.release();
            area = a;
        }
        return a;
    }

    public double intersectionArea(ConvexQuadrangle other) {
        if (!boundingBox.intersects(other.boundingBox)) {
            return 0;
        }
        MatOfPoint2f p1 = toContour();
        MatOfPoint2f p2 = other.toContour();
        Mat p12 = new Mat();
        double intersection = Imgproc.intersectConvexConvex(p1, p2, p12, true);
        p1.release();
        p2.release();
        p12.release();
        return Math.max(0, intersection);
    }

    public double unionArea(ConvexQuadrangle other) {
        return area() + other.area() - intersectionArea(other);
    }

    /**
     * Corners in a counter-clockwise order with respect to the numeric coordinate axes, which is
     * what {@link Imgproc#intersectConvexConvex} expects.
     */
    MatOfPoint2f toContour() {
        Point[] corners = {topLeft, topRight, bottomRight, bottomLeft};
        double signedArea = 0;
        for (int i = 0; i < corners.length; i++) {
            Point a = corners[i];
            Point b = corners[(i + 1) % corners.length];
            signedArea += a.x * b.y - b.x * a.y;
        }
        if (signedArea < 0) {
            corners = new Point[]{topLeft, bottomLeft, bottomRight, topRight};
        }
        return new MatOfPoint2f(corners);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.1f,%.1f)(%.1f,%.1f)(%.1f,%.1f)(%.1f,%.1f)",
                topLeft.x, topLeft.y, topRight.x, topRight.y,
                bottomRight.x, bottomRight.y, bottomLeft.x, bottomLeft.y);
    }
}
