package pagesync.opencv.quadrangle;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Axis-aligned rectangle given by its top-left and bottom-right corners. Boxes that only touch
 * along an edge or at a corner still intersect.
 */
@Getter
@EqualsAndHashCode
public final class BoundingBox {

    private final double minX;
    private final double minY;
    private final double maxX;
    private final double maxY;

    public BoundingBox(double minX, double minY, double maxX, double maxY) {
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException(String.format(
                    "Degenerate bounding box (%f, %f) - (%f, %f)", minX, minY, maxX, maxY));
        }
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    public double area() {
        return (maxX - minX) * (maxY - minY);
    }

    public boolean intersects(BoundingBox other) {
        return minX <= other.maxX && other.minX <= maxX && minY <= other.maxY && other.minY <= maxY;
    }

    public boolean contains(BoundingBox other) {
        return minX <= other.minX && other.maxX <= maxX && minY <= other.minY && other.maxY <= maxY;
    }

    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(
                Math.min(minX, other.minX), Math.min(minY, other.minY),
                Math.max(maxX, other.maxX), Math.max(maxY, other.maxY));
    }

    /**
     * Area by which this box would grow to also cover {@code other}.
     */
    public double enlargement(BoundingBox other) {
        return union(other).area() - area();
    }

    @Override
    public String toString() {
        return String.format("[%.1f, %.1f - %.1f, %.1f]", minX, minY, maxX, maxY);
    }
}
