package pagesync.opencv.quadrangle;

import lombok.Value;

/**
 * A quadrangle in the current frame together with the track it belongs to.
 */
@Value
public class TrackedQuadrangle {
    ConvexQuadrangle quadrangle;
    MovingQuadrangle movingQuadrangle;
}
