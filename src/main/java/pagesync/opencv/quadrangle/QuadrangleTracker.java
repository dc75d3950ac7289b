package pagesync.opencv.quadrangle;

import java.util.Collection;

/**
 * Keeps the identity of convex quadrangles across time frames.
 */
public interface QuadrangleTracker {

    /**
     * Records the quadrangles of the current time frame and matches them with the quadrangles of
     * the previous one.
     */
    TrackerUpdate update(Collection<ConvexQuadrangle> currentQuadrangles);

    void clear();

    int size();
}
