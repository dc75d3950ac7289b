package pagesync.opencv.quadrangle;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link QuadrangleTracker#update}: three disjoint groups of tracks.
 */
@Getter
public class TrackerUpdate {

    private final List<TrackedQuadrangle> appeared;
    private final List<TrackedQuadrangle> existing;
    private final List<TrackedQuadrangle> disappeared;

    public TrackerUpdate(List<TrackedQuadrangle> appeared, List<TrackedQuadrangle> existing,
                         List<TrackedQuadrangle> disappeared) {
        this.appeared = Collections.unmodifiableList(new ArrayList<>(appeared));
        this.existing = Collections.unmodifiableList(new ArrayList<>(existing));
        this.disappeared = Collections.unmodifiableList(new ArrayList<>(disappeared));
    }

    @Override
    public String toString() {
        return "appeared: " + appeared.size() + "; existing: " + existing.size()
                + "; disappeared: " + disappeared.size();
    }
}
