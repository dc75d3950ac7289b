package pagesync.opencv.quadrangle;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Quadrangle tracker that indexes the latest position of every track in a {@link QuadrangleIndex}
 * and keeps each track's history in a {@link MovingQuadrangle}.
 *
 * <p>A current quadrangle equal to a previous position continues that track. Any other current
 * quadrangle continues the unclaimed track whose previous position has the highest Jaccard index
 * with it, or starts a new track when it overlaps no unclaimed previous position. Tracks that are
 * not continued disappear.
 *
 * <p>Not thread-safe.
 */
@Slf4j
public class RTreeDequeQuadrangleTracker implements QuadrangleTracker {

    private final Integer windowSize;
    private final QuadrangleIndex index;
    private final Map<Integer, MovingQuadrangle> tracks = new LinkedHashMap<>();
    private final Map<ConvexQuadrangle, Integer> previousQuadrangles = new HashMap<>();
    private int nextId = 0;

    public RTreeDequeQuadrangleTracker() {
        this(null);
    }

    /**
     * @param windowSize the number of positions kept per track, {@code null} for unbounded
     * @throws IllegalArgumentException if the window size is less than two
     */
    public RTreeDequeQuadrangleTracker(Integer windowSize) {
        this(windowSize, new RTreeQuadrangleIndex());
    }

    RTreeDequeQuadrangleTracker(Integer windowSize, QuadrangleIndex index) {
        MovingQuadrangle.checkWindowSize(windowSize);
        this.windowSize = windowSize;
        this.index = index;
    }

    @Override
    public void clear() {
        tracks.clear();
        previousQuadrangles.clear();
        index.clear();
    }

    @Override
    public int size() {
        return tracks.size();
    }

    @Override
    public TrackerUpdate update(Collection<ConvexQuadrangle> currentQuadrangles) {
        Set<ConvexQuadrangle> current = new LinkedHashSet<>(currentQuadrangles);
        List<TrackedQuadrangle> appeared = new ArrayList<>();
        List<TrackedQuadrangle> existing = new ArrayList<>();
        List<TrackedQuadrangle> disappeared = new ArrayList<>();
        Set<Integer> claimed = new HashSet<>();
        List<MovingQuadrangle> reindexed = new ArrayList<>();

        // stationary
        Iterator<ConvexQuadrangle> i = current.iterator();
        while (i.hasNext()) {
            ConvexQuadrangle quadrangle = i.next();
            Integer id = previousQuadrangles.get(quadrangle);
            if (id != null) {
                MovingQuadrangle track = tracks.get(id);
                track.add(quadrangle);
                claimed.add(id);
                existing.add(new TrackedQuadrangle(quadrangle, track));
                i.remove();
            }
        }

        // moved or appeared
        for (ConvexQuadrangle quadrangle : current) {
            Integer bestId = null;
            double bestJaccardIndex = 0;
            for (Map.Entry<Integer, Double> candidate : index.jaccardIndexes(quadrangle).entrySet()) {
                if (claimed.contains(candidate.getKey())) {
                    continue;
                }
                if (bestId == null || candidate.getValue() > bestJaccardIndex) {
                    bestId = candidate.getKey();
                    bestJaccardIndex = candidate.getValue();
                }
            }

            MovingQuadrangle track;
            if (bestId != null) {
                track = tracks.get(bestId);
                ConvexQuadrangle previous = track.getCurrentQuadrangle();
                track.add(quadrangle);
                claimed.add(bestId);
                index.remove(bestId);
                log.trace(String.format("moved #%d %s -> %s (%.3f)", bestId, previous, quadrangle, bestJaccardIndex));
                existing.add(new TrackedQuadrangle(quadrangle, track));
            } else {
                int id = nextId++;
                track = new MovingQuadrangle(id, quadrangle, windowSize);
                tracks.put(id, track);
                claimed.add(id);
                log.trace("appeared #" + id + " " + quadrangle);
                appeared.add(new TrackedQuadrangle(quadrangle, track));
            }
            reindexed.add(track);
        }

        Iterator<MovingQuadrangle> t = tracks.values().iterator();
        while (t.hasNext()) {
            MovingQuadrangle track = t.next();
            if (!claimed.contains(track.getId())) {
                index.remove(track.getId());
                t.remove();
                log.trace("disappeared " + track);
                disappeared.add(new TrackedQuadrangle(track.getCurrentQuadrangle(), track));
            }
        }

        for (MovingQuadrangle track : reindexed) {
            index.put(track.getId(), track.getCurrentQuadrangle());
        }

        previousQuadrangles.clear();
        for (MovingQuadrangle track : tracks.values()) {
            previousQuadrangles.put(track.getCurrentQuadrangle(), track.getId());
        }

        TrackerUpdate update = new TrackerUpdate(appeared, existing, disappeared);
        log.trace("tracker update: " + update);
        return update;
    }
}
