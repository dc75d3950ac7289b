package pagesync.opencv.quadrangle;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quadrangle index backed by an {@link RTree} over the bounding boxes of the quadrangles.
 */
@Slf4j
public class RTreeQuadrangleIndex implements QuadrangleIndex {

    private final Map<Integer, ConvexQuadrangle> quadrangles = new HashMap<>();
    private final RTree<Integer> tree = new RTree<>();

    @Override
    public void put(int id, ConvexQuadrangle quadrangle) {
        ConvexQuadrangle previous = quadrangles.get(id);
        if (quadrangle.equals(previous)) {
            return;
        }
        if (previous != null) {
            tree.delete(previous.getBoundingBox(), id);
        }
        quadrangles.put(id, quadrangle);
        tree.insert(quadrangle.getBoundingBox(), id);
    }

    @Override
    public void remove(int id) {
        ConvexQuadrangle previous = quadrangles.remove(id);
        if (previous != null) {
            tree.delete(previous.getBoundingBox(), id);
        }
    }

    @Override
    public void clear() {
        quadrangles.clear();
        tree.clear();
    }

    @Override
    public int size() {
        return quadrangles.size();
    }

    @Override
    public ConvexQuadrangle get(int id) {
        return quadrangles.get(id);
    }

    @Override
    public Map<Integer, Double> jaccardIndexes(ConvexQuadrangle query) {
        Map<Integer, Double> jaccardIndexes = new LinkedHashMap<>();
        for (Integer id : tree.search(query.getBoundingBox())) {
            ConvexQuadrangle indexed = quadrangles.get(id);
            double intersection = query.intersectionArea(indexed);
            if (intersection > 0) {
                jaccardIndexes.put(id, intersection / query.unionArea(indexed));
            }
        }
        log.trace("jaccard indexes of " + query + ": " + jaccardIndexes);
        return jaccardIndexes;
    }
}
