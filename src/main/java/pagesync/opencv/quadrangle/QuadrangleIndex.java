package pagesync.opencv.quadrangle;

import java.util.Map;

/**
 * A mutable set of convex quadrangles keyed by the integer id of their owner, queryable by
 * overlap. Keys are identities: two owners may hold geometrically equal quadrangles without
 * aliasing each other.
 */
public interface QuadrangleIndex {

    /**
     * Indexes {@code quadrangle} under {@code id}. Re-putting an equal quadrangle under the same id
     * is a no-op, a different one replaces the previous entry.
     */
    void put(int id, ConvexQuadrangle quadrangle);

    /**
     * Removes the entry under {@code id}, if any.
     */
    void remove(int id);

    void clear();

    int size();

    ConvexQuadrangle get(int id);

    /**
     * Jaccard indexes between {@code query} and every indexed quadrangle whose intersection with
     * it has a positive area. Iteration order follows the index scan.
     *
     * @return a map from owner id to intersection area divided by union area
     */
    Map<Integer, Double> jaccardIndexes(ConvexQuadrangle query);
}
