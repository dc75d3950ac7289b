package pagesync.opencv.quadrangle;

import nu.pattern.OpenCV;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RTreeQuadrangleIndexTest {

    private RTreeQuadrangleIndex index;

    @BeforeAll
    static void loadOpenCv() {
        OpenCV.loadLocally();
    }

    @BeforeEach
    void setUp() {
        index = new RTreeQuadrangleIndex();
    }

    @Test
    void jaccardIndexesOfOverlappingQuadrangles() {
        index.put(0, ConvexQuadrangle.ofRectangle(0, 0, 10, 10));
        index.put(1, ConvexQuadrangle.ofRectangle(5, 0, 10, 10));
        index.put(2, ConvexQuadrangle.ofRectangle(100, 100, 10, 10));

        Map<Integer, Double> jaccardIndexes = index.jaccardIndexes(ConvexQuadrangle.ofRectangle(0, 0, 10, 10));
        assertThat(jaccardIndexes).containsOnlyKeys(0, 1);
        assertThat(jaccardIndexes.get(0)).isCloseTo(1.0, within(1e-9));
        assertThat(jaccardIndexes.get(1)).isCloseTo(50.0 / 150.0, within(1e-9));
    }

    @Test
    void touchingQuadranglesAreNotReported() {
        index.put(0, ConvexQuadrangle.ofRectangle(0, 0, 10, 10));
        assertThat(index.jaccardIndexes(ConvexQuadrangle.ofRectangle(10, 0, 10, 10))).isEmpty();
    }

    @Test
    void putReplacesAndRemoveForgets() {
        index.put(0, ConvexQuadrangle.ofRectangle(0, 0, 10, 10));
        index.put(0, ConvexQuadrangle.ofRectangle(50, 50, 10, 10));
        assertThat(index.size()).isEqualTo(1);
        assertThat(index.get(0)).isEqualTo(ConvexQuadrangle.ofRectangle(50, 50, 10, 10));
        assertThat(index.jaccardIndexes(ConvexQuadrangle.ofRectangle(0, 0, 10, 10))).isEmpty();
        assertThat(index.jaccardIndexes(ConvexQuadrangle.ofRectangle(50, 50, 10, 10))).containsOnlyKeys(0);

        index.remove(0);
        index.remove(42);
        assertThat(index.size()).isZero();
        assertThat(index.get(0)).isNull();
        assertThat(index.jaccardIndexes(ConvexQuadrangle.ofRectangle(50, 50, 10, 10))).isEmpty();
    }
}
