package pagesync.opencv.quadrangle;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundingBoxTest {

    @Test
    void touchingBoxesIntersect() {
        BoundingBox a = new BoundingBox(0, 0, 10, 10);
        assertThat(a.intersects(new BoundingBox(10, 0, 20, 10))).isTrue();
        assertThat(a.intersects(new BoundingBox(10, 10, 20, 20))).isTrue();
        assertThat(a.intersects(new BoundingBox(10.5, 0, 20, 10))).isFalse();
    }

    @Test
    void unionAndEnlargement() {
        BoundingBox a = new BoundingBox(0, 0, 10, 10);
        BoundingBox b = new BoundingBox(5, 5, 20, 15);
        assertThat(a.union(b)).isEqualTo(new BoundingBox(0, 0, 20, 15));
        assertThat(a.enlargement(b)).isEqualTo(200.0);
        assertThat(a.enlargement(new BoundingBox(2, 2, 3, 3))).isZero();
        assertThat(a.union(b).contains(b)).isTrue();
        assertThat(b.contains(a)).isFalse();
    }

    @Test
    void rejectsDegenerateBox() {
        assertThatThrownBy(() -> new BoundingBox(1, 0, 0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new BoundingBox(1, 1, 1, 1).area()).isZero();
    }
}
