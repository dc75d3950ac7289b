package pagesync.opencv.quadrangle;

import lombok.Getter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * The successive positions of one tracked quadrangle, oldest first. With a window size only the
 * latest {@code windowSize} positions are kept.
 */
public class MovingQuadrangle implements Iterable<ConvexQuadrangle> {

    @Getter
    private final int id;
    @Getter
    private final Integer windowSize;
    private final Deque<ConvexQuadrangle> quadrangles = new ArrayDeque<>();

    /**
     * @param windowSize the number of retained positions, {@code null} for unbounded
     * @throws IllegalArgumentException if the window size is less than two
     */
    public MovingQuadrangle(int id, ConvexQuadrangle currentQuadrangle, Integer windowSize) {
        checkWindowSize(windowSize);
        this.id = id;
        this.windowSize = windowSize;
        quadrangles.addLast(currentQuadrangle);
    }

    static void checkWindowSize(Integer windowSize) {
        // the tracker compares the current position with the previous one
        if (windowSize != null && windowSize < 2) {
            throw new IllegalArgumentException("The window size must not be less than two, got " + windowSize);
        }
    }

    public void add(ConvexQuadrangle quadrangle) {
        if (windowSize != null && quadrangles.size() == windowSize) {
            quadrangles.removeFirst();
        }
        quadrangles.addLast(quadrangle);
    }

    public ConvexQuadrangle getCurrentQuadrangle() {
        return quadrangles.peekLast();
    }

    public int size() {
        return quadrangles.size();
    }

    @Override
    public Iterator<ConvexQuadrangle> iterator() {
        return quadrangles.iterator();
    }

    public Iterator<ConvexQuadrangle> descendingIterator() {
        return quadrangles.descendingIterator();
    }

    @Override
    public String toString() {
        return "#" + id + " " + getCurrentQuadrangle() + " (" + quadrangles.size() + ")";
    }
}
