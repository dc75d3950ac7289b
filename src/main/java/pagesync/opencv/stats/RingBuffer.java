package pagesync.opencv.stats;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * FIFO with O(1) push and eviction. A bounded buffer evicts its oldest element when a push would
 * exceed the capacity; an unbounded one grows.
 *
 * @param <T> the element type
 */
public class RingBuffer<T> implements Iterable<T> {

    private final Integer capacity;
    private final Deque<T> elements = new ArrayDeque<>();

    /**
     * @param capacity the maximum number of elements, {@code null} for unbounded
     */
    public RingBuffer(Integer capacity) {
        if (capacity != null && capacity < 1) {
            throw new IllegalArgumentException("The capacity must not be less than one, got " + capacity);
        }
        this.capacity = capacity;
    }

    public boolean isFull() {
        return capacity != null && elements.size() == capacity;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * @return the oldest element, {@code null} if the buffer is empty
     */
    public T peekOldest() {
        return elements.peekFirst();
    }

    /**
     * Appends {@code element}.
     *
     * @return the evicted oldest element, {@code null} if nothing was evicted
     */
    public T push(T element) {
        T evicted = isFull() ? elements.removeFirst() : null;
        elements.addLast(element);
        return evicted;
    }

    public void clear() {
        elements.clear();
    }

    @Override
    public Iterator<T> iterator() {
        return elements.iterator();
    }
}
