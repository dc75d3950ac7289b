package pagesync.opencv.quadrangle;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * In-memory R-tree over {@link BoundingBox} envelopes with Guttman's quadratic split.
 *
 * <p>Values are compared with {@link Object#equals(Object)} on deletion. Search visits node entries
 * in insertion order, so the result order is deterministic for a given sequence of operations.
 *
 * @param <T> the value type
 */
public class RTree<T> {

    static final int MAX_ENTRIES = 8;
    static final int MIN_ENTRIES = 3;

    private Node<T> root = new Node<>(true);
    private int size = 0;

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void clear() {
        root = new Node<>(true);
        size = 0;
    }

    public void insert(BoundingBox box, T value) {
        insert(new Entry<>(box, value, null));
        size++;
    }

    /**
     * Removes one entry holding {@code value} whose envelope equals {@code box}.
     *
     * @return {@code true} if an entry was removed
     */
    public boolean delete(BoundingBox box, T value) {
        List<Entry<T>> orphans = new ArrayList<>();
        if (!delete(root, box, value, orphans)) {
            return false;
        }
        size--;
        while (!root.leaf && root.entries.size() == 1) {
            root = root.entries.get(0).child;
        }
        if (!root.leaf && root.entries.isEmpty()) {
            root = new Node<>(true);
        }
        for (Entry<T> orphan : orphans) {
            insert(orphan);
        }
        return true;
    }

    /**
     * Values whose envelopes intersect {@code box}, touching envelopes included.
     */
    public List<T> search(BoundingBox box) {
        List<T> result = new ArrayList<>();
        search(root, box, result);
        return result;
    }

    int height() {
        int height = 1;
        Node<T> node = root;
        while (!node.leaf) {
            node = node.entries.get(0).child;
            height++;
        }
        return height;
    }

    private void insert(Entry<T> entry) {
        Node<T> sibling = insert(root, entry);
        if (sibling != null) {
            Node<T> newRoot = new Node<>(false);
            newRoot.entries.add(new Entry<>(root.bounds(), null, root));
            newRoot.entries.add(new Entry<>(sibling.bounds(), null, sibling));
            root = newRoot;
        }
    }

    private Node<T> insert(Node<T> node, Entry<T> entry) {
        if (node.leaf) {
            node.entries.add(entry);
        } else {
            Entry<T> target = chooseSubtree(node, entry.box);
            Node<T> sibling = insert(target.child, entry);
            target.box = target.child.bounds();
            if (sibling != null) {
                node.entries.add(new Entry<>(sibling.bounds(), null, sibling));
            }
        }
        return node.entries.size() > MAX_ENTRIES ? split(node) : null;
    }

    private Entry<T> chooseSubtree(Node<T> node, BoundingBox box) {
        Entry<T> best = null;
        double bestEnlargement = Double.POSITIVE_INFINITY;
        double bestArea = Double.POSITIVE_INFINITY;
        for (Entry<T> candidate : node.entries) {
            double enlargement = candidate.box.enlargement(box);
            double area = candidate.box.area();
            if (enlargement < bestEnlargement || (enlargement == bestEnlargement && area < bestArea)) {
                best = candidate;
                bestEnlargement = enlargement;
                bestArea = area;
            }
        }
        return best;
    }

    /**
     * Quadratic split. {@code node} keeps the first group, the returned sibling gets the second.
     */
    private Node<T> split(Node<T> node) {
        List<Entry<T>> remaining = new ArrayList<>(node.entries);

        int seedA = 0;
        int seedB = 1;
        double worstWaste = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < remaining.size(); i++) {
            for (int j = i + 1; j < remaining.size(); j++) {
                BoundingBox a = remaining.get(i).box;
                BoundingBox b = remaining.get(j).box;
                double waste = a.union(b).area() - a.area() - b.area();
                if (waste > worstWaste) {
                    worstWaste = waste;
                    seedA = i;
                    seedB = j;
                }
            }
        }

        Node<T> sibling = new Node<>(node.leaf);
        List<Entry<T>> groupA = node.entries = new ArrayList<>();
        List<Entry<T>> groupB = sibling.entries;
        Entry<T> first = remaining.get(seedA);
        Entry<T> second = remaining.get(seedB);
        remaining.remove(seedB);
        remaining.remove(seedA);
        groupA.add(first);
        groupB.add(second);
        BoundingBox boxA = first.box;
        BoundingBox boxB = second.box;

        while (!remaining.isEmpty()) {
            if (groupA.size() + remaining.size() <= MIN_ENTRIES) {
                groupA.addAll(remaining);
                break;
            }
            if (groupB.size() + remaining.size() <= MIN_ENTRIES) {
                groupB.addAll(remaining);
                break;
            }

            int next = 0;
            double greatestPreference = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < remaining.size(); i++) {
                BoundingBox box = remaining.get(i).box;
                double preference = Math.abs(boxA.enlargement(box) - boxB.enlargement(box));
                if (preference > greatestPreference) {
                    greatestPreference = preference;
                    next = i;
                }
            }

            Entry<T> entry = remaining.remove(next);
            double enlargementA = boxA.enlargement(entry.box);
            double enlargementB = boxB.enlargement(entry.box);
            boolean toA;
            if (enlargementA != enlargementB) {
                toA = enlargementA < enlargementB;
            } else if (boxA.area() != boxB.area()) {
                toA = boxA.area() < boxB.area();
            } else {
                toA = groupA.size() <= groupB.size();
            }
            if (toA) {
                groupA.add(entry);
                boxA = boxA.union(entry.box);
            } else {
                groupB.add(entry);
                boxB = boxB.union(entry.box);
            }
        }
        return sibling;
    }

    private boolean delete(Node<T> node, BoundingBox box, T value, List<Entry<T>> orphans) {
        if (node.leaf) {
            Iterator<Entry<T>> i = node.entries.iterator();
            while (i.hasNext()) {
                Entry<T> entry = i.next();
                if (entry.box.equals(box) && entry.value.equals(value)) {
                    i.remove();
                    return true;
                }
            }
            return false;
        }
        Iterator<Entry<T>> i = node.entries.iterator();
        while (i.hasNext()) {
            Entry<T> entry = i.next();
            if (!entry.box.contains(box) || !delete(entry.child, box, value, orphans)) {
                continue;
            }
            if (entry.child.entries.size() < MIN_ENTRIES) {
                i.remove();
                collectLeafEntries(entry.child, orphans);
            } else {
                entry.box = entry.child.bounds();
            }
            return true;
        }
        return false;
    }

    private void collectLeafEntries(Node<T> node, List<Entry<T>> sink) {
        if (node.leaf) {
            sink.addAll(node.entries);
        } else {
            for (Entry<T> entry : node.entries) {
                collectLeafEntries(entry.child, sink);
            }
        }
    }

    private void search(Node<T> node, BoundingBox box, List<T> result) {
        for (Entry<T> entry : node.entries) {
            if (!entry.box.intersects(box)) {
                continue;
            }
            if (node.leaf) {
                result.add(entry.value);
            } else {
                search(entry.child, box, result);
            }
        }
    }

    private static final class Node<T> {

        private final boolean leaf;
        private List<Entry<T>> entries = new ArrayList<>();

        private Node(boolean leaf) {
            this.leaf = leaf;
        }

        private BoundingBox bounds() {
            BoundingBox bounds = entries.get(0).box;
            for (int i = 1; i < entries.size(); i++) {
                bounds = bounds.union(entries.get(i).box);
            }
            return bounds;
        }
    }

    private static final class Entry<T> {

        private BoundingBox box;
        private final T value;
        private final Node<T> child;

        private Entry(BoundingBox box, T value, Node<T> child) {
            this.box = box;
            this.value = value;
            this.child = child;
        }
    }
}
