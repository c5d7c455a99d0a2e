package structure;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The structured form of one function: a root SEQUENCE plus the labels that
 * jump regions refer to, keyed by block id.
 */
public final class RegionTree {
    private final Region root;
    private final SortedMap<Integer, String> labels;

    public RegionTree(Region root, SortedMap<Integer, String> labels) {
        this.root = root;
        this.labels = Collections.unmodifiableSortedMap(new TreeMap<>(labels));
    }

    public Region getRoot() {
        return root;
    }

    public SortedMap<Integer, String> getLabels() {
        return labels;
    }

    public boolean isLabeled(int blockId) {
        return labels.containsKey(blockId);
    }

    public String labelOf(int blockId) {
        return labels.get(blockId);
    }

    public List<Integer> leaves() {
        return root.leaves();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RegionTree t)) return false;
        return root.equals(t.root) && labels.equals(t.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, labels);
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
