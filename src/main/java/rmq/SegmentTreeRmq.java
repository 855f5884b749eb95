package rmq;

import java.util.Arrays;

/**
 * Segment tree over an implicit binary tree stored in a flat buffer.
 * Node {@code i} has children {@code 2i+1} and {@code 2i+2}; the root covers [0, n-1].
 * Build O(n), update O(log n), query O(log n), space O(n).
 */
public final class SegmentTreeRmq extends AbstractRangeMinimum {

    // Minimum of the range each node covers; 4n is enough for any n.
    private final double[] tree;

    public SegmentTreeRmq(double[] values) {
        super(values);
        this.tree = new double[capacity(n)];
        Arrays.fill(tree, Double.POSITIVE_INFINITY);
        build(0, 0, n - 1);
    }

    static int capacity(int n) {
        try {
            return Math.multiplyExact(4, n);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Segment tree for N=" + n + " exceeds the maximum array size", e);
        }
    }

    private static int leftChild(int node)  { return 2 * node + 1; }
    private static int rightChild(int node) { return 2 * node + 2; }

    private void build(int node, int start, int end) {
        if (start == end) {
            tree[node] = values[start];
            return;
        }
        int mid = (start + end) >>> 1;
        build(leftChild(node), start, mid);
        build(rightChild(node), mid + 1, end);
        tree[node] = Math.min(tree[leftChild(node)], tree[rightChild(node)]);
    }

    @Override
    protected void doUpdate(int index, double value) {
        update(0, 0, n - 1, index, value);
    }

    // Walks one root-to-leaf path and repairs the ancestors on the way back.
    private void update(int node, int start, int end, int index, double value) {
        if (start == end) {
            values[index] = value;
            tree[node] = value;
            return;
        }
        int mid = (start + end) >>> 1;
        if (index <= mid) {
            update(leftChild(node), start, mid, index, value);
        } else {
            update(rightChild(node), mid + 1, end, index, value);
        }
        tree[node] = Math.min(tree[leftChild(node)], tree[rightChild(node)]);
    }

    @Override
    protected double doQuery(int left, int right) {
        return query(0, 0, n - 1, left, right);
    }

    private double query(int node, int start, int end, int left, int right) {
        // Disjoint: identity of min.
        if (right < start || end < left) {
            return Double.POSITIVE_INFINITY;
        }
        // Fully contained: the node already holds the answer.
        if (left <= start && end <= right) {
            return tree[node];
        }
        int mid = (start + end) >>> 1;
        double q1 = query(leftChild(node), start, mid, left, right);
        double q2 = query(rightChild(node), mid + 1, end, left, right);
        return Math.min(q1, q2);
    }

    // Value stored at the root, i.e. the minimum of the whole sequence.
    double rootMinimum() {
        return tree[0];
    }

    @Override
    public RmqType type() { return RmqType.SEGMENT_TREE; }
}
