package rmq;

import java.util.Arrays;

/**
 * Square root decomposition: the sequence is split into ceil(n / b) blocks of size
 * b = ceil(sqrt(n)) and the minimum of each block is kept in {@code blockMin}.
 * Update O(sqrt n), query O(sqrt n).
 */
public final class SqrtDecompositionRmq extends AbstractRangeMinimum {

    private final int blockSize;
    private final double[] blockMin;

    public SqrtDecompositionRmq(double[] values) {
        super(values);
        this.blockSize = (int) Math.ceil(Math.sqrt(n));
        this.blockMin = new double[(n + blockSize - 1) / blockSize];
        Arrays.fill(blockMin, Double.POSITIVE_INFINITY);
        for (int i = 0; i < n; i++) {
            int block = i / blockSize;
            blockMin[block] = Math.min(blockMin[block], values[i]);
        }
    }

    // The old value may have been the block minimum, so the block is rescanned
    // instead of folding the new value into the stored minimum.
    @Override
    protected void doUpdate(int index, double value) {
        values[index] = value;
        int block = index / blockSize;
        int from = block * blockSize;
        int to = Math.min(from + blockSize, n);
        double min = Double.POSITIVE_INFINITY;
        for (int i = from; i < to; i++) {
            min = Math.min(min, values[i]);
        }
        blockMin[block] = min;
    }

    @Override
    protected double doQuery(int left, int right) {
        double currentMin = Double.POSITIVE_INFINITY;

        // Head of a partially covered block.
        while (left < right && left % blockSize != 0) {
            currentMin = Math.min(currentMin, values[left]);
            left++;
        }
        // Whole blocks.
        while (left + blockSize <= right + 1) {
            currentMin = Math.min(currentMin, blockMin[left / blockSize]);
            left += blockSize;
        }
        // Tail.
        while (left <= right) {
            currentMin = Math.min(currentMin, values[left]);
            left++;
        }
        return currentMin;
    }

    int blockSize() { return blockSize; }

    int blockCount() { return blockMin.length; }

    double blockMinimum(int block) { return blockMin[block]; }

    @Override
    public RmqType type() { return RmqType.SQRT_DECOMPOSITION; }
}
