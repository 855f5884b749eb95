package rmq;

/**
 * Baseline with no auxiliary state.
 * Update O(1), query O(r - l + 1).
 */
public final class NaiveRmq extends AbstractRangeMinimum {

    public NaiveRmq(double[] values) {
        super(values);
    }

    @Override
    protected void doUpdate(int index, double value) {
        values[index] = value;
    }

    @Override
    protected double doQuery(int left, int right) {
        double currentMin = Double.POSITIVE_INFINITY;
        for (int i = left; i <= right; i++) {
            currentMin = Math.min(currentMin, values[i]);
        }
        return currentMin;
    }

    @Override
    public RmqType type() { return RmqType.NAIVE; }
}
