package rmq;

import java.util.Arrays;

// Owns the sequence and the validation shared by all strategies.
abstract class AbstractRangeMinimum implements RangeMinimumQuery {

    protected final double[] values;
    protected final int n;

    protected AbstractRangeMinimum(double[] values) {
        if (values == null) {
            throw RmqException.invalidType("Input array must be a sequence of numbers.");
        }
        if (values.length == 0) {
            throw RmqException.emptyInput();
        }
        this.values = Arrays.copyOf(values, values.length);
        this.n = values.length;
    }

    @Override
    public final void update(int index, double value) {
        checkIndex(index);
        doUpdate(index, value);
    }

    @Override
    public final double query(int left, int right) {
        if (left < 0 || left >= n || right < 0 || right >= n) {
            throw RmqException.indexOutOfBounds(
                    "Range indices [" + left + ", " + right + "] are out of bounds for size " + n + ".");
        }
        if (left > right) {
            throw RmqException.invalidRange(left, right);
        }
        return doQuery(left, right);
    }

    protected abstract void doUpdate(int index, double value);

    // Bounds are already validated and left <= right.
    protected abstract double doQuery(int left, int right);

    @Override
    public int size() { return n; }

    @Override
    public double get(int index) {
        checkIndex(index);
        return values[index];
    }

    @Override
    public double[] toArray() {
        return Arrays.copyOf(values, n);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= n) {
            throw RmqException.indexOutOfBounds("Index " + index + " is out of bounds for size " + n + ".");
        }
    }

    @Override
    public String toString() {
        return type().displayName() + "[n=" + n + "]";
    }
}
