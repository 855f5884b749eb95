package rmq;

/**
 * Point-update / range-minimum-query over a mutable sequence of doubles.
 * Implementations are built once from an initial array and own a private copy of it.
 * Instances are not thread-safe.
 */
public interface RangeMinimumQuery {

    /**
     * Sets the element at {@code index} to {@code value}.
     *
     * @throws RmqException INDEX_OUT_OF_BOUNDS if index is outside [0, size())
     */
    void update(int index, double value);

    /**
     * Minimum over the inclusive range [left, right].
     *
     * @throws RmqException INDEX_OUT_OF_BOUNDS if a bound is outside [0, size()),
     *                      INVALID_RANGE if left > right
     */
    double query(int left, int right);

    int size();

    double get(int index);

    // Copy of the current sequence.
    double[] toArray();

    RmqType type();
}
