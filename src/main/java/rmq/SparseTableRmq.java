package rmq;

/**
 * Sparse table for range-minimum queries.
 * Preprocessing O(n log n), queries O(1), space O(n log n).
 * <p>
 * The table is static: every update overwrites the element and rebuilds all levels,
 * so updates cost O(n log n). Use it for query-heavy workloads only.
 */
public final class SparseTableRmq extends AbstractRangeMinimum {

    private final int[] log2;
    // st[k][i] = min of values[i .. i + 2^k - 1]
    private final double[][] st;

    public SparseTableRmq(double[] values) {
        super(values);
        this.log2 = new int[n + 1];
        for (int i = 2; i <= n; i++) {
            log2[i] = log2[i >> 1] + 1;
        }
        int K = 31 - Integer.numberOfLeadingZeros(n);
        this.st = new double[K + 1][n];
        build();
    }

    private void build() {
        System.arraycopy(values, 0, st[0], 0, n);
        for (int k = 1; k < st.length; k++) {
            int len = 1 << k;
            int half = len >> 1;
            double[] prev = st[k - 1];
            double[] cur = st[k];
            for (int i = 0; i + len <= n; i++) {
                cur[i] = Math.min(prev[i], prev[i + half]);
            }
        }
    }

    @Override
    protected void doUpdate(int index, double value) {
        values[index] = value;
        build();
    }

    // The two blocks of length 2^k cover [l, r] and may overlap; overlap is harmless for min.
    @Override
    protected double doQuery(int left, int right) {
        int k = log2[right - left + 1];
        return Math.min(st[k][left], st[k][right - (1 << k) + 1]);
    }

    int levels() {
        return st.length;
    }

    @Override
    public RmqType type() { return RmqType.SPARSE_TABLE; }
}
