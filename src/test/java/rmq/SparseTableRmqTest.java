package rmq;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SparseTableRmqTest {

    @Test
    void levelCountIsFloorLog2PlusOne() {
        assertEquals(1, new SparseTableRmq(new double[1]).levels());
        assertEquals(2, new SparseTableRmq(new double[2]).levels());
        assertEquals(2, new SparseTableRmq(new double[3]).levels());
        assertEquals(3, new SparseTableRmq(new double[4]).levels());
        assertEquals(3, new SparseTableRmq(new double[7]).levels());
        assertEquals(4, new SparseTableRmq(new double[8]).levels());
        assertEquals(11, new SparseTableRmq(new double[1024]).levels());
    }

    @Test
    void powerOfTwoSizesCoverTheFullRange() {
        for (int n = 1; n <= 64; n <<= 1) {
            double[] data = new double[n];
            for (int i = 0; i < n; i++) data[i] = n - i;
            SparseTableRmq st = new SparseTableRmq(data);
            assertEquals(1.0, st.query(0, n - 1));
            assertEquals(n, st.query(0, 0));
        }
    }

    @Test
    void updateRebuildsEveryLevel() {
        double[] data = new double[16];
        for (int i = 0; i < data.length; i++) data[i] = i;
        SparseTableRmq st = new SparseTableRmq(data);
        assertEquals(0.0, st.query(0, 15));

        // Raising the old minimum must be seen by ranges of every length.
        st.update(0, 100.0);
        assertEquals(1.0, st.query(0, 15));
        assertEquals(1.0, st.query(0, 7));
        assertEquals(1.0, st.query(0, 1));
        assertEquals(100.0, st.query(0, 0));

        st.update(9, -3.0);
        assertEquals(-3.0, st.query(8, 11));
        assertEquals(-3.0, st.query(0, 15));
        assertEquals(1.0, st.query(0, 8));
    }

    @Test
    void overlappingHalvesForNonPowerOfTwoLengths() {
        SparseTableRmq st = new SparseTableRmq(new double[]{9, 8, 7, 1, 6, 5, 4});
        assertEquals(1.0, st.query(0, 6));
        assertEquals(4.0, st.query(4, 6));
        assertEquals(5.0, st.query(4, 5));
        assertEquals(1.0, st.query(1, 3));
        assertEquals(7.0, st.query(0, 2));
    }
}
