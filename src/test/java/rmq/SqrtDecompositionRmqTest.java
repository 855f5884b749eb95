package rmq;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqrtDecompositionRmqTest {

    @Test
    void blockLayout() {
        SqrtDecompositionRmq srd = new SqrtDecompositionRmq(new double[10]);
        assertEquals(4, srd.blockSize());
        assertEquals(3, srd.blockCount());

        srd = new SqrtDecompositionRmq(new double[16]);
        assertEquals(4, srd.blockSize());
        assertEquals(4, srd.blockCount());

        srd = new SqrtDecompositionRmq(new double[1]);
        assertEquals(1, srd.blockSize());
        assertEquals(1, srd.blockCount());
    }

    @Test
    void blockMinimaAfterBuild() {
        SqrtDecompositionRmq srd = new SqrtDecompositionRmq(new double[]{5, 3, 8, 2, 7, 1, 9, 6, 4, 0});
        // blockSize 4: [5,3,8,2] [7,1,9,6] [4,0]
        assertEquals(2.0, srd.blockMinimum(0));
        assertEquals(1.0, srd.blockMinimum(1));
        assertEquals(0.0, srd.blockMinimum(2));
    }

    @Test
    void raisingBlockMinimumRescansTheBlock() {
        SqrtDecompositionRmq srd = new SqrtDecompositionRmq(new double[]{5, 3, 8, 2, 7, 1, 9, 6, 4, 0});
        srd.update(3, 10.0);
        assertEquals(3.0, srd.blockMinimum(0));
        assertEquals(3.0, srd.query(0, 3));
        assertEquals(1.0, srd.query(0, 7));

        srd.update(5, 50.0);
        assertEquals(6.0, srd.blockMinimum(1));
        assertEquals(6.0, srd.query(4, 7));
    }

    @Test
    void loweringBlockMinimum() {
        SqrtDecompositionRmq srd = new SqrtDecompositionRmq(new double[]{5, 3, 8, 2, 7, 1, 9, 6, 4, 0});
        srd.update(6, -4.0);
        assertEquals(-4.0, srd.blockMinimum(1));
        assertEquals(-4.0, srd.query(0, 9));
    }

    @Test
    void headFullBlocksAndTail() {
        double[] data = new double[25];
        for (int i = 0; i < data.length; i++) data[i] = 100 - i;
        SqrtDecompositionRmq srd = new SqrtDecompositionRmq(data);
        assertEquals(5, srd.blockSize());
        // head 3..4, blocks 5..19, tail 20..22
        assertEquals(78.0, srd.query(3, 22));
        // within one block
        assertEquals(88.0, srd.query(11, 12));
        // exactly one aligned block
        assertEquals(81.0, srd.query(15, 19));
        assertEquals(76.0, srd.query(0, 24));
    }
}
