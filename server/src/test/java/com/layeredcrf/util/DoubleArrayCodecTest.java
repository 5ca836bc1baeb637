package com.layeredcrf.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class DoubleArrayCodecTest {

    @Test
    public void testCountsTableRoundTrip() {
        double[] counts = { 12.0, 0.0, 3.0, 1e9, 7.0, 0.0 };
        byte[] bytes = DoubleArrayCodec.toBytes(counts);
        Assertions.assertEquals(counts.length * Double.BYTES, bytes.length);
        Assertions.assertArrayEquals(counts, DoubleArrayCodec.fromBytes(bytes), 0.0);
    }

    @Test
    public void testNullAndTruncatedBlobs() {
        Assertions.assertNull(DoubleArrayCodec.toBytes(null));
        Assertions.assertNull(DoubleArrayCodec.fromBytes(null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> DoubleArrayCodec.fromBytes(new byte[12]));
    }
}
