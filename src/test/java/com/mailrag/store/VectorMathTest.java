package com.mailrag.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

class VectorMathTest {

    @Test
    void shouldOrderByDistanceThenInsertionOrder() {
        List<VectorMath.Scored<String>> ranked = VectorMath.nearest(List.of(
                new VectorMath.Scored<>("late-tie", 1f, 5),
                new VectorMath.Scored<>("far", 4f, 0),
                new VectorMath.Scored<>("early-tie", 1f, 2),
                new VectorMath.Scored<>("closest", 0.5f, 9)), 3);

        assertEquals(List.of("closest", "early-tie", "late-tie"), ranked.stream().map(VectorMath.Scored::item).toList());
    }

    @Test
    void shouldFailOnMismatchedLengthsInsteadOfTruncating() {
        assertThrows(DimensionMismatchException.class, () -> VectorMath.squaredL2(new float[3], new float[4]));
    }

    @Test
    void shouldDecodeWhatWasEncoded() {
        float[] embedding = { 1.5f, -2f, 0f, Float.MIN_VALUE };

        assertArrayEquals(embedding, EmbeddingCodec.decode(EmbeddingCodec.encode(embedding)));
        assertThrows(IllegalArgumentException.class, () -> EmbeddingCodec.decode(new byte[] { 0, 0, 0, 9, 1 }));
    }

    @Test
    void shouldDetectNonFiniteValues() {
        assertFalse(VectorMath.isFinite(new float[] { 1f, Float.NaN }));
        assertFalse(VectorMath.isFinite(new float[] { Float.POSITIVE_INFINITY }));
    }
}
