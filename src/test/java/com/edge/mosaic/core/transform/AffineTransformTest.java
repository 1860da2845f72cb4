package com.edge.mosaic.core.transform;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AffineTransformTest {

    private static final AffineTransform T = new AffineTransform(1.1, -0.1, 200, 0.1, 1.1, 10);

    @Test
    void testCompose_AppliesRightOperandFirst() {
        AffineTransform shift = AffineTransform.translation(5, -3);
        AffineTransform scale = AffineTransform.scaling(2, 2);

        AffineTransform composed = shift.compose(scale);

        // (1, 1) -> 缩放 (2, 2) -> 平移 (7, -1)
        assertEquals(7.0, composed.applyX(1, 1), 1e-12);
        assertEquals(-1.0, composed.applyY(1, 1), 1e-12);
    }

    @Test
    void testInverse_RoundTripIsIdentity() {
        AffineTransform roundTrip = T.inverse().compose(T);
        assertTrue(roundTrip.approxEquals(AffineTransform.identity(), 1e-9),
            "Expected identity but was " + roundTrip);
    }

    @Test
    void testInverse_SingularThrows() {
        AffineTransform collapse = new AffineTransform(1, 2, 0, 2, 4, 0);
        assertFalse(collapse.isInvertible());
        assertThrows(IllegalStateException.class, collapse::inverse);
    }

    @Test
    void testIsInvertible_RejectsNonFinite() {
        assertFalse(new AffineTransform(1, 0, Double.NaN, 0, 1, 0).isInvertible());
        assertFalse(new AffineTransform(Double.POSITIVE_INFINITY, 0, 0, 0, 1, 0).isInvertible());
        assertTrue(T.isInvertible());
    }

    @Test
    void testApproxEquals_RelativePerCoefficient() {
        AffineTransform close = new AffineTransform(1.1 * 1.01, -0.1 * 0.99, 200 * 1.015, 0.1, 1.1, 10 * 1.019);
        AffineTransform far = new AffineTransform(1.1, -0.1 * 1.05, 200, 0.1, 1.1, 10);

        assertTrue(close.approxEquals(T, 0.02));
        assertFalse(far.approxEquals(T, 0.02));
    }

    @Test
    void testOf_RequiresSixCoefficients() {
        assertEquals(T, AffineTransform.of(T.toArray()));
        assertThrows(IllegalArgumentException.class, () -> AffineTransform.of(new double[]{1, 0, 0, 0, 1}));
    }
}
