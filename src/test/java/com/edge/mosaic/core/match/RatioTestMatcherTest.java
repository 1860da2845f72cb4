package com.edge.mosaic.core.match;

import com.edge.mosaic.core.feature.FeatureSet;
import com.edge.mosaic.core.feature.Keypoint;
import com.edge.mosaic.testing.OpenCvTestSupport;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RatioTestMatcherTest {

    @BeforeAll
    static void loadOpenCv() {
        OpenCvTestSupport.load();
    }

    private static Keypoint kp(double x, double y, float... descriptor) {
        return new Keypoint(x, y, 2, 1, descriptor);
    }

    @Test
    void testMatch_DistinctDescriptorsPass() {
        FeatureSet reference = new FeatureSet(List.of(
            kp(10, 10, 1, 0, 0, 0),
            kp(20, 20, 0, 1, 0, 0)), 4);
        FeatureSet moving = new FeatureSet(List.of(
            kp(110, 10, 1, 0, 0, 0.01f),
            kp(120, 20, 0, 1, 0, 0),
            kp(130, 30, 0, 0, 1, 0)), 4);

        List<Correspondence> matches = new RatioTestMatcher().match(reference, moving);

        assertEquals(2, matches.size());
        for (Correspondence c : matches) {
            assertEquals(c.getReference().getX() + 100, c.getMoving().getX(), 1e-9);
        }
        // 按距离升序
        assertTrue(matches.get(0).getDistance() <= matches.get(1).getDistance());
    }

    @Test
    void testMatch_AmbiguousCandidateIsRejected() {
        FeatureSet reference = new FeatureSet(List.of(kp(10, 10, 1, 0, 0, 0)), 4);
        FeatureSet moving = new FeatureSet(List.of(
            kp(50, 50, 0.9f, 0.1f, 0, 0),
            kp(60, 60, 0.9f, 0, 0.1f, 0)), 4);

        assertTrue(new RatioTestMatcher().match(reference, moving).isEmpty());
    }

    @Test
    void testMatch_EachMovingKeypointUsedOnce() {
        FeatureSet reference = new FeatureSet(List.of(
            kp(10, 10, 1, 0, 0, 0),
            kp(20, 20, 0.99f, 0, 0, 0)), 4);
        FeatureSet moving = new FeatureSet(List.of(
            kp(70, 70, 1, 0, 0, 0),
            kp(80, 80, 0, 0, 0, 1)), 4);

        List<Correspondence> matches = new RatioTestMatcher().match(reference, moving);

        assertEquals(1, matches.size());
        assertEquals(10, matches.get(0).getReference().getX(), 1e-9);
        assertTrue(matches.size() <= Math.min(reference.size(), moving.size()));
    }

    @Test
    void testMatch_TooFewKeypointsIsEmpty() {
        FeatureSet reference = new FeatureSet(List.of(kp(10, 10, 1, 0, 0, 0)), 4);
        FeatureSet single = new FeatureSet(List.of(kp(10, 10, 1, 0, 0, 0)), 4);

        assertTrue(new RatioTestMatcher().match(reference, single).isEmpty());
        assertTrue(new RatioTestMatcher().match(FeatureSet.empty(4), single).isEmpty());
    }

    @Test
    void testMatch_DescriptorSizeMismatchThrows() {
        FeatureSet reference = new FeatureSet(List.of(kp(10, 10, 1, 0)), 2);
        FeatureSet moving = new FeatureSet(List.of(kp(1, 1, 1, 0, 0), kp(2, 2, 0, 1, 0)), 3);

        assertThrows(IllegalArgumentException.class, () -> new RatioTestMatcher().match(reference, moving));
    }

    @Test
    void testConstructor_RejectsRatioOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> new RatioTestMatcher(0));
        assertThrows(IllegalArgumentException.class, () -> new RatioTestMatcher(1.5));
    }
}
