package com.edge.mosaic.core.transform;

import com.edge.mosaic.core.feature.Keypoint;
import com.edge.mosaic.core.match.Correspondence;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RansacAffineFitterTest {

    private static final AffineTransform TRUTH = new AffineTransform(1.2, -0.1, 160, 0.1, 1.2, -40);
    private static final float[] DESCRIPTOR = {0f};

    /**
     * moving 点随机分布，reference = TRUTH(moving)
     */
    private static List<Correspondence> inliers(int count, double noise, Random random) {
        List<Correspondence> matches = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double x = random.nextDouble() * 400;
            double y = random.nextDouble() * 800;
            double rx = TRUTH.applyX(x, y) + random.nextGaussian() * noise;
            double ry = TRUTH.applyY(x, y) + random.nextGaussian() * noise;
            matches.add(pair(rx, ry, x, y));
        }
        return matches;
    }

    /**
     * 与真实位置至少偏离 50 像素
     */
    private static List<Correspondence> outliers(int count, Random random) {
        List<Correspondence> matches = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double x = random.nextDouble() * 400;
            double y = random.nextDouble() * 800;
            double angle = random.nextDouble() * 2 * Math.PI;
            double offset = 50 + random.nextDouble() * 200;
            matches.add(pair(TRUTH.applyX(x, y) + offset * Math.cos(angle),
                TRUTH.applyY(x, y) + offset * Math.sin(angle), x, y));
        }
        return matches;
    }

    private static Correspondence pair(double rx, double ry, double mx, double my) {
        return new Correspondence(new Keypoint(rx, ry, 1, 1, DESCRIPTOR), new Keypoint(mx, my, 1, 1, DESCRIPTOR), 0);
    }

    private static RansacAffineFitter seededFitter() {
        return new RansacAffineFitter(RansacSettings.defaults().withSeed(7L));
    }

    @Test
    void testFit_FewerThanThreeMatchesIsNoResult() {
        List<Correspondence> two = inliers(2, 0, new Random(1));

        FitResult result = seededFitter().fit(two);

        assertFalse(result.isFound());
        assertTrue(result.getTransform().isEmpty());
        assertEquals(2, result.getMatchCount());
        assertTrue(result.getInliers().isEmpty());
    }

    @Test
    void testFit_RecoversTransformDespiteOutliers() {
        Random random = new Random(11);
        List<Correspondence> matches = new ArrayList<>(inliers(100, 0, random));
        matches.addAll(outliers(60, random));
        Collections.shuffle(matches, random);

        FitResult result = seededFitter().fit(matches);

        assertTrue(result.isFound());
        assertTrue(result.getTransform().get().approxEquals(TRUTH, 1e-6), result.toString());
        assertEquals(100, result.getInlierCount());
        assertEquals(160, result.getMatchCount());
        assertTrue(result.getMeanError() < 1e-6);
    }

    @Test
    void testFit_NoisyInliersStayWithinTolerance() {
        Random random = new Random(5);
        List<Correspondence> matches = new ArrayList<>(inliers(200, 0.5, random));
        matches.addAll(outliers(100, random));

        FitResult result = seededFitter().fit(matches);

        assertTrue(result.isFound());
        assertTrue(result.getTransform().get().approxEquals(TRUTH, 0.02), result.toString());
        assertTrue(result.getInlierCount() <= result.getMatchCount());
        assertTrue(result.getInlierCount() >= 190);
    }

    @Test
    void testFit_UnrelatedPointsIsNoResult() {
        Random random = new Random(3);
        List<Correspondence> matches = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            matches.add(pair(random.nextDouble() * 1000, random.nextDouble() * 1000,
                random.nextDouble() * 1000, random.nextDouble() * 1000));
        }

        FitResult result = seededFitter().fit(matches);

        assertFalse(result.isFound());
        assertEquals(80, result.getMatchCount());
    }

    @Test
    void testFit_InlierRatioBelowMinimumIsNoResult() {
        Random random = new Random(9);
        List<Correspondence> matches = new ArrayList<>(inliers(12, 0, random));
        matches.addAll(outliers(200, random));

        FitResult result = seededFitter().fit(matches);

        // 12 / 212 < 0.1
        assertFalse(result.isFound());
        assertEquals(212, result.getMatchCount());
    }

    @Test
    void testFit_SameSeedIsReproducible() {
        Random random = new Random(21);
        List<Correspondence> matches = new ArrayList<>(inliers(80, 1.0, random));
        matches.addAll(outliers(80, random));

        FitResult first = seededFitter().fit(matches);
        FitResult second = seededFitter().fit(matches);

        assertTrue(first.isFound());
        assertEquals(first.getTransform(), second.getTransform());
        assertEquals(first.getInlierCount(), second.getInlierCount());
    }

    @Test
    void testSolveExact_CollinearSampleIsRejected() {
        double[] sx = {0, 1, 2};
        double[] sy = {0, 1, 2};
        double[] dx = {5, 6, 7};
        double[] dy = {3, 4, 5};

        assertNull(RansacAffineFitter.solveExact(sx, sy, dx, dy, new int[]{0, 1, 2}));
    }

    @Test
    void testSolveExact_ThreePointsDetermineTransform() {
        double[] sx = {0, 100, 0};
        double[] sy = {0, 0, 100};
        double[] dx = new double[3], dy = new double[3];
        for (int i = 0; i < 3; i++) {
            dx[i] = TRUTH.applyX(sx[i], sy[i]);
            dy[i] = TRUTH.applyY(sx[i], sy[i]);
        }

        AffineTransform solved = RansacAffineFitter.solveExact(sx, sy, dx, dy, new int[]{0, 1, 2});

        assertNotNull(solved);
        assertTrue(solved.approxEquals(TRUTH, 1e-9), solved.toString());
    }
}
