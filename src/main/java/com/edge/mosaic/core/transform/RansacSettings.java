package com.edge.mosaic.core.transform;

import java.util.Random;

/**
 * RANSAC 参数
 * <p>
 * seed 为空时每次拟合使用新的随机源；测试中固定 seed 可完全复现。
 */
public final class RansacSettings {
    private final double reprojectionThreshold;   // 内点判定的像素距离
    private final int maxIterations;
    private final double confidence;              // 自适应迭代次数使用的置信度
    private final int minInliers;
    private final double minInlierRatio;
    private final Long seed;

    public RansacSettings(double reprojectionThreshold, int maxIterations, double confidence,
                          int minInliers, double minInlierRatio, Long seed) {
        if (!(reprojectionThreshold > 0)) {
            throw new IllegalArgumentException("reprojectionThreshold must be positive: " + reprojectionThreshold);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1: " + maxIterations);
        }
        if (!(confidence > 0 && confidence < 1)) {
            throw new IllegalArgumentException("confidence must be within (0, 1): " + confidence);
        }
        if (minInliers < 3) {
            throw new IllegalArgumentException("minInliers must be >= 3: " + minInliers);
        }
        if (!(minInlierRatio >= 0 && minInlierRatio <= 1)) {
            throw new IllegalArgumentException("minInlierRatio must be within [0, 1]: " + minInlierRatio);
        }
        this.reprojectionThreshold = reprojectionThreshold;
        this.maxIterations = maxIterations;
        this.confidence = confidence;
        this.minInliers = minInliers;
        this.minInlierRatio = minInlierRatio;
        this.seed = seed;
    }

    public static RansacSettings defaults() {
        return new RansacSettings(3.0, 2000, 0.995, 10, 0.1, null);
    }

    public RansacSettings withSeed(Long seed) {
        return new RansacSettings(reprojectionThreshold, maxIterations, confidence, minInliers, minInlierRatio, seed);
    }

    public Random newRandom() {
        return seed == null ? new Random() : new Random(seed);
    }

    public double getReprojectionThreshold() { return reprojectionThreshold; }
    public int getMaxIterations() { return maxIterations; }
    public double getConfidence() { return confidence; }
    public int getMinInliers() { return minInliers; }
    public double getMinInlierRatio() { return minInlierRatio; }
    public Long getSeed() { return seed; }

    @Override
    public String toString() {
        return "ransac[thr=" + reprojectionThreshold + ", iter=" + maxIterations + ", conf=" + confidence
            + ", minInliers=" + minInliers + ", minRatio=" + minInlierRatio + ", seed=" + seed + "]";
    }
}
