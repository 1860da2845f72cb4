package com.edge.mosaic.core.feature;

import java.util.Locale;

/**
 * SIFT 检测参数
 */
public final class FeatureSettings {
    private final int maxKeypoints;          // 0 表示不限制
    private final int octaveLayers;
    private final double contrastThreshold;
    private final double edgeThreshold;
    private final double sigma;

    public FeatureSettings(int maxKeypoints, int octaveLayers, double contrastThreshold,
                           double edgeThreshold, double sigma) {
        if (maxKeypoints < 0) {
            throw new IllegalArgumentException("maxKeypoints must be >= 0: " + maxKeypoints);
        }
        if (octaveLayers < 1) {
            throw new IllegalArgumentException("octaveLayers must be >= 1: " + octaveLayers);
        }
        if (!(contrastThreshold > 0) || !(edgeThreshold > 0) || !(sigma > 0)) {
            throw new IllegalArgumentException("SIFT thresholds and sigma must be positive");
        }
        this.maxKeypoints = maxKeypoints;
        this.octaveLayers = octaveLayers;
        this.contrastThreshold = contrastThreshold;
        this.edgeThreshold = edgeThreshold;
        this.sigma = sigma;
    }

    /**
     * OpenCV SIFT 默认值
     */
    public static FeatureSettings defaults() {
        return new FeatureSettings(0, 3, 0.04, 10.0, 1.6);
    }

    public int getMaxKeypoints() { return maxKeypoints; }
    public int getOctaveLayers() { return octaveLayers; }
    public double getContrastThreshold() { return contrastThreshold; }
    public double getEdgeThreshold() { return edgeThreshold; }
    public double getSigma() { return sigma; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "sift[max=%d, layers=%d, contrast=%.4f, edge=%.2f, sigma=%.3f]",
            maxKeypoints, octaveLayers, contrastThreshold, edgeThreshold, sigma);
    }
}
