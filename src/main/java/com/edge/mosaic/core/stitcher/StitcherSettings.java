package com.edge.mosaic.core.stitcher;

import com.edge.mosaic.core.feature.FeatureSettings;
import com.edge.mosaic.core.match.RatioTestMatcher;
import com.edge.mosaic.core.raster.CropWindow;
import com.edge.mosaic.core.transform.RansacSettings;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stitcher 的不可变配置
 * <p>
 * scales: 依次尝试的缩放比例，必须非空、严格单调（递增或递减）
 * crop: 特征提取前的裁剪窗口
 * cacheDir: 特征缓存目录，为空则不缓存
 */
public final class StitcherSettings {

    private final List<Double> scales;
    private final CropWindow crop;
    private final Path cacheDir;
    private final FeatureSettings feature;
    private final double matchRatio;
    private final RansacSettings ransac;

    private StitcherSettings(Builder builder) {
        this.scales = List.copyOf(builder.scales);
        this.crop = builder.crop;
        this.cacheDir = builder.cacheDir;
        this.feature = builder.feature;
        this.matchRatio = builder.matchRatio;
        this.ransac = builder.ransac;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StitcherSettings defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
            .scales(scales)
            .crop(crop)
            .cacheDir(cacheDir)
            .feature(feature)
            .matchRatio(matchRatio)
            .ransac(ransac);
    }

    public List<Double> getScales() { return scales; }
    public CropWindow getCrop() { return crop; }
    public Optional<Path> getCacheDir() { return Optional.ofNullable(cacheDir); }
    public FeatureSettings getFeature() { return feature; }
    public double getMatchRatio() { return matchRatio; }
    public RansacSettings getRansac() { return ransac; }

    @Override
    public String toString() {
        return "StitcherSettings{scales=" + scales + ", crop=" + crop + ", cacheDir=" + cacheDir
            + ", feature=" + feature + ", ratio=" + matchRatio + ", " + ransac + "}";
    }

    public static final class Builder {
        private List<Double> scales = List.of(0.5, 1.0);
        private CropWindow crop = CropWindow.full();
        private Path cacheDir;
        private FeatureSettings feature = FeatureSettings.defaults();
        private double matchRatio = RatioTestMatcher.DEFAULT_RATIO;
        private RansacSettings ransac = RansacSettings.defaults();

        private Builder() {
        }

        public Builder scales(List<Double> scales) {
            this.scales = scales == null ? null : new ArrayList<>(scales);
            return this;
        }

        public Builder scales(double... scales) {
            List<Double> list = new ArrayList<>(scales.length);
            for (double s : scales) list.add(s);
            this.scales = list;
            return this;
        }

        public Builder crop(CropWindow crop) {
            this.crop = crop;
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        public Builder feature(FeatureSettings feature) {
            this.feature = feature;
            return this;
        }

        public Builder matchRatio(double matchRatio) {
            this.matchRatio = matchRatio;
            return this;
        }

        public Builder ransac(RansacSettings ransac) {
            this.ransac = ransac;
            return this;
        }

        public StitcherSettings build() {
            validateScales(scales);
            if (crop == null) {
                throw new IllegalArgumentException("Crop window cannot be null");
            }
            if (feature == null || ransac == null) {
                throw new IllegalArgumentException("Feature and RANSAC settings cannot be null");
            }
            if (!(matchRatio > 0 && matchRatio <= 1)) {
                throw new IllegalArgumentException("Match ratio must be within (0, 1]: " + matchRatio);
            }
            return new StitcherSettings(this);
        }

        private static void validateScales(List<Double> scales) {
            if (scales == null || scales.isEmpty()) {
                throw new IllegalArgumentException("Scale list cannot be empty");
            }
            for (Double s : scales) {
                if (s == null || !Double.isFinite(s) || s <= 0) {
                    throw new IllegalArgumentException("Scales must be finite and positive: " + scales);
                }
            }
            if (scales.size() < 2) {
                return;
            }
            boolean increasing = scales.get(1) > scales.get(0);
            for (int i = 1; i < scales.size(); i++) {
                double prev = scales.get(i - 1), cur = scales.get(i);
                if (increasing ? cur <= prev : cur >= prev) {
                    throw new IllegalArgumentException("Scales must be strictly increasing or strictly decreasing: " + scales);
                }
            }
        }
    }
}
