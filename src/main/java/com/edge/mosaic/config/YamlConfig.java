package com.edge.mosaic.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "edge-mosaic")
public class YamlConfig {
    private StitchingConfig stitching = new StitchingConfig();
    private FeatureConfig feature = new FeatureConfig();
    private MatchConfig match = new MatchConfig();
    private RansacConfig ransac = new RansacConfig();

    @Data
    public static class StitchingConfig {
        private List<Double> scales = new ArrayList<>(List.of(0.5, 1.0));  // 按顺序尝试
        private CropConfig crop = new CropConfig();
        private String cacheDir = "data/feature-cache";  // 为空则不缓存
        private String outputDir = "data/output";        // 可视化输出目录
    }

    @Data
    public static class CropConfig {
        // 保留窗口，取值为宽高的比例
        private double top = 0.0;
        private double bottom = 1.0;
        private double left = 0.0;
        private double right = 1.0;
    }

    @Data
    public static class FeatureConfig {
        private int maxKeypoints = 0;          // 0 表示不限制
        private double contrastThreshold = 0.04;
        private double edgeThreshold = 10.0;
        private double sigma = 1.6;
        private int octaveLayers = 3;
    }

    @Data
    public static class MatchConfig {
        private double ratio = 0.75;
    }

    @Data
    public static class RansacConfig {
        private double reprojectionThreshold = 3.0;  // 像素
        private int maxIterations = 2000;
        private double confidence = 0.995;
        private int minInliers = 10;
        private double minInlierRatio = 0.1;
        private Long seed;                           // 不设置则每次随机
    }
}
