package com.edge.mosaic.config;

import com.edge.mosaic.core.feature.FeatureSettings;
import com.edge.mosaic.core.raster.CropWindow;
import com.edge.mosaic.core.stitcher.Stitcher;
import com.edge.mosaic.core.stitcher.StitcherSettings;
import com.edge.mosaic.core.transform.RansacSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * 配准器配置
 * <p>
 * 从 application.yml 读取配置，构建不可变的 StitcherSettings 并注入到 Stitcher
 */
@Configuration
public class StitcherConfig {
    private static final Logger logger = LoggerFactory.getLogger(StitcherConfig.class);

    @Autowired
    private YamlConfig yamlConfig;

    @Bean
    public StitcherSettings stitcherSettings() {
        StitcherSettings settings = toSettings(yamlConfig);
        logger.info("Stitcher 配置: {}", settings);
        return settings;
    }

    @Bean
    public Stitcher stitcher(StitcherSettings stitcherSettings) {
        NativeLibraryLoader.loadNativeLibraries();
        return new Stitcher(stitcherSettings);
    }

    /**
     * yml 配置 -> StitcherSettings，非法配置抛 IllegalArgumentException
     */
    static StitcherSettings toSettings(YamlConfig config) {
        YamlConfig.StitchingConfig stitching = config.getStitching();
        YamlConfig.CropConfig crop = stitching.getCrop();
        YamlConfig.FeatureConfig feature = config.getFeature();
        YamlConfig.RansacConfig ransac = config.getRansac();

        String cacheDir = stitching.getCacheDir();
        return StitcherSettings.builder()
            .scales(stitching.getScales())
            .crop(CropWindow.of(crop.getTop(), crop.getBottom(), crop.getLeft(), crop.getRight()))
            .cacheDir(cacheDir == null || cacheDir.isBlank() ? null : Path.of(cacheDir))
            .feature(new FeatureSettings(feature.getMaxKeypoints(), feature.getOctaveLayers(),
                feature.getContrastThreshold(), feature.getEdgeThreshold(), feature.getSigma()))
            .matchRatio(config.getMatch().getRatio())
            .ransac(new RansacSettings(ransac.getReprojectionThreshold(), ransac.getMaxIterations(),
                ransac.getConfidence(), ransac.getMinInliers(), ransac.getMinInlierRatio(), ransac.getSeed()))
            .build();
    }
}
