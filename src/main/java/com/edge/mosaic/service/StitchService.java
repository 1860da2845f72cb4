package com.edge.mosaic.service;

import com.edge.mosaic.config.YamlConfig;
import com.edge.mosaic.core.raster.CropWindow;
import com.edge.mosaic.core.stitcher.StitchOptions;
import com.edge.mosaic.core.stitcher.StitchResult;
import com.edge.mosaic.core.stitcher.Stitcher;
import com.edge.mosaic.core.stitcher.StitcherSettings;
import com.edge.mosaic.core.transform.RansacSettings;
import com.edge.mosaic.dto.StitchPairRequest;
import com.edge.mosaic.dto.StitchPairResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 图像对配准服务
 * <p>
 * 负责请求参数校验、可视化输出路径解析，以及把配准结果转换为响应
 */
@Service
public class StitchService {
    private static final Logger logger = LoggerFactory.getLogger(StitchService.class);

    @Autowired
    private Stitcher stitcher;

    @Autowired
    private YamlConfig yamlConfig;

    public StitchPairResponse stitchPair(StitchPairRequest request) {
        if (request == null || isBlank(request.getImg0()) || isBlank(request.getImg1())) {
            throw new IllegalArgumentException("img0 and img1 are required");
        }
        Path img0 = Path.of(request.getImg0());
        Path img1 = Path.of(request.getImg1());
        StitchOptions options = StitchOptions.of(request.isVerbose(), resolveShowPath(request.getShowPath()));

        logger.info("配准请求: img0={}, img1={}, verbose={}, show={}",
            img0, img1, options.isVerbose(), options.isShow());
        StitchResult result = stitcher.stitchPair(img0, img1, options);

        StitchPairResponse response = new StitchPairResponse();
        response.setFound(result.isFound());
        response.setTransform(result.getTransform().map(t -> t.toArray()).orElse(null));
        response.setScale(result.getScale());
        response.setDiagnostics(result.getDiagnostics().asMap());
        return response;
    }

    /**
     * 当前生效的配准参数
     */
    public Map<String, Object> getConfig() {
        StitcherSettings settings = stitcher.getSettings();
        CropWindow crop = settings.getCrop();
        RansacSettings ransac = settings.getRansac();

        Map<String, Object> cropMap = new LinkedHashMap<>();
        cropMap.put("top", crop.getTop());
        cropMap.put("bottom", crop.getBottom());
        cropMap.put("left", crop.getLeft());
        cropMap.put("right", crop.getRight());

        Map<String, Object> ransacMap = new LinkedHashMap<>();
        ransacMap.put("reprojectionThreshold", ransac.getReprojectionThreshold());
        ransacMap.put("maxIterations", ransac.getMaxIterations());
        ransacMap.put("confidence", ransac.getConfidence());
        ransacMap.put("minInliers", ransac.getMinInliers());
        ransacMap.put("minInlierRatio", ransac.getMinInlierRatio());
        ransacMap.put("seed", ransac.getSeed());

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("scales", settings.getScales());
        config.put("crop", cropMap);
        config.put("cacheDir", settings.getCacheDir().map(Path::toString).orElse(null));
        config.put("outputDir", yamlConfig.getStitching().getOutputDir());
        config.put("feature", settings.getFeature().toString());
        config.put("matchRatio", settings.getMatchRatio());
        config.put("ransac", ransacMap);
        return config;
    }

    /**
     * 可视化输出基础路径只能是 output-dir 下的相对路径
     *
     * @throws IllegalArgumentException 绝对路径，或规范化后落在 output-dir 之外
     */
    Path resolveShowPath(String showPath) {
        if (isBlank(showPath)) {
            return null;
        }
        Path path = Path.of(showPath);
        if (path.isAbsolute()) {
            throw new IllegalArgumentException("showPath must be relative to the output directory: " + showPath);
        }
        String outputDir = yamlConfig.getStitching().getOutputDir();
        Path base = Path.of(isBlank(outputDir) ? "" : outputDir).toAbsolutePath().normalize();
        Path resolved = base.resolve(path).normalize();
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw new IllegalArgumentException("showPath escapes the output directory: " + showPath);
        }
        return resolved;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
