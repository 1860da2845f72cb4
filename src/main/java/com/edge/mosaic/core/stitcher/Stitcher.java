package com.edge.mosaic.core.stitcher;

import com.edge.mosaic.core.cache.FeatureCache;
import com.edge.mosaic.core.cache.FileFeatureCache;
import com.edge.mosaic.core.cache.NoOpFeatureCache;
import com.edge.mosaic.core.diagnostics.Diagnostics;
import com.edge.mosaic.core.diagnostics.MatchRenderer;
import com.edge.mosaic.core.diagnostics.OpenCvRasterWarper;
import com.edge.mosaic.core.diagnostics.OverlayRenderer;
import com.edge.mosaic.core.diagnostics.RasterWarper;
import com.edge.mosaic.core.feature.FeatureExtractor;
import com.edge.mosaic.core.feature.FeatureSet;
import com.edge.mosaic.core.feature.SiftFeatureExtractor;
import com.edge.mosaic.core.match.Correspondence;
import com.edge.mosaic.core.match.RatioTestMatcher;
import com.edge.mosaic.core.raster.Raster;
import com.edge.mosaic.core.raster.RasterLoader;
import com.edge.mosaic.core.transform.AffineTransform;
import com.edge.mosaic.core.transform.FitResult;
import com.edge.mosaic.core.transform.RansacAffineFitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * 两幅图像的仿射配准
 * <p>
 * 两个入口都走多尺度重试：
 * <ul>
 *   <li>estimateAffine: 内存中的图像，直接提取特征</li>
 *   <li>stitchPair: 按路径加载图像，特征经过缓存</li>
 * </ul>
 * 结果变换把 img1 的像素坐标映射到 img0 的像素坐标，已换算回原图分辨率、未裁剪坐标。
 * <p>
 * 实例本身不持有可变状态，可在多个线程中并发调用（前提是缓存实现线程安全）。
 */
public class Stitcher {
    private static final Logger logger = LoggerFactory.getLogger(Stitcher.class);

    private final StitcherSettings settings;
    private final FeatureExtractor extractor;
    private final FeatureCache cache;
    private final RasterLoader loader;
    private final RatioTestMatcher matcher;
    private final RansacAffineFitter fitter;
    private final MatchRenderer matchRenderer;
    private final OverlayRenderer overlayRenderer;

    public Stitcher(StitcherSettings settings) {
        this(settings,
            new SiftFeatureExtractor(settings.getFeature()),
            settings.getCacheDir().<FeatureCache>map(FileFeatureCache::new).orElse(NoOpFeatureCache.INSTANCE),
            new RasterLoader(),
            new OpenCvRasterWarper());
    }

    public Stitcher(StitcherSettings settings, FeatureExtractor extractor, FeatureCache cache,
                    RasterLoader loader, RasterWarper warper) {
        this.settings = settings;
        this.extractor = extractor;
        this.cache = cache;
        this.loader = loader;
        this.matcher = new RatioTestMatcher(settings.getMatchRatio());
        this.fitter = new RansacAffineFitter(settings.getRansac());
        this.matchRenderer = new MatchRenderer();
        this.overlayRenderer = new OverlayRenderer(warper);
    }

    /**
     * 内存图像配准，只返回变换
     */
    public Optional<AffineTransform> estimateAffine(Raster img0, Raster img1) {
        return estimateAffine(img0, img1, StitchOptions.defaults()).getTransform();
    }

    /**
     * 内存图像配准
     *
     * @param img0    参考图像
     * @param img1    待配准图像
     * @param options verbose / showPath
     * @return 变换（可能为空）+ 诊断记录
     */
    public StitchResult estimateAffine(Raster img0, Raster img1, StitchOptions options) {
        requireRaster(img0, "img0");
        requireRaster(img1, "img1");
        FeatureSource source = (index, frame) -> extractor.extract(frame.getRaster());
        return register(img0, img1, source, options, Diagnostics.builder());
    }

    /**
     * 按路径配准，只返回变换
     */
    public Optional<AffineTransform> stitchPair(Path path0, Path path1) {
        return stitchPair(path0, path1, StitchOptions.defaults()).getTransform();
    }

    /**
     * 按路径配准
     * <p>
     * 诊断记录始终包含 scale、img0、img1。
     *
     * @throws com.edge.mosaic.core.raster.RasterReadException 文件不存在或无法解码
     */
    public StitchResult stitchPair(Path path0, Path path1, StitchOptions options) {
        Raster img0 = loader.load(path0);
        Raster img1 = null;
        try {
            img1 = loader.load(path1);
            Path[] paths = {path0, path1};
            FeatureSource source = (index, frame) -> cachedFeatures(paths[index], frame);

            Diagnostics.Builder diagnostics = Diagnostics.builder()
                .put(Diagnostics.IMG0, path0.toString())
                .put(Diagnostics.IMG1, path1.toString());
            return register(img0, img1, source, options, diagnostics);
        } finally {
            img0.release();
            if (img1 != null) {
                img1.release();
            }
        }
    }

    private StitchResult register(Raster img0, Raster img1, FeatureSource source,
                                  StitchOptions options, Diagnostics.Builder diagnostics) {
        long start = System.currentTimeMillis();
        Random random = settings.getRansac().newRandom();

        MultiScaleController<ScaleAttempt> controller =
            new MultiScaleController<>(settings.getScales(), ScaleAttempt::isFound);
        try {
            ScaleAttempt result = controller.run(scale -> attempt(scale, img0, img1, source, random));
            return conclude(result, controller.getAttempts(), img0, img1, options, diagnostics, start);
        } finally {
            for (ScaleAttempt attempt : controller.getAttempts()) {
                attempt.release();
            }
        }
    }

    private StitchResult conclude(ScaleAttempt result, List<ScaleAttempt> attempts, Raster img0, Raster img1,
                                  StitchOptions options, Diagnostics.Builder diagnostics, long start) {
        FitResult fit = result.getFit();
        AffineTransform transform = result.getFullTransform().orElse(null);

        diagnostics.put(Diagnostics.N_MATCH, fit.getMatchCount())
            .put(Diagnostics.SCALE, result.getScale());
        if (transform != null) {
            diagnostics.put(Diagnostics.N_INLIER, fit.getInlierCount());
        }
        if (options.isVerbose()) {
            putVerbose(diagnostics, result, attempts);
        }
        if (options.isShow()) {
            renderArtifacts(options, img0, img1, result, diagnostics);
        }

        logger.info("配准完成: found={}, scale={}, n_match={}, n_inlier={}, 耗时={}ms",
            transform != null, result.getScale(), fit.getMatchCount(),
            transform != null ? fit.getInlierCount() : "-", System.currentTimeMillis() - start);
        return new StitchResult(transform, diagnostics.build(), result.getScale());
    }

    private ScaleAttempt attempt(double scale, Raster img0, Raster img1, FeatureSource source, Random random) {
        WorkingFrame frame0 = WorkingFrame.prepare(img0, settings.getCrop(), scale);
        WorkingFrame frame1 = null;
        try {
            frame1 = WorkingFrame.prepare(img1, settings.getCrop(), scale);

            FeatureSet features0 = source.features(0, frame0);
            FeatureSet features1 = source.features(1, frame1);
            List<Correspondence> matches = matcher.match(features0, features1);
            FitResult fit = fitter.fit(matches, random);

            logger.debug("scale={}: keypoints={}/{}, matches={}, {}",
                scale, features0.size(), features1.size(), matches.size(), fit);
            return new ScaleAttempt(scale, frame0, frame1, features0, features1, matches, fit);
        } catch (RuntimeException e) {
            // 未形成尝试记录的工作图像在此释放
            frame0.release();
            if (frame1 != null) {
                frame1.release();
            }
            throw e;
        }
    }

    private FeatureSet cachedFeatures(Path path, WorkingFrame frame) {
        Optional<String> key = cacheKey(path, frame.getScale());
        if (key.isEmpty()) {
            return extractor.extract(frame.getRaster());
        }
        return cache.getOrCompute(key.get(), () -> extractor.extract(frame.getRaster()));
    }

    /**
     * 缓存键：绝对路径 + 文件大小 + 修改时间 + 尺度 + 裁剪 + 提取器参数
     * 读不到文件属性时不走缓存
     */
    Optional<String> cacheKey(Path path, double scale) {
        Path absolute = path.toAbsolutePath().normalize();
        try {
            long size = Files.size(absolute);
            long modified = Files.getLastModifiedTime(absolute).toMillis();
            return Optional.of(absolute + "|" + size + "|" + modified + "|" + scale
                + "|" + settings.getCrop().signature() + "|" + extractor.signature());
        } catch (IOException e) {
            logger.warn("无法读取文件属性，跳过特征缓存: {} ({})", absolute, e.getMessage());
            return Optional.empty();
        }
    }

    private static void putVerbose(Diagnostics.Builder diagnostics, ScaleAttempt result, List<ScaleAttempt> attempts) {
        diagnostics.put(Diagnostics.N_KEYPOINT0, result.getFeatures0().size())
            .put(Diagnostics.N_KEYPOINT1, result.getFeatures1().size());

        FitResult fit = result.getFit();
        if (fit.isFound()) {
            List<double[]> inliers = new ArrayList<>(fit.getInlierCount());
            for (Correspondence c : fit.getInliers()) {
                inliers.add(result.toFullResolution(c));
            }
            diagnostics.put(Diagnostics.INLIERS, inliers)
                .put(Diagnostics.MEAN_ERROR, fit.getMeanError());
        }

        List<Map<String, Object>> summary = new ArrayList<>(attempts.size());
        for (ScaleAttempt attempt : attempts) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(Diagnostics.SCALE, attempt.getScale());
            entry.put(Diagnostics.N_MATCH, attempt.getFit().getMatchCount());
            if (attempt.isFound()) {
                entry.put(Diagnostics.N_INLIER, attempt.getFit().getInlierCount());
            }
            summary.add(entry);
        }
        diagnostics.put(Diagnostics.ATTEMPTS, summary);
    }

    private void renderArtifacts(StitchOptions options, Raster img0, Raster img1,
                                 ScaleAttempt result, Diagnostics.Builder diagnostics) {
        Path matchPath = options.matchArtifact();
        FitResult fit = result.getFit();
        matchRenderer.renderTo(matchPath,
            result.getFrame0().getRaster(), result.getFeatures0(),
            result.getFrame1().getRaster(), result.getFeatures1(),
            result.getMatches(), fit.getInliers());
        diagnostics.put(Diagnostics.MATCH_IMAGE, matchPath.toString());

        Optional<AffineTransform> transform = result.getFullTransform();
        if (transform.isPresent()) {
            Path overlayPath = options.overlayArtifact();
            overlayRenderer.renderTo(overlayPath, img0, img1, transform.get());
            diagnostics.put(Diagnostics.OVERLAY_IMAGE, overlayPath.toString());
        }
    }

    private static void requireRaster(Raster raster, String name) {
        if (raster == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    public StitcherSettings getSettings() {
        return settings;
    }

    /**
     * 工作图像的特征来源：直接提取或经过缓存
     */
    @FunctionalInterface
    private interface FeatureSource {
        FeatureSet features(int index, WorkingFrame frame);
    }
}
