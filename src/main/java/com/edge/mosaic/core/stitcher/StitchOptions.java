package com.edge.mosaic.core.stitcher;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 单次调用的输出选项
 * <p>
 * verbose: 诊断记录中附带特征点数、内点坐标、每个尺度的尝试记录
 * showPath: 非空时输出 {base}_match.png，找到变换时再输出 {base}_overlay.png
 */
public final class StitchOptions {

    private static final StitchOptions DEFAULTS = new StitchOptions(false, null);

    private final boolean verbose;
    private final Path showPath;

    private StitchOptions(boolean verbose, Path showPath) {
        this.verbose = verbose;
        this.showPath = showPath;
    }

    public static StitchOptions defaults() {
        return DEFAULTS;
    }

    public static StitchOptions of(boolean verbose, Path showPath) {
        return new StitchOptions(verbose, showPath);
    }

    public StitchOptions withVerbose(boolean verbose) {
        return new StitchOptions(verbose, showPath);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isShow() {
        return showPath != null;
    }

    public Optional<Path> getShowPath() {
        return Optional.ofNullable(showPath);
    }

    Path matchArtifact() {
        return sibling("_match.png");
    }

    Path overlayArtifact() {
        return sibling("_overlay.png");
    }

    private Path sibling(String suffix) {
        Path name = showPath.getFileName();
        String file = (name == null ? "stitch" : name.toString()) + suffix;
        Path parent = showPath.getParent();
        return parent == null ? Path.of(file) : parent.resolve(file);
    }
}
