package com.edge.mosaic.core.stitcher;

import com.edge.mosaic.core.diagnostics.Diagnostics;
import com.edge.mosaic.core.transform.AffineTransform;

import java.util.Optional;

/**
 * 一次配准的结果：可能为空的变换 + 诊断记录
 * <p>
 * 变换把 img1 的像素坐标映射到 img0 的像素坐标（原图分辨率）。
 */
public final class StitchResult {

    private final AffineTransform transform;
    private final Diagnostics diagnostics;
    private final double scale;

    StitchResult(AffineTransform transform, Diagnostics diagnostics, double scale) {
        this.transform = transform;
        this.diagnostics = diagnostics;
        this.scale = scale;
    }

    public boolean isFound() {
        return transform != null;
    }

    public Optional<AffineTransform> getTransform() {
        return Optional.ofNullable(transform);
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * 成功的尺度，或全部失败时最后尝试的尺度
     */
    public double getScale() {
        return scale;
    }

    @Override
    public String toString() {
        return "StitchResult{transform=" + transform + ", diagnostics=" + diagnostics + "}";
    }
}
