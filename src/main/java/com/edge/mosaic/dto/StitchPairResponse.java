package com.edge.mosaic.dto;

import java.util.Map;

/**
 * 图像对配准响应
 * <p>
 * transform 为 [a, b, c, d, e, f]，把 img1 的像素坐标映射到 img0；未找到时为 null
 */
public class StitchPairResponse {
    private boolean found;
    private double[] transform;
    private double scale;
    private Map<String, Object> diagnostics;

    public boolean isFound() { return found; }
    public void setFound(boolean found) { this.found = found; }

    public double[] getTransform() { return transform; }
    public void setTransform(double[] transform) { this.transform = transform; }

    public double getScale() { return scale; }
    public void setScale(double scale) { this.scale = scale; }

    public Map<String, Object> getDiagnostics() { return diagnostics; }
    public void setDiagnostics(Map<String, Object> diagnostics) { this.diagnostics = diagnostics; }
}
