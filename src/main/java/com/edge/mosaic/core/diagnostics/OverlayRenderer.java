package com.edge.mosaic.core.diagnostics;

import com.edge.mosaic.core.raster.Raster;
import com.edge.mosaic.core.transform.AffineTransform;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import java.nio.file.Path;

/**
 * 叠加可视化：img1 按变换映射到 img0 的坐标系后与 img0 各占一半权重叠加
 */
public class OverlayRenderer {

    private final RasterWarper warper;

    public OverlayRenderer(RasterWarper warper) {
        this.warper = warper;
    }

    /**
     * @param transform img1 像素坐标 -> img0 像素坐标
     * @return 叠加结果，调用方负责释放
     */
    public Mat render(Raster img0, Raster img1, AffineTransform transform) {
        Raster warped = warper.warp(img1, transform, img0.getWidth(), img0.getHeight());
        try {
            Mat blended = new Mat();
            Core.addWeighted(img0.view(), 0.5, warped.view(), 0.5, 0.0, blended);
            return blended;
        } finally {
            warped.release();
        }
    }

    public void renderTo(Path target, Raster img0, Raster img1, AffineTransform transform) {
        Mat blended = render(img0, img1, transform);
        try {
            Artifacts.write(blended, target);
        } finally {
            blended.release();
        }
    }
}
