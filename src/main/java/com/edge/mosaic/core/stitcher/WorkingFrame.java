package com.edge.mosaic.core.stitcher;

import com.edge.mosaic.core.raster.CropWindow;
import com.edge.mosaic.core.raster.Raster;
import com.edge.mosaic.core.transform.AffineTransform;
import org.opencv.core.Rect;

/**
 * 参与某一尺度尝试的工作图像：先裁剪再缩放
 * <p>
 * toWorking() 把原图像素坐标映射到工作图像素坐标，
 * 缩放部分与 OpenCV resize 的像素中心约定一致：dst = s * (src + 0.5) - 0.5
 */
final class WorkingFrame {

    private final Raster raster;
    private final int offsetX;
    private final int offsetY;
    private final double scale;
    // raster 是否为本帧新建（裁剪或缩放产生），而非直接借用原图
    private final boolean owned;

    private WorkingFrame(Raster raster, int offsetX, int offsetY, double scale, boolean owned) {
        this.raster = raster;
        this.owned = owned;
        this.offsetX = offsetX;
        this.offsetY = offsetY;
        this.scale = scale;
    }

    static WorkingFrame prepare(Raster source, CropWindow crop, double scale) {
        int offsetX = 0;
        int offsetY = 0;
        Raster cropped = source;
        if (!crop.isFull()) {
            Rect rect = crop.toRect(source.getWidth(), source.getHeight());
            offsetX = rect.x;
            offsetY = rect.y;
            cropped = source.crop(crop);
        }
        Raster working = null;
        try {
            working = cropped.resize(scale);
            return new WorkingFrame(working, offsetX, offsetY, scale, working != source);
        } finally {
            if (cropped != source && cropped != working) {
                cropped.release();
            }
        }
    }

    /**
     * 释放本帧新建的工作图像；借用的原图由调用方负责
     */
    void release() {
        if (owned) {
            raster.release();
        }
    }

    AffineTransform toWorking() {
        AffineTransform resize = AffineTransform.translation(-0.5, -0.5)
            .compose(AffineTransform.scaling(scale, scale))
            .compose(AffineTransform.translation(0.5, 0.5));
        return resize.compose(AffineTransform.translation(-offsetX, -offsetY));
    }

    Raster getRaster() {
        return raster;
    }

    int getOffsetX() {
        return offsetX;
    }

    int getOffsetY() {
        return offsetY;
    }

    double getScale() {
        return scale;
    }
}
