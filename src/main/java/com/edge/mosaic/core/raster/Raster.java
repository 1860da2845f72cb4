package com.edge.mosaic.core.raster;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * 单通道灰度栅格
 * <p>
 * 内部持有一份独立的 CV_8UC1 数据拷贝，创建后不再修改。
 * 本地内存归 Raster 所有，由创建者在用完后调用 {@link #release()}；
 * 裁剪和缩放在窗口为全图或比例为 1 时返回同一实例，其余情况返回新的 Raster。
 */
public final class Raster {

    private final Mat mat;

    private Raster(Mat mat) {
        this.mat = mat;
    }

    /**
     * 从任意 Mat 创建栅格（彩色图转灰度，非 8 位数据转换为 8 位）
     * <p>
     * 源 Mat 不会被修改，调用方负责释放。
     */
    public static Raster of(Mat source) {
        if (source == null || source.empty()) {
            throw new IllegalArgumentException("Raster source cannot be null or empty");
        }

        Mat gray = new Mat();
        switch (source.channels()) {
            case 1:
                source.copyTo(gray);
                break;
            case 3:
                Imgproc.cvtColor(source, gray, Imgproc.COLOR_BGR2GRAY);
                break;
            case 4:
                Imgproc.cvtColor(source, gray, Imgproc.COLOR_BGRA2GRAY);
                break;
            default:
                throw new IllegalArgumentException("Unsupported channel count: " + source.channels());
        }

        if (gray.depth() != CvType.CV_8U) {
            Mat converted = new Mat();
            gray.convertTo(converted, CvType.CV_8U);
            gray.release();
            gray = converted;
        }
        return new Raster(gray);
    }

    /**
     * 从行优先的 8 位像素数组创建栅格
     */
    public static Raster fromPixels(int width, int height, byte[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster size must be positive: " + width + "x" + height);
        }
        if (pixels == null || pixels.length != width * height) {
            throw new IllegalArgumentException("Pixel buffer does not match " + width + "x" + height);
        }
        Mat mat = new Mat(height, width, CvType.CV_8UC1);
        mat.put(0, 0, pixels);
        return new Raster(mat);
    }

    public int getWidth() {
        return mat.cols();
    }

    public int getHeight() {
        return mat.rows();
    }

    /**
     * 只读视图，调用方不得修改或释放，需要可写数据时用 {@link #toMat()}
     */
    public Mat view() {
        return mat;
    }

    /**
     * 返回像素数据的独立拷贝，调用方负责释放
     */
    public Mat toMat() {
        return mat.clone();
    }

    /**
     * 按裁剪窗口截取子区域
     */
    public Raster crop(CropWindow window) {
        if (window.isFull()) {
            return this;
        }
        Rect rect = window.toRect(getWidth(), getHeight());
        Mat roi = new Mat(mat, rect);
        try {
            return new Raster(roi.clone());
        } finally {
            roi.release();
        }
    }

    /**
     * 按比例缩放（缩小用 INTER_AREA，放大用 INTER_LINEAR）
     */
    public Raster resize(double scale) {
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new IllegalArgumentException("Scale must be positive: " + scale);
        }
        if (scale == 1.0) {
            return this;
        }
        // 与 OpenCV cvRound 相同的取整规则（四舍六入五成双）
        if (Math.rint(getWidth() * scale) < 1 || Math.rint(getHeight() * scale) < 1) {
            throw new IllegalArgumentException("Scale " + scale + " collapses a "
                + getWidth() + "x" + getHeight() + " raster");
        }
        Mat resized = new Mat();
        int interpolation = scale < 1.0 ? Imgproc.INTER_AREA : Imgproc.INTER_LINEAR;
        Imgproc.resize(mat, resized, new Size(), scale, scale, interpolation);
        return new Raster(resized);
    }

    /**
     * 释放本地像素内存，之后不得再使用此实例
     */
    public void release() {
        mat.release();
    }

    @Override
    public String toString() {
        return "Raster[" + getWidth() + "x" + getHeight() + "]";
    }
}
