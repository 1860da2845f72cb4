package com.edge.mosaic.core.diagnostics;

import com.edge.mosaic.core.raster.Raster;
import com.edge.mosaic.core.transform.AffineTransform;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * 基于 Imgproc.warpAffine 的栅格变换（双线性插值，边界填 0）
 */
public class OpenCvRasterWarper implements RasterWarper {

    @Override
    public Raster warp(Raster source, AffineTransform transform, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + width + "x" + height);
        }
        Mat m = transform.toMat();
        Mat warped = new Mat();
        try {
            Imgproc.warpAffine(source.view(), warped, m, new Size(width, height),
                Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, new Scalar(0));
            return Raster.of(warped);
        } finally {
            m.release();
            warped.release();
        }
    }
}
