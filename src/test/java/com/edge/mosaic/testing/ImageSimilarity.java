package com.edge.mosaic.testing;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * 结构相似度 (SSIM)，11x11 高斯窗口，sigma 1.5
 */
public final class ImageSimilarity {

    private static final double C1 = Math.pow(0.01 * 255, 2);
    private static final double C2 = Math.pow(0.03 * 255, 2);

    private ImageSimilarity() {
    }

    /**
     * 两幅同尺寸图像的平均 SSIM，彩色图先转灰度
     */
    public static double ssim(Mat first, Mat second) {
        if (first.rows() != second.rows() || first.cols() != second.cols()) {
            throw new IllegalArgumentException("Size mismatch: " + first.size() + " vs " + second.size());
        }
        Mat i1 = toFloatGray(first);
        Mat i2 = toFloatGray(second);
        Size window = new Size(11, 11);

        Mat mu1 = new Mat(), mu2 = new Mat();
        Imgproc.GaussianBlur(i1, mu1, window, 1.5);
        Imgproc.GaussianBlur(i2, mu2, window, 1.5);

        Mat mu1Sq = mu1.mul(mu1);
        Mat mu2Sq = mu2.mul(mu2);
        Mat mu12 = mu1.mul(mu2);

        Mat sigma1Sq = blurOfProduct(i1, i1, window);
        Core.subtract(sigma1Sq, mu1Sq, sigma1Sq);
        Mat sigma2Sq = blurOfProduct(i2, i2, window);
        Core.subtract(sigma2Sq, mu2Sq, sigma2Sq);
        Mat sigma12 = blurOfProduct(i1, i2, window);
        Core.subtract(sigma12, mu12, sigma12);

        // (2*mu12 + C1) * (2*sigma12 + C2)
        Mat t1 = new Mat(), t2 = new Mat(), numerator = new Mat();
        Core.addWeighted(mu12, 2, mu12, 0, C1, t1);
        Core.addWeighted(sigma12, 2, sigma12, 0, C2, t2);
        Core.multiply(t1, t2, numerator);

        // (mu1^2 + mu2^2 + C1) * (sigma1^2 + sigma2^2 + C2)
        Mat d1 = new Mat(), d2 = new Mat(), denominator = new Mat();
        Core.add(mu1Sq, mu2Sq, d1);
        Core.add(d1, new Scalar(C1), d1);
        Core.add(sigma1Sq, sigma2Sq, d2);
        Core.add(d2, new Scalar(C2), d2);
        Core.multiply(d1, d2, denominator);

        Mat map = new Mat();
        Core.divide(numerator, denominator, map);
        double value = Core.mean(map).val[0];

        for (Mat m : new Mat[]{i1, i2, mu1, mu2, mu1Sq, mu2Sq, mu12, sigma1Sq, sigma2Sq, sigma12,
            t1, t2, numerator, d1, d2, denominator, map}) {
            m.release();
        }
        return value;
    }

    private static Mat blurOfProduct(Mat a, Mat b, Size window) {
        Mat product = a.mul(b);
        Mat blurred = new Mat();
        Imgproc.GaussianBlur(product, blurred, window, 1.5);
        product.release();
        return blurred;
    }

    private static Mat toFloatGray(Mat source) {
        Mat gray = new Mat();
        if (source.channels() == 3) {
            Imgproc.cvtColor(source, gray, Imgproc.COLOR_BGR2GRAY);
        } else {
            source.copyTo(gray);
        }
        Mat result = new Mat();
        gray.convertTo(result, CvType.CV_32F);
        gray.release();
        return result;
    }
}
