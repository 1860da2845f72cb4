package com.edge.mosaic.core.diagnostics;

import com.edge.mosaic.core.feature.FeatureSet;
import com.edge.mosaic.core.feature.Keypoint;
import com.edge.mosaic.core.match.Correspondence;
import com.edge.mosaic.core.raster.Raster;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 左右并排的匹配可视化
 * <p>
 * 左边 img0，右边 img1；所有特征点画小圆，外点连红线，内点连绿线（内点画在最上层）。
 */
public class MatchRenderer {

    private static final Scalar KEYPOINT_COLOR = new Scalar(255, 160, 0);
    private static final Scalar OUTLIER_COLOR = new Scalar(0, 0, 255);
    private static final Scalar INLIER_COLOR = new Scalar(0, 255, 0);

    public Mat render(Raster img0, FeatureSet features0, Raster img1, FeatureSet features1,
                      List<Correspondence> matches, Collection<Correspondence> inliers) {
        int width = img0.getWidth() + img1.getWidth();
        int height = Math.max(img0.getHeight(), img1.getHeight());
        int offsetX = img0.getWidth();

        Mat canvas = Mat.zeros(height, width, CvType.CV_8UC3);
        paste(canvas, img0, 0);
        paste(canvas, img1, offsetX);

        for (Keypoint kp : features0.getKeypoints()) {
            Imgproc.circle(canvas, new Point(kp.getX(), kp.getY()), 2, KEYPOINT_COLOR, 1);
        }
        for (Keypoint kp : features1.getKeypoints()) {
            Imgproc.circle(canvas, new Point(kp.getX() + offsetX, kp.getY()), 2, KEYPOINT_COLOR, 1);
        }

        Set<Correspondence> inlierSet = Collections.newSetFromMap(new IdentityHashMap<>());
        inlierSet.addAll(inliers);

        for (Correspondence m : matches) {
            if (!inlierSet.contains(m)) {
                drawLine(canvas, m, offsetX, OUTLIER_COLOR);
            }
        }
        for (Correspondence m : matches) {
            if (inlierSet.contains(m)) {
                drawLine(canvas, m, offsetX, INLIER_COLOR);
            }
        }
        return canvas;
    }

    public void renderTo(Path target, Raster img0, FeatureSet features0, Raster img1, FeatureSet features1,
                         List<Correspondence> matches, Collection<Correspondence> inliers) {
        Mat canvas = render(img0, features0, img1, features1, matches, inliers);
        try {
            Artifacts.write(canvas, target);
        } finally {
            canvas.release();
        }
    }

    private static void paste(Mat canvas, Raster raster, int offsetX) {
        Mat color = new Mat();
        Mat roi = canvas.submat(new Rect(offsetX, 0, raster.getWidth(), raster.getHeight()));
        try {
            Imgproc.cvtColor(raster.view(), color, Imgproc.COLOR_GRAY2BGR);
            color.copyTo(roi);
        } finally {
            color.release();
            roi.release();
        }
    }

    private static void drawLine(Mat canvas, Correspondence m, int offsetX, Scalar color) {
        Point p0 = new Point(m.getReference().getX(), m.getReference().getY());
        Point p1 = new Point(m.getMoving().getX() + offsetX, m.getMoving().getY());
        Imgproc.line(canvas, p0, p1, color, 1, Imgproc.LINE_AA);
    }
}
