package com.edge.mosaic.core.feature;

import com.edge.mosaic.core.raster.Raster;
import org.opencv.core.CvType;
import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.features2d.SIFT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 OpenCV SIFT 的特征提取
 * <p>
 * 每次调用创建独立的检测器实例，不同线程可同时调用。
 */
public class SiftFeatureExtractor implements FeatureExtractor {
    private static final Logger logger = LoggerFactory.getLogger(SiftFeatureExtractor.class);

    /** SIFT 描述子维度 */
    public static final int DESCRIPTOR_SIZE = 128;

    private final FeatureSettings settings;

    public SiftFeatureExtractor() {
        this(FeatureSettings.defaults());
    }

    public SiftFeatureExtractor(FeatureSettings settings) {
        this.settings = settings;
    }

    @Override
    public FeatureSet extract(Raster raster) {
        SIFT detector = SIFT.create(
            settings.getMaxKeypoints(),
            settings.getOctaveLayers(),
            settings.getContrastThreshold(),
            settings.getEdgeThreshold(),
            settings.getSigma());

        MatOfKeyPoint kps = new MatOfKeyPoint();
        Mat desc = new Mat();
        try {
            detector.detectAndCompute(raster.view(), new Mat(), kps, desc);

            if (desc.empty() || kps.rows() == 0) {
                logger.debug("No keypoints found in {}", raster);
                return FeatureSet.empty(DESCRIPTOR_SIZE);
            }
            if (desc.type() != CvType.CV_32F) {
                desc.convertTo(desc, CvType.CV_32F);
            }

            List<KeyPoint> kpList = kps.toList();
            int dim = desc.cols();
            float[] row = new float[dim];
            List<Keypoint> keypoints = new ArrayList<>(kpList.size());
            for (int i = 0; i < kpList.size(); i++) {
                KeyPoint kp = kpList.get(i);
                desc.get(i, 0, row);
                keypoints.add(new Keypoint(kp.pt.x, kp.pt.y, kp.size, kp.response, row));
            }

            logger.debug("Extracted {} keypoints from {}", keypoints.size(), raster);
            return new FeatureSet(keypoints, dim);
        } finally {
            kps.release();
            desc.release();
        }
    }

    @Override
    public String signature() {
        return settings.toString();
    }

    public FeatureSettings getSettings() {
        return settings;
    }
}
