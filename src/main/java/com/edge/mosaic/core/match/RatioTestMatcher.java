package com.edge.mosaic.core.match;

import com.edge.mosaic.core.feature.FeatureSet;
import org.opencv.core.Core;
import org.opencv.core.DMatch;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDMatch;
import org.opencv.features2d.BFMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 暴力 KNN 匹配 + Lowe 比值检验
 * <p>
 * 最近邻距离必须小于 ratio 倍的次近邻距离才接受；
 * 同一个 moving 点被多个 reference 点选中时只保留距离最小的一对，
 * 因此结果数量不超过 min(|A|, |B|)。
 * 暴力匹配是确定性的（FLANN 的随机 KD 树不是）。
 */
public class RatioTestMatcher {
    private static final Logger logger = LoggerFactory.getLogger(RatioTestMatcher.class);

    public static final double DEFAULT_RATIO = 0.75;

    private final double ratio;

    public RatioTestMatcher() {
        this(DEFAULT_RATIO);
    }

    public RatioTestMatcher(double ratio) {
        if (!(ratio > 0 && ratio <= 1)) {
            throw new IllegalArgumentException("Ratio must be within (0, 1]: " + ratio);
        }
        this.ratio = ratio;
    }

    public List<Correspondence> match(FeatureSet reference, FeatureSet moving) {
        // 次近邻不存在时无法做比值检验
        if (reference.isEmpty() || moving.size() < 2) {
            return new ArrayList<>();
        }
        if (reference.getDescriptorSize() != moving.getDescriptorSize()) {
            throw new IllegalArgumentException("Descriptor sizes differ: "
                + reference.getDescriptorSize() + " vs " + moving.getDescriptorSize());
        }

        Mat descRef = reference.toDescriptorMat();
        Mat descMov = moving.toDescriptorMat();
        List<MatOfDMatch> knnMatches = new ArrayList<>();
        try {
            BFMatcher matcher = BFMatcher.create(Core.NORM_L2, false);
            matcher.knnMatch(descRef, descMov, knnMatches, 2);

            // moving 索引 -> 当前最佳匹配
            Map<Integer, DMatch> bestByMoving = new HashMap<>();
            int passed = 0;
            for (MatOfDMatch m : knnMatches) {
                DMatch[] dm = m.toArray();
                if (dm.length < 2 || dm[0].distance >= ratio * dm[1].distance) {
                    continue;
                }
                passed++;
                DMatch current = bestByMoving.get(dm[0].trainIdx);
                if (current == null || dm[0].distance < current.distance
                        || (dm[0].distance == current.distance && dm[0].queryIdx < current.queryIdx)) {
                    bestByMoving.put(dm[0].trainIdx, dm[0]);
                }
            }

            List<DMatch> kept = new ArrayList<>(bestByMoving.values());
            kept.sort(Comparator.comparingDouble((DMatch d) -> d.distance).thenComparingInt(d -> d.queryIdx));

            List<Correspondence> result = new ArrayList<>(kept.size());
            for (DMatch d : kept) {
                result.add(new Correspondence(reference.get(d.queryIdx), moving.get(d.trainIdx), d.distance));
            }

            logger.debug("Ratio test: {} x {} keypoints, {} passed, {} unique matches",
                reference.size(), moving.size(), passed, result.size());
            return result;
        } finally {
            descRef.release();
            descMov.release();
            for (MatOfDMatch m : knnMatches) m.release();
        }
    }

    public double getRatio() {
        return ratio;
    }
}
