package com.edge.mosaic.core.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 单幅图像的特征点集合
 * <p>
 * 特征点按 (y, x, size, response, descriptor) 排序存放，使相同输入得到完全相同的集合。
 */
public final class FeatureSet {

    private static final Comparator<Keypoint> CANONICAL_ORDER = Comparator
        .comparingDouble(Keypoint::getY)
        .thenComparingDouble(Keypoint::getX)
        .thenComparingDouble(Keypoint::getSize)
        .thenComparingDouble(Keypoint::getResponse)
        .thenComparing(Keypoint::getDescriptor, Arrays::compare);

    private final List<Keypoint> keypoints;
    private final int descriptorSize;

    @JsonCreator
    public FeatureSet(@JsonProperty("keypoints") List<Keypoint> keypoints,
                      @JsonProperty("descriptorSize") int descriptorSize) {
        if (descriptorSize <= 0) {
            throw new IllegalArgumentException("Descriptor size must be positive: " + descriptorSize);
        }
        List<Keypoint> sorted = new ArrayList<>(keypoints == null ? List.of() : keypoints);
        for (Keypoint kp : sorted) {
            if (kp.descriptorLength() != descriptorSize) {
                throw new IllegalArgumentException("Descriptor length " + kp.descriptorLength()
                    + " does not match " + descriptorSize);
            }
        }
        sorted.sort(CANONICAL_ORDER);
        this.keypoints = List.copyOf(sorted);
        this.descriptorSize = descriptorSize;
    }

    public static FeatureSet empty(int descriptorSize) {
        return new FeatureSet(List.of(), descriptorSize);
    }

    public List<Keypoint> getKeypoints() {
        return keypoints;
    }

    public int getDescriptorSize() {
        return descriptorSize;
    }

    public int size() {
        return keypoints.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return keypoints.isEmpty();
    }

    public Keypoint get(int index) {
        return keypoints.get(index);
    }

    /**
     * 组装 N x D 的 CV_32F 描述子矩阵（调用方负责释放）
     */
    public Mat toDescriptorMat() {
        Mat mat = new Mat(keypoints.size(), descriptorSize, CvType.CV_32F);
        if (keypoints.isEmpty()) {
            return mat;
        }
        float[] buf = new float[keypoints.size() * descriptorSize];
        for (int i = 0; i < keypoints.size(); i++) {
            keypoints.get(i).copyDescriptorTo(buf, i * descriptorSize);
        }
        mat.put(0, 0, buf);
        return mat;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureSet)) return false;
        FeatureSet that = (FeatureSet) o;
        return descriptorSize == that.descriptorSize && keypoints.equals(that.keypoints);
    }

    @Override
    public int hashCode() {
        return 31 * keypoints.hashCode() + descriptorSize;
    }

    @Override
    public String toString() {
        return "FeatureSet[" + keypoints.size() + " keypoints, dim=" + descriptorSize + "]";
    }
}
