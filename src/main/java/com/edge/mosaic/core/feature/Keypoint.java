package com.edge.mosaic.core.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * 特征点：像素坐标 + 描述子
 */
public final class Keypoint {
    private final double x;         // 像素中心坐标 X
    private final double y;         // 像素中心坐标 Y
    private final double size;      // 邻域直径
    private final double response;  // 检测响应强度
    private final float[] descriptor;

    @JsonCreator
    public Keypoint(@JsonProperty("x") double x,
                    @JsonProperty("y") double y,
                    @JsonProperty("size") double size,
                    @JsonProperty("response") double response,
                    @JsonProperty("descriptor") float[] descriptor) {
        this.x = x;
        this.y = y;
        this.size = size;
        this.response = response;
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor").clone();
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getSize() { return size; }
    public double getResponse() { return response; }

    public float[] getDescriptor() {
        return descriptor.clone();
    }

    int descriptorLength() {
        return descriptor.length;
    }

    void copyDescriptorTo(float[] target, int offset) {
        System.arraycopy(descriptor, 0, target, offset, descriptor.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Keypoint)) return false;
        Keypoint that = (Keypoint) o;
        return Double.compare(x, that.x) == 0
            && Double.compare(y, that.y) == 0
            && Double.compare(size, that.size) == 0
            && Double.compare(response, that.response) == 0
            && Arrays.equals(descriptor, that.descriptor);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(x, y, size, response);
        return 31 * result + Arrays.hashCode(descriptor);
    }

    @Override
    public String toString() {
        return String.format("Keypoint(%.2f, %.2f, size=%.1f)", x, y, size);
    }
}
