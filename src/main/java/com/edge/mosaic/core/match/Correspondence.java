package com.edge.mosaic.core.match;

import com.edge.mosaic.core.feature.Keypoint;

/**
 * 一对候选匹配点
 * <p>
 * reference 来自第一幅图 (img0)，moving 来自第二幅图 (img1)。
 */
public final class Correspondence {
    private final Keypoint reference;
    private final Keypoint moving;
    private final double distance;   // 描述子 L2 距离

    public Correspondence(Keypoint reference, Keypoint moving, double distance) {
        this.reference = reference;
        this.moving = moving;
        this.distance = distance;
    }

    public Keypoint getReference() { return reference; }
    public Keypoint getMoving() { return moving; }
    public double getDistance() { return distance; }

    @Override
    public String toString() {
        return String.format("(%.1f, %.1f) <- (%.1f, %.1f) d=%.1f",
            reference.getX(), reference.getY(), moving.getX(), moving.getY(), distance);
    }
}
