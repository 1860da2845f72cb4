package com.edge.mosaic.core.transform;

import com.edge.mosaic.core.match.Correspondence;

import java.util.List;
import java.util.Optional;

/**
 * 鲁棒拟合结果
 * <p>
 * 未找到变换是正常结果（例如两幅图不重叠），不是错误。
 */
public final class FitResult {
    private final AffineTransform transform;      // 未找到时为 null
    private final List<Correspondence> inliers;
    private final int matchCount;
    private final double meanError;               // 内点平均重投影误差（像素）

    private FitResult(AffineTransform transform, List<Correspondence> inliers, int matchCount, double meanError) {
        this.transform = transform;
        this.inliers = List.copyOf(inliers);
        this.matchCount = matchCount;
        this.meanError = meanError;
    }

    public static FitResult noResult(int matchCount) {
        return new FitResult(null, List.of(), matchCount, Double.NaN);
    }

    public static FitResult found(AffineTransform transform, List<Correspondence> inliers, int matchCount, double meanError) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        if (inliers.size() > matchCount) {
            throw new IllegalArgumentException("More inliers than matches: " + inliers.size() + " > " + matchCount);
        }
        return new FitResult(transform, inliers, matchCount, meanError);
    }

    public boolean isFound() {
        return transform != null;
    }

    public Optional<AffineTransform> getTransform() {
        return Optional.ofNullable(transform);
    }

    public List<Correspondence> getInliers() {
        return inliers;
    }

    public int getMatchCount() {
        return matchCount;
    }

    public int getInlierCount() {
        return inliers.size();
    }

    public double getMeanError() {
        return meanError;
    }

    @Override
    public String toString() {
        if (!isFound()) {
            return "FitResult[none, n_match=" + matchCount + "]";
        }
        return String.format("FitResult[%s, n_match=%d, n_inlier=%d, err=%.3f]",
            transform, matchCount, inliers.size(), meanError);
    }
}
