package com.edge.mosaic.core.stitcher;

import com.edge.mosaic.core.feature.FeatureSet;
import com.edge.mosaic.core.match.Correspondence;
import com.edge.mosaic.core.transform.AffineTransform;
import com.edge.mosaic.core.transform.FitResult;

import java.util.List;
import java.util.Optional;

/**
 * 某一尺度上的一次完整尝试：工作图像、特征、匹配和拟合结果
 * <p>
 * 找到变换时同时给出原图分辨率下的变换：
 * full = toWorking(img0)^-1 * M * toWorking(img1)
 */
public final class ScaleAttempt {

    private final double scale;
    private final WorkingFrame frame0;
    private final WorkingFrame frame1;
    private final FeatureSet features0;
    private final FeatureSet features1;
    private final List<Correspondence> matches;
    private final FitResult fit;
    private final AffineTransform fullTransform;

    ScaleAttempt(double scale, WorkingFrame frame0, WorkingFrame frame1,
                 FeatureSet features0, FeatureSet features1,
                 List<Correspondence> matches, FitResult fit) {
        this.scale = scale;
        this.frame0 = frame0;
        this.frame1 = frame1;
        this.features0 = features0;
        this.features1 = features1;
        this.matches = List.copyOf(matches);
        this.fit = fit;
        this.fullTransform = fit.getTransform()
            .map(m -> frame0.toWorking().inverse().compose(m).compose(frame1.toWorking()))
            .orElse(null);
    }

    public boolean isFound() {
        return fullTransform != null;
    }

    public double getScale() {
        return scale;
    }

    public Optional<AffineTransform> getFullTransform() {
        return Optional.ofNullable(fullTransform);
    }

    public FitResult getFit() {
        return fit;
    }

    public List<Correspondence> getMatches() {
        return matches;
    }

    public FeatureSet getFeatures0() {
        return features0;
    }

    public FeatureSet getFeatures1() {
        return features1;
    }

    WorkingFrame getFrame0() {
        return frame0;
    }

    WorkingFrame getFrame1() {
        return frame1;
    }

    void release() {
        frame0.release();
        frame1.release();
    }

    /**
     * 工作图坐标换算回原图坐标（用于 verbose 输出内点）
     */
    double[] toFullResolution(Correspondence c) {
        AffineTransform back0 = frame0.toWorking().inverse();
        AffineTransform back1 = frame1.toWorking().inverse();
        double x0 = c.getReference().getX(), y0 = c.getReference().getY();
        double x1 = c.getMoving().getX(), y1 = c.getMoving().getY();
        return new double[]{
            back0.applyX(x0, y0), back0.applyY(x0, y0),
            back1.applyX(x1, y1), back1.applyY(x1, y1)
        };
    }

    @Override
    public String toString() {
        return "ScaleAttempt{scale=" + scale + ", " + fit + "}";
    }
}
