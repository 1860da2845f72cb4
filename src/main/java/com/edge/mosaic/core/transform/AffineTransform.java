package com.edge.mosaic.core.transform;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.Arrays;

/**
 * 二维仿射变换
 * <pre>
 *   x' = a*x + b*y + c
 *   y' = d*x + e*y + f
 * </pre>
 * 不可变对象。线性部分行列式接近 0 时视为退化，不能求逆。
 */
public final class AffineTransform {

    /** 线性部分行列式的退化阈值 */
    public static final double SINGULAR_EPSILON = 1e-6;

    private static final AffineTransform IDENTITY = new AffineTransform(1, 0, 0, 0, 1, 0);

    private final double a, b, c;
    private final double d, e, f;

    @JsonCreator
    public AffineTransform(@JsonProperty("a") double a, @JsonProperty("b") double b, @JsonProperty("c") double c,
                           @JsonProperty("d") double d, @JsonProperty("e") double e, @JsonProperty("f") double f) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
        this.e = e;
        this.f = f;
    }

    public static AffineTransform identity() {
        return IDENTITY;
    }

    public static AffineTransform translation(double tx, double ty) {
        return new AffineTransform(1, 0, tx, 0, 1, ty);
    }

    public static AffineTransform scaling(double sx, double sy) {
        return new AffineTransform(sx, 0, 0, 0, sy, 0);
    }

    /**
     * 从 [a, b, c, d, e, f] 创建
     */
    public static AffineTransform of(double[] coefficients) {
        if (coefficients == null || coefficients.length != 6) {
            throw new IllegalArgumentException("Affine transform needs exactly 6 coefficients");
        }
        return new AffineTransform(coefficients[0], coefficients[1], coefficients[2],
            coefficients[3], coefficients[4], coefficients[5]);
    }

    public double getA() { return a; }
    public double getB() { return b; }
    public double getC() { return c; }
    public double getD() { return d; }
    public double getE() { return e; }
    public double getF() { return f; }

    /**
     * 系数数组 [a, b, c, d, e, f]
     */
    public double[] toArray() {
        return new double[]{a, b, c, d, e, f};
    }

    /**
     * 转换为 OpenCV warpAffine 使用的 2x3 CV_64F 矩阵（调用方负责释放）
     */
    public Mat toMat() {
        Mat m = new Mat(2, 3, CvType.CV_64F);
        m.put(0, 0, a, b, c, d, e, f);
        return m;
    }

    @JsonIgnore
    public double getDeterminant() {
        return a * e - b * d;
    }

    /**
     * 系数有限且线性部分非退化
     */
    @JsonIgnore
    public boolean isInvertible() {
        for (double v : toArray()) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return Math.abs(getDeterminant()) > SINGULAR_EPSILON;
    }

    public AffineTransform inverse() {
        if (!isInvertible()) {
            throw new IllegalStateException("Affine transform is not invertible: " + this);
        }
        double det = getDeterminant();
        double ia = e / det;
        double ib = -b / det;
        double id = -d / det;
        double ie = a / det;
        double ic = -(ia * c + ib * f);
        double iff = -(id * c + ie * f);
        return new AffineTransform(ia, ib, ic, id, ie, iff);
    }

    /**
     * 矩阵乘积 this · other，即先应用 other 再应用 this
     */
    public AffineTransform compose(AffineTransform other) {
        return new AffineTransform(
            a * other.a + b * other.d,
            a * other.b + b * other.e,
            a * other.c + b * other.f + c,
            d * other.a + e * other.d,
            d * other.b + e * other.e,
            d * other.c + e * other.f + f);
    }

    public double applyX(double x, double y) {
        return a * x + b * y + c;
    }

    public double applyY(double x, double y) {
        return d * x + e * y + f;
    }

    /**
     * 逐系数相对误差比较：|this - expected| <= rel * |expected|（另加 1e-12 绝对容差）
     */
    public boolean approxEquals(AffineTransform expected, double rel) {
        double[] mine = toArray();
        double[] theirs = expected.toArray();
        for (int i = 0; i < 6; i++) {
            double tolerance = Math.max(rel * Math.abs(theirs[i]), 1e-12);
            if (!(Math.abs(mine[i] - theirs[i]) <= tolerance)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AffineTransform)) return false;
        return Arrays.equals(toArray(), ((AffineTransform) o).toArray());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(toArray());
    }

    @Override
    public String toString() {
        return String.format("Affine[%.6f, %.6f, %.3f; %.6f, %.6f, %.3f]", a, b, c, d, e, f);
    }
}
