package com.edge.mosaic.core.raster;

import org.opencv.core.Rect;

import java.util.Locale;

/**
 * 裁剪窗口（相对尺寸的比例边界）
 * <p>
 * 保留行 [top*h, bottom*h) 和列 [left*w, right*w)。
 * 默认 {0, 1, 0, 1} 表示不裁剪。
 */
public final class CropWindow {

    private static final CropWindow FULL = new CropWindow(0, 1, 0, 1);

    private final double top;
    private final double bottom;
    private final double left;
    private final double right;

    private CropWindow(double top, double bottom, double left, double right) {
        this.top = top;
        this.bottom = bottom;
        this.left = left;
        this.right = right;
    }

    public static CropWindow full() {
        return FULL;
    }

    public static CropWindow of(double top, double bottom, double left, double right) {
        checkFraction("top", top);
        checkFraction("bottom", bottom);
        checkFraction("left", left);
        checkFraction("right", right);
        if (top >= bottom) {
            throw new IllegalArgumentException("Crop top must be less than bottom: " + top + " >= " + bottom);
        }
        if (left >= right) {
            throw new IllegalArgumentException("Crop left must be less than right: " + left + " >= " + right);
        }
        return new CropWindow(top, bottom, left, right);
    }

    private static void checkFraction(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException("Crop " + name + " must be within [0, 1]: " + value);
        }
    }

    public boolean isFull() {
        return top == 0.0 && bottom == 1.0 && left == 0.0 && right == 1.0;
    }

    /**
     * 换算成给定尺寸下的像素矩形
     */
    public Rect toRect(int width, int height) {
        int x0 = (int) Math.round(left * width);
        int x1 = (int) Math.round(right * width);
        int y0 = (int) Math.round(top * height);
        int y1 = (int) Math.round(bottom * height);
        x1 = Math.min(x1, width);
        y1 = Math.min(y1, height);
        if (x1 <= x0 || y1 <= y0) {
            throw new IllegalArgumentException("Crop " + this + " leaves nothing of a " + width + "x" + height + " raster");
        }
        return new Rect(x0, y0, x1 - x0, y1 - y0);
    }

    public double getTop() { return top; }
    public double getBottom() { return bottom; }
    public double getLeft() { return left; }
    public double getRight() { return right; }

    /**
     * 用于缓存键的稳定文本表示
     */
    public String signature() {
        return String.format(Locale.ROOT, "%.6f,%.6f,%.6f,%.6f", top, bottom, left, right);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CropWindow)) return false;
        CropWindow that = (CropWindow) o;
        return top == that.top && bottom == that.bottom && left == that.left && right == that.right;
    }

    @Override
    public int hashCode() {
        return signature().hashCode();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Crop[top=%.2f, bottom=%.2f, left=%.2f, right=%.2f]", top, bottom, left, right);
    }
}
