package com.edge.mosaic.core.transform;

import com.edge.mosaic.core.match.Correspondence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * RANSAC 仿射拟合
 * <p>
 * 拟合方向为 moving (img1) -> reference (img0)。
 * 流程：
 * 1. 随机抽取 3 对匹配，闭式解出候选仿射（共线样本跳过）
 * 2. 统计重投影误差小于阈值的内点，保留内点最多的候选
 * 3. 按当前最优内点率自适应缩减迭代次数
 * 4. 用内点做最小二乘精化，再按精化结果重新划分内点
 * 5. 内点数或内点率不达标则返回无结果
 */
public class RansacAffineFitter {
    private static final Logger logger = LoggerFactory.getLogger(RansacAffineFitter.class);

    private static final int SAMPLE_SIZE = 3;
    private static final int REFINE_ROUNDS = 3;

    private final RansacSettings settings;

    public RansacAffineFitter() {
        this(RansacSettings.defaults());
    }

    public RansacAffineFitter(RansacSettings settings) {
        this.settings = settings;
    }

    public FitResult fit(List<Correspondence> matches) {
        return fit(matches, settings.newRandom());
    }

    public FitResult fit(List<Correspondence> matches, Random random) {
        int n = matches.size();
        if (n < SAMPLE_SIZE) {
            logger.debug("Only {} matches, at least {} required", n, SAMPLE_SIZE);
            return FitResult.noResult(n);
        }

        double[] sx = new double[n], sy = new double[n];
        double[] dx = new double[n], dy = new double[n];
        for (int i = 0; i < n; i++) {
            Correspondence m = matches.get(i);
            sx[i] = m.getMoving().getX();
            sy[i] = m.getMoving().getY();
            dx[i] = m.getReference().getX();
            dy[i] = m.getReference().getY();
        }

        double thr2 = settings.getReprojectionThreshold() * settings.getReprojectionThreshold();
        boolean[] bestMask = null;
        int bestCount = 0;
        int limit = settings.getMaxIterations();
        int iterations = 0;
        int[] sample = new int[SAMPLE_SIZE];

        while (iterations < limit) {
            iterations++;
            drawSample(random, n, sample);
            AffineTransform candidate = solveExact(sx, sy, dx, dy, sample);
            if (candidate == null || !candidate.isInvertible()) {
                continue;
            }

            boolean[] mask = new boolean[n];
            int count = classify(candidate, sx, sy, dx, dy, thr2, mask);
            if (count > bestCount) {
                bestCount = count;
                bestMask = mask;
                limit = Math.min(limit, adaptiveLimit((double) count / n));
            }
        }

        if (bestMask == null || bestCount < SAMPLE_SIZE) {
            logger.debug("No consistent sample after {} iterations ({} matches)", iterations, n);
            return FitResult.noResult(n);
        }

        // 最小二乘精化：内点集合稳定后停止
        AffineTransform model = null;
        boolean[] mask = bestMask;
        int count = bestCount;
        for (int round = 0; round < REFINE_ROUNDS; round++) {
            AffineTransform refined = solveLeastSquares(sx, sy, dx, dy, mask);
            if (refined == null || !refined.isInvertible()) {
                break;
            }
            boolean[] next = new boolean[n];
            int nextCount = classify(refined, sx, sy, dx, dy, thr2, next);
            if (nextCount < SAMPLE_SIZE) {
                break;
            }
            model = refined;
            boolean stable = Arrays.equals(mask, next);
            mask = next;
            count = nextCount;
            if (stable) {
                break;
            }
        }

        if (model == null) {
            logger.debug("Least-squares refinement degenerated for {} inliers", bestCount);
            return FitResult.noResult(n);
        }

        double ratio = (double) count / n;
        if (count < settings.getMinInliers() || ratio < settings.getMinInlierRatio()) {
            logger.debug("Rejected fit: {} inliers of {} matches (ratio {}), need {} and {}",
                count, n, String.format("%.3f", ratio), settings.getMinInliers(), settings.getMinInlierRatio());
            return FitResult.noResult(n);
        }

        List<Correspondence> inliers = new ArrayList<>(count);
        double errSum = 0;
        for (int i = 0; i < n; i++) {
            if (mask[i]) {
                inliers.add(matches.get(i));
                errSum += Math.sqrt(squaredError(model, sx[i], sy[i], dx[i], dy[i]));
            }
        }

        logger.debug("RANSAC finished after {} iterations: {} / {} inliers, {}", iterations, count, n, model);
        return FitResult.found(model, inliers, n, errSum / count);
    }

    /**
     * 标准 RANSAC 迭代次数公式 log(1-p) / log(1-w^3)
     */
    private int adaptiveLimit(double inlierRatio) {
        double pNoOutliers = 1.0 - Math.pow(inlierRatio, SAMPLE_SIZE);
        if (pNoOutliers <= Double.MIN_VALUE) {
            return 1;
        }
        if (pNoOutliers >= 1.0) {
            return settings.getMaxIterations();
        }
        double needed = Math.log(1.0 - settings.getConfidence()) / Math.log(pNoOutliers);
        if (!Double.isFinite(needed) || needed >= settings.getMaxIterations()) {
            return settings.getMaxIterations();
        }
        return Math.max(1, (int) Math.ceil(needed));
    }

    private static void drawSample(Random random, int n, int[] sample) {
        for (int i = 0; i < sample.length; i++) {
            int idx;
            boolean duplicate;
            do {
                idx = random.nextInt(n);
                duplicate = false;
                for (int j = 0; j < i; j++) {
                    if (sample[j] == idx) {
                        duplicate = true;
                        break;
                    }
                }
            } while (duplicate);
            sample[i] = idx;
        }
    }

    private static int classify(AffineTransform t, double[] sx, double[] sy, double[] dx, double[] dy,
                                double thr2, boolean[] mask) {
        int count = 0;
        for (int i = 0; i < sx.length; i++) {
            if (squaredError(t, sx[i], sy[i], dx[i], dy[i]) <= thr2) {
                mask[i] = true;
                count++;
            }
        }
        return count;
    }

    private static double squaredError(AffineTransform t, double x, double y, double tx, double ty) {
        double ex = t.applyX(x, y) - tx;
        double ey = t.applyY(x, y) - ty;
        return ex * ex + ey * ey;
    }

    /**
     * 三点闭式解（Cramer 法则），样本共线时返回 null
     */
    static AffineTransform solveExact(double[] sx, double[] sy, double[] dx, double[] dy, int[] idx) {
        int i = idx[0], j = idx[1], k = idx[2];
        // 以第一个点为原点，减小数值误差
        double x1 = sx[j] - sx[i], y1 = sy[j] - sy[i];
        double x2 = sx[k] - sx[i], y2 = sy[k] - sy[i];
        double det = x1 * y2 - x2 * y1;

        // 三角形面积过小即视为共线
        double scale = Math.max(x1 * x1 + y1 * y1, x2 * x2 + y2 * y2);
        if (Math.abs(det) <= 1e-6 * Math.max(scale, 1.0)) {
            return null;
        }

        double u1 = dx[j] - dx[i], v1 = dy[j] - dy[i];
        double u2 = dx[k] - dx[i], v2 = dy[k] - dy[i];

        double a = (u1 * y2 - u2 * y1) / det;
        double b = (x1 * u2 - x2 * u1) / det;
        double d = (v1 * y2 - v2 * y1) / det;
        double e = (x1 * v2 - x2 * v1) / det;
        double c = dx[i] - a * sx[i] - b * sy[i];
        double f = dy[i] - d * sx[i] - e * sy[i];
        return new AffineTransform(a, b, c, d, e, f);
    }

    /**
     * 最小二乘拟合（先去质心，再解 2x2 法方程）
     */
    static AffineTransform solveLeastSquares(double[] sx, double[] sy, double[] dx, double[] dy, boolean[] mask) {
        int count = 0;
        double mx = 0, my = 0, mu = 0, mv = 0;
        for (int i = 0; i < sx.length; i++) {
            if (!mask[i]) continue;
            mx += sx[i];
            my += sy[i];
            mu += dx[i];
            mv += dy[i];
            count++;
        }
        if (count < SAMPLE_SIZE) {
            return null;
        }
        mx /= count;
        my /= count;
        mu /= count;
        mv /= count;

        double sxx = 0, sxy = 0, syy = 0;
        double sxu = 0, syu = 0, sxv = 0, syv = 0;
        for (int i = 0; i < sx.length; i++) {
            if (!mask[i]) continue;
            double x = sx[i] - mx, y = sy[i] - my;
            double u = dx[i] - mu, v = dy[i] - mv;
            sxx += x * x;
            sxy += x * y;
            syy += y * y;
            sxu += x * u;
            syu += y * u;
            sxv += x * v;
            syv += y * v;
        }

        double det = sxx * syy - sxy * sxy;
        if (Math.abs(det) <= 1e-9 * Math.max(sxx * syy, 1.0)) {
            return null;
        }

        double a = (sxu * syy - syu * sxy) / det;
        double b = (syu * sxx - sxu * sxy) / det;
        double d = (sxv * syy - syv * sxy) / det;
        double e = (syv * sxx - sxv * sxy) / det;
        double c = mu - a * mx - b * my;
        double f = mv - d * mx - e * my;
        return new AffineTransform(a, b, c, d, e, f);
    }

    public RansacSettings getSettings() {
        return settings;
    }
}
