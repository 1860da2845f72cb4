package com.edge.mosaic.core.diagnostics;

import com.edge.mosaic.core.feature.FeatureSet;
import com.edge.mosaic.core.feature.Keypoint;
import com.edge.mosaic.core.match.Correspondence;
import com.edge.mosaic.core.raster.Raster;
import com.edge.mosaic.core.transform.AffineTransform;
import com.edge.mosaic.testing.ImageSimilarity;
import com.edge.mosaic.testing.OpenCvTestSupport;
import com.edge.mosaic.testing.SyntheticScenes;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RendererTest {

    @BeforeAll
    static void loadOpenCv() {
        OpenCvTestSupport.load();
    }

    @Test
    void testMatchRender_SideBySideCanvas() {
        Raster img0 = SyntheticScenes.blank(120, 80);
        Raster img1 = SyntheticScenes.blank(60, 100);
        Keypoint k0 = new Keypoint(10, 10, 2, 1, new float[]{1});
        Keypoint k1 = new Keypoint(20, 30, 2, 1, new float[]{1});
        Correspondence match = new Correspondence(k0, k1, 0);

        Mat canvas = new MatchRenderer().render(img0, new FeatureSet(List.of(k0), 1),
            img1, new FeatureSet(List.of(k1), 1), List.of(match), List.of(match));

        assertEquals(180, canvas.cols());
        assertEquals(100, canvas.rows());
        assertEquals(CvType.CV_8UC3, canvas.type());
        // 内点连线为绿色 (BGR)，抗锯齿后绿色分量占优
        double[] mid = canvas.get(20, 75);
        assertTrue(mid[1] > mid[0] + 50, Arrays.toString(mid));
        assertTrue(mid[1] > mid[2] + 50, Arrays.toString(mid));
    }

    @Test
    void testOverlay_IdentityReproducesReference() {
        Raster img = SyntheticScenes.image0();

        Mat overlay = new OverlayRenderer(new OpenCvRasterWarper()).render(img, img, AffineTransform.identity());

        assertEquals(img.getWidth(), overlay.cols());
        assertEquals(img.getHeight(), overlay.rows());
        assertTrue(ImageSimilarity.ssim(img.view(), overlay) > 0.99);
    }

    @Test
    void testWarper_UsesTargetCanvasSize() {
        Raster source = SyntheticScenes.image1();

        Raster warped = new OpenCvRasterWarper().warp(source, AffineTransform.translation(5, 5), 150, 90);

        assertEquals(150, warped.getWidth());
        assertEquals(90, warped.getHeight());
    }

    @Test
    void testRenderTo_CreatesParentDirectories(@TempDir Path dir) {
        Raster img = SyntheticScenes.blank(40, 40);
        Path target = dir.resolve("nested/out/pair_overlay.png");

        new OverlayRenderer(new OpenCvRasterWarper()).renderTo(target, img, img, AffineTransform.identity());

        assertTrue(Files.isRegularFile(target));
        assertFalse(Imgcodecs.imread(target.toString()).empty());
    }
}
