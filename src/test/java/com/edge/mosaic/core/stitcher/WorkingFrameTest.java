package com.edge.mosaic.core.stitcher;

import com.edge.mosaic.core.raster.CropWindow;
import com.edge.mosaic.core.raster.Raster;
import com.edge.mosaic.core.transform.AffineTransform;
import com.edge.mosaic.testing.OpenCvTestSupport;
import com.edge.mosaic.testing.SyntheticScenes;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkingFrameTest {

    @BeforeAll
    static void loadOpenCv() {
        OpenCvTestSupport.load();
    }

    @Test
    void testPrepare_CropThenResize() {
        Raster source = SyntheticScenes.blank(200, 100);

        WorkingFrame frame = WorkingFrame.prepare(source, CropWindow.of(0, 1, 0.1, 1), 0.5);

        assertEquals(20, frame.getOffsetX());
        assertEquals(0, frame.getOffsetY());
        assertEquals(90, frame.getRaster().getWidth());
        assertEquals(50, frame.getRaster().getHeight());
    }

    @Test
    void testToWorking_FollowsPixelCentreConvention() {
        WorkingFrame frame = WorkingFrame.prepare(SyntheticScenes.blank(200, 100), CropWindow.of(0, 1, 0.1, 1), 0.5);
        AffineTransform toWorking = frame.toWorking();

        // 裁剪后的 (0, 0) 像素中心缩放后落在 (-0.25, -0.25)
        assertEquals(-0.25, toWorking.applyX(20, 0), 1e-12);
        assertEquals(-0.25, toWorking.applyY(20, 0), 1e-12);
        // 边界 -0.5 保持不变
        assertEquals(-0.5, toWorking.applyX(19.5, -0.5), 1e-12);
        assertEquals(-0.5, toWorking.applyY(19.5, -0.5), 1e-12);
    }

    @Test
    void testToWorking_IdentityAtFullScaleWithoutCrop() {
        WorkingFrame frame = WorkingFrame.prepare(SyntheticScenes.blank(50, 50), CropWindow.full(), 1.0);

        assertTrue(frame.toWorking().approxEquals(AffineTransform.identity(), 1e-12));
        assertEquals(50, frame.getRaster().getWidth());
    }

    @Test
    void testRelease_LeavesBorrowedSourceIntact() {
        Raster source = SyntheticScenes.blank(60, 40);

        WorkingFrame borrowed = WorkingFrame.prepare(source, CropWindow.full(), 1.0);
        assertSame(source, borrowed.getRaster());
        borrowed.release();
        assertFalse(source.view().empty());

        WorkingFrame owned = WorkingFrame.prepare(source, CropWindow.of(0, 1, 0.5, 1), 1.0);
        owned.release();
        assertTrue(owned.getRaster().view().empty());
        assertFalse(source.view().empty());
    }

    @Test
    void testPrepare_CollapsingScaleIsRejected() {
        Raster source = SyntheticScenes.blank(1, 1);

        assertThrows(IllegalArgumentException.class, () -> WorkingFrame.prepare(source, CropWindow.full(), 0.5));
        assertFalse(source.view().empty());
    }
}
