package com.edge.mosaic.core.feature;

import com.edge.mosaic.core.raster.Raster;
import com.edge.mosaic.testing.OpenCvTestSupport;
import com.edge.mosaic.testing.SyntheticScenes;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SiftFeatureExtractorTest {

    @BeforeAll
    static void loadOpenCv() {
        OpenCvTestSupport.load();
    }

    @Test
    void testExtract_BlankRasterYieldsNoKeypoints() {
        FeatureSet features = new SiftFeatureExtractor().extract(SyntheticScenes.blank(200, 150));

        assertTrue(features.isEmpty());
        assertEquals(SiftFeatureExtractor.DESCRIPTOR_SIZE, features.getDescriptorSize());
    }

    @Test
    void testExtract_TexturedRasterYieldsKeypoints() {
        FeatureSet features = new SiftFeatureExtractor().extract(SyntheticScenes.image0());

        assertTrue(features.size() > 100, "Only " + features.size() + " keypoints");
        assertEquals(128, features.getDescriptorSize());
        for (Keypoint kp : features.getKeypoints()) {
            assertTrue(kp.getX() >= 0 && kp.getX() < SyntheticScenes.T0_WIDTH);
            assertTrue(kp.getY() >= 0 && kp.getY() < SyntheticScenes.T0_HEIGHT);
        }
    }

    @Test
    void testExtract_IsDeterministic() {
        Raster raster = SyntheticScenes.image1();
        SiftFeatureExtractor extractor = new SiftFeatureExtractor();

        FeatureSet first = extractor.extract(raster);
        FeatureSet second = extractor.extract(raster);
        FeatureSet fromCopy = new SiftFeatureExtractor().extract(Raster.of(raster.toMat()));

        assertEquals(first, second);
        assertEquals(first, fromCopy);
    }

    @Test
    void testSignature_ReflectsSettings() {
        SiftFeatureExtractor defaults = new SiftFeatureExtractor();
        SiftFeatureExtractor limited = new SiftFeatureExtractor(new FeatureSettings(500, 3, 0.04, 10, 1.6));

        assertEquals(defaults.signature(), new SiftFeatureExtractor(FeatureSettings.defaults()).signature());
        assertNotEquals(defaults.signature(), limited.signature());
    }

    @Test
    void testFeatureSet_CanonicalOrderIgnoresInputOrder() {
        Keypoint a = new Keypoint(5, 1, 2, 0.5, new float[]{1, 2});
        Keypoint b = new Keypoint(1, 3, 2, 0.5, new float[]{3, 4});
        Keypoint c = new Keypoint(0, 1, 2, 0.5, new float[]{5, 6});

        FeatureSet forward = new FeatureSet(List.of(a, b, c), 2);
        FeatureSet backward = new FeatureSet(List.of(c, b, a), 2);

        assertEquals(forward, backward);
        assertEquals(List.of(c, a, b), forward.getKeypoints());
    }

    @Test
    void testFeatureSet_RejectsWrongDescriptorLength() {
        Keypoint kp = new Keypoint(0, 0, 1, 1, new float[]{1, 2, 3});
        assertThrows(IllegalArgumentException.class, () -> new FeatureSet(List.of(kp), 2));
    }
}
