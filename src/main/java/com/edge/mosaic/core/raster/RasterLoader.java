package com.edge.mosaic.core.raster;

import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 按路径读取灰度栅格
 */
public class RasterLoader {
    private static final Logger logger = LoggerFactory.getLogger(RasterLoader.class);

    public Raster load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("Image path cannot be null");
        }
        if (!Files.isRegularFile(path)) {
            throw new RasterReadException("Image not found: " + path);
        }

        Mat mat = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_GRAYSCALE);
        if (mat == null || mat.empty()) {
            throw new RasterReadException("Cannot decode image: " + path);
        }
        try {
            Raster raster = Raster.of(mat);
            logger.debug("Loaded {} from {}", raster, path);
            return raster;
        } finally {
            mat.release();
        }
    }
}
