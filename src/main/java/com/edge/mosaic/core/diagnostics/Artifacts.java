package com.edge.mosaic.core.diagnostics;

import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 诊断图输出
 */
final class Artifacts {
    private static final Logger logger = LoggerFactory.getLogger(Artifacts.class);

    private Artifacts() {
    }

    static void write(Mat image, Path target) {
        Path parent = target.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + parent, e);
        }
        if (!Imgcodecs.imwrite(target.toString(), image)) {
            throw new IllegalStateException("Failed to write image: " + target);
        }
        logger.info("Wrote {}x{} artifact to {}", image.cols(), image.rows(), target);
    }
}
