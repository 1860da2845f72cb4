package com.edge.mosaic.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV 的 JNI 库，必须在任何使用 OpenCV 的代码之前调用
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    private NativeLibraryLoader() {
    }

    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }
        logger.info("Loading OpenCV native library via openpnp...");
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            logger.info("OpenCV loaded successfully: {}", org.opencv.core.Core.VERSION);
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            logger.warn("Failed to load OpenCV via openpnp: {}", e.getMessage());
            throw new IllegalStateException("OpenCV native library unavailable", e);
        }
    }
}
