package com.edge.mosaic.testing;

import com.edge.mosaic.config.NativeLibraryLoader;

/**
 * 测试中加载 OpenCV native 库
 */
public final class OpenCvTestSupport {

    private OpenCvTestSupport() {
    }

    public static void load() {
        NativeLibraryLoader.loadNativeLibraries();
    }
}
