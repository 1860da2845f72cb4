package com.edge.mosaic.core.raster;

/**
 * 图像路径不存在或无法解码
 */
public class RasterReadException extends RuntimeException {

    public RasterReadException(String message) {
        super(message);
    }

    public RasterReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
