package com.edge.mosaic.core.diagnostics;

import com.edge.mosaic.core.raster.Raster;
import com.edge.mosaic.core.transform.AffineTransform;

public interface RasterWarper {
    /**
     * 将 source 按仿射变换映射到目标坐标系
     * @param source 源栅格
     * @param transform source 像素坐标 -> 目标像素坐标
     * @param width 目标宽度
     * @param height 目标高度
     * @return 新建的目标尺寸栅格，未覆盖区域为 0，调用方负责 release
     */
    Raster warp(Raster source, AffineTransform transform, int width, int height);
}
