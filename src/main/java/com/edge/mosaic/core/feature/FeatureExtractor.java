package com.edge.mosaic.core.feature;

import com.edge.mosaic.core.raster.Raster;

public interface FeatureExtractor {
    /**
     * 提取特征点和描述子
     * <p>
     * 相同像素和相同配置必须得到相同结果；近乎均匀的图像返回空集或少量点，不抛异常。
     * @param raster 输入栅格
     * @return 特征点集合
     */
    FeatureSet extract(Raster raster);

    /**
     * 影响提取结果的配置摘要，用于缓存键
     */
    String signature();
}
