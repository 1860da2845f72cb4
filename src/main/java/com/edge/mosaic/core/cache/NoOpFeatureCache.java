package com.edge.mosaic.core.cache;

import com.edge.mosaic.core.feature.FeatureSet;

import java.util.Optional;

/**
 * 未配置缓存目录时使用：从不命中，也不保存
 */
public final class NoOpFeatureCache implements FeatureCache {

    public static final NoOpFeatureCache INSTANCE = new NoOpFeatureCache();

    private NoOpFeatureCache() {
    }

    @Override
    public Optional<FeatureSet> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, FeatureSet features) {
        // 不保存
    }
}
