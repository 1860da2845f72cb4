package com.edge.mosaic.core.cache;

import com.edge.mosaic.core.feature.FeatureSet;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * 特征缓存
 * <p>
 * 实现负责自身的并发控制；读写失败只影响性能，不影响结果。
 */
public interface FeatureCache {

    Optional<FeatureSet> get(String key);

    void put(String key, FeatureSet features);

    /**
     * 命中则直接返回，否则计算并写入
     */
    default FeatureSet getOrCompute(String key, Supplier<FeatureSet> compute) {
        Optional<FeatureSet> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        FeatureSet computed = compute.get();
        put(key, computed);
        return computed;
    }
}
