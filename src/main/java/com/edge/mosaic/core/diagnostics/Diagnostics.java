package com.edge.mosaic.core.diagnostics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 一次配准的诊断记录
 * <p>
 * 通过 {@link Builder} 逐步填充，结束后以不可变形式返回。
 * n_match 总是存在；n_inlier 只在找到变换时存在。
 */
public final class Diagnostics {

    public static final String N_MATCH = "n_match";
    public static final String N_INLIER = "n_inlier";
    public static final String SCALE = "scale";
    public static final String IMG0 = "img0";
    public static final String IMG1 = "img1";
    public static final String N_KEYPOINT0 = "n_keypoint0";
    public static final String N_KEYPOINT1 = "n_keypoint1";
    public static final String MEAN_ERROR = "mean_error";
    public static final String INLIERS = "inliers";
    public static final String ATTEMPTS = "attempts";
    public static final String MATCH_IMAGE = "match_image";
    public static final String OVERLAY_IMAGE = "overlay_image";

    private final Map<String, Object> fields;

    private Diagnostics(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String key) {
        return fields.containsKey(key);
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public int getInt(String key) {
        Object value = requireField(key);
        return ((Number) value).intValue();
    }

    public double getDouble(String key) {
        Object value = requireField(key);
        return ((Number) value).doubleValue();
    }

    public String getString(String key) {
        return String.valueOf(requireField(key));
    }

    private Object requireField(String key) {
        Object value = fields.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Diagnostic field not present: " + key);
        }
        return value;
    }

    public Set<String> keySet() {
        return fields.keySet();
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public String toString() {
        return "Diagnostics" + fields;
    }

    public static final class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, Object value) {
            if (value == null) {
                fields.remove(key);
            } else {
                fields.put(key, value);
            }
            return this;
        }

        public Diagnostics build() {
            return new Diagnostics(fields);
        }
    }
}
