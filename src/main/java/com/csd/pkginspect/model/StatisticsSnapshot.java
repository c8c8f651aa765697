package com.csd.pkginspect.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ecosystem metrics for one package. Values are {@link Long}, {@link ByteSize} or raw text.
 */
@Value
public class StatisticsSnapshot {
    String packageName;
    String manager;
    Map<String, Object> values;

    public StatisticsSnapshot(String packageName, String manager, Map<String, Object> values) {
        this.packageName = packageName;
        this.manager = manager;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
