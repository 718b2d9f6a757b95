package com.gdin.inspection.waterleak.pipeline.context;

import lombok.Getter;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Getter
public class PipelineRunContext {

    private final PipelineRunStats stats = new PipelineRunStats();
    private final Map<String, Object> state = new ConcurrentHashMap<>();

    public void put(String key, Object value) {
        // ConcurrentHashMap 不接受 null，null 视为移除
        if (value == null) {
            state.remove(key);
        } else {
            state.put(key, value);
        }
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) { return (T) state.get(key); }

    @SuppressWarnings("unchecked")
    public <T> T getOrDefault(String key, T defaultValue) {
        Object v = state.get(key);
        return v == null ? defaultValue : (T) v;
    }

    public boolean has(String key) {
        return state.containsKey(key);
    }

    public Set<String> keySet() {
        return state.keySet();
    }
}
