package com.khoipd8.teacherdashboard.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Paths of the response fields that hold fallback values rather than sheet data, reported to the
 * UI as {@code syntheticMetrics}.
 */
public class SyntheticMetrics {

    private final List<String> paths = new ArrayList<>();

    public <T> T take(String path, Estimate<T> estimate) {
        if (estimate.isSynthetic()) {
            paths.add(path);
        }
        return estimate.getValue();
    }

    public void mark(String path) {
        paths.add(path);
    }

    public List<String> asList() {
        return Collections.unmodifiableList(new ArrayList<>(paths));
    }
}
