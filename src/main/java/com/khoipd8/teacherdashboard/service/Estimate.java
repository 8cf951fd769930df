package com.khoipd8.teacherdashboard.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A metric value together with whether it was computed from sheet data or substituted by
 * {@link FallbackPolicy}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Estimate<T> {

    private final T value;
    private final boolean synthetic;

    public static <T> Estimate<T> live(T value) {
        return new Estimate<>(value, false);
    }

    public static <T> Estimate<T> synthetic(T value) {
        return new Estimate<>(value, true);
    }
}
