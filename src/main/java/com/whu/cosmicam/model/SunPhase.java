package com.whu.cosmicam.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 按太阳高度角划分的光照阶段
 * 声明顺序即判定顺序：从最暗到最亮，第一个满足 altitude <= upperBound 的阶段胜出，
 * 所以正好落在边界上的高度角归入更暗的一档。
 */
public enum SunPhase {

    NIGHT("night", -18.0),
    ASTRONOMICAL_TWILIGHT("astronomical_twilight", -12.0),
    NAUTICAL_TWILIGHT("nautical_twilight", -6.0),
    CIVIL_TWILIGHT("civil_twilight", -0.833),
    DAY("day", Double.POSITIVE_INFINITY);

    private final String key;
    private final double upperBound;

    SunPhase(String key, double upperBound) {
        this.key = key;
        this.upperBound = upperBound;
    }

    /**
     * 与相机 profile 名称一致的阶段标识
     */
    @JsonValue
    public String getKey() {
        return key;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public static SunPhase fromAltitude(double altitudeDegrees) {
        for (SunPhase phase : values()) {
            if (altitudeDegrees <= phase.upperBound) {
                return phase;
            }
        }
        // NaN 不满足任何比较
        return DAY;
    }
}
