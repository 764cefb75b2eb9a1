package com.blissengine.dictionary;

import java.util.Locale;

/**
 * 符号词性颜色分类。
 */
public enum PosCategory {
    YELLOW,
    RED,
    GREEN,
    BLUE,
    GREY,
    WHITE,
    UNKNOWN;

    /**
     * 可充当分类符（classifier）的颜色。
     */
    public boolean isHeadBearing() {
        return this == YELLOW || this == RED || this == GREEN || this == BLUE;
    }

    /**
     * 修饰符/指示符所用的灰白颜色。
     */
    public boolean isSatellite() {
        return this == GREY || this == WHITE;
    }

    /**
     * 解析词典中的 pos 字段，未知或缺失值统一映射为 UNKNOWN。
     */
    public static PosCategory parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (PosCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
