package com.blissengine.dictionary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class PosCategoryTest {

    @ParameterizedTest
    @EnumSource(value = PosCategory.class, names = {"YELLOW", "RED", "GREEN", "BLUE"})
    @DisplayName("有色符号可充当分类符")
    void testHeadBearingColors(PosCategory pos) {
        assertTrue(pos.isHeadBearing());
        assertFalse(pos.isSatellite());
    }

    @ParameterizedTest
    @EnumSource(value = PosCategory.class, names = {"GREY", "WHITE"})
    @DisplayName("灰白符号为卫星符号")
    void testSatelliteColors(PosCategory pos) {
        assertTrue(pos.isSatellite());
        assertFalse(pos.isHeadBearing());
    }

    @Test
    void testUnknownIsNeither() {
        assertFalse(PosCategory.UNKNOWN.isHeadBearing());
        assertFalse(PosCategory.UNKNOWN.isSatellite());
    }

    @Test
    void testParseIgnoresCaseAndWhitespace() {
        assertEquals(PosCategory.YELLOW, PosCategory.parse("YELLOW"));
        assertEquals(PosCategory.GREEN, PosCategory.parse(" green "));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"PURPLE", "   ", "yellowish"})
    @DisplayName("未知或缺失的词性映射为 UNKNOWN")
    void testParseFallsBackToUnknown(String raw) {
        assertEquals(PosCategory.UNKNOWN, PosCategory.parse(raw));
    }
}
