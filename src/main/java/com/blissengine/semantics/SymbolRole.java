package com.blissengine.semantics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 可携带语义事实的两类卫星符号角色。
 */
public enum SymbolRole {
    INDICATOR,
    MODIFIER;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
