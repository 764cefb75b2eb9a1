package com.blissengine.classify;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SymbolType {
    MODIFIER("modifier"),
    INDICATOR("indicator"),
    CHARACTER_OR_WORD("character_or_word"),
    UNKNOWN("unknown");

    private final String label;

    SymbolType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
