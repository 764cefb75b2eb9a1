package com.blissengine.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 分析结果中分类符或限定符的释义。
 */
public record GlossInfo(
    String id,
    List<String> gloss,
    @JsonProperty("isCharacter") boolean character,
    boolean found
) {
    public GlossInfo {
        gloss = List.copyOf(gloss);
    }
}
