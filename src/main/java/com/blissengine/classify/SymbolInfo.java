package com.blissengine.classify;

import com.blissengine.dictionary.PosCategory;
import com.blissengine.semantics.SemanticDescriptor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 单个符号的完整信息：词典字段、角色类型以及语义表中的描述。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SymbolInfo(
    String id,
    PosCategory pos,
    Map<String, List<String>> glosses,
    @JsonProperty("isCharacter") boolean character,
    String explanation,
    SemanticDescriptor symbolSemantics,
    SymbolType type,
    SemanticDescriptor semantics,
    String error
) {
    public static SymbolInfo notFound(String symbolId) {
        return new SymbolInfo(symbolId, null, null, false, null, null, null, null,
            "Symbol " + symbolId + " not found");
    }

    public boolean found() {
        return error == null;
    }
}
