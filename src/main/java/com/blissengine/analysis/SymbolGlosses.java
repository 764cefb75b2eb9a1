package com.blissengine.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SymbolGlosses(
    String id,
    List<String> glosses,
    String explanation,
    @JsonProperty("isCharacter") Boolean character,
    String error
) {
    public static SymbolGlosses notFound(String symbolId) {
        return new SymbolGlosses(symbolId, null, null, null, "Symbol " + symbolId + " not found");
    }

    public boolean found() {
        return error == null;
    }
}
