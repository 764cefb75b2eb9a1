package com.blissengine.dictionary;

import com.blissengine.semantics.SemanticDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 词典中的单个符号定义，加载后不可变。
 */
public record SymbolRecord(
    String id,
    PosCategory pos,
    boolean character,
    Map<String, List<String>> glosses,
    String explanation,
    SemanticDescriptor semantics
) {
    public SymbolRecord {
        pos = pos == null ? PosCategory.UNKNOWN : pos;
        explanation = explanation == null ? "" : explanation;
        Map<String, List<String>> orderedGlosses = new LinkedHashMap<>();
        if (glosses != null) {
            glosses.forEach((language, list) -> orderedGlosses.put(language, List.copyOf(list)));
        }
        glosses = Collections.unmodifiableMap(orderedGlosses);
    }

    /**
     * 仅含词性的最简符号，常用于构造测试词典。
     */
    public static SymbolRecord of(String id, PosCategory pos) {
        return new SymbolRecord(id, pos, false, Map.of(), "", null);
    }

    /**
     * 指定语言的释义列表，缺失时返回空列表。
     */
    public List<String> glossesFor(String language) {
        return glosses.getOrDefault(language, List.of());
    }

    public boolean hasLanguage(String language) {
        return glosses.containsKey(language);
    }

    public Optional<SemanticDescriptor> semanticEffect() {
        return Optional.ofNullable(semantics);
    }
}
