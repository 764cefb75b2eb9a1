package com.blissengine.compose;

import com.blissengine.config.Constants;
import com.blissengine.dictionary.BlissDictionary;
import com.blissengine.dictionary.SymbolRecord;
import com.blissengine.semantics.SemanticDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 组合器持有的三个反向索引，构建一次后只读：
 * 释义到符号、符号到语义效果、语义路径（TYPE:value）到符号。
 */
public final class ReverseIndices {
    private static final Logger logger = LoggerFactory.getLogger(ReverseIndices.class);

    private final Map<String, String> glossToId;
    private final Map<String, SemanticDescriptor> idToSemanticEffect;
    private final Map<String, String> semanticPathToId;

    private ReverseIndices(Map<String, String> glossToId,
                           Map<String, SemanticDescriptor> idToSemanticEffect,
                           Map<String, String> semanticPathToId) {
        this.glossToId = Collections.unmodifiableMap(glossToId);
        this.idToSemanticEffect = Collections.unmodifiableMap(idToSemanticEffect);
        this.semanticPathToId = Collections.unmodifiableMap(semanticPathToId);
    }

    /**
     * 按词典顺序建立索引。
     *
     * 释义冲突时保留先写入者，除非后来者是字符而已有者是组合词（字符是释义的权威来源）；
     * 语义路径只索引简单描述，取值忽略大小写，先写入者胜出。
     */
    public static ReverseIndices build(BlissDictionary dictionary) {
        Map<String, String> glossToId = new LinkedHashMap<>();
        Map<String, SemanticDescriptor> idToSemanticEffect = new LinkedHashMap<>();
        Map<String, String> semanticPathToId = new LinkedHashMap<>();

        for (SymbolRecord record : dictionary.symbols()) {
            for (String gloss : record.glossesFor(Constants.FALLBACK_LANGUAGE)) {
                String existingId = glossToId.get(gloss);
                if (existingId == null) {
                    glossToId.put(gloss, record.id());
                } else if (record.character() && !isCharacter(dictionary, existingId)) {
                    glossToId.put(gloss, record.id());
                }
            }

            SemanticDescriptor effect = record.semantics();
            if (effect == null) {
                continue;
            }
            idToSemanticEffect.put(record.id(), effect);
            if (effect instanceof SemanticDescriptor.Simple simple && simple.value() != null) {
                semanticPathToId.putIfAbsent(pathKey(simple.type(), simple.value()), record.id());
            }
        }

        logger.debug("反向索引构建完成: {} 条释义, {} 个语义效果, {} 条语义路径",
            glossToId.size(), idToSemanticEffect.size(), semanticPathToId.size());
        return new ReverseIndices(glossToId, idToSemanticEffect, semanticPathToId);
    }

    public static String semanticPath(String type, String value) {
        return type + Constants.SEMANTIC_PATH_SEPARATOR + value;
    }

    /**
     * 索引键中的取值统一为小写，与语义表的匹配规则一致；类型保持区分大小写。
     */
    private static String pathKey(String type, String value) {
        return semanticPath(type, value.toLowerCase(Locale.ROOT));
    }

    private static boolean isCharacter(BlissDictionary dictionary, String symbolId) {
        return dictionary.find(symbolId).map(SymbolRecord::character).orElse(false);
    }

    public Optional<String> idForGloss(String gloss) {
        return Optional.ofNullable(glossToId.get(gloss));
    }

    public Optional<SemanticDescriptor> semanticEffectOf(String symbolId) {
        return Optional.ofNullable(idToSemanticEffect.get(symbolId));
    }

    public Optional<String> idForSemanticPath(String type, String value) {
        if (type == null || value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(semanticPathToId.get(pathKey(type, value)));
    }

    public int glossCount() {
        return glossToId.size();
    }

    public int semanticPathCount() {
        return semanticPathToId.size();
    }
}
