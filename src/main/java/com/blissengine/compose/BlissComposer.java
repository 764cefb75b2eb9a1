package com.blissengine.compose;

import com.blissengine.dictionary.BlissDictionary;
import com.blissengine.dictionary.SymbolRecord;
import com.blissengine.semantics.SemanticDescriptor;
import com.blissengine.semantics.SemanticTables;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 由语义规格或显式角色 ID 合成符号序列。
 */
public class BlissComposer {

    private final BlissDictionary dictionary;
    private final SemanticTables semanticTables;
    private final ReverseIndices indices;

    public BlissComposer(BlissDictionary dictionary, SemanticTables semanticTables) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.semanticTables = Objects.requireNonNull(semanticTables, "semanticTables");
        this.indices = ReverseIndices.build(dictionary);
    }

    /**
     * 按规格合成：分类符、限定符、语义符号依次排列。
     */
    public CompositionResult composeFromSpec(CompositionSpec spec) {
        if (spec == null || spec.classifier() == null) {
            return CompositionResult.failure(CompositionError.missingField("classifier"));
        }

        Optional<String> classifierId = findByGloss(spec.classifier());
        if (classifierId.isEmpty()) {
            return CompositionResult.failure(CompositionError.notFound("classifier not found: " + spec.classifier()));
        }

        List<String> composition = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        composition.add(classifierId.get());

        for (String specifierGloss : spec.specifiers()) {
            Optional<String> specifierId = findByGloss(specifierGloss);
            if (specifierId.isPresent()) {
                composition.add(specifierId.get());
            } else {
                warnings.add("specifier not found: " + specifierGloss);
            }
        }

        for (Map<String, String> semanticItem : spec.semantics()) {
            if (semanticItem == null || semanticItem.size() != 1) {
                warnings.add("complex semantic spec not fully supported: " + semanticItem);
                continue;
            }
            Map.Entry<String, String> entry = semanticItem.entrySet().iterator().next();
            Optional<String> symbolId = findSemanticSymbol(entry.getKey(), entry.getValue());
            if (symbolId.isPresent()) {
                composition.add(symbolId.get());
            } else {
                warnings.add("no symbol found for semantic " + entry.getKey() + ":" + entry.getValue());
            }
        }

        return CompositionResult.success(composition, warnings);
    }

    /**
     * 按显式 ID 合成：前缀修饰符、分类符、限定符、后缀指示符。
     * 分类符不在词典中为致命错误；其余缺失的 ID 被丢弃并记录告警。
     */
    public CompositionResult composeWithIds(String classifierId, List<String> specifierIds,
                                            List<String> modifierIds, List<String> indicatorIds) {
        if (!dictionary.contains(classifierId)) {
            return CompositionResult.failure(CompositionError.notFound("classifier " + classifierId + " not found"));
        }

        List<String> composition = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        appendKnown(modifierIds, "modifier", composition, warnings);
        composition.add(classifierId);
        appendKnown(specifierIds, "specifier", composition, warnings);
        appendKnown(indicatorIds, "indicator", composition, warnings);
        return CompositionResult.success(composition, warnings);
    }

    public CompositionResult composeWithIds(String classifierId) {
        return composeWithIds(classifierId, List.of(), List.of(), List.of());
    }

    private void appendKnown(List<String> symbolIds, String roleName, List<String> composition, List<String> warnings) {
        if (symbolIds == null) {
            return;
        }
        for (String symbolId : symbolIds) {
            if (dictionary.contains(symbolId)) {
                composition.add(symbolId);
            } else {
                warnings.add(roleName + " " + symbolId + " not found");
            }
        }
    }

    /**
     * 先查英文释义索引的精确匹配，再按词典顺序对所有语言做忽略大小写的扫描。
     */
    public Optional<String> findByGloss(String gloss) {
        if (gloss == null) {
            return Optional.empty();
        }
        Optional<String> exact = indices.idForGloss(gloss);
        if (exact.isPresent()) {
            return exact;
        }

        String normalizedGloss = gloss.toLowerCase(Locale.ROOT);
        for (SymbolRecord record : dictionary.symbols()) {
            for (List<String> glossList : record.glosses().values()) {
                for (String candidate : glossList) {
                    if (candidate.toLowerCase(Locale.ROOT).equals(normalizedGloss)) {
                        return Optional.of(record.id());
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 依次搜索指示符表、修饰符表（取值忽略大小写），最后回退到词典语义路径索引。
     */
    public Optional<String> findSemanticSymbol(String type, String value) {
        if (type == null || value == null) {
            return Optional.empty();
        }
        Optional<String> fromIndicators = firstMatch(semanticTables.indicatorSemantics(), type, value);
        if (fromIndicators.isPresent()) {
            return fromIndicators;
        }
        Optional<String> fromModifiers = firstMatch(semanticTables.modifierSemantics(), type, value);
        if (fromModifiers.isPresent()) {
            return fromModifiers;
        }
        return indices.idForSemanticPath(type, value);
    }

    private Optional<String> firstMatch(Map<String, SemanticDescriptor> table, String type, String value) {
        for (Map.Entry<String, SemanticDescriptor> entry : table.entrySet()) {
            if (entry.getValue().matches(type, value)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public Optional<SemanticDescriptor> semanticEffectOf(String symbolId) {
        return indices.semanticEffectOf(symbolId);
    }

    ReverseIndices indices() {
        return indices;
    }
}
