package com.blissengine.semantics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class SemanticExtractor {

    private final SemanticTables semanticTables;

    public SemanticExtractor(SemanticTables semanticTables) {
        this.semanticTables = Objects.requireNonNull(semanticTables, "semanticTables");
    }

    /**
     * 查询指示符或修饰符的语义描述，原样保留 Simple/Alternatives/Combination 形状。
     */
    public Optional<SemanticFact> extract(String symbolId, SymbolRole role) {
        return semanticTables.lookup(symbolId, role)
            .map(descriptor -> new SemanticFact(symbolId, role, descriptor));
    }

    /**
     * 先处理全部指示符，再处理全部修饰符，各自保持原序；无语义的符号被跳过。
     */
    public List<SemanticFact> extractAll(List<String> indicatorIds, List<String> modifierIds) {
        List<SemanticFact> facts = new ArrayList<>(indicatorIds.size() + modifierIds.size());
        for (String indicatorId : indicatorIds) {
            extract(indicatorId, SymbolRole.INDICATOR).ifPresent(facts::add);
        }
        for (String modifierId : modifierIds) {
            extract(modifierId, SymbolRole.MODIFIER).ifPresent(facts::add);
        }
        return List.copyOf(facts);
    }
}
