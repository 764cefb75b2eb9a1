package com.blissengine.engine;

import com.blissengine.analysis.BlissAnalyzer;
import com.blissengine.analysis.CompositionAnalysis;
import com.blissengine.analysis.CompositionGlosses;
import com.blissengine.analysis.CompositionStructure;
import com.blissengine.analysis.ContextualSymbolAnalysis;
import com.blissengine.analysis.SymbolGlosses;
import com.blissengine.classify.RoleAssignment;
import com.blissengine.classify.SymbolClassifier;
import com.blissengine.classify.SymbolInfo;
import com.blissengine.compose.BlissComposer;
import com.blissengine.compose.CompositionResult;
import com.blissengine.compose.CompositionSpec;
import com.blissengine.config.Constants;
import com.blissengine.config.EngineConfig;
import com.blissengine.dictionary.BlissDictionary;
import com.blissengine.dictionary.DictionaryLoader;
import com.blissengine.semantics.SemanticExtractor;
import com.blissengine.semantics.SemanticTables;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Blissymbolics 组合与分析的统一入口。
 *
 * 支持三类用例：查询已有符号的释义、分析新组合的语义、由语义规格合成新组合。
 * 词典、语义表与反向索引在构造时建立，之后只读，可被多线程并发读取。
 */
public class BlissEngine {

    private final BlissDictionary dictionary;
    private final SymbolClassifier classifier;
    private final BlissAnalyzer analyzer;
    private final BlissComposer composer;

    /**
     * 使用类路径内置语义表构造引擎。
     */
    public BlissEngine(BlissDictionary dictionary) {
        this(dictionary, SemanticTables.defaults());
    }

    public BlissEngine(BlissDictionary dictionary, SemanticTables semanticTables) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary must not be null");
        Objects.requireNonNull(semanticTables, "semanticTables must not be null");
        this.classifier = new SymbolClassifier(dictionary, semanticTables);
        this.analyzer = new BlissAnalyzer(dictionary, classifier, new SemanticExtractor(semanticTables));
        this.composer = new BlissComposer(dictionary, semanticTables);
    }

    /**
     * 按配置加载词典与语义表。
     */
    public static BlissEngine load(EngineConfig config) throws IOException {
        BlissDictionary dictionary = new DictionaryLoader().load(config.getDictionaryPath());
        SemanticTables semanticTables = config.getSemanticsPath() == null
            ? SemanticTables.defaults()
            : SemanticTables.load(config.getSemanticsPath());
        return new BlissEngine(dictionary, semanticTables);
    }

    // ==================== 用例 1：已有符号释义 ====================

    public SymbolGlosses symbolGlosses(String symbolId, String language) {
        return analyzer.symbolGlosses(symbolId, language);
    }

    public SymbolGlosses symbolGlosses(String symbolId) {
        return symbolGlosses(symbolId, Constants.DEFAULT_LANGUAGE);
    }

    public CompositionGlosses compositionGlosses(List<String> composition, String language) {
        return analyzer.compositionGlosses(composition, language);
    }

    // ==================== 用例 2：分析新组合 ====================

    public CompositionAnalysis analyzeComposition(List<String> composition, String language) {
        return analyzer.analyzeComposition(composition, language);
    }

    public CompositionAnalysis analyzeComposition(List<String> composition) {
        return analyzeComposition(composition, Constants.DEFAULT_LANGUAGE);
    }

    public CompositionStructure compositionStructure(List<String> composition) {
        return analyzer.compositionStructure(composition);
    }

    public ContextualSymbolAnalysis analyzeSymbolWithContext(String symbolId, List<String> contextIds, String language) {
        return analyzer.analyzeSymbolWithContext(symbolId, contextIds, language);
    }

    // ==================== 用例 3：合成新组合 ====================

    public CompositionResult composeFromSpec(CompositionSpec spec) {
        return composer.composeFromSpec(spec);
    }

    public CompositionResult composeWithIds(String classifierId, List<String> specifierIds,
                                            List<String> modifierIds, List<String> indicatorIds) {
        return composer.composeWithIds(classifierId, specifierIds, modifierIds, indicatorIds);
    }

    // ==================== 工具方法 ====================

    public RoleAssignment classify(List<String> tokens) {
        return classifier.classify(tokens);
    }

    public SymbolInfo symbolInfo(String symbolId) {
        return classifier.symbolInfo(symbolId);
    }

    public boolean isClassifier(String symbolId) {
        return classifier.isClassifier(symbolId);
    }

    public boolean isModifier(String symbolId) {
        return classifier.isModifier(symbolId);
    }

    public boolean isIndicator(String symbolId) {
        return classifier.isIndicator(symbolId);
    }

    public DictionaryStats dictionaryStats() {
        long characters = dictionary.characterCount();
        return new DictionaryStats(
            dictionary.size(),
            characters,
            dictionary.size() - characters,
            "Blissymbolics symbol dictionary"
        );
    }

    public BlissDictionary dictionary() {
        return dictionary;
    }

    public BlissComposer composer() {
        return composer;
    }
}
