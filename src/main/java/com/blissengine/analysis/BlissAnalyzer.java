package com.blissengine.analysis;

import com.blissengine.classify.RoleAssignment;
import com.blissengine.classify.SymbolClassifier;
import com.blissengine.classify.SymbolInfo;
import com.blissengine.classify.SymbolType;
import com.blissengine.config.Constants;
import com.blissengine.dictionary.BlissDictionary;
import com.blissengine.dictionary.SymbolRecord;
import com.blissengine.semantics.SemanticExtractor;
import com.blissengine.semantics.SemanticFact;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 从已有组合中提取释义与语义。
 */
public class BlissAnalyzer {

    private final BlissDictionary dictionary;
    private final SymbolClassifier classifier;
    private final SemanticExtractor extractor;

    public BlissAnalyzer(BlissDictionary dictionary, SymbolClassifier classifier, SemanticExtractor extractor) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /**
     * 单个符号的释义、说明与字符标记；请求语言缺失时回退英文。
     */
    public SymbolGlosses symbolGlosses(String symbolId, String language) {
        Optional<SymbolRecord> found = dictionary.find(symbolId);
        if (found.isEmpty()) {
            return SymbolGlosses.notFound(symbolId);
        }
        SymbolRecord record = found.get();
        List<String> glosses = record.hasLanguage(language)
            ? record.glossesFor(language)
            : record.glossesFor(Constants.FALLBACK_LANGUAGE);
        return new SymbolGlosses(symbolId, glosses, record.explanation(), record.character(), null);
    }

    /**
     * 组合中每个数字 ID 的释义，渲染标记被跳过。
     */
    public CompositionGlosses compositionGlosses(List<String> composition, String language) {
        List<SymbolGlosses> components = new ArrayList<>();
        for (String symbolId : SymbolClassifier.filterSymbolIds(composition)) {
            components.add(symbolGlosses(symbolId, language));
        }
        return new CompositionGlosses(List.copyOf(composition), List.copyOf(components));
    }

    /**
     * 分类后提取分类符与限定符的释义，以及先指示符后修饰符的语义事实。
     */
    public CompositionAnalysis analyzeComposition(List<String> composition, String language) {
        List<String> original = List.copyOf(composition);
        RoleAssignment assignment = classifier.classify(original);
        if (assignment.hasErrors()) {
            return CompositionAnalysis.failed(original, assignment);
        }

        GlossInfo classifierInfo = assignment.hasClassifier()
            ? glossInfo(assignment.classifier(), language)
            : null;
        List<GlossInfo> specifierInfo = new ArrayList<>(assignment.specifiers().size());
        for (String specifierId : assignment.specifiers()) {
            specifierInfo.add(glossInfo(specifierId, language));
        }
        List<SemanticFact> semantics = extractor.extractAll(assignment.indicators(), assignment.modifiers());

        return new CompositionAnalysis(
            original,
            assignment.classifier(),
            classifierInfo,
            assignment.specifiers(),
            List.copyOf(specifierInfo),
            semantics,
            assignment.indicators(),
            assignment.modifiers(),
            null,
            null
        );
    }

    public CompositionStructure compositionStructure(List<String> composition) {
        List<String> original = List.copyOf(composition);
        RoleAssignment assignment = classifier.classify(original);

        GlossInfo classifierGlosses = assignment.hasClassifier()
            ? glossInfo(assignment.classifier(), Constants.DEFAULT_LANGUAGE)
            : null;
        List<GlossInfo> specifierGlosses = new ArrayList<>(assignment.specifiers().size());
        for (String specifierId : assignment.specifiers()) {
            specifierGlosses.add(glossInfo(specifierId, Constants.DEFAULT_LANGUAGE));
        }

        return new CompositionStructure(original, assignment, new CompositionStructure.Interpretation(
            classifierGlosses,
            List.copyOf(specifierGlosses),
            assignment.indicators().size(),
            assignment.modifiers().size()
        ));
    }

    public ContextualSymbolAnalysis analyzeSymbolWithContext(String symbolId, List<String> contextIds, String language) {
        SymbolGlosses glosses = symbolGlosses(symbolId, language);
        SymbolInfo info = classifier.symbolInfo(symbolId);
        SymbolType type = info.found() ? info.type() : SymbolType.UNKNOWN;
        RoleAssignment context = contextIds == null || contextIds.isEmpty() ? null : classifier.classify(contextIds);
        return new ContextualSymbolAnalysis(glosses, type, context);
    }

    /**
     * 请求语言、英文、"(unknown)" 依次回退；未知符号同样得到占位释义。
     */
    GlossInfo glossInfo(String symbolId, String language) {
        Optional<SymbolRecord> found = dictionary.find(symbolId);
        if (found.isEmpty()) {
            return new GlossInfo(symbolId, List.of(Constants.UNKNOWN_GLOSS), false, false);
        }
        SymbolRecord record = found.get();
        List<String> gloss;
        if (record.hasLanguage(language)) {
            gloss = record.glossesFor(language);
        } else if (record.hasLanguage(Constants.FALLBACK_LANGUAGE)) {
            gloss = record.glossesFor(Constants.FALLBACK_LANGUAGE);
        } else {
            gloss = List.of(Constants.UNKNOWN_GLOSS);
        }
        return new GlossInfo(symbolId, gloss, record.character(), true);
    }
}
