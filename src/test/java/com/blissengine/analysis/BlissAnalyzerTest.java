package com.blissengine.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.blissengine.TestDictionaries;
import com.blissengine.classify.SymbolClassifier;
import com.blissengine.classify.SymbolType;
import com.blissengine.config.Constants;
import com.blissengine.dictionary.BlissDictionary;
import com.blissengine.semantics.SemanticDescriptor;
import com.blissengine.semantics.SemanticExtractor;
import com.blissengine.semantics.SemanticFact;
import com.blissengine.semantics.SemanticTables;
import com.blissengine.semantics.SymbolRole;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BlissAnalyzerTest {

    private BlissAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        BlissDictionary dictionary = TestDictionaries.sample();
        SemanticTables tables = SemanticTables.defaults();
        analyzer = new BlissAnalyzer(dictionary, new SymbolClassifier(dictionary, tables), new SemanticExtractor(tables));
    }

    @Test
    void testSymbolGlosses() {
        SymbolGlosses glosses = analyzer.symbolGlosses("14905", "en");

        assertTrue(glosses.found());
        assertEquals(List.of("building"), glosses.glosses());
        assertEquals("A structure", glosses.explanation());
        assertTrue(glosses.character());
    }

    @Test
    @DisplayName("请求语言缺失时回退英文")
    void testSymbolGlossesFallBackToEnglish() {
        assertEquals(List.of("byggnad"), analyzer.symbolGlosses("14905", "sv").glosses());
        assertEquals(List.of("medicine"), analyzer.symbolGlosses("24920", "sv").glosses());
    }

    @Test
    void testSymbolGlossesNotFound() {
        SymbolGlosses glosses = analyzer.symbolGlosses("99999", "en");

        assertFalse(glosses.found());
        assertEquals("Symbol 99999 not found", glosses.error());
        assertNull(glosses.glosses());
    }

    @Test
    void testCompositionGlossesSkipMarkers() {
        CompositionGlosses glosses = analyzer.compositionGlosses(List.of("14647", "/", "14905"), "en");

        assertEquals(List.of("14647", "/", "14905"), glosses.composition());
        assertEquals(2, glosses.components().size());
        assertEquals(List.of("many"), glosses.components().get(0).glosses());
        assertEquals("14905", glosses.components().get(1).id());
    }

    @Test
    @DisplayName("分析组合：分类符释义、限定符释义与语义事实")
    void testAnalyzeComposition() {
        CompositionAnalysis analysis = analyzer.analyzeComposition(List.of("14647", "14905", "24920", "9011"), "en");

        assertFalse(analysis.isFailed());
        assertEquals("14905", analysis.classifier());
        assertEquals(List.of("building"), analysis.classifierInfo().gloss());
        assertEquals(List.of("24920"), analysis.specifiers());
        assertEquals(List.of("medicine"), analysis.specifierInfo().get(0).gloss());
        assertEquals(List.of("9011"), analysis.indicators());
        assertEquals(List.of("14647"), analysis.modifiers());
        assertEquals(List.of(
            new SemanticFact("9011", SymbolRole.INDICATOR, new SemanticDescriptor.Simple("NUMBER", "plural")),
            new SemanticFact("14647", SymbolRole.MODIFIER, new SemanticDescriptor.Simple("QUANTIFIER", "many"))
        ), analysis.semantics());
    }

    @Test
    void testAnalyzeSingleSymbol() {
        CompositionAnalysis analysis = analyzer.analyzeComposition(List.of("14905"), "en");

        assertEquals("14905", analysis.classifier());
        assertTrue(analysis.specifiers().isEmpty());
        assertTrue(analysis.semantics().isEmpty());
    }

    @Test
    void testAnalyzeWithMarkers() {
        CompositionAnalysis analysis = analyzer.analyzeComposition(List.of("14905", "/", "24920", ";", "9011"), "en");

        assertEquals(List.of("14905", "/", "24920", ";", "9011"), analysis.originalComposition());
        assertEquals(List.of("24920"), analysis.specifiers());
        assertEquals(List.of("9011"), analysis.indicators());
    }

    @Test
    @DisplayName("分类失败时返回首条错误与完整角色划分")
    void testAnalyzeFailure() {
        CompositionAnalysis analysis = analyzer.analyzeComposition(List.of("9011", "14905"), "en");

        assertTrue(analysis.isFailed());
        assertEquals(Constants.ERROR_INDICATOR_FIRST, analysis.error());
        assertNotNull(analysis.details());
        assertNull(analysis.classifier());
    }

    @Test
    void testCompositionStructure() {
        CompositionStructure structure = analyzer.compositionStructure(List.of("14905", "24920"));

        assertEquals("14905", structure.structure().classifier());
        assertEquals(List.of("24920"), structure.structure().specifiers());
        assertEquals(List.of("building"), structure.interpretation().classifierGlosses().gloss());
        assertEquals(1, structure.interpretation().specifierGlosses().size());
        assertEquals(0, structure.interpretation().indicatorCount());
        assertEquals(0, structure.interpretation().modifierCount());
    }

    @Test
    void testCompositionStructureWithoutClassifier() {
        CompositionStructure structure = analyzer.compositionStructure(List.of("9011"));

        assertNull(structure.interpretation().classifierGlosses());
        assertTrue(structure.structure().hasErrors());
    }

    @Test
    void testAnalyzeSymbolWithContext() {
        ContextualSymbolAnalysis analysis = analyzer.analyzeSymbolWithContext("9011", List.of("14905", "9011"), "en");

        assertEquals(SymbolType.INDICATOR, analysis.type());
        assertEquals(List.of("plural"), analysis.symbol().glosses());
        assertEquals("14905", analysis.contextClassification().classifier());

        ContextualSymbolAnalysis unknown = analyzer.analyzeSymbolWithContext("99999", List.of(), "en");
        assertEquals(SymbolType.UNKNOWN, unknown.type());
        assertNull(unknown.contextClassification());
    }

    @Test
    @DisplayName("释义回退：请求语言、英文、占位符")
    void testGlossInfoFallbacks() {
        assertEquals(List.of("byggnad"), analyzer.glossInfo("14905", "sv").gloss());
        assertEquals(List.of("medicine"), analyzer.glossInfo("24920", "sv").gloss());

        GlossInfo unknown = analyzer.glossInfo("99999", "en");
        assertEquals(List.of(Constants.UNKNOWN_GLOSS), unknown.gloss());
        assertFalse(unknown.found());
        assertFalse(unknown.character());
    }
}
