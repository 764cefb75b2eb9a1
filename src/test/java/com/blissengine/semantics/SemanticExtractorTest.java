package com.blissengine.semantics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SemanticExtractorTest {

    private final SemanticExtractor extractor = new SemanticExtractor(SemanticTables.defaults());

    @Test
    void testExtractIndicator() {
        SemanticFact fact = extractor.extract("9011", SymbolRole.INDICATOR).orElseThrow();

        assertEquals("9011", fact.symbolId());
        assertEquals(SymbolRole.INDICATOR, fact.role());
        assertEquals(new SemanticDescriptor.Simple("NUMBER", "plural"), fact.descriptor());
    }

    @Test
    void testExtractUsesRoleTable() {
        assertTrue(extractor.extract("9011", SymbolRole.MODIFIER).isEmpty());
        assertTrue(extractor.extract("99999", SymbolRole.INDICATOR).isEmpty());
    }

    @Test
    @DisplayName("先指示符后修饰符，无语义的符号被跳过")
    void testExtractAllOrdering() {
        List<SemanticFact> facts = extractor.extractAll(List.of("8998", "99999", "9011"), List.of("15474", "14647"));

        assertEquals(List.of("8998", "9011", "15474", "14647"),
            facts.stream().map(SemanticFact::symbolId).toList());
        assertEquals(SymbolRole.MODIFIER, facts.get(2).role());
    }

    @Test
    void testExtractAllEmpty() {
        assertTrue(extractor.extractAll(List.of(), List.of()).isEmpty());
    }
}
