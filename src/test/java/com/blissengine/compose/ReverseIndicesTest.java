package com.blissengine.compose;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.blissengine.TestDictionaries;
import com.blissengine.dictionary.BlissDictionary;
import com.blissengine.dictionary.PosCategory;
import com.blissengine.dictionary.SymbolRecord;
import com.blissengine.semantics.SemanticDescriptor;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReverseIndicesTest {

    @Test
    void testGlossIndexUsesEnglishGlosses() {
        ReverseIndices indices = ReverseIndices.build(TestDictionaries.sample());

        assertEquals("14905", indices.idForGloss("building").orElseThrow());
        assertEquals("12335", indices.idForGloss("going").orElseThrow());
        assertTrue(indices.idForGloss("byggnad").isEmpty());
        assertTrue(indices.idForGloss("Building").isEmpty());
    }

    @Test
    @DisplayName("释义冲突时字符优先于组合词")
    void testCharacterWinsOverLaterWord() {
        BlissDictionary dictionary = BlissDictionary.of(List.of(
            word("100", false, "house"),
            word("200", true, "house")
        ));

        assertEquals("200", ReverseIndices.build(dictionary).idForGloss("house").orElseThrow());
    }

    @Test
    void testEarlierCharacterIsNotDisplaced() {
        BlissDictionary dictionary = BlissDictionary.of(List.of(
            word("200", true, "house"),
            word("100", false, "house"),
            word("300", true, "house")
        ));

        assertEquals("200", ReverseIndices.build(dictionary).idForGloss("house").orElseThrow());
    }

    @Test
    void testEarlierWordKeptAgainstLaterWord() {
        BlissDictionary dictionary = BlissDictionary.of(List.of(
            word("100", false, "house"),
            word("101", false, "house")
        ));

        assertEquals("100", ReverseIndices.build(dictionary).idForGloss("house").orElseThrow());
    }

    @Test
    @DisplayName("语义路径只索引简单描述，先写入者胜出")
    void testSemanticPathIndex() {
        ReverseIndices indices = ReverseIndices.build(TestDictionaries.sample());

        assertEquals("9011", indices.idForSemanticPath("NUMBER", "plural").orElseThrow());
        assertEquals("9011", indices.idForSemanticPath("NUMBER", "Plural").orElseThrow());
        assertTrue(indices.idForSemanticPath("number", "plural").isEmpty());
        assertTrue(indices.idForSemanticPath("NUMBER", null).isEmpty());
        assertTrue(indices.idForSemanticPath("TENSE", "past").isEmpty());
        assertEquals(4, indices.semanticPathCount());
        assertTrue(indices.semanticEffectOf("8994").orElseThrow() instanceof SemanticDescriptor.Combination);
        assertTrue(indices.semanticEffectOf("14905").isEmpty());
    }

    @Test
    void testSemanticPathFormat() {
        assertEquals("NUMBER:plural", ReverseIndices.semanticPath("NUMBER", "plural"));
    }

    private static SymbolRecord word(String id, boolean character, String gloss) {
        return new SymbolRecord(id, PosCategory.BLUE, character, Map.of("en", List.of(gloss)), "", null);
    }
}
