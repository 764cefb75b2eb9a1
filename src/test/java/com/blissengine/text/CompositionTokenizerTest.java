package com.blissengine.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompositionTokenizerTest {

    private final CompositionTokenizer tokenizer = new CompositionTokenizer();

    @Test
    @DisplayName("空白与逗号分隔符号 ID")
    void testWhitespaceAndCommas() {
        List<Token> tokens = tokenizer.tokenize("14647 14905,24920");

        assertEquals(3, tokens.size());
        assertToken(tokens.get(0), "14647", 0, 0, 5);
        assertToken(tokens.get(1), "14905", 1, 6, 11);
        assertToken(tokens.get(2), "24920", 2, 12, 17);
    }

    @Test
    @DisplayName("渲染标记不需要空白也会单独成为 token")
    void testMarkersSplitWithoutWhitespace() {
        List<Token> tokens = tokenizer.tokenize("14647/14905;9011");

        assertEquals(List.of("14647", "/", "14905", ";", "9011"), tokens.stream().map(Token::text).toList());
        assertToken(tokens.get(1), "/", 1, 5, 6);
        assertTrue(tokens.get(1).isRenderingMarker());
        assertFalse(tokens.get(0).isRenderingMarker());
    }

    @Test
    void testTexts() {
        assertEquals(List.of("14647", "/", "14905"), tokenizer.texts("  14647 /  14905  "));
    }

    @Test
    void testEmptyInput() {
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize(" , ").isEmpty());
    }

    private void assertToken(Token token, String text, int position, int start, int end) {
        assertEquals(text, token.text());
        assertEquals(position, token.position());
        assertEquals(start, token.startOffset());
        assertEquals(end, token.endOffset());
    }
}
