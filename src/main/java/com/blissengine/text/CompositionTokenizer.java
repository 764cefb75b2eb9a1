package com.blissengine.text;

import com.blissengine.config.Constants;

import java.util.ArrayList;
import java.util.List;

/**
 * 将输入的组合文本（如 "14647 / 14905;24920, 9011"）切分为符号 ID 与渲染标记。
 */
public class CompositionTokenizer implements Tokenizer {

    /**
     * 以空白与逗号为分隔；"/" 与 ";" 即使没有空白包围也单独成为标记 token。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int segmentStart = -1;
        for (int cursor = 0; cursor < text.length(); cursor++) {
            char ch = text.charAt(cursor);
            if (Character.isWhitespace(ch) || ch == ',') {
                appendSegment(text, segmentStart, cursor, tokens);
                segmentStart = -1;
            } else if (isMarker(ch)) {
                appendSegment(text, segmentStart, cursor, tokens);
                segmentStart = -1;
                tokens.add(new Token(String.valueOf(ch), tokens.size(), cursor, cursor + 1));
            } else if (segmentStart < 0) {
                segmentStart = cursor;
            }
        }
        appendSegment(text, segmentStart, text.length(), tokens);

        return List.copyOf(tokens);
    }

    /**
     * 只返回 token 文本，供分类器直接使用。
     */
    public List<String> texts(String text) {
        return tokenize(text).stream().map(Token::text).toList();
    }

    private void appendSegment(String sourceText, int startOffset, int endOffset, List<Token> tokens) {
        if (startOffset < 0 || startOffset >= endOffset) {
            return;
        }
        tokens.add(new Token(sourceText.substring(startOffset, endOffset), tokens.size(), startOffset, endOffset));
    }

    private boolean isMarker(char ch) {
        return Constants.SPACE_MARKER.charAt(0) == ch || Constants.SEPARATOR_MARKER.charAt(0) == ch;
    }
}
