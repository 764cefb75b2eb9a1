package com.blissengine.text;

import com.blissengine.classify.SymbolClassifier;

public record Token(
    String text,
    int position,
    int startOffset,
    int endOffset
) {
    /**
     * 非数字 token（"/"、";" 等）只用于排版，不参与分类。
     */
    public boolean isRenderingMarker() {
        return !SymbolClassifier.isSymbolId(text);
    }
}
