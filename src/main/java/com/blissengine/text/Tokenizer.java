package com.blissengine.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为 token 列表。
     */
    List<Token> tokenize(String text);
}
