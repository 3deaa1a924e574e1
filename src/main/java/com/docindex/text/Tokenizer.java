package com.docindex.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为小写词项列表。
     */
    List<Token> tokenize(String text);
}
