package com.docindex.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class WordTokenizer implements Tokenizer {

    /**
     * 对一行文本分词，并输出原文偏移。
     *
     * 词项为字母/数字连续片段，相邻片段之间恰好隔一个撇号（' 或 ’）时合并，
     * 例如 o'er、o’er。逐字符线性扫描，行长不受限制。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int length = text.length();
        int index = 0;
        int nextPosition = 0;
        while (index < length) {
            if (!isTermChar(text.codePointAt(index))) {
                index += Character.charCount(text.codePointAt(index));
                continue;
            }
            int start = index;
            index = skipTermChars(text, index);
            while (index + 1 < length && isApostrophe(text.charAt(index))
                    && isTermChar(text.codePointAt(index + 1))) {
                index = skipTermChars(text, index + 1);
            }
            String normalizedTerm = text.substring(start, index).toLowerCase(Locale.ROOT);
            tokens.add(new Token(normalizedTerm, nextPosition, start, index));
            nextPosition++;
        }
        return List.copyOf(tokens);
    }

    private static int skipTermChars(String text, int index) {
        int length = text.length();
        while (index < length) {
            int codePoint = text.codePointAt(index);
            if (!isTermChar(codePoint)) {
                break;
            }
            index += Character.charCount(codePoint);
        }
        return index;
    }

    private static boolean isApostrophe(char ch) {
        return ch == '\'' || ch == '’';
    }

    /**
     * Unicode 字母（L*）或数字（Nd、Nl、No）。
     */
    static boolean isTermChar(int codePoint) {
        if (Character.isLetter(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.DECIMAL_DIGIT_NUMBER
            || type == Character.LETTER_NUMBER
            || type == Character.OTHER_NUMBER;
    }
}
