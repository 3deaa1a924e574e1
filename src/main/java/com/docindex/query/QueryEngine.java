package com.docindex.query;

import com.docindex.index.ScoredDocument;
import com.docindex.index.SearchEngine;

import java.util.List;
import java.util.Locale;

public class QueryEngine {
    private final SearchEngine engine;

    public QueryEngine(SearchEngine engine) {
        this.engine = engine;
    }

    /**
     * 单词项相关度查询。
     *
     * @param rawTerm 原始输入，去除首尾空白并转小写
     * @return 按分数降序、文档路径升序排列的结果；未知词项返回空结果
     */
    public SearchResult search(String rawTerm) {
        String term = normalize(rawTerm);
        if (term.isEmpty()) {
            return SearchResult.empty(term);
        }
        List<ScoredDocument> ranked = engine.relevanceLookup(term);
        return new SearchResult(term, ranked.size(), ranked);
    }

    /**
     * 去除首尾空白（含 U+0085 与不间断空格等 Unicode 空白）后转小写。
     */
    public static String normalize(String rawTerm) {
        if (rawTerm == null) {
            return "";
        }
        int start = 0;
        int end = rawTerm.length();
        while (start < end && isSpace(rawTerm.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(rawTerm.charAt(end - 1))) {
            end--;
        }
        return rawTerm.substring(start, end).toLowerCase(Locale.ROOT);
    }

    private static boolean isSpace(char ch) {
        return ch == '\u0085' || Character.isWhitespace(ch) || Character.isSpaceChar(ch);
    }
}
