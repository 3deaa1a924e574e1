package com.docindex.index;

/**
 * 单个文档对某个词项的相关度分数。
 */
public record ScoredDocument(String document, double score) {
}
