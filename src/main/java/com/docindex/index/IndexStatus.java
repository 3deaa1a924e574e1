package com.docindex.index;

public record IndexStatus(int docCount, int termCount, long totalTerms) {
}
