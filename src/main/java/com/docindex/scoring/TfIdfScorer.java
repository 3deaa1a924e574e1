package com.docindex.scoring;

/**
 * tf-idf 评分公式。
 */
public final class TfIdfScorer {
    private TfIdfScorer() {
    }

    /**
     * tf(t,d) = n(t,d) / 文档词项总数，总数为 0 时返回 0。
     */
    public static double termFrequency(int termCount, int totalTerms) {
        if (totalTerms <= 0) {
            return 0.0;
        }
        return (double) termCount / (double) totalTerms;
    }

    /**
     * idf(t) = ln(N / (n(t) + 1))。
     *
     * 分母加一是固定约定，词项出现在大部分文档中时结果为负数。
     * N 或 n(t) 为 0 时返回 0。
     *
     * @param totalDocs 已索引文档总数 N
     * @param docFrequency 包含该词项的文档数 n(t)
     */
    public static double inverseDocumentFrequency(int totalDocs, int docFrequency) {
        if (totalDocs <= 0 || docFrequency <= 0) {
            return 0.0;
        }
        return Math.log((double) totalDocs / ((double) docFrequency + 1));
    }

    public static double tfIdf(int termCount, int totalTerms, int totalDocs, int docFrequency) {
        return termFrequency(termCount, totalTerms) * inverseDocumentFrequency(totalDocs, docFrequency);
    }
}
