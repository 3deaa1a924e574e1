package com.docindex.index;

import com.docindex.document.Document;
import com.docindex.scoring.TfIdfScorer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内存倒排索引。
 *
 * <p>持有四个结构：词项到文档集合的倒排表、每个文档的词频、每个文档的词项总数以及全部文档集合。
 * 本类不是线程安全的：索引阶段只允许 {@link Reducer} 单线程写入，{@link #seal()} 之后只读。
 */
public class SearchEngine {

    /** 分数降序，分数相等时按文档标识升序。 */
    static final Comparator<ScoredDocument> RELEVANCE_ORDER = (left, right) -> {
        if (left.score() == right.score()) {
            return left.document().compareTo(right.document());
        }
        return Double.compare(right.score(), left.score());
    };

    private final Map<String, Set<String>> index = new HashMap<>();
    private final Map<String, Map<String, Integer>> counts = new HashMap<>();
    private final Map<String, Integer> totals = new HashMap<>();
    private final Set<String> docs = new HashSet<>();
    private boolean sealed;

    /**
     * 添加（或替换）一个文档，四个结构作为一个整体更新。
     *
     * <p>重复添加同一文档会替换词频与总数，但不会移除旧词项的倒排记录。
     *
     * @throws IllegalStateException 索引已封存时抛出
     */
    public void addDocument(Document document) {
        if (sealed) {
            throw new IllegalStateException("索引已封存，禁止写入: " + document.id());
        }
        String docId = document.id();
        docs.add(docId);
        counts.put(docId, document.frequencies());
        totals.put(docId, document.totalTerms());
        for (String term : document.frequencies().keySet()) {
            index.computeIfAbsent(term, key -> new HashSet<>()).add(docId);
        }
    }

    /**
     * 封存索引，之后只允许读取。
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * 返回包含词项的文档标识副本，词项不存在时返回空列表。顺序无意义。
     */
    public List<String> lookup(String term) {
        Set<String> postings = index.get(term);
        if (postings == null) {
            return List.of();
        }
        return new ArrayList<>(postings);
    }

    public int documentFrequency(String term) {
        Set<String> postings = index.get(term);
        return postings == null ? 0 : postings.size();
    }

    public double termFrequency(String term, String docId) {
        int total = totals.getOrDefault(docId, 0);
        Map<String, Integer> frequencies = counts.get(docId);
        int count = frequencies == null ? 0 : frequencies.getOrDefault(term, 0);
        return TfIdfScorer.termFrequency(count, total);
    }

    public double inverseDocumentFrequency(String term) {
        return TfIdfScorer.inverseDocumentFrequency(docs.size(), documentFrequency(term));
    }

    public double tfIdf(String term, String docId) {
        return termFrequency(term, docId) * inverseDocumentFrequency(term);
    }

    /**
     * 计算包含词项的全部文档的 tf-idf 并排序。
     *
     * @return 按分数降序、文档标识升序排列的结果
     */
    public List<ScoredDocument> relevanceLookup(String term) {
        List<String> docIds = lookup(term);
        double idf = inverseDocumentFrequency(term);
        List<ScoredDocument> scored = new ArrayList<>(docIds.size());
        for (String docId : docIds) {
            scored.add(new ScoredDocument(docId, termFrequency(term, docId) * idf));
        }
        scored.sort(RELEVANCE_ORDER);
        return scored;
    }

    public int documentCount() {
        return docs.size();
    }

    public int termCount() {
        return index.size();
    }

    public boolean containsDocument(String docId) {
        return docs.contains(docId);
    }

    /**
     * 返回文档的只读词频映射，文档不存在时返回空映射。
     */
    public Map<String, Integer> frequencies(String docId) {
        return counts.getOrDefault(docId, Map.of());
    }

    public int totalTerms(String docId) {
        return totals.getOrDefault(docId, 0);
    }

    public IndexStatus status() {
        long totalTerms = 0;
        for (int total : totals.values()) {
            totalTerms += total;
        }
        return new IndexStatus(docs.size(), index.size(), totalTerms);
    }
}
