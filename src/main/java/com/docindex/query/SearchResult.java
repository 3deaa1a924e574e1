package com.docindex.query;

import com.docindex.index.ScoredDocument;

import java.util.List;

public record SearchResult(
        String term,
        int totalMatches,
        List<ScoredDocument> hits
) {
    public SearchResult {
        hits = List.copyOf(hits);
    }

    public static SearchResult empty(String term) {
        return new SearchResult(term, 0, List.of());
    }
}
