package com.docindex.document;

import java.util.Map;

/**
 * 单个文档的词频统计结果。
 *
 * @param id 文档标识（文件路径）
 * @param frequencies 词项到出现次数的映射
 * @param totalTerms 文档词项总数
 */
public record Document(String id, Map<String, Integer> frequencies, int totalTerms) {
    /**
     * 构造时校验词频与总数一致，并复制映射，避免外部修改。
     */
    public Document {
        if (id == null || frequencies == null) {
            throw new IllegalArgumentException("id与frequencies不能为null");
        }
        if (totalTerms < 0) {
            throw new IllegalArgumentException("totalTerms不能为负数: " + totalTerms);
        }
        long sum = 0;
        for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
            Integer count = entry.getValue();
            if (entry.getKey() == null || count == null || count <= 0) {
                throw new IllegalArgumentException("词频必须为正数, term=" + entry.getKey() + ", count=" + count);
            }
            sum += count;
        }
        if (sum != totalTerms) {
            throw new IllegalArgumentException("词频之和与totalTerms不一致: " + sum + " vs " + totalTerms);
        }
        frequencies = Map.copyOf(frequencies);
    }

    /**
     * 创建不含任何词项的文档。
     */
    public static Document empty(String id) {
        return new Document(id, Map.of(), 0);
    }

    /**
     * 返回指定词项的出现次数，不存在时为 0。
     */
    public int count(String term) {
        return frequencies.getOrDefault(term, 0);
    }
}
