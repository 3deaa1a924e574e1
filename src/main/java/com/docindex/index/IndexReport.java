package com.docindex.index;

import java.util.List;

/**
 * 一次索引过程的统计。
 *
 * @param discoveredFiles 发现的文件数
 * @param indexedDocuments 成功写入索引的文档数
 * @param failedPaths 读取失败被跳过的文件
 * @param workerCount 实际使用的工作线程数
 * @param elapsedMs 耗时（毫秒）
 */
public record IndexReport(
        int discoveredFiles,
        int indexedDocuments,
        List<String> failedPaths,
        int workerCount,
        long elapsedMs
) {
    public IndexReport {
        failedPaths = List.copyOf(failedPaths);
    }

    public IndexReport withTiming(int workerCount, long elapsedMs) {
        return new IndexReport(discoveredFiles, indexedDocuments, failedPaths, workerCount, elapsedMs);
    }
}
