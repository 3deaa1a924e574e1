package com.docindex.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * 归约器：索引的唯一写入者。
 *
 * <p>在单个线程中逐个取出映射结果，失败的文件记录警告后跳过，成功的文档整体写入索引。
 */
public class Reducer {
    private static final Logger logger = LoggerFactory.getLogger(Reducer.class);

    private final SearchEngine engine;

    public Reducer(SearchEngine engine) {
        this.engine = engine;
    }

    /**
     * 从结果队列中恰好取出 expected 个结果并写入索引。
     *
     * @param results 工作线程池的结果队列
     * @param expected 已分发的路径数
     * @return 本次归约统计
     * @throws InterruptedException 等待结果时被中断
     */
    public IndexReport reduce(BlockingQueue<MapResult> results, int expected) throws InterruptedException {
        int indexed = 0;
        List<String> failedPaths = new ArrayList<>();
        for (int received = 0; received < expected; received++) {
            MapResult result = results.take();
            if (accept(result)) {
                indexed++;
            } else {
                failedPaths.add(result.path().toString());
            }
        }
        return new IndexReport(expected, indexed, failedPaths, 0, 0L);
    }

    /**
     * 处理单个结果。
     *
     * @return 文档写入索引时返回 true
     */
    boolean accept(MapResult result) {
        if (!result.isSuccess()) {
            logger.warn("跳过无法读取的文件 {}: {}", result.path(), describe(result.error()));
            return false;
        }
        engine.addDocument(result.document());
        return true;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        String type = error.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
