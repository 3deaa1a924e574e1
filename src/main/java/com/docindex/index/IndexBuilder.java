package com.docindex.index;

import com.docindex.config.Constants;
import com.docindex.config.EngineConfig;
import com.docindex.document.DocumentMapper;
import com.docindex.document.FileCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * 索引构建入口：收集文件 → 并行映射 → 单线程归约 → 封存索引。
 */
public class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    private final EngineConfig config;
    private final DocumentMapper mapper;
    private final int processors;

    public IndexBuilder(EngineConfig config) {
        this(config, new DocumentMapper(), Constants.AVAILABLE_PROCESSORS);
    }

    public IndexBuilder(EngineConfig config, DocumentMapper mapper, int processors) {
        config.validate();
        this.config = config;
        this.mapper = mapper;
        this.processors = processors;
    }

    /**
     * 索引目录下的全部普通文件，返回已封存的索引。
     *
     * @throws IOException 目录遍历失败时抛出
     */
    public SearchEngine build(Path root) throws IOException {
        List<Path> files = FileCollector.collect(root);
        logger.debug("在 {} 下发现 {} 个文件", root, files.size());
        return build(files);
    }

    /**
     * 索引给定文件列表，返回已封存的索引。
     */
    public SearchEngine build(List<Path> files) {
        SearchEngine engine = new SearchEngine();
        IndexReport report = indexInto(engine, files);
        engine.seal();
        IndexStatus status = engine.status();
        logger.info("索引完成: 文件数={}, 文档数={}, 失败数={}, 词条数={}, 线程数={}, 用时={}ms",
            report.discoveredFiles(), status.docCount(), report.failedPaths().size(),
            status.termCount(), report.workerCount(), report.elapsedMs());
        return engine;
    }

    /**
     * 运行映射/归约流水线，把文件写入给定索引。
     *
     * @throws IndexingException 等待结果时线程被中断
     */
    public IndexReport indexInto(SearchEngine engine, List<Path> files) {
        long start = System.currentTimeMillis();
        if (files.isEmpty()) {
            return new IndexReport(0, 0, List.of(), 0, 0L);
        }

        int workers = WorkerPool.chooseWorkerCount(files.size(), processors, config);
        int capacity = config.getResultQueueCapacity() > 0 ? config.getResultQueueCapacity() : workers;
        try (WorkerPool pool = new WorkerPool(mapper, workers, capacity)) {
            BlockingQueue<MapResult> results = pool.dispatch(files);
            IndexReport report = new Reducer(engine).reduce(results, files.size());
            return report.withTiming(workers, System.currentTimeMillis() - start);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IndexingException("索引过程被中断", interruptedException);
        }
    }
}
