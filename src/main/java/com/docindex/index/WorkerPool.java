package com.docindex.index;

import com.docindex.config.Constants;
import com.docindex.config.EngineConfig;
import com.docindex.document.DocumentMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 有界工作线程池：从任务队列取文件路径，映射后把结果放入结果队列。
 *
 * <p>工作线程从不访问索引。每消费一个路径恰好产生一个结果，{@link Reducer} 依赖这一点计数。
 * 一个实例只能分发一次。
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    /** 毒丸对象，按引用比较，用于关闭任务队列 */
    private static final Path POISON = Path.of("__POISON__");

    private final DocumentMapper mapper;
    private final int workerCount;
    private final int resultQueueCapacity;
    private final ExecutorService executor;
    private final AtomicBoolean dispatched = new AtomicBoolean(false);

    /**
     * 创建线程池，结果队列容量与工作线程数一致。
     */
    public WorkerPool(DocumentMapper mapper, int workerCount) {
        this(mapper, workerCount, workerCount);
    }

    public WorkerPool(DocumentMapper mapper, int workerCount, int resultQueueCapacity) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("工作线程数必须为正数: " + workerCount);
        }
        if (resultQueueCapacity <= 0) {
            throw new IllegalArgumentException("结果队列容量必须为正数: " + resultQueueCapacity);
        }
        this.mapper = mapper;
        this.workerCount = workerCount;
        this.resultQueueCapacity = resultQueueCapacity;
        // 额外一个线程负责投递任务
        this.executor = Executors.newFixedThreadPool(workerCount + 1, new WorkerThreadFactory());
    }

    /**
     * 根据文件数与处理器数量计算工作线程数。
     *
     * <p>自动模式下为 processors × workersPerCpu，限制在 [minWorkers, maxWorkers]；
     * 显式指定时只受 maxWorkers 限制。结果不超过文件数，且至少为 1。
     */
    public static int chooseWorkerCount(int numFiles, int processors, EngineConfig config) {
        int workers;
        if (config.getWorkerCount() > 0) {
            workers = Math.min(config.getWorkerCount(), config.getMaxWorkers());
        } else {
            workers = Math.max(processors, 1) * config.getWorkersPerCpu();
            workers = Math.max(workers, config.getMinWorkers());
            workers = Math.min(workers, config.getMaxWorkers());
        }
        return Math.min(workers, Math.max(1, numFiles));
    }

    public int workerCount() {
        return workerCount;
    }

    /**
     * 启动投递线程与工作线程，返回结果队列。
     *
     * <p>调用方必须从返回的队列中恰好取出 {@code paths.size()} 个结果。
     *
     * @throws IllegalStateException 重复分发时抛出
     */
    public BlockingQueue<MapResult> dispatch(List<Path> paths) {
        if (!dispatched.compareAndSet(false, true)) {
            throw new IllegalStateException("工作线程池只能分发一次");
        }
        BlockingQueue<Path> jobs = new ArrayBlockingQueue<>(Constants.JOB_QUEUE_CAPACITY);
        BlockingQueue<MapResult> results = new ArrayBlockingQueue<>(resultQueueCapacity);

        for (int index = 0; index < workerCount; index++) {
            executor.execute(() -> runWorker(jobs, results));
        }
        executor.execute(() -> feed(List.copyOf(paths), jobs));
        logger.debug("已分发 {} 个文件给 {} 个工作线程", paths.size(), workerCount);
        return results;
    }

    /**
     * 等待全部线程退出，超时后强制中断。
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Constants.POOL_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("工作线程未在 {}s 内退出，强制中断", Constants.POOL_SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException interruptedException) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void feed(List<Path> paths, BlockingQueue<Path> jobs) {
        try {
            for (Path path : paths) {
                jobs.put(path);
            }
            // 每个工作线程一个毒丸，任务队列只关闭一次
            for (int index = 0; index < workerCount; index++) {
                jobs.put(POISON);
            }
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            logger.debug("任务投递被中断");
        }
    }

    private void runWorker(BlockingQueue<Path> jobs, BlockingQueue<MapResult> results) {
        try {
            while (true) {
                Path path = jobs.take();
                if (path == POISON) {
                    return;
                }
                results.put(mapSafely(path));
            }
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            logger.debug("工作线程被中断: {}", Thread.currentThread().getName());
        }
    }

    /**
     * 任何映射异常或错误（包括栈溢出）都转换为失败结果，保证每个路径恰好产生一个结果。
     */
    MapResult mapSafely(Path path) {
        try {
            return MapResult.success(path, mapper.map(path));
        } catch (Exception exception) {
            return MapResult.failure(path, exception);
        } catch (Error error) {
            return MapResult.failure(path, error);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger threadNumber = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "index-worker-" + threadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
