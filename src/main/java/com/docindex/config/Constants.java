package com.docindex.config;

/**
 * 全局常量定义
 *
 * 包含工作线程池参数、队列参数和查询输出参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 线程参数 ====================
    /** 每个CPU核心对应的工作线程数，IO等待期间保持CPU繁忙 */
    public static final int WORKERS_PER_CPU = 4;
    /** 工作线程下限 */
    public static final int MIN_WORKERS = 4;
    /** 工作线程上限，限制同时打开的文件描述符数量 */
    public static final int MAX_WORKERS = 32;
    /** 可用处理器数量 */
    public static final int AVAILABLE_PROCESSORS = Runtime.getRuntime().availableProcessors();
    /** 线程池关闭等待秒数 */
    public static final long POOL_SHUTDOWN_TIMEOUT_SECONDS = 30;

    // ==================== 队列参数 ====================
    /** 任务队列容量 */
    public static final int JOB_QUEUE_CAPACITY = 1000;

    // ==================== 查询参数 ====================
    /** 相关度分数输出小数位数 */
    public static final int SCORE_DECIMALS = 6;
    /** 查询结果头部格式 */
    public static final String RESULT_HEADER_FORMAT = "== %s (%d)";
}
