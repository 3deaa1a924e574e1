package com.docindex.config;

import java.util.Properties;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或配置文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    public static final String KEY_WORKERS = "index.workers";
    public static final String KEY_MIN_WORKERS = "index.minWorkers";
    public static final String KEY_MAX_WORKERS = "index.maxWorkers";
    public static final String KEY_WORKERS_PER_CPU = "index.workersPerCpu";
    public static final String KEY_RESULT_QUEUE_CAPACITY = "index.resultQueueCapacity";

    /** 0 表示按CPU数量自动计算 */
    private int workerCount = 0;
    private int minWorkers = Constants.MIN_WORKERS;
    private int maxWorkers = Constants.MAX_WORKERS;
    private int workersPerCpu = Constants.WORKERS_PER_CPU;
    /** 0 表示与工作线程数一致 */
    private int resultQueueCapacity = 0;

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = requireNonNegative(KEY_WORKERS, workerCount);
    }

    public int getMinWorkers() {
        return minWorkers;
    }

    public void setMinWorkers(int minWorkers) {
        this.minWorkers = requirePositive(KEY_MIN_WORKERS, minWorkers);
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = requirePositive(KEY_MAX_WORKERS, maxWorkers);
    }

    public int getWorkersPerCpu() {
        return workersPerCpu;
    }

    public void setWorkersPerCpu(int workersPerCpu) {
        this.workersPerCpu = requirePositive(KEY_WORKERS_PER_CPU, workersPerCpu);
    }

    public int getResultQueueCapacity() {
        return resultQueueCapacity;
    }

    public void setResultQueueCapacity(int resultQueueCapacity) {
        this.resultQueueCapacity = requireNonNegative(KEY_RESULT_QUEUE_CAPACITY, resultQueueCapacity);
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从属性文件内容创建配置，未出现的键保持默认值。
     *
     * @param properties 已加载的属性
     * @return 新配置实例
     * @throws IllegalArgumentException 数值非法或 minWorkers 大于 maxWorkers 时抛出
     */
    public static EngineConfig fromProperties(Properties properties) {
        EngineConfig config = new EngineConfig();
        String workers = properties.getProperty(KEY_WORKERS);
        if (workers != null) {
            config.setWorkerCount(parseInt(KEY_WORKERS, workers));
        }
        String minWorkers = properties.getProperty(KEY_MIN_WORKERS);
        if (minWorkers != null) {
            config.setMinWorkers(parseInt(KEY_MIN_WORKERS, minWorkers));
        }
        String maxWorkers = properties.getProperty(KEY_MAX_WORKERS);
        if (maxWorkers != null) {
            config.setMaxWorkers(parseInt(KEY_MAX_WORKERS, maxWorkers));
        }
        String workersPerCpu = properties.getProperty(KEY_WORKERS_PER_CPU);
        if (workersPerCpu != null) {
            config.setWorkersPerCpu(parseInt(KEY_WORKERS_PER_CPU, workersPerCpu));
        }
        String resultQueueCapacity = properties.getProperty(KEY_RESULT_QUEUE_CAPACITY);
        if (resultQueueCapacity != null) {
            config.setResultQueueCapacity(parseInt(KEY_RESULT_QUEUE_CAPACITY, resultQueueCapacity));
        }
        config.validate();
        return config;
    }

    /**
     * 校验配置项之间的约束。
     */
    public void validate() {
        if (minWorkers > maxWorkers) {
            throw new IllegalArgumentException(
                KEY_MIN_WORKERS + "=" + minWorkers + " 不能大于 " + KEY_MAX_WORKERS + "=" + maxWorkers);
        }
    }

    private static int parseInt(String key, String rawValue) {
        try {
            return Integer.parseInt(rawValue.trim());
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException("配置项 " + key + " 不是合法整数: " + rawValue, exception);
        }
    }

    private static int requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("配置项 " + key + " 必须为正数: " + value);
        }
        return value;
    }

    private static int requireNonNegative(String key, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("配置项 " + key + " 不能为负数: " + value);
        }
        return value;
    }
}
