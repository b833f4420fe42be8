package com.work.lock.core.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；平台可通过自定义 Bean 接入具体实现。
 */
public interface LockMetrics {

    /**
     * @param store  实际应答的 store（redis / local）
     * @param result acquired / refused
     */
    default void acquire(String store, String result) {
    }

    default void release(String store, String result) {
    }

    default void storeUnavailable(String op) {
    }

    default void guardedRun(String key, String result) {
    }
}
