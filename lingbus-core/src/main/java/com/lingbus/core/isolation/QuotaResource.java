package com.lingbus.core.isolation;

/**
 * 可设置配额的资源
 */
public enum QuotaResource {
    /**
     * 每秒事件数
     */
    EVENTS_PER_SECOND,
    /**
     * 每秒处理器耗时 (ms)
     */
    HANDLER_TIME_PER_SECOND,
    /**
     * 内存占用 (bytes)
     */
    MEMORY_USAGE
}
