package com.lingbus.core.plugin;

/**
 * 手动上报的资源类型
 */
public enum ResourceKind {
    /**
     * 事件发布，数量为事件字节数
     */
    EVENTS,
    /**
     * 处理器执行，数量为耗时 (ms)
     */
    EXECUTION_TIME
}
