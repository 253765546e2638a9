package com.lingbus.core.security;

import lombok.Builder;
import lombok.Value;

/**
 * 插件在当前窗口内的资源使用快照
 */
@Value
@Builder
public class ResourceUsage {
    long eventsEmitted;
    long eventBytesEmitted;
    /**
     * 处理器累计耗时 (ms)
     */
    long handlerExecutionTime;
    long handlerExecutions;
    /**
     * 窗口开始时间 (epoch ms)
     */
    long windowStart;
}
