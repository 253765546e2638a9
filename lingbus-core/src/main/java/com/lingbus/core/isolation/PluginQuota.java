package com.lingbus.core.isolation;

import lombok.Builder;
import lombok.Value;

/**
 * 插件配额，未设置的项表示不限
 */
@Value
@Builder
public class PluginQuota {
    Long maxEventsPerSecond;
    Long maxHandlerTimePerSecond;
    Long maxMemoryUsage;

    public Long limitOf(QuotaResource resource) {
        return switch (resource) {
            case EVENTS_PER_SECOND -> maxEventsPerSecond;
            case HANDLER_TIME_PER_SECOND -> maxHandlerTimePerSecond;
            case MEMORY_USAGE -> maxMemoryUsage;
        };
    }
}
