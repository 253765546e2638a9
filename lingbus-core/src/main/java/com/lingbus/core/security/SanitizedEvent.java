package com.lingbus.core.security;

import com.lingbus.api.event.PluginEvent;
import lombok.Value;

import java.util.Map;

/**
 * 清洗后的事件副本，与输入事件不共享任何可变结构
 */
@Value
public class SanitizedEvent {
    String type;
    Object payload;
    Object timestamp;
    String source;
    Map<String, Object> metadata;

    /**
     * 重新组装为可发布的事件。timestamp 不是数字时使用当前时间。
     */
    public PluginEvent toEvent() {
        return PluginEvent.builder()
                .type(type)
                .payload(payload)
                .timestamp(timestamp instanceof Number n ? n.longValue() : null)
                .source(source)
                .metadata(metadata)
                .build();
    }
}
