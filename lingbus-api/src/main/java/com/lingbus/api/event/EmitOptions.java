package com.lingbus.api.event;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * emit 的可选参数
 */
@Value
@Builder
public class EmitOptions {

    private static final EmitOptions NONE = EmitOptions.builder().build();

    @Builder.Default
    EventPriority priority = EventPriority.NORMAL;

    /**
     * 事件来源，例如 "plugin:order"
     */
    String source;

    /**
     * 附加元数据，会拷贝进事件
     */
    Map<String, Object> metadata;

    public static EmitOptions none() {
        return NONE;
    }
}
