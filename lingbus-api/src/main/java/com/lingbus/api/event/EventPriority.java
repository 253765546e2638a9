package com.lingbus.api.event;

/**
 * 事件优先级
 * <p>
 * 派发始终是同步的，优先级仅作为事件属性随事件传递，供订阅者参考。
 */
public enum EventPriority {
    IMMEDIATE,
    HIGH,
    NORMAL,
    LOW
}
