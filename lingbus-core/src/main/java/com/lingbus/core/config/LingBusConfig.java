package com.lingbus.core.config;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * LingBus Core 全局配置对象 (Immutable)
 * <p>
 * 职责：作为隔离层的唯一配置入口。由宿主构造后显式注入到各组件，不提供全局单例。
 * 包含：
 * 1. 资源监控阈值 (Resource Window)
 * 2. 派发保护 (Dispatch)
 */
@Value
@Builder(toBuilder = true)
@ToString
public class LingBusConfig {

    // ================= 资源监控 =================

    /**
     * 单个窗口内允许的事件数，超过即视为超限
     */
    @Builder.Default
    int maxEventsPerWindow = 1000;

    /**
     * 单个窗口内允许的处理器累计耗时 (ms)，超过即视为超限
     */
    @Builder.Default
    long maxHandlerTimeMsPerWindow = 500;

    /**
     * 监控窗口长度 (ms)
     */
    @Builder.Default
    long monitorIntervalMs = 1000;

    /**
     * SandboxedPluginManager 创建时是否自动开启监控
     */
    @Builder.Default
    boolean autoStartMonitoring = true;

    // ================= 派发保护 =================

    /**
     * 同一线程上嵌套派发的最大深度
     */
    @Builder.Default
    int maxDispatchDepth = 64;

    public static LingBusConfig defaults() {
        return LingBusConfig.builder().build();
    }
}
