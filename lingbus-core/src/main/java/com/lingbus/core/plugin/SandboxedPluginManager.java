package com.lingbus.core.plugin;

import com.lingbus.api.event.PluginEvent;
import com.lingbus.core.bridge.CrossPluginBridge;
import com.lingbus.core.config.LingBusConfig;
import com.lingbus.core.event.EventBus;
import com.lingbus.core.isolation.PermissionManager;
import com.lingbus.core.isolation.PluginEventForwarder;
import com.lingbus.core.isolation.PluginQuota;
import com.lingbus.core.isolation.QuotaManager;
import com.lingbus.core.isolation.QuotaResource;
import com.lingbus.core.security.ErrorBoundary;
import com.lingbus.core.security.ErrorCallback;
import com.lingbus.core.security.EventValidator;
import com.lingbus.core.security.ResourceMonitor;
import com.lingbus.core.security.ResourceUsage;
import com.lingbus.core.security.SanitizedEvent;
import com.lingbus.core.security.ValidationResult;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * 沙箱化插件管理器
 * 职责：
 * 1. 组装沙箱注册表、跨插件桥、权限与配额服务、校验器、资源监控
 * 2. 为每个插件维护错误边界，订阅时自动包装处理器并计时
 * 3. 监听共享总线，把插件转发出来的事件记入资源监控
 * <p>
 * 共享总线由宿主构造并注入，本类不持有任何全局状态。
 */
@Slf4j
public class SandboxedPluginManager {

    @Getter
    private final LingBusConfig config;
    @Getter
    private final EventBus baseBus;
    @Getter
    private final PermissionManager permissionManager;
    @Getter
    private final QuotaManager quotaManager;
    @Getter
    private final ResourceMonitor resourceMonitor;
    private final EventValidator eventValidator;
    private final PluginEventForwarder forwarder;
    private final CrossPluginBridge bridge;

    // 错误边界表：Key=PluginId
    private final Map<String, ErrorBoundary> errorBoundaries = new ConcurrentHashMap<>();
    private final EventBus.Subscription emissionTap;

    @Setter
    private ErrorCallback errorCallback; // 可选，插件故障时通知宿主

    public SandboxedPluginManager(EventBus baseBus) {
        this(baseBus, LingBusConfig.defaults());
    }

    public SandboxedPluginManager(EventBus baseBus, LingBusConfig config) {
        this.config = config;
        this.baseBus = baseBus;
        this.permissionManager = new PermissionManager();
        this.quotaManager = new QuotaManager();
        this.resourceMonitor = new ResourceMonitor(config);
        this.eventValidator = new EventValidator();
        this.forwarder = new PluginEventForwarder(baseBus, permissionManager, config);
        this.bridge = new CrossPluginBridge(forwarder, config);
        this.emissionTap = baseBus.on(EventBus.WILDCARD, this::recordForwardedEvent);

        if (config.isAutoStartMonitoring()) {
            resourceMonitor.startMonitoring(config.getMonitorIntervalMs());
        }
    }

    // ==================== 沙箱 ====================

    /**
     * 创建沙箱并授予权限，permissions 为 null 时视为没有任何权限
     *
     * @return 插件私有总线
     */
    public EventBus createSandbox(String pluginId, List<String> permissions) {
        List<String> granted = permissions != null ? permissions : List.of();
        EventBus bus = forwarder.createSandbox(pluginId, granted);
        try {
            permissionManager.grantCapabilities(pluginId, granted);
            errorBoundaries.put(pluginId, new ErrorBoundary(pluginId, this::onPluginError));
        } catch (RuntimeException e) {
            // 回滚，避免留下没有授权和错误边界的半注册沙箱
            log.error("[{}] Failed to register sandbox, rolling back: {}", pluginId, e.getMessage());
            forwarder.destroySandbox(pluginId);
            permissionManager.clearPermissions(pluginId);
            throw e;
        }
        return bus;
    }

    /**
     * 销毁沙箱并清理该插件的全部资源
     */
    public void destroySandbox(String pluginId) {
        forwarder.destroySandbox(pluginId);
        permissionManager.clearPermissions(pluginId);
        quotaManager.clear(pluginId);
        resourceMonitor.untrack(pluginId);
        errorBoundaries.remove(pluginId);
    }

    public Optional<EventBus> getSandbox(String pluginId) {
        return forwarder.getSandbox(pluginId);
    }

    // ==================== 频道 ====================

    public EventBus createChannel(String channelId, List<String> allowedPluginIds) {
        return bridge.createChannel(channelId, allowedPluginIds);
    }

    public boolean destroyChannel(String channelId) {
        return bridge.destroyChannel(channelId);
    }

    // ==================== 校验 ====================

    public ValidationResult validateEvent(Map<String, ?> event) {
        return eventValidator.validate(event);
    }

    public ValidationResult validateEvent(PluginEvent event) {
        return eventValidator.validate(event);
    }

    public SanitizedEvent sanitizeEvent(PluginEvent event) {
        return eventValidator.sanitize(event);
    }

    // ==================== 权限与配额 ====================

    public boolean hasPermission(String pluginId, String permission) {
        return permissionManager.hasPermission(pluginId, permission);
    }

    public void setQuota(String pluginId, PluginQuota quota) {
        quotaManager.setQuota(pluginId, quota);
    }

    public boolean checkQuota(String pluginId, QuotaResource resource, long amount) {
        return quotaManager.checkQuota(pluginId, resource, amount);
    }

    // ==================== 错误边界 ====================

    /**
     * 用插件的错误边界包装函数，插件未注册时原样返回
     */
    public <T> Consumer<T> wrapWithBoundary(String pluginId, Consumer<T> fn, String context) {
        ErrorBoundary boundary = errorBoundaries.get(pluginId);
        return boundary != null ? boundary.wrapConsumer(fn, context) : fn;
    }

    public Optional<ErrorBoundary> getErrorBoundary(String pluginId) {
        return Optional.ofNullable(errorBoundaries.get(pluginId));
    }

    /**
     * 在插件私有总线上订阅，处理器被错误边界包装，耗时记入资源监控
     *
     * @throws IllegalStateException 插件没有沙箱
     */
    public EventBus.Subscription subscribe(String pluginId, String typeOrPattern, Consumer<PluginEvent> handler) {
        EventBus bus = forwarder.getSandbox(pluginId)
                .orElseThrow(() -> new IllegalStateException("No sandbox for plugin: " + pluginId));
        Consumer<PluginEvent> guarded = wrapWithBoundary(pluginId, handler, "handler:" + typeOrPattern);
        return bus.on(typeOrPattern, event -> {
            long start = System.nanoTime();
            try {
                guarded.accept(event);
            } finally {
                resourceMonitor.recordHandlerExecution(pluginId, (System.nanoTime() - start) / 1_000_000);
            }
        });
    }

    // ==================== 资源 ====================

    public void recordResourceUsage(String pluginId, ResourceKind kind, long amount) {
        switch (kind) {
            case EVENTS -> resourceMonitor.recordEventEmission(pluginId, amount);
            case EXECUTION_TIME -> resourceMonitor.recordHandlerExecution(pluginId, amount);
        }
    }

    public ResourceUsage getResourceUsage(String pluginId) {
        return resourceMonitor.getUsage(pluginId);
    }

    public boolean isExceedingLimits(String pluginId) {
        return resourceMonitor.isExceedingLimits(pluginId);
    }

    /**
     * 关闭：停止监控，拆除全部频道与沙箱
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down SandboxedPluginManager...");
        resourceMonitor.stopMonitoring();
        bridge.getChannelIds().forEach(bridge::destroyChannel);
        forwarder.getPluginIds().forEach(this::destroySandbox);
        emissionTap.unsubscribe();
    }

    private void recordForwardedEvent(PluginEvent event) {
        if (!Boolean.TRUE.equals(event.getMetadata().get(PluginEvent.META_SANDBOXED))) {
            return;
        }
        String pluginId = event.getMetadataString(PluginEvent.META_PLUGIN_ID);
        if (pluginId != null) {
            resourceMonitor.recordEventEmission(pluginId, estimateSize(event));
        }
    }

    private void onPluginError(Throwable error, String pluginId) {
        if (errorCallback != null) {
            errorCallback.onError(error, pluginId);
        }
    }

    // 粗略估算：类型与载荷字符串形式的 UTF-8 字节数
    static long estimateSize(PluginEvent event) {
        String payload = String.valueOf(event.getPayload());
        return (long) event.getType().getBytes(StandardCharsets.UTF_8).length
                + payload.getBytes(StandardCharsets.UTF_8).length;
    }
}
