package com.lingbus.core.isolation;

import com.lingbus.api.exception.DuplicateRegistrationException;
import com.lingbus.api.security.PermissionChecker;
import com.lingbus.core.config.LingBusConfig;
import com.lingbus.core.event.EventBus;
import com.lingbus.core.security.EventValidator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 沙箱注册表
 * 职责：
 * 1. 按插件 ID 创建与销毁沙箱（沙箱的唯一创建者）
 * 2. 持有共享总线的引用
 * <p>
 * 调用方只拿到私有总线，不直接接触沙箱对象。
 */
@Slf4j
public class PluginEventForwarder {

    // 沙箱表：Key=PluginId, Value=Sandbox
    private final Map<String, EventSandbox> sandboxes = new ConcurrentHashMap<>();

    @Getter
    private final EventBus baseBus;
    private final PermissionChecker hostChecker;
    private final EventValidator validator;
    private final int maxDispatchDepth;

    public PluginEventForwarder(EventBus baseBus) {
        this(baseBus, PermissionChecker.allowAll(), LingBusConfig.defaults());
    }

    public PluginEventForwarder(EventBus baseBus, PermissionChecker hostChecker, LingBusConfig config) {
        if (baseBus == null) {
            throw new IllegalArgumentException("baseBus is required");
        }
        this.baseBus = baseBus;
        this.hostChecker = hostChecker != null ? hostChecker : PermissionChecker.allowAll();
        this.validator = new EventValidator();
        this.maxDispatchDepth = config.getMaxDispatchDepth();
    }

    /**
     * 为插件创建沙箱
     *
     * @param pluginId    插件ID
     * @param permissions 权限串，例如 "emit:*"、"emit:order.created"
     * @return 插件私有总线
     * @throws DuplicateRegistrationException 插件已存在存活的沙箱
     */
    public EventBus createSandbox(String pluginId, List<String> permissions) {
        if (pluginId == null || pluginId.isBlank()) {
            throw new IllegalArgumentException("pluginId is required");
        }
        PermissionSet permissionSet = PermissionSet.parse(permissions);

        EventSandbox sandbox = sandboxes.compute(pluginId, (id, existing) -> {
            if (existing != null) {
                throw new DuplicateRegistrationException("sandbox", id);
            }
            return new EventSandbox(id, baseBus, permissionSet, hostChecker, validator, maxDispatchDepth);
        });

        log.info("[{}] Sandbox created with permissions {}", pluginId, permissionSet);
        return sandbox.getBus();
    }

    /**
     * 销毁沙箱，未注册的插件直接忽略
     */
    public void destroySandbox(String pluginId) {
        EventSandbox sandbox = sandboxes.remove(pluginId);
        if (sandbox == null) {
            log.debug("[{}] No sandbox to destroy", pluginId);
            return;
        }
        sandbox.destroy();
        log.info("[{}] Sandbox destroyed", pluginId);
    }

    public Optional<EventBus> getSandbox(String pluginId) {
        return getSandboxInstance(pluginId).map(EventSandbox::getBus);
    }

    /**
     * 获取沙箱实例（供 CrossPluginBridge 内部使用）
     */
    public Optional<EventSandbox> getSandboxInstance(String pluginId) {
        return pluginId == null ? Optional.empty() : Optional.ofNullable(sandboxes.get(pluginId));
    }

    public Set<String> getPluginIds() {
        return Set.copyOf(sandboxes.keySet());
    }
}
