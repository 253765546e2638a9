package com.lingbus.core.isolation;

import com.lingbus.api.event.EventPriority;
import com.lingbus.api.event.PluginEvent;
import com.lingbus.api.security.PermissionChecker;
import com.lingbus.core.event.EventBus;
import com.lingbus.core.security.EventValidator;
import com.lingbus.core.security.SanitizedEvent;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 插件事件沙箱
 * 职责：
 * 1. 持有插件的私有总线，私有总线上的本地投递不做权限检查
 * 2. 把权限允许的事件清洗后转发到共享总线，并打上 "plugin:&lt;id&gt;" 来源
 * 3. 未授权的事件只留在本地，共享总线与其他插件都观察不到
 */
@Slf4j
public class EventSandbox {

    @Getter
    private final String pluginId;
    private final EventBus sharedBus;
    private final EventBus localBus;
    @Getter
    private final PermissionSet permissions;
    private final PermissionChecker hostChecker;
    private final EventValidator validator;
    private final EventBus.Subscription forwarding;
    private final String sourceTag;

    private volatile boolean active = true;

    public EventSandbox(String pluginId, EventBus sharedBus, List<String> permissions) {
        this(pluginId, sharedBus, PermissionSet.parse(permissions), PermissionChecker.allowAll(),
                new EventValidator(), EventBus.DEFAULT_MAX_DISPATCH_DEPTH);
    }

    public EventSandbox(String pluginId,
                        EventBus sharedBus,
                        PermissionSet permissions,
                        PermissionChecker hostChecker,
                        EventValidator validator,
                        int maxDispatchDepth) {
        if (pluginId == null || pluginId.isBlank()) {
            throw new IllegalArgumentException("pluginId is required");
        }
        this.pluginId = pluginId;
        this.sharedBus = sharedBus;
        this.permissions = permissions != null ? permissions : PermissionSet.empty();
        this.hostChecker = hostChecker != null ? hostChecker : PermissionChecker.allowAll();
        this.validator = validator != null ? validator : new EventValidator();
        this.sourceTag = PluginEvent.PLUGIN_SOURCE_PREFIX + pluginId;
        this.localBus = new EventBus("sandbox:" + pluginId, maxDispatchDepth);
        this.forwarding = localBus.on(EventBus.WILDCARD, this::forward);
    }

    /**
     * 插件私有总线
     */
    public EventBus getBus() {
        return localBus;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * 是否允许把该类型转发到共享总线
     */
    public boolean canForward(String eventType) {
        return permissions.allows(eventType) && hostChecker.canEmit(pluginId, eventType);
    }

    private void forward(PluginEvent event) {
        if (!active) {
            return;
        }

        // 已带插件/频道来源的事件是投递进来的，不能再以本插件名义发出去
        String source = event.getSource();
        if (source != null && (source.startsWith(PluginEvent.PLUGIN_SOURCE_PREFIX)
                || source.startsWith(PluginEvent.CHANNEL_SOURCE_PREFIX))) {
            return;
        }

        if (!permissions.allows(event.getType())) {
            log.debug("[{}] Event {} kept local: no emit permission", pluginId, event.getType());
            return;
        }
        if (!hostChecker.canEmit(pluginId, event.getType())) {
            log.debug("[{}] Event {} kept local: denied by host permission service", pluginId, event.getType());
            return;
        }

        sharedBus.publish(sandboxEvent(event));
    }

    private PluginEvent sandboxEvent(PluginEvent event) {
        SanitizedEvent sanitized = validator.sanitize(event);

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (sanitized.getMetadata() != null) {
            metadata.putAll(sanitized.getMetadata());
        }
        // 覆盖插件自带的同名键，防止伪造身份
        metadata.put(PluginEvent.META_SANDBOXED, Boolean.TRUE);
        metadata.put(PluginEvent.META_PLUGIN_ID, pluginId);

        return PluginEvent.builder()
                .type(event.getType())
                .payload(sanitized.getPayload())
                .timestamp(event.getTimestamp())
                .source(sourceTag)
                .metadata(metadata)
                .priority(EventPriority.IMMEDIATE)
                .build();
    }

    /**
     * 销毁沙箱：断开转发并清空私有总线。之后对私有总线的 emit 是空操作，不会抛异常。
     */
    public void destroy() {
        if (!active) {
            return;
        }
        active = false;
        forwarding.unsubscribe();
        localBus.clear();
        log.debug("[{}] Sandbox destroyed", pluginId);
    }
}
