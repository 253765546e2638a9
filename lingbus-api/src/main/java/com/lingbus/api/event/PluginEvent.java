package com.lingbus.api.event;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 插件事件 (Immutable)
 * <p>
 * 总线上流转的唯一事件形态。metadata 中约定的键：
 * <ul>
 *     <li>{@link #META_PLUGIN_ID}：转发到共享总线时由沙箱打上的插件标识</li>
 *     <li>{@link #META_TARGET_PLUGIN}：频道转发的目标插件</li>
 *     <li>{@link #META_CHANNEL_ID}：投递到插件私有总线时所属的频道</li>
 * </ul>
 */
@Getter
public final class PluginEvent {

    public static final String META_PLUGIN_ID = "pluginId";
    public static final String META_TARGET_PLUGIN = "targetPlugin";
    public static final String META_CHANNEL_ID = "channelId";
    public static final String META_SANDBOXED = "sandboxed";

    public static final String PLUGIN_SOURCE_PREFIX = "plugin:";
    public static final String CHANNEL_SOURCE_PREFIX = "channel:";

    private final String type;
    private final Object payload;
    private final long timestamp;
    private final String source;
    private final Map<String, Object> metadata;
    private final EventPriority priority;

    @Builder(toBuilder = true)
    private PluginEvent(String type, Object payload, Long timestamp, String source,
                        Map<String, Object> metadata, EventPriority priority) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = payload;
        this.timestamp = timestamp != null ? timestamp : System.currentTimeMillis();
        this.source = source;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.priority = priority != null ? priority : EventPriority.NORMAL;
    }

    public static PluginEvent of(String type, Object payload) {
        return PluginEvent.builder().type(type).payload(payload).build();
    }

    /**
     * 读取字符串类型的元数据，类型不符时返回 null
     */
    public String getMetadataString(String key) {
        Object value = metadata.get(key);
        return value instanceof String s ? s : null;
    }

    /**
     * 来源是否已经是某个插件 (source 以 "plugin:" 开头)
     */
    public boolean isPluginSourced() {
        return source != null && source.startsWith(PLUGIN_SOURCE_PREFIX);
    }

    /**
     * 转换为无类型的线格式，供校验器使用
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.put("payload", payload);
        map.put("timestamp", timestamp);
        if (source != null) {
            map.put("source", source);
        }
        if (!metadata.isEmpty()) {
            map.put("metadata", metadata);
        }
        return map;
    }

    @Override
    public String toString() {
        return "PluginEvent[type=" + type + ", source=" + source + ", timestamp=" + timestamp + "]";
    }
}
