package com.lingbus.core.security;

import com.lingbus.api.event.PluginEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 事件校验器
 * 职责：
 * 1. 校验事件的结构 (validate)，失败时返回结果而不是抛异常
 * 2. 剔除载荷与元数据中的危险键 (sanitize)，纯树变换，可重复执行
 */
@Slf4j
public class EventValidator {

    /**
     * 原型链相关的危险键
     */
    static final Set<String> DANGEROUS_KEYS = Set.of("__proto__", "constructor", "prototype");

    /**
     * 循环引用的替换值
     */
    public static final String CIRCULAR_REFERENCE = "<Circular Reference>";

    public ValidationResult validate(PluginEvent event) {
        return event == null ? ValidationResult.fail("Event type is required") : validate(event.toMap());
    }

    /**
     * 校验无类型的线格式事件
     */
    public ValidationResult validate(Map<String, ?> event) {
        if (event == null) {
            return ValidationResult.fail("Event type is required");
        }

        Object type = event.get("type");
        if (type == null || "".equals(type)) {
            return ValidationResult.fail("Event type is required");
        }
        if (!(type instanceof String)) {
            return ValidationResult.fail("Event type must be a string");
        }

        Object source = event.get("source");
        if (source != null && !(source instanceof String)) {
            return ValidationResult.fail("Event source must be a string");
        }

        Object timestamp = event.get("timestamp");
        if (timestamp != null && !(timestamp instanceof Number)) {
            return ValidationResult.fail("Event timestamp must be a number");
        }

        Object metadata = event.get("metadata");
        if (metadata != null && !(metadata instanceof Map)) {
            return ValidationResult.fail("Event metadata must be an object");
        }

        return ValidationResult.ok();
    }

    public SanitizedEvent sanitize(PluginEvent event) {
        return event == null ? null : sanitize(event.toMap());
    }

    /**
     * 生成清洗后的副本。调用方应先通过 {@link #validate(Map)}，
     * 此处对类型不符的字段只做尽力转换。
     */
    public SanitizedEvent sanitize(Map<String, ?> event) {
        if (event == null) {
            return null;
        }
        Object type = event.get("type");
        Object source = event.get("source");
        Object metadata = event.get("metadata");

        return new SanitizedEvent(
                type != null ? type.toString() : null,
                sanitizePayload(event.get("payload")),
                event.get("timestamp"),
                source instanceof String s ? s : null,
                metadata instanceof Map<?, ?> m ? sanitizeMap(m, newIdentitySet()) : null);
    }

    /**
     * 递归清洗载荷：Map 剔除危险键，List/数组逐元素处理并保持顺序和长度，标量原样返回。
     * 指回祖先节点的引用替换为 {@link #CIRCULAR_REFERENCE}，同一对象被多处共享但不成环时照常清洗。
     */
    public Object sanitizePayload(Object payload) {
        return sanitizePayload(payload, newIdentitySet());
    }

    private Object sanitizePayload(Object payload, Set<Object> ancestors) {
        if (payload == null) {
            return null;
        }
        boolean container = payload instanceof Map || payload instanceof List || payload instanceof Object[];
        if (!container) {
            return payload;
        }
        if (!ancestors.add(payload)) {
            log.debug("Replaced circular reference in event payload");
            return CIRCULAR_REFERENCE;
        }
        try {
            if (payload instanceof Map<?, ?> map) {
                return sanitizeMap(map, ancestors);
            }
            if (payload instanceof List<?> list) {
                List<Object> sanitized = new ArrayList<>(list.size());
                for (Object item : list) {
                    sanitized.add(sanitizePayload(item, ancestors));
                }
                return Collections.unmodifiableList(sanitized);
            }
            Object[] array = (Object[]) payload;
            Object[] sanitized = new Object[array.length];
            for (int i = 0; i < array.length; i++) {
                sanitized[i] = sanitizePayload(array[i], ancestors);
            }
            return sanitized;
        } finally {
            ancestors.remove(payload);
        }
    }

    private Map<String, Object> sanitizeMap(Map<?, ?> map, Set<Object> ancestors) {
        ancestors.add(map);
        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (isDangerousProperty(key)) {
                log.debug("Stripped dangerous key [{}] from event payload", key);
                continue;
            }
            sanitized.put(key, sanitizePayload(entry.getValue(), ancestors));
        }
        return Collections.unmodifiableMap(sanitized);
    }

    private static Set<Object> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    static boolean isDangerousProperty(String propertyName) {
        return DANGEROUS_KEYS.contains(propertyName);
    }
}
