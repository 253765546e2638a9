package com.lingbus.core.event;

import com.lingbus.api.event.EmitOptions;
import com.lingbus.api.event.PluginEvent;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 插件事件总线
 * <p>
 * 特点：
 * - 同步派发，按订阅顺序调用处理器
 * - 可重入：处理器内部再次 emit 会在当前线程立即派发
 * - 派发深度受限：同一线程上的嵌套派发超过上限时丢弃并记录错误
 * - 订阅者异常不影响其他订阅者
 * <p>
 * 订阅模式：精确类型、{@code "*"} 匹配全部、{@code "ns:*"} 匹配以 {@code "ns:"} 开头的类型。
 * 多线程宿主需要自行保证同一总线的派发串行化，否则订阅顺序之外的排序无法保证。
 */
@Slf4j
public class EventBus {

    public static final String WILDCARD = "*";
    public static final int DEFAULT_MAX_DISPATCH_DEPTH = 64;

    // 嵌套派发深度按线程统计，跨总线共享（沙箱 -> 共享总线 -> 频道 -> 沙箱 属于同一条链）
    private static final ThreadLocal<int[]> DISPATCH_DEPTH = ThreadLocal.withInitial(() -> new int[1]);

    @Getter
    private final String name;
    private final int maxDispatchDepth;
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();

    public EventBus(String name) {
        this(name, DEFAULT_MAX_DISPATCH_DEPTH);
    }

    public EventBus(String name, int maxDispatchDepth) {
        if (maxDispatchDepth < 1) {
            throw new IllegalArgumentException("maxDispatchDepth must be positive: " + maxDispatchDepth);
        }
        this.name = name;
        this.maxDispatchDepth = maxDispatchDepth;
    }

    /**
     * 订阅事件
     *
     * @param typeOrPattern 事件类型或模式
     * @param handler       处理器
     * @return 订阅句柄
     */
    public Subscription on(String typeOrPattern, Consumer<PluginEvent> handler) {
        if (typeOrPattern == null || typeOrPattern.isEmpty()) {
            throw new IllegalArgumentException("Event type or pattern is required");
        }
        EventListener listener = new EventListener(typeOrPattern, handler);
        listeners.add(listener);
        log.debug("[{}] Subscribed to {}", name, typeOrPattern);
        return () -> listeners.remove(listener);
    }

    public void emit(String type, Object payload) {
        emit(type, payload, EmitOptions.none());
    }

    /**
     * 构造事件并发布
     */
    public void emit(String type, Object payload, EmitOptions options) {
        EmitOptions opts = options != null ? options : EmitOptions.none();
        Map<String, Object> metadata = opts.getMetadata() != null
                ? new LinkedHashMap<>(opts.getMetadata())
                : null;
        publish(PluginEvent.builder()
                .type(type)
                .payload(payload)
                .source(opts.getSource())
                .metadata(metadata)
                .priority(opts.getPriority())
                .build());
    }

    /**
     * 发布已构造好的事件
     */
    public void publish(PluginEvent event) {
        if (listeners.isEmpty()) {
            return;
        }

        int[] depth = DISPATCH_DEPTH.get();
        if (depth[0] >= maxDispatchDepth) {
            log.error("[{}] Dispatch depth {} exceeded, dropping event {} (source={})",
                    name, maxDispatchDepth, event.getType(), event.getSource());
            return;
        }

        depth[0]++;
        try {
            log.debug("[{}] Publishing event: {}", name, event.getType());
            for (EventListener listener : listeners) {
                if (!listener.matches(event.getType())) {
                    continue;
                }
                try {
                    listener.handler.accept(event);
                } catch (VirtualMachineError fatal) {
                    throw fatal;
                } catch (Throwable e) {
                    // 处理器来自插件，断言失败等 Error 也只影响它自己
                    log.error("[{}] Error handling event {}: {}",
                            name, event.getType(), e.getMessage(), e);
                }
            }
        } finally {
            depth[0]--;
            if (depth[0] == 0) {
                DISPATCH_DEPTH.remove();
            }
        }
    }

    /**
     * 清除所有订阅
     */
    public void clear() {
        listeners.clear();
        log.debug("[{}] All subscriptions cleared", name);
    }

    /**
     * 获取订阅数量
     */
    public int getSubscriptionCount() {
        return listeners.size();
    }

    static boolean matches(String pattern, String type) {
        if (WILDCARD.equals(pattern)) {
            return true;
        }
        if (pattern.endsWith(":*")) {
            return type.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(type);
    }

    // ===== 内部类 =====

    /**
     * 订阅句柄（用于取消订阅）
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record EventListener(String pattern, Consumer<PluginEvent> handler) {

        boolean matches(String type) {
            return EventBus.matches(pattern, type);
        }
    }
}
