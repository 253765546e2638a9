package com.lingbus.core.isolation;

import com.lingbus.api.security.QuotaChecker;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * 配额管理器
 * <p>
 * 按插件维护一个 1 秒窗口的用量。{@link #checkQuota} 在用量加上本次申请量超过上限时拒绝，
 * 未拒绝时才累加用量。没有配额的插件或资源视为不限。
 */
@Slf4j
public class QuotaManager implements QuotaChecker {

    private static final long WINDOW_MS = 1000;

    private final Map<String, PluginQuota> quotas = new ConcurrentHashMap<>();
    private final Map<String, Window> usage = new ConcurrentHashMap<>();
    private final LongSupplier clock;

    public QuotaManager() {
        this(System::currentTimeMillis);
    }

    QuotaManager(LongSupplier clock) {
        this.clock = clock;
    }

    public void setQuota(String pluginId, PluginQuota quota) {
        quotas.put(pluginId, quota);
    }

    public PluginQuota getQuota(String pluginId) {
        return quotas.get(pluginId);
    }

    /**
     * 申请资源
     *
     * @return 未超额返回 true 并记入用量；超额返回 false
     */
    public boolean checkQuota(String pluginId, QuotaResource resource, long amount) {
        Window window = currentWindow(pluginId);

        PluginQuota quota = quotas.get(pluginId);
        Long limit = quota != null ? quota.limitOf(resource) : null;

        synchronized (window) {
            long used = window.used.getOrDefault(resource, 0L);
            if (limit != null && used + amount > limit) {
                window.exceeded = true;
                log.warn("Plugin {} exceeded quota for {}: {} + {} > {}", pluginId, resource, used, amount, limit);
                return false;
            }
            window.used.put(resource, used + amount);
            return true;
        }
    }

    public long getUsage(String pluginId, QuotaResource resource) {
        Window window = currentWindow(pluginId);
        synchronized (window) {
            return window.used.getOrDefault(resource, 0L);
        }
    }

    public void resetUsage(String pluginId) {
        usage.remove(pluginId);
    }

    /**
     * 清除插件的配额与用量
     */
    public void clear(String pluginId) {
        quotas.remove(pluginId);
        usage.remove(pluginId);
    }

    /**
     * 当前窗口内是否发生过拒绝
     */
    @Override
    public boolean isOverQuota(String pluginId) {
        Window window = currentWindow(pluginId);
        synchronized (window) {
            return window.exceeded;
        }
    }

    private Window currentWindow(String pluginId) {
        long now = clock.getAsLong();
        return usage.compute(pluginId, (id, window) ->
                window == null || now - window.start >= WINDOW_MS ? new Window(now) : window);
    }

    private static final class Window {
        final long start;
        final Map<QuotaResource, Long> used = new EnumMap<>(QuotaResource.class);
        boolean exceeded;

        Window(long start) {
            this.start = start;
        }
    }
}
