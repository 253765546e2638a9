package com.lingbus.core.security;

import com.lingbus.api.security.QuotaChecker;
import com.lingbus.core.config.LingBusConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 插件资源监控
 * <p>
 * 纯观测：只计数、判定并记录告警，从不阻断发布、不停止插件。
 * 是否据此限流或挂起由宿主决定。
 */
@Slf4j
public class ResourceMonitor implements QuotaChecker {

    private final Map<String, UsageWindow> pluginUsage = new ConcurrentHashMap<>();
    private final long maxEventsPerWindow;
    private final long maxHandlerTimeMsPerWindow;
    private final long defaultIntervalMs;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tick;

    public ResourceMonitor() {
        this(LingBusConfig.defaults());
    }

    public ResourceMonitor(LingBusConfig config) {
        this.maxEventsPerWindow = config.getMaxEventsPerWindow();
        this.maxHandlerTimeMsPerWindow = config.getMaxHandlerTimeMsPerWindow();
        this.defaultIntervalMs = config.getMonitorIntervalMs();
    }

    /**
     * 开启周期性统计。重复调用会先取消上一个周期。
     */
    public synchronized void startMonitoring(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive: " + intervalMs);
        }
        if (tick != null) {
            tick.cancel(false);
        }
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "lingbus-resource-monitor");
                thread.setDaemon(true); // 守护线程，不阻碍 JVM 退出
                thread.setUncaughtExceptionHandler((t, e) ->
                        log.error("Thread {} failed: {}", t.getName(), e.getMessage()));
                return thread;
            });
        }
        tick = scheduler.scheduleAtFixedRate(this::collectResourceUsage, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Resource monitoring started, window={}ms", intervalMs);
    }

    public void startMonitoring() {
        startMonitoring(defaultIntervalMs);
    }

    public synchronized void stopMonitoring() {
        if (tick != null) {
            tick.cancel(false);
            tick = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("Resource monitoring stopped");
        }
    }

    public synchronized boolean isMonitoring() {
        return tick != null;
    }

    public void recordEventEmission(String pluginId, long eventSizeBytes) {
        UsageWindow usage = getOrCreateUsage(pluginId);
        usage.eventsEmitted.incrementAndGet();
        usage.eventBytesEmitted.addAndGet(Math.max(0, eventSizeBytes));
    }

    public void recordHandlerExecution(String pluginId, long durationMs) {
        UsageWindow usage = getOrCreateUsage(pluginId);
        usage.handlerExecutionTime.addAndGet(Math.max(0, durationMs));
        usage.handlerExecutions.incrementAndGet();
    }

    /**
     * 获取使用快照（防御性拷贝）
     */
    public ResourceUsage getUsage(String pluginId) {
        // 只读查询，不为未跟踪的插件建立窗口
        UsageWindow usage = pluginId == null ? null : pluginUsage.get(pluginId);
        if (usage == null) {
            return ResourceUsage.builder().windowStart(System.currentTimeMillis()).build();
        }
        return usage.snapshot();
    }

    public boolean isExceedingLimits(String pluginId) {
        ResourceUsage usage = getUsage(pluginId);
        return usage.getEventsEmitted() > maxEventsPerWindow
                || usage.getHandlerExecutionTime() > maxHandlerTimeMsPerWindow;
    }

    @Override
    public boolean isOverQuota(String pluginId) {
        return isExceedingLimits(pluginId);
    }

    /**
     * 停止跟踪某个插件（沙箱销毁后调用）
     */
    public void untrack(String pluginId) {
        pluginUsage.remove(pluginId);
    }

    public Set<String> getTrackedPlugins() {
        return Set.copyOf(pluginUsage.keySet());
    }

    /**
     * 执行一次窗口结算：先检查超限并告警，再清零计数并开启新窗口
     */
    public void collectResourceUsage() {
        long now = System.currentTimeMillis();
        for (Map.Entry<String, UsageWindow> entry : pluginUsage.entrySet()) {
            String pluginId = entry.getKey();
            UsageWindow usage = entry.getValue();

            ResourceUsage snapshot = usage.snapshot();
            if (snapshot.getEventsEmitted() > maxEventsPerWindow) {
                log.warn("Plugin {} emitting excessive events: {} in window (limit {})",
                        pluginId, snapshot.getEventsEmitted(), maxEventsPerWindow);
            }
            if (snapshot.getHandlerExecutionTime() > maxHandlerTimeMsPerWindow) {
                log.warn("Plugin {} using excessive handler time: {}ms in window (limit {}ms)",
                        pluginId, snapshot.getHandlerExecutionTime(), maxHandlerTimeMsPerWindow);
            }

            usage.reset(now);
        }
    }

    private UsageWindow getOrCreateUsage(String pluginId) {
        return pluginUsage.computeIfAbsent(pluginId, k -> new UsageWindow(System.currentTimeMillis()));
    }

    // ===== 内部类 =====

    private static final class UsageWindow {
        final AtomicLong eventsEmitted = new AtomicLong();
        final AtomicLong eventBytesEmitted = new AtomicLong();
        final AtomicLong handlerExecutionTime = new AtomicLong();
        final AtomicLong handlerExecutions = new AtomicLong();
        volatile long windowStart;

        UsageWindow(long windowStart) {
            this.windowStart = windowStart;
        }

        void reset(long now) {
            eventsEmitted.set(0);
            eventBytesEmitted.set(0);
            handlerExecutionTime.set(0);
            handlerExecutions.set(0);
            windowStart = now;
        }

        ResourceUsage snapshot() {
            return ResourceUsage.builder()
                    .eventsEmitted(eventsEmitted.get())
                    .eventBytesEmitted(eventBytesEmitted.get())
                    .handlerExecutionTime(handlerExecutionTime.get())
                    .handlerExecutions(handlerExecutions.get())
                    .windowStart(windowStart)
                    .build();
        }
    }
}
