package com.lingbus.core.security;

/**
 * 插件故障回调
 */
@FunctionalInterface
public interface ErrorCallback {

    void onError(Throwable error, String pluginId);

    default void onCaptured(CapturedError captured) {
        onError(captured.error(), captured.pluginId());
    }
}
