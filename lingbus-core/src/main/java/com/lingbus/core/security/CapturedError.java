package com.lingbus.core.security;

/**
 * 被边界捕获的一次插件故障，交给回调后即丢弃
 *
 * @param pluginId 插件ID
 * @param context  上下文标签，可为 null
 * @param error    原始异常
 */
public record CapturedError(String pluginId, String context, Throwable error) {

    public String message() {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    String describe() {
        String where = context != null ? " in " + context : "";
        return "[Plugin " + pluginId + "] Error" + where + ": " + message();
    }
}
