package com.lingbus.api.security;

/**
 * 宿主提供 - 权限决策服务
 * 沙箱在把事件转发到共享总线之前会额外询问它。
 *
 * @author LingBus
 */
@FunctionalInterface
public interface PermissionChecker {

    /**
     * 检查插件是否允许执行 {@code emit:<eventType>}。
     *
     * @param pluginId  插件ID
     * @param eventType 事件类型
     * @return 允许转发返回 true
     */
    boolean canEmit(String pluginId, String eventType);

    /**
     * 放行一切的默认实现
     */
    static PermissionChecker allowAll() {
        return (pluginId, eventType) -> true;
    }
}
