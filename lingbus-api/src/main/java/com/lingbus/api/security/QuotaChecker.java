package com.lingbus.api.security;

/**
 * 宿主提供 - 配额决策服务
 * <p>
 * 只回答"是否超额"，是否据此限流或挂起插件由宿主自行决定。
 *
 * @author LingBus
 */
@FunctionalInterface
public interface QuotaChecker {

    /**
     * @param pluginId 插件ID
     * @return 插件在当前窗口内已超出配额返回 true
     */
    boolean isOverQuota(String pluginId);
}
