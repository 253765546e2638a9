package com.lingbus.core.isolation;

import com.lingbus.api.security.PermissionChecker;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 默认权限服务实现
 * 职责：管理插件的能力授权与回收，提供鉴权查询
 * <p>
 * 匹配规则：精确匹配、全局 "*"、以及 "prefix:*" 前缀匹配。
 * 被显式回收的能力优先于任何授权（包括通配授权）。
 */
@Slf4j
public class PermissionManager implements PermissionChecker {

    // 权限表: Map<PluginId, Set<Capability>>
    private final Map<String, Set<String>> pluginPermissions = new ConcurrentHashMap<>();

    // 回收表: Map<PluginId, Set<Capability>>
    private final Map<String, Set<String>> revokedPermissions = new ConcurrentHashMap<>();

    public void grantCapabilities(String pluginId, Collection<String> capabilities) {
        Set<String> granted = pluginPermissions.computeIfAbsent(pluginId, k -> ConcurrentHashMap.newKeySet());
        granted.addAll(capabilities);
        // 重新授权即撤销之前的回收
        Set<String> revoked = revokedPermissions.get(pluginId);
        if (revoked != null) {
            revoked.removeAll(capabilities);
        }
    }

    public void revokeCapabilities(String pluginId, Collection<String> capabilities) {
        Set<String> granted = pluginPermissions.get(pluginId);
        if (granted == null) {
            return;
        }
        granted.removeAll(capabilities);
        revokedPermissions.computeIfAbsent(pluginId, k -> ConcurrentHashMap.newKeySet())
                .addAll(capabilities);
        log.info("[{}] Capabilities revoked: {}", pluginId, capabilities);
    }

    public boolean hasPermission(String pluginId, String permission) {
        Set<String> revoked = revokedPermissions.get(pluginId);
        if (revoked != null && revoked.contains(permission)) {
            return false;
        }

        Set<String> granted = pluginPermissions.get(pluginId);
        if (granted == null) {
            return false;
        }
        if (granted.contains(permission) || granted.contains("*")) {
            return true;
        }
        for (String perm : granted) {
            if (perm.endsWith(":*")) {
                String prefix = perm.substring(0, perm.length() - 1);
                if (permission.startsWith(prefix)) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean hasAllPermissions(String pluginId, Collection<String> permissions) {
        return permissions.stream().allMatch(p -> hasPermission(pluginId, p));
    }

    public boolean hasAnyPermission(String pluginId, Collection<String> permissions) {
        return permissions.stream().anyMatch(p -> hasPermission(pluginId, p));
    }

    public Set<String> getPermissions(String pluginId) {
        Set<String> granted = pluginPermissions.get(pluginId);
        return granted == null ? Set.of() : Set.copyOf(granted);
    }

    public void clearPermissions(String pluginId) {
        pluginPermissions.remove(pluginId);
        revokedPermissions.remove(pluginId);
    }

    @Override
    public boolean canEmit(String pluginId, String eventType) {
        boolean allowed = hasPermission(pluginId, EmitPermission.PREFIX + eventType);
        if (!allowed) {
            log.warn("DENY: Plugin [{}] tried to emit [{}] without permission.", pluginId, eventType);
        }
        return allowed;
    }
}
