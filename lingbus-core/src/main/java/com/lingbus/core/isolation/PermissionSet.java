package com.lingbus.core.isolation;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 沙箱持有的发布权限集合 (Immutable)
 * 权限串只在构造时解析一次，之后按类型判定。
 */
@Slf4j
public final class PermissionSet {

    private static final PermissionSet EMPTY = new PermissionSet(Set.of());

    private final Set<EmitPermission> permissions;
    private final boolean wildcard;

    private PermissionSet(Set<EmitPermission> permissions) {
        this.permissions = Set.copyOf(permissions);
        this.wildcard = permissions.contains(EmitPermission.Wildcard.INSTANCE);
    }

    public static PermissionSet empty() {
        return EMPTY;
    }

    /**
     * 从权限串构建。非 emit 前缀的条目属于其他能力（例如 "read:data"），在此忽略。
     */
    public static PermissionSet parse(Collection<String> rawPermissions) {
        if (rawPermissions == null || rawPermissions.isEmpty()) {
            return EMPTY;
        }
        Set<EmitPermission> parsed = new LinkedHashSet<>();
        for (String raw : rawPermissions) {
            if (!EmitPermission.isEmitPermission(raw)) {
                log.debug("Ignoring non-emit permission: {}", raw);
                continue;
            }
            parsed.add(EmitPermission.parse(raw));
        }
        return new PermissionSet(parsed);
    }

    public static PermissionSet of(String... rawPermissions) {
        return parse(List.of(rawPermissions));
    }

    public boolean allows(String eventType) {
        if (wildcard) {
            return true;
        }
        for (EmitPermission permission : permissions) {
            if (permission.allows(eventType)) {
                return true;
            }
        }
        return false;
    }

    public Set<EmitPermission> asSet() {
        return permissions;
    }

    @Override
    public String toString() {
        return permissions.toString();
    }
}
