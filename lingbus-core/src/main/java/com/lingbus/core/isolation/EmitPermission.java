package com.lingbus.core.isolation;

/**
 * 发布权限
 * <p>
 * 只有两种形态：{@code emit:*} 允许任意类型，{@code emit:<type>} 只允许该精确类型。
 */
public sealed interface EmitPermission {

    String PREFIX = "emit:";

    boolean allows(String eventType);

    /**
     * 解析权限串
     *
     * @param permission 例如 "emit:*"、"emit:order.created"
     * @return 解析结果
     * @throws IllegalArgumentException 不是 emit 权限或缺少事件类型
     */
    static EmitPermission parse(String permission) {
        if (permission == null || !permission.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Not an emit permission: " + permission);
        }
        String type = permission.substring(PREFIX.length());
        if (type.isEmpty()) {
            throw new IllegalArgumentException("Emit permission without event type: " + permission);
        }
        return "*".equals(type) ? Wildcard.INSTANCE : new Exact(type);
    }

    static boolean isEmitPermission(String permission) {
        return permission != null && permission.startsWith(PREFIX);
    }

    /**
     * emit:*
     */
    enum Wildcard implements EmitPermission {
        INSTANCE;

        @Override
        public boolean allows(String eventType) {
            return true;
        }

        @Override
        public String toString() {
            return PREFIX + "*";
        }
    }

    /**
     * emit:&lt;type&gt;
     */
    record Exact(String type) implements EmitPermission {

        @Override
        public boolean allows(String eventType) {
            return type.equals(eventType);
        }

        @Override
        public String toString() {
            return PREFIX + type;
        }
    }
}
