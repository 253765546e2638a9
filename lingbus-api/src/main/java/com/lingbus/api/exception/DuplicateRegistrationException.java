package com.lingbus.api.exception;

import lombok.Getter;

/**
 * 重复注册异常
 * 当同一个插件 ID 已存在存活的沙箱，或同一个频道 ID 已被创建时抛出。
 *
 * @author LingBus
 */
@Getter
public class DuplicateRegistrationException extends LingBusException {

    /**
     * 冲突的注册类型，例如 "sandbox"、"channel"
     */
    private final String kind;

    /**
     * 冲突的标识
     */
    private final String id;

    public DuplicateRegistrationException(String kind, String id) {
        super(kind + " already registered: " + id);
        this.kind = kind;
        this.id = id;
    }
}
