package com.lingbus.api.exception;

/**
 * LingBus 基础异常
 *
 * @author LingBus
 */
public class LingBusException extends RuntimeException {

    public LingBusException(String message) {
        super(message);
    }

    public LingBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
