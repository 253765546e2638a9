package com.lingbus.core.security;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 结构校验结果
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(true, null);

    private final boolean valid;
    private final String errorMessage;

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult fail(String errorMessage) {
        return new ValidationResult(false, errorMessage);
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult{valid}" : "ValidationResult{invalid: " + errorMessage + "}";
    }
}
