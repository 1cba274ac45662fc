package com.cloudgov.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 校验项状态枚举
 */
public enum ValidationStatusEnum {

    /**
     * 错误 - 阻断发布
     */
    ERROR("error"),

    /**
     * 警告 - 提示但不阻断
     */
    WARNING("warning"),

    /**
     * 通过
     */
    OK("ok");

    private final String code;

    ValidationStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isProblem() {
        return this == ERROR || this == WARNING;
    }

    /**
     * 解析外部校验结果中的状态，后端历史数据使用 "pass" 表示通过。
     */
    public static ValidationStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        if ("pass".equals(normalized)) {
            return OK;
        }
        for (ValidationStatusEnum status : ValidationStatusEnum.values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown validation status code: " + code);
    }
}
