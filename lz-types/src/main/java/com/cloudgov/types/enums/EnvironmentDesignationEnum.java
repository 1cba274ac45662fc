package com.cloudgov.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 节点环境标识枚举。
 */
public enum EnvironmentDesignationEnum {

    /**
     * 未指定（不落库，存储时等同于缺省）
     */
    NONE("none"),

    /**
     * 共享环境
     */
    SHARED("shared"),

    /**
     * 生产环境
     */
    PRODUCTION("production"),

    /**
     * 开发环境
     */
    DEVELOPMENT("development"),

    /**
     * 预发环境
     */
    STAGING("staging"),

    /**
     * 沙箱环境
     */
    SANDBOX("sandbox");

    private final String code;

    EnvironmentDesignationEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static EnvironmentDesignationEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (EnvironmentDesignationEnum designation : EnvironmentDesignationEnum.values()) {
            if (designation.code.equals(normalized)) {
                return designation;
            }
        }
        throw new IllegalArgumentException("Unknown environment designation code: " + code);
    }
}
