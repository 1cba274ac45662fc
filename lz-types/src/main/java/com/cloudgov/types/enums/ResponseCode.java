package com.cloudgov.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 00xx 为通用码，01xx 为层级设计器的结构性违规码。
 * </p>
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 设计会话不存在或已过期 */
    SESSION_NOT_FOUND("0101", "设计会话不存在"),

    /** 云厂商层级定义不存在 */
    PROVIDER_NOT_FOUND("0102", "云厂商层级定义不存在"),

    /** 节点不存在 */
    NODE_NOT_FOUND("0103", "节点不存在"),

    /** 层级放置约束不满足 */
    PLACEMENT_REJECTED("0104", "层级放置约束不满足"),

    /** 层级未在当前云厂商中声明 */
    UNDECLARED_LEVEL("0105", "层级类型未声明"),

    /** 层级不支持该能力（标签、IPAM、环境标识） */
    CAPABILITY_UNSUPPORTED("0106", "层级不支持该能力"),

    /** 层级树完整性校验失败 */
    HIERARCHY_INTEGRITY_VIOLATION("0107", "层级树完整性校验失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
