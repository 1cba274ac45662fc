package com.cloudgov.domain.hierarchy.model.valobj;

/**
 * CIDR 解析结果。无效输入时 valid=false，数值字段全部为 0，network 为空串。
 */
public record CidrInfo(boolean valid,
                       String network,
                       int prefix,
                       long totalAddresses,
                       long usableAddresses) {

    public static final CidrInfo INVALID = new CidrInfo(false, "", 0, 0L, 0L);

    /**
     * 规范化后的 network/prefix 表示，无效时返回空串。
     */
    public String notation() {
        return valid ? network + "/" + prefix : "";
    }
}
