package com.cloudgov.domain.hierarchy.model.valobj;

/**
 * 节点地址规划摘要。
 *
 * @param nodeId 节点 ID
 * @param rawCidr 节点存储的原始 CIDR 字符串，可能无效
 * @param cidr 解析结果
 * @param broadcast 广播地址，无效时为空串
 * @param privateRange 是否位于 RFC1918 私有地址段
 * @param parentCidr 父节点有效 CIDR，缺省为 null
 * @param containedInParent 是否被父节点 CIDR 包含；父节点无有效 CIDR 时为 true
 * @param childCount 拥有有效 CIDR 的子节点数量
 * @param childUtilizationPercent 子节点可用地址占本节点可用地址的百分比
 */
public record IpamSummary(String nodeId,
                          String rawCidr,
                          CidrInfo cidr,
                          String broadcast,
                          boolean privateRange,
                          String parentCidr,
                          boolean containedInParent,
                          int childCount,
                          double childUtilizationPercent) {
}
