package com.cloudgov.api.dto;

import lombok.Data;

/**
 * 节点地址规划摘要 DTO。
 */
@Data
public class IpamSummaryDTO {

    private String nodeId;
    private String rawCidr;
    private CidrInfoDTO cidr;
    private String parentCidr;
    private boolean containedInParent;
    private int childCount;
    private double childUtilizationPercent;
}
