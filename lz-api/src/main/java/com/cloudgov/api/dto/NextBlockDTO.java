package com.cloudgov.api.dto;

import lombok.Data;

/**
 * 子网段建议 DTO，cidr 为 null 表示无可用网段。
 */
@Data
public class NextBlockDTO {

    private String nodeId;
    private int prefix;
    private String cidr;
}
