package com.cloudgov.api.dto;

import lombok.Data;

/**
 * CIDR 解析结果 DTO。
 */
@Data
public class CidrInfoDTO {

    private String input;
    private boolean valid;
    private String network;
    private int prefix;
    private long totalAddresses;
    private long usableAddresses;
    private String broadcast;
    private boolean privateRange;
}
