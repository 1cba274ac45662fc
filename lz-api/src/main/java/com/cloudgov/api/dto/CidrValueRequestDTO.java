package com.cloudgov.api.dto;

import lombok.Data;

/**
 * 写入 CIDR 请求 DTO，空白表示清除。
 */
@Data
public class CidrValueRequestDTO {

    private String cidr;
}
