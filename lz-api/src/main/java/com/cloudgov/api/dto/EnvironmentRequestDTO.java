package com.cloudgov.api.dto;

import lombok.Data;

/**
 * 环境标识请求 DTO，none 表示清除。
 */
@Data
public class EnvironmentRequestDTO {

    private String environmentDesignation;
}
