package com.cloudgov.api.dto;

import lombok.Data;

/**
 * 打开设计会话请求 DTO。
 */
@Data
public class DesignerOpenRequestDTO {

    private String providerName;
}
