package com.cloudgov.api.dto;

import lombok.Data;

/**
 * 命名模板请求 DTO，空白表示清除。
 */
@Data
public class NamingTemplateRequestDTO {

    private String template;
}
