package com.cloudgov.api.dto;

import lombok.Data;

/**
 * 命名预览 DTO。
 */
@Data
public class NamingPreviewDTO {

    private String nodeId;
    private String template;
    private String preview;
}
