package com.cloudgov.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 层级定义 DTO。
 */
@Data
public class HierarchyLevelDTO {

    private String typeId;
    private String label;
    private String icon;
    private List<String> allowedChildren;
    private boolean supportsTags;
    private boolean supportsIpam;
    private boolean supportsEnvironment;
}
