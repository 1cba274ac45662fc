package com.cloudgov.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 云厂商层级定义 DTO。
 */
@Data
public class ProviderHierarchyDTO {

    private String providerName;
    private String rootType;
    private List<HierarchyLevelDTO> levels;
}
