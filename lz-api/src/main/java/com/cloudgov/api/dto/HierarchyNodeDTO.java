package com.cloudgov.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 层级节点 DTO，与落库的扁平节点形态一致。
 */
@Data
public class HierarchyNodeDTO {

    private String id;
    private String parentId;
    private String typeId;
    private String label;
    private Map<String, Object> properties;
}
