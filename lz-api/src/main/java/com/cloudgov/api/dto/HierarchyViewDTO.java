package com.cloudgov.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 设计会话视图 DTO。
 */
@Data
public class HierarchyViewDTO {

    private String zoneId;
    private String providerName;
    private String rootType;
    private Long revision;

    /**
     * 当前选中节点，未选中为 null
     */
    private String selectedNodeId;

    private List<HierarchyNodeDTO> nodes;
    private Map<String, List<String>> nodeErrors;
    private LocalDateTime updatedAt;
}
