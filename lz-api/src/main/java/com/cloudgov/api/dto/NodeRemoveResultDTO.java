package com.cloudgov.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 节点删除结果 DTO。
 */
@Data
public class NodeRemoveResultDTO {

    private List<String> removedNodeIds;
    private String selectedNodeId;
    private Long revision;
}
