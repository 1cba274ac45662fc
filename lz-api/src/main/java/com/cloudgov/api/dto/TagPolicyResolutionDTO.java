package com.cloudgov.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 节点标签策略解析结果 DTO。
 */
@Data
public class TagPolicyResolutionDTO {

    private String nodeId;
    private List<TagPolicyDTO> inherited;
    private List<TagPolicyDTO> local;
    private List<TagPolicyDTO> effective;
}
