package com.cloudgov.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 整树替换请求 DTO（蓝图加载或后端重新同步）。
 */
@Data
public class HierarchyReplaceRequestDTO {

    private List<HierarchyNodeDTO> nodes;

    /**
     * 蓝图默认标签策略，追加到根节点
     */
    private List<TagPolicyDTO> defaultTagPolicies;
}
