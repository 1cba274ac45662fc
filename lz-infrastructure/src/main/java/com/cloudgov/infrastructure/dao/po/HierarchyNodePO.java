package com.cloudgov.infrastructure.dao.po;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 层级节点 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyNodePO {

    private String id;

    /**
     * 父节点 ID，根节点序列化为 null
     */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String parentId;

    private String typeId;
    private String label;

    /**
     * 节点属性（tagPolicies 仅含本地条目）
     */
    private Map<String, Object> properties;
}
