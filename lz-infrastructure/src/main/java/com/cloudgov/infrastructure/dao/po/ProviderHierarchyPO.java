package com.cloudgov.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 云厂商层级定义 PO（类路径 JSON 资源）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderHierarchyPO {

    /**
     * 云厂商名称 (如 'aws', 'oci')
     */
    private String providerName;

    /**
     * 根层级类型
     */
    private String rootType;

    /**
     * 有序层级定义
     */
    private List<HierarchyLevelPO> levels;
}
