package com.cloudgov.infrastructure.dao.po;

import lombok.Data;

import java.util.List;

/**
 * provider-hierarchies.json 根节点
 */
@Data
public class ProviderHierarchyCatalogPO {

    private List<ProviderHierarchyPO> providers;
}
