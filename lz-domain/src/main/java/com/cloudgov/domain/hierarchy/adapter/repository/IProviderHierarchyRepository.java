package com.cloudgov.domain.hierarchy.adapter.repository;

import com.cloudgov.domain.hierarchy.model.valobj.ProviderHierarchy;

import java.util.List;

/**
 * 云厂商层级定义仓储接口。
 */
public interface IProviderHierarchyRepository {

    /**
     * 按云厂商名称查找（忽略大小写），不存在返回 null。
     */
    ProviderHierarchy findByProvider(String providerName);

    List<ProviderHierarchy> findAll();
}
