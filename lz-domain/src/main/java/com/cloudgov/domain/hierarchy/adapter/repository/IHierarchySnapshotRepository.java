package com.cloudgov.domain.hierarchy.adapter.repository;

import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;

import java.util.List;

/**
 * 层级树快照仓储接口：以扁平节点数组形态持久化。
 */
public interface IHierarchySnapshotRepository {

    void save(String zoneId, List<HierarchyNodeEntity> nodes);

    /**
     * 读取最近一次落库的节点列表，从未落库返回 null。
     */
    List<HierarchyNodeEntity> findByZoneId(String zoneId);
}
