package com.cloudgov.domain.hierarchy.adapter.repository;

import com.cloudgov.domain.hierarchy.model.entity.HierarchyDesignSessionEntity;

/**
 * 层级设计会话仓储接口。
 */
public interface IHierarchyDesignSessionRepository {

    HierarchyDesignSessionEntity save(HierarchyDesignSessionEntity session);

    HierarchyDesignSessionEntity findByZoneId(String zoneId);

    void remove(String zoneId);
}
