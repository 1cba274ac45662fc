package com.cloudgov.infrastructure.repository.hierarchy;

import com.cloudgov.domain.hierarchy.adapter.repository.IHierarchyDesignSessionRepository;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyDesignSessionEntity;
import com.google.common.cache.Cache;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * 层级设计会话仓储实现类：进程内 Guava 缓存，空闲超时后自动淘汰。
 */
@Repository
public class HierarchyDesignSessionRepositoryImpl implements IHierarchyDesignSessionRepository {

    private final Cache<String, HierarchyDesignSessionEntity> designSessionCache;

    public HierarchyDesignSessionRepositoryImpl(
            @Qualifier("designSessionCache") Cache<String, HierarchyDesignSessionEntity> designSessionCache) {
        this.designSessionCache = designSessionCache;
    }

    @Override
    public HierarchyDesignSessionEntity save(HierarchyDesignSessionEntity session) {
        designSessionCache.put(session.getZoneId(), session);
        return session;
    }

    @Override
    public HierarchyDesignSessionEntity findByZoneId(String zoneId) {
        if (StringUtils.isBlank(zoneId)) {
            return null;
        }
        return designSessionCache.getIfPresent(zoneId.trim());
    }

    @Override
    public void remove(String zoneId) {
        if (StringUtils.isNotBlank(zoneId)) {
            designSessionCache.invalidate(zoneId.trim());
        }
    }
}
