package com.cloudgov.test;

import com.cloudgov.domain.hierarchy.model.entity.HierarchyDesignSessionEntity;
import com.cloudgov.infrastructure.repository.hierarchy.HierarchyDesignSessionRepositoryImpl;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.cloudgov.test.support.HierarchyTestFixtures.orgOuSchema;

public class HierarchyDesignSessionRepositoryTest {

    @Test
    public void shouldStoreFindAndRemoveSessionByZone() {
        Cache<String, HierarchyDesignSessionEntity> cache = CacheBuilder.newBuilder().maximumSize(10).build();
        HierarchyDesignSessionRepositoryImpl repository = new HierarchyDesignSessionRepositoryImpl(cache);
        HierarchyDesignSessionEntity session = HierarchyDesignSessionEntity.open("lz-1", orgOuSchema());

        repository.save(session);

        Assertions.assertSame(session, repository.findByZoneId(" lz-1 "));
        Assertions.assertNull(repository.findByZoneId(null));

        repository.remove("lz-1");
        Assertions.assertNull(repository.findByZoneId("lz-1"));
        Assertions.assertEquals(0L, cache.size());
    }
}
