package com.cloudgov.test;

import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyEntry;
import com.cloudgov.infrastructure.repository.hierarchy.HierarchySnapshotRepositoryImpl;
import com.cloudgov.infrastructure.util.JsonCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.cloudgov.test.support.HierarchyTestFixtures.node;
import static com.cloudgov.test.support.HierarchyTestFixtures.tag;
import static com.cloudgov.test.support.HierarchyTestFixtures.withCidr;
import static com.cloudgov.test.support.HierarchyTestFixtures.withTags;

public class HierarchySnapshotRepositoryTest {

    private HierarchySnapshotRepositoryImpl repository;

    @BeforeEach
    public void setUp() {
        this.repository = new HierarchySnapshotRepositoryImpl(new JsonCodec(new ObjectMapper()));
    }

    @Test
    public void shouldReturnNullForUnknownZone() {
        Assertions.assertNull(repository.findByZoneId("lz-missing"));
        Assertions.assertNull(repository.findByZoneId(" "));
    }

    @Test
    public void shouldPreserveFlatStructureAndProperties() {
        repository.save("lz-1", List.of(
                node("org", null, "organization", "Acme"),
                node("ou", "org", "ou", "Workloads"),
                withCidr(node("vpc", "ou", "vpc", "Core"), "10.0.0.0/16")));

        List<HierarchyNodeEntity> loaded = repository.findByZoneId("lz-1");

        Assertions.assertEquals(3, loaded.size());
        Assertions.assertNull(loaded.get(0).getParentId());
        Assertions.assertEquals("org", loaded.get(1).getParentId());
        Assertions.assertEquals("ou", loaded.get(2).getParentId());
        Assertions.assertEquals("10.0.0.0/16", loaded.get(2).readCidr());
        Assertions.assertEquals("Workloads", loaded.get(1).getLabel());
    }

    @Test
    public void shouldDropInheritedTagEntriesOnWrite() {
        TagPolicyEntry inherited = tag("owner", "platform");
        inherited.setInherited(true);
        inherited.setInheritedFrom("Acme");
        repository.save("lz-1", List.of(withTags(node("ou", null, "ou", "Workloads"), inherited, tag("app", "web"))));

        HierarchyNodeEntity loaded = repository.findByZoneId("lz-1").get(0);
        List<?> stored = (List<?>) loaded.getProperties().get("tagPolicies");

        Assertions.assertEquals(1, stored.size());
        Map<?, ?> entry = (Map<?, ?>) stored.get(0);
        Assertions.assertEquals("app", entry.get("tagKey"));
        Assertions.assertFalse(entry.containsKey("inherited"));
        Assertions.assertFalse(entry.containsKey("inheritedFrom"));
    }

    @Test
    public void shouldReplacePreviousSnapshot() {
        repository.save("lz-1", List.of(node("a", null, "organization", "A")));
        repository.save("lz-1", List.of(node("b", null, "organization", "B"), node("c", "b", "ou", "C")));

        List<HierarchyNodeEntity> loaded = repository.findByZoneId("lz-1");

        Assertions.assertEquals(2, loaded.size());
        Assertions.assertEquals("b", loaded.get(0).getId());
    }
}
