package com.cloudgov.infrastructure.repository.hierarchy;

import com.cloudgov.domain.hierarchy.adapter.repository.IHierarchySnapshotRepository;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyEntry;
import com.cloudgov.infrastructure.dao.po.HierarchyNodePO;
import com.cloudgov.infrastructure.dao.po.HierarchySnapshotPO;
import com.cloudgov.infrastructure.util.JsonCodec;
import com.cloudgov.types.common.Constants;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 层级树快照仓储实现类。
 * <p>
 * 以扁平节点数组 JSON 保存：{"nodes": [{id, parentId, typeId, label, properties}]}。
 * 标签策略只写本地形态，inherited / inheritedFrom 不落库。
 * </p>
 */
@Slf4j
@Repository
public class HierarchySnapshotRepositoryImpl implements IHierarchySnapshotRepository {

    private final Map<String, String> snapshots = new ConcurrentHashMap<>();
    private final JsonCodec jsonCodec;

    public HierarchySnapshotRepositoryImpl(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    @Override
    public void save(String zoneId, List<HierarchyNodeEntity> nodes) {
        List<HierarchyNodePO> nodePOs = new ArrayList<>();
        if (nodes != null) {
            for (HierarchyNodeEntity node : nodes) {
                nodePOs.add(toPO(node));
            }
        }
        String json = jsonCodec.writeValue(new HierarchySnapshotPO(nodePOs));
        snapshots.put(zoneId, json);
        log.debug("HIERARCHY_SNAPSHOT_WRITTEN zoneId={}, nodeCount={}, bytes={}", zoneId, nodePOs.size(), json.length());
    }

    @Override
    public List<HierarchyNodeEntity> findByZoneId(String zoneId) {
        String json = StringUtils.isBlank(zoneId) ? null : snapshots.get(zoneId);
        HierarchySnapshotPO snapshot = jsonCodec.readValue(json, HierarchySnapshotPO.class);
        if (snapshot == null) {
            return null;
        }
        List<HierarchyNodeEntity> nodes = new ArrayList<>();
        if (snapshot.getNodes() != null) {
            for (HierarchyNodePO po : snapshot.getNodes()) {
                nodes.add(toEntity(po));
            }
        }
        return nodes;
    }

    private HierarchyNodePO toPO(HierarchyNodeEntity entity) {
        HierarchyNodeEntity copy = entity.copy();
        if (copy.getProperties().containsKey(Constants.PROP_TAG_POLICIES)) {
            // 只保留本地条目，派生字段在重写时被剥离
            List<TagPolicyEntry> local = new ArrayList<>();
            for (TagPolicyEntry entry : copy.readTagPolicies()) {
                if (!entry.markedInherited()) {
                    local.add(entry);
                }
            }
            copy.writeTagPolicies(local);
        }
        return HierarchyNodePO.builder()
                .id(copy.getId())
                .parentId(copy.isRoot() ? null : copy.getParentId())
                .typeId(copy.getTypeId())
                .label(copy.getLabel())
                .properties(copy.getProperties())
                .build();
    }

    private HierarchyNodeEntity toEntity(HierarchyNodePO po) {
        HierarchyNodeEntity entity = new HierarchyNodeEntity();
        entity.setId(po.getId());
        entity.setParentId(po.getParentId());
        entity.setTypeId(po.getTypeId());
        entity.setLabel(po.getLabel());
        entity.setProperties(po.getProperties() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(po.getProperties()));
        return entity;
    }
}
