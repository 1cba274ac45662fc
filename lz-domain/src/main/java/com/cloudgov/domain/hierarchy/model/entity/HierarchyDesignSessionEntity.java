package com.cloudgov.domain.hierarchy.model.entity;

import com.cloudgov.domain.hierarchy.model.aggregate.HierarchyTreeAggregate;
import com.cloudgov.domain.hierarchy.model.valobj.NodeSelection;
import com.cloudgov.domain.hierarchy.model.valobj.ProviderHierarchy;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 层级设计会话领域实体：一个 Landing Zone 同一时刻只有一个写入者。
 */
@Data
public class HierarchyDesignSessionEntity {

    /**
     * Landing Zone ID
     */
    private String zoneId;

    /**
     * 当前会话使用的云厂商层级定义
     */
    private ProviderHierarchy providerHierarchy;

    /**
     * 层级树
     */
    private HierarchyTreeAggregate tree = new HierarchyTreeAggregate();

    /**
     * 当前选中状态
     */
    private NodeSelection selection = NodeSelection.none();

    /**
     * 最近一次校验映射到节点上的消息
     */
    private Map<String, List<String>> nodeValidationErrors = new LinkedHashMap<>();

    /**
     * 修订号，每次变更递增
     */
    private long revision;

    /**
     * 会话打开时间
     */
    private LocalDateTime openedAt;

    /**
     * 最近修改时间
     */
    private LocalDateTime updatedAt;

    /**
     * 打开会话
     */
    public static HierarchyDesignSessionEntity open(String zoneId, ProviderHierarchy providerHierarchy) {
        if (zoneId == null || zoneId.trim().isEmpty()) {
            throw new IllegalStateException("Zone id cannot be empty");
        }
        if (providerHierarchy == null) {
            throw new IllegalStateException("Provider hierarchy cannot be null");
        }
        HierarchyDesignSessionEntity session = new HierarchyDesignSessionEntity();
        session.setZoneId(zoneId.trim());
        session.setProviderHierarchy(providerHierarchy);
        session.setOpenedAt(LocalDateTime.now());
        session.setUpdatedAt(session.getOpenedAt());
        return session;
    }

    public String providerName() {
        return providerHierarchy == null ? null : providerHierarchy.getProviderName();
    }

    /**
     * 记录一次变更
     */
    public void touch() {
        this.revision++;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 选中节点已不存在时回退为未选中
     */
    public void reconcileSelection() {
        String selectedId = selection == null ? null : selection.nodeIdOrNull();
        if (selectedId != null && !tree.contains(selectedId)) {
            this.selection = NodeSelection.none();
        }
    }
}
