package com.cloudgov.domain.hierarchy.model.valobj;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 云厂商层级结构值对象：唯一根类型 + 有序层级定义。
 */
@Getter
@ToString(exclude = "levelIndex")
@EqualsAndHashCode(exclude = "levelIndex")
public final class ProviderHierarchy {

    private final String providerName;
    private final String rootType;
    private final ImmutableList<HierarchyLevelDef> levels;
    private final ImmutableMap<String, HierarchyLevelDef> levelIndex;

    public ProviderHierarchy(String providerName, String rootType, List<HierarchyLevelDef> levels) {
        if (providerName == null || providerName.trim().isEmpty()) {
            throw new IllegalArgumentException("Provider name cannot be empty");
        }
        if (levels == null || levels.isEmpty()) {
            throw new IllegalArgumentException("Provider hierarchy levels cannot be empty: " + providerName);
        }
        ImmutableMap.Builder<String, HierarchyLevelDef> index = ImmutableMap.builder();
        for (HierarchyLevelDef level : levels) {
            index.put(level.getTypeId(), level);
        }
        this.providerName = providerName.trim().toLowerCase();
        this.rootType = rootType;
        this.levels = ImmutableList.copyOf(levels);
        this.levelIndex = index.buildOrThrow();
        if (!levelIndex.containsKey(rootType)) {
            throw new IllegalArgumentException("Root type " + rootType + " is not a declared level of " + providerName);
        }
    }

    /**
     * 按类型标识查找层级定义，未声明返回 null。
     */
    public HierarchyLevelDef findLevel(String typeId) {
        return typeId == null ? null : levelIndex.get(typeId);
    }

    public boolean isDeclared(String typeId) {
        return findLevel(typeId) != null;
    }

    public boolean isRootType(String typeId) {
        return rootType.equals(typeId);
    }

    /**
     * 返回父类型允许的子层级定义，按层级声明顺序排列。
     */
    public List<HierarchyLevelDef> allowedChildren(String parentTypeId) {
        HierarchyLevelDef parent = findLevel(parentTypeId);
        if (parent == null) {
            return List.of();
        }
        return levels.stream()
                .filter(level -> parent.allowsChild(level.getTypeId()))
                .collect(Collectors.toList());
    }
}
