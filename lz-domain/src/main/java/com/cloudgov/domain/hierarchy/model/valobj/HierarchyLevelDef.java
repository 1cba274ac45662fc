package com.cloudgov.domain.hierarchy.model.valobj;

import com.google.common.collect.ImmutableSet;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;

/**
 * 层级定义值对象：云厂商下的一种节点类型及其放置规则与能力。
 * <p>
 * 在一次设计会话内不可变，按云厂商加载一次。
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class HierarchyLevelDef {

    /** 类型标识，如 account、vpc */
    private final String typeId;

    /** 展示名 */
    private final String label;

    /** 图标标识 */
    private final String icon;

    /** 允许作为子节点的类型标识 */
    private final ImmutableSet<String> allowedChildren;

    /** 是否支持标签策略 */
    private final boolean supportsTags;

    /** 是否支持 IPAM 地址规划 */
    private final boolean supportsIpam;

    /** 是否支持环境标识 */
    private final boolean supportsEnvironment;

    @Builder
    private HierarchyLevelDef(String typeId,
                              String label,
                              String icon,
                              Collection<String> allowedChildren,
                              boolean supportsTags,
                              boolean supportsIpam,
                              boolean supportsEnvironment) {
        if (typeId == null || typeId.trim().isEmpty()) {
            throw new IllegalArgumentException("Level typeId cannot be empty");
        }
        this.typeId = typeId.trim();
        this.label = label == null || label.trim().isEmpty() ? this.typeId : label.trim();
        this.icon = icon;
        this.allowedChildren = allowedChildren == null ? ImmutableSet.of() : ImmutableSet.copyOf(allowedChildren);
        this.supportsTags = supportsTags;
        this.supportsIpam = supportsIpam;
        this.supportsEnvironment = supportsEnvironment;
    }

    public boolean allowsChild(String childTypeId) {
        return childTypeId != null && allowedChildren.contains(childTypeId);
    }
}
