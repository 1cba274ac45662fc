package com.cloudgov.domain.hierarchy.model.valobj;

/**
 * 层级面板项：某个层级在当前选中状态下能否添加，以及提示文案。
 */
public record PlacementOption(HierarchyLevelDef level,
                              boolean placeable,
                              String hint) {
}
