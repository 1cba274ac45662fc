package com.cloudgov.domain.hierarchy.service;

import com.cloudgov.domain.hierarchy.model.aggregate.HierarchyTreeAggregate;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.HierarchyLevelDef;
import com.cloudgov.domain.hierarchy.model.valobj.NodeSelection;
import com.cloudgov.domain.hierarchy.model.valobj.PlacementOption;
import com.cloudgov.domain.hierarchy.model.valobj.ProviderHierarchy;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 层级放置约束领域服务。
 * <p>
 * 未选中：只允许添加根类型。已选中：选中节点的层级定义必须允许该子类型；
 * 选中节点不存在或其类型未声明时一律拒绝。
 * </p>
 */
@Service
public class HierarchyPlacementDomainService {

    public boolean canPlace(String levelTypeId,
                            NodeSelection selection,
                            HierarchyTreeAggregate tree,
                            ProviderHierarchy schema) {
        if (levelTypeId == null || schema == null) {
            return false;
        }
        if (selection instanceof NodeSelection.Selected selected) {
            HierarchyNodeEntity selectedNode = tree == null ? null : tree.findById(selected.nodeId());
            if (selectedNode == null) {
                return false;
            }
            HierarchyLevelDef parentDef = schema.findLevel(selectedNode.getTypeId());
            return parentDef != null && parentDef.allowsChild(levelTypeId);
        }
        return schema.isRootType(levelTypeId);
    }

    /**
     * 生成层级面板：每个层级的可放置状态与提示。
     */
    public List<PlacementOption> palette(NodeSelection selection,
                                         HierarchyTreeAggregate tree,
                                         ProviderHierarchy schema) {
        List<PlacementOption> options = new ArrayList<>();
        if (schema == null) {
            return options;
        }
        boolean selected = selection instanceof NodeSelection.Selected;
        for (HierarchyLevelDef level : schema.getLevels()) {
            boolean placeable = canPlace(level.getTypeId(), selection, tree, schema);
            options.add(new PlacementOption(level, placeable, hint(level, placeable, selected)));
        }
        return options;
    }

    private String hint(HierarchyLevelDef level, boolean placeable, boolean selected) {
        if (placeable) {
            return selected
                    ? "添加 " + level.getLabel() + " 作为选中节点的子节点"
                    : "添加 " + level.getLabel() + " 作为根节点";
        }
        if (!selected) {
            return "请先选中一个节点，或该层级必须为根类型";
        }
        return level.getLabel() + " 不能作为选中节点类型的子节点";
    }
}
