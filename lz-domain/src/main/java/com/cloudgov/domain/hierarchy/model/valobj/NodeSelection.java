package com.cloudgov.domain.hierarchy.model.valobj;

/**
 * 设计器当前选中状态：未选中 或 选中某个节点。
 */
public sealed interface NodeSelection permits NodeSelection.None, NodeSelection.Selected {

    None NONE = new None();

    static NodeSelection none() {
        return NONE;
    }

    static NodeSelection of(String nodeId) {
        if (nodeId == null || nodeId.trim().isEmpty()) {
            return NONE;
        }
        return new Selected(nodeId.trim());
    }

    /**
     * 选中节点 ID，未选中返回 null。
     */
    default String nodeIdOrNull() {
        if (this instanceof Selected selected) {
            return selected.nodeId();
        }
        return null;
    }

    record None() implements NodeSelection {
    }

    record Selected(String nodeId) implements NodeSelection {
    }
}
