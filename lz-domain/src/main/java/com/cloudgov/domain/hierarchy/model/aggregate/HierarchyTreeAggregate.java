package com.cloudgov.domain.hierarchy.model.aggregate;

import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.HierarchyLevelDef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 层级树聚合：扁平节点集合 + parentId 指针 + 按 ID 索引。
 * <p>
 * 聚合本身不校验放置约束，调用方（节点编辑领域服务）在插入前负责检查。
 * 按 ID 读取 O(1)，子节点查询为线性扫描。祖先与子树遍历带访问集合保护，
 * 遇到环或悬挂的 parentId 时终止而不会死循环。
 * </p>
 */
public class HierarchyTreeAggregate {

    private final Map<String, HierarchyNodeEntity> nodeIndex = new LinkedHashMap<>();

    public HierarchyTreeAggregate() {
    }

    public HierarchyTreeAggregate(Collection<HierarchyNodeEntity> nodes) {
        replaceAll(nodes);
    }

    /**
     * 创建新节点，默认名称为 "New " + 层级展示名，属性为空。
     *
     * @param levelDef 层级定义
     * @param parentId 父节点 ID，为空表示根节点
     * @return 新节点
     */
    public HierarchyNodeEntity addNode(HierarchyLevelDef levelDef, String parentId) {
        if (levelDef == null) {
            throw new IllegalArgumentException("Level definition cannot be null");
        }
        String normalizedParentId = normalizeId(parentId);
        if (normalizedParentId != null && !nodeIndex.containsKey(normalizedParentId)) {
            throw new IllegalArgumentException("Parent node does not exist: " + normalizedParentId);
        }
        HierarchyNodeEntity node = new HierarchyNodeEntity();
        node.setId(UUID.randomUUID().toString());
        node.setParentId(normalizedParentId);
        node.setTypeId(levelDef.getTypeId());
        node.setLabel("New " + levelDef.getLabel());
        nodeIndex.put(node.getId(), node);
        return node;
    }

    /**
     * 合并更新节点属性。
     *
     * @return 更新后的节点；ID 不存在时不做任何修改并返回 null
     */
    public HierarchyNodeEntity updateNode(String id, Map<String, Object> partialProperties) {
        HierarchyNodeEntity node = findById(id);
        if (node == null) {
            return null;
        }
        node.mergeProperties(partialProperties);
        return node;
    }

    /**
     * 修改节点名称，ID 不存在时返回 null。
     */
    public HierarchyNodeEntity renameNode(String id, String label) {
        HierarchyNodeEntity node = findById(id);
        if (node == null) {
            return null;
        }
        node.setLabel(label);
        return node;
    }

    /**
     * 仅移除指定节点，不级联；其子节点的 parentId 将悬挂。
     *
     * @return 是否移除成功
     */
    public boolean removeNode(String id) {
        String key = normalizeId(id);
        return key != null && nodeIndex.remove(key) != null;
    }

    /**
     * 整树原子替换（蓝图加载或后端重新同步），以最后一次调用为准。
     */
    public void replaceAll(Collection<HierarchyNodeEntity> nodes) {
        Map<String, HierarchyNodeEntity> replacement = new LinkedHashMap<>();
        if (nodes != null) {
            for (HierarchyNodeEntity node : nodes) {
                if (node == null || normalizeId(node.getId()) == null) {
                    throw new IllegalArgumentException("Hierarchy node id cannot be empty");
                }
                HierarchyNodeEntity copy = node.copy();
                copy.setId(normalizeId(node.getId()));
                copy.setParentId(normalizeId(node.getParentId()));
                if (replacement.put(copy.getId(), copy) != null) {
                    throw new IllegalArgumentException("Duplicate hierarchy node id: " + copy.getId());
                }
            }
        }
        nodeIndex.clear();
        nodeIndex.putAll(replacement);
    }

    public HierarchyNodeEntity findById(String id) {
        String key = normalizeId(id);
        return key == null ? null : nodeIndex.get(key);
    }

    public boolean contains(String id) {
        return findById(id) != null;
    }

    public int size() {
        return nodeIndex.size();
    }

    /**
     * 按插入顺序返回全部节点（只读视图）。
     */
    public List<HierarchyNodeEntity> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodeIndex.values()));
    }

    public List<HierarchyNodeEntity> roots() {
        List<HierarchyNodeEntity> roots = new ArrayList<>();
        for (HierarchyNodeEntity node : nodeIndex.values()) {
            if (node.isRoot()) {
                roots.add(node);
            }
        }
        return roots;
    }

    public List<HierarchyNodeEntity> childrenOf(String id) {
        String key = normalizeId(id);
        List<HierarchyNodeEntity> children = new ArrayList<>();
        if (key == null) {
            return children;
        }
        for (HierarchyNodeEntity node : nodeIndex.values()) {
            if (key.equals(node.getParentId())) {
                children.add(node);
            }
        }
        return children;
    }

    /**
     * 祖先链，最近的祖先在前。遇到悬挂的 parentId 或重复访问时停止。
     */
    public List<HierarchyNodeEntity> ancestorsOf(String id) {
        List<HierarchyNodeEntity> ancestors = new ArrayList<>();
        HierarchyNodeEntity current = findById(id);
        if (current == null) {
            return ancestors;
        }
        Set<String> visited = new HashSet<>();
        visited.add(current.getId());
        while (!current.isRoot()) {
            HierarchyNodeEntity parent = nodeIndex.get(current.getParentId());
            if (parent == null || !visited.add(parent.getId())) {
                break;
            }
            ancestors.add(parent);
            current = parent;
        }
        return ancestors;
    }

    /**
     * 节点是否处于 parentId 环中（自身可经祖先链回到自身）。
     */
    public boolean isInCycle(String id) {
        HierarchyNodeEntity start = findById(id);
        if (start == null) {
            return false;
        }
        Set<String> visited = new HashSet<>();
        HierarchyNodeEntity current = start;
        while (current != null && !current.isRoot()) {
            if (!visited.add(current.getId())) {
                return false;
            }
            HierarchyNodeEntity parent = nodeIndex.get(current.getParentId());
            if (parent != null && parent.getId().equals(start.getId())) {
                return true;
            }
            current = parent;
        }
        return false;
    }

    /**
     * 以指定节点为根的子树 ID（含自身），广度优先，父节点在子节点之前。
     */
    public List<String> subtreeIdsOf(String id) {
        List<String> result = new ArrayList<>();
        HierarchyNodeEntity root = findById(id);
        if (root == null) {
            return result;
        }
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(root.getId());
        visited.add(root.getId());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(current);
            for (HierarchyNodeEntity child : childrenOf(current)) {
                if (visited.add(child.getId())) {
                    queue.add(child.getId());
                }
            }
        }
        return result;
    }

    /**
     * 导出节点副本，供持久化或外部展示使用。
     */
    public List<HierarchyNodeEntity> snapshot() {
        List<HierarchyNodeEntity> copies = new ArrayList<>();
        for (HierarchyNodeEntity node : nodeIndex.values()) {
            copies.add(node.copy());
        }
        return copies;
    }

    private static String normalizeId(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
