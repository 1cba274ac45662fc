package com.cloudgov.domain.hierarchy.service;

import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyEntry;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyResolution;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 标签策略继承解析领域服务。
 * <p>
 * 自下而上沿 parentId 遍历祖先，每个祖先只贡献自身直接声明的策略；近祖先的同 key 策略遮蔽远祖先。
 * 本地策略与继承策略同 key 时两者都保留，交由治理评审处理冲突。
 * </p>
 */
@Service
public class TagPolicyResolveDomainService {

    public TagPolicyResolution resolve(HierarchyNodeEntity node, Collection<HierarchyNodeEntity> allNodes) {
        if (node == null) {
            return new TagPolicyResolution(List.of(), List.of(), List.of());
        }
        List<TagPolicyEntry> local = localPolicies(node);
        List<TagPolicyEntry> inherited = inheritedPolicies(node, indexById(allNodes));

        List<TagPolicyEntry> effective = new ArrayList<>(inherited.size() + local.size());
        effective.addAll(inherited);
        effective.addAll(local);
        return new TagPolicyResolution(List.copyOf(inherited), List.copyOf(local), List.copyOf(effective));
    }

    /**
     * 本地策略与继承策略同 key 的 tagKey 集合（按本地声明顺序）。
     */
    public Set<String> conflictingKeys(TagPolicyResolution resolution) {
        Set<String> conflicts = new LinkedHashSet<>();
        if (resolution == null) {
            return conflicts;
        }
        Set<String> inheritedKeys = new HashSet<>();
        for (TagPolicyEntry entry : resolution.inherited()) {
            inheritedKeys.add(entry.getTagKey());
        }
        for (TagPolicyEntry entry : resolution.local()) {
            if (inheritedKeys.contains(entry.getTagKey())) {
                conflicts.add(entry.getTagKey());
            }
        }
        return conflicts;
    }

    private List<TagPolicyEntry> localPolicies(HierarchyNodeEntity node) {
        List<TagPolicyEntry> local = new ArrayList<>();
        for (TagPolicyEntry entry : node.readTagPolicies()) {
            if (!entry.markedInherited()) {
                local.add(entry.localCopy());
            }
        }
        return local;
    }

    private List<TagPolicyEntry> inheritedPolicies(HierarchyNodeEntity node, Map<String, HierarchyNodeEntity> nodesById) {
        List<TagPolicyEntry> inherited = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();
        Set<String> visited = new HashSet<>();
        visited.add(node.getId());

        HierarchyNodeEntity current = node;
        while (!current.isRoot()) {
            HierarchyNodeEntity ancestor = nodesById.get(current.getParentId());
            if (ancestor == null || !visited.add(ancestor.getId())) {
                break;
            }
            for (TagPolicyEntry entry : ancestor.readTagPolicies()) {
                if (entry.markedInherited() || !seenKeys.add(entry.getTagKey())) {
                    continue;
                }
                inherited.add(entry.inheritedCopy(ancestor.getLabel()));
            }
            current = ancestor;
        }
        return inherited;
    }

    private Map<String, HierarchyNodeEntity> indexById(Collection<HierarchyNodeEntity> allNodes) {
        Map<String, HierarchyNodeEntity> index = new HashMap<>();
        if (allNodes == null) {
            return index;
        }
        for (HierarchyNodeEntity candidate : allNodes) {
            if (candidate != null && candidate.getId() != null) {
                index.putIfAbsent(candidate.getId(), candidate);
            }
        }
        return index;
    }
}
