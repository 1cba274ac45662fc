package com.cloudgov.domain.hierarchy.service;

import com.cloudgov.domain.hierarchy.model.aggregate.HierarchyTreeAggregate;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.CidrInfo;
import com.cloudgov.domain.hierarchy.model.valobj.HierarchyLevelDef;
import com.cloudgov.domain.hierarchy.model.valobj.ProviderHierarchy;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyEntry;
import com.cloudgov.domain.hierarchy.model.valobj.ValidationCheck;
import com.cloudgov.types.common.Constants;
import com.cloudgov.types.enums.ValidationStatusEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 层级树完整性校验领域服务。
 * <p>
 * 逐节点产出 key 为 {@code <checkKey>:node:<nodeId>} 的校验项，便于回挂到节点；
 * 最后追加一条汇总项 {@code hierarchy}。只有 error 级别的项会阻断落库。
 * </p>
 */
@Service
public class HierarchyIntegrityDomainService {

    public static final String CHECK_UNDECLARED_LEVEL = "hierarchy_undeclared_level";
    public static final String CHECK_ROOT_TYPE = "hierarchy_root_type";
    public static final String CHECK_ORPHAN = "hierarchy_orphan";
    public static final String CHECK_CYCLE = "hierarchy_cycle";
    public static final String CHECK_STRUCTURE = "hierarchy_structure";
    public static final String CHECK_IPAM_INVALID = "ipam_invalid";
    public static final String CHECK_IPAM_CONTAINMENT = "ipam_containment";
    public static final String CHECK_IPAM_SIBLING_OVERLAP = "ipam_sibling_overlap";
    public static final String CHECK_TAG_DUPLICATE = "tag_policy_duplicate";
    public static final String CHECK_TAG_CONFLICT = "tag_policy_conflict";
    public static final String CHECK_SUMMARY = "hierarchy";

    private final TagPolicyResolveDomainService tagPolicyResolveDomainService;

    public HierarchyIntegrityDomainService(TagPolicyResolveDomainService tagPolicyResolveDomainService) {
        this.tagPolicyResolveDomainService = tagPolicyResolveDomainService;
    }

    public List<ValidationCheck> check(HierarchyTreeAggregate tree, ProviderHierarchy schema) {
        List<ValidationCheck> checks = new ArrayList<>();
        if (tree != null && schema != null) {
            for (HierarchyNodeEntity node : tree.nodes()) {
                checkStructure(node, tree, schema, checks);
                checkIpam(node, tree, checks);
                checkTagPolicies(node, tree, checks);
            }
        }
        checks.add(summary(checks));
        return checks;
    }

    /**
     * 是否存在 error 级别的校验项。
     */
    public boolean hasErrors(List<ValidationCheck> checks) {
        if (checks == null) {
            return false;
        }
        for (ValidationCheck check : checks) {
            if (check != null && check.isError()) {
                return true;
            }
        }
        return false;
    }

    private void checkStructure(HierarchyNodeEntity node,
                                HierarchyTreeAggregate tree,
                                ProviderHierarchy schema,
                                List<ValidationCheck> checks) {
        String label = displayName(node);
        HierarchyLevelDef level = schema.findLevel(node.getTypeId());
        if (level == null) {
            checks.add(error(CHECK_UNDECLARED_LEVEL, node, "层级类型",
                    label + " 的类型 " + node.getTypeId() + " 未在 " + schema.getProviderName() + " 中声明"));
        }
        if (node.isRoot()) {
            if (!schema.isRootType(node.getTypeId())) {
                checks.add(error(CHECK_ROOT_TYPE, node, "根节点类型",
                        label + " 没有父节点，但类型不是根类型 " + schema.getRootType()));
            }
            return;
        }
        HierarchyNodeEntity parent = tree.findById(node.getParentId());
        if (parent == null) {
            checks.add(error(CHECK_ORPHAN, node, "父节点引用",
                    label + " 的父节点 " + node.getParentId() + " 不存在"));
            return;
        }
        if (tree.isInCycle(node.getId())) {
            checks.add(error(CHECK_CYCLE, node, "层级环",
                    label + " 的祖先链形成环"));
            return;
        }
        HierarchyLevelDef parentLevel = schema.findLevel(parent.getTypeId());
        if (level != null && parentLevel != null && !parentLevel.allowsChild(node.getTypeId())) {
            checks.add(error(CHECK_STRUCTURE, node, "层级结构",
                    level.getLabel() + " " + label + " 不能放在 " + parentLevel.getLabel() + " " + displayName(parent) + " 之下"));
        }
    }

    private void checkIpam(HierarchyNodeEntity node, HierarchyTreeAggregate tree, List<ValidationCheck> checks) {
        String rawCidr = node.readCidr();
        if (rawCidr == null) {
            return;
        }
        CidrInfo info = CidrArithmeticService.parseCidr(rawCidr);
        if (!info.valid()) {
            checks.add(check(CHECK_IPAM_INVALID, node, "地址规划", ValidationStatusEnum.WARNING,
                    displayName(node) + " 的 CIDR " + rawCidr + " 不是有效的 IPv4 CIDR"));
            return;
        }
        if (!node.isRoot()) {
            HierarchyNodeEntity parent = tree.findById(node.getParentId());
            CidrInfo parentInfo = parent == null ? CidrInfo.INVALID : CidrArithmeticService.parseCidr(parent.readCidr());
            if (parentInfo.valid() && !CidrArithmeticService.contains(parentInfo, info)) {
                checks.add(error(CHECK_IPAM_CONTAINMENT, node, "地址包含",
                        displayName(node) + " 的 " + info.notation() + " 不在父节点 " + displayName(parent)
                                + " 的 " + parentInfo.notation() + " 范围内"));
            }
        }
        for (HierarchyNodeEntity sibling : earlierSiblings(node, tree)) {
            CidrInfo siblingInfo = CidrArithmeticService.parseCidr(sibling.readCidr());
            if (CidrArithmeticService.overlaps(siblingInfo, info)) {
                checks.add(error(CHECK_IPAM_SIBLING_OVERLAP, node, "同级地址重叠",
                        displayName(node) + " 的 " + info.notation() + " 与同级 " + displayName(sibling)
                                + " 的 " + siblingInfo.notation() + " 重叠"));
                break;
            }
        }
    }

    private void checkTagPolicies(HierarchyNodeEntity node, HierarchyTreeAggregate tree, List<ValidationCheck> checks) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicated = new LinkedHashSet<>();
        for (TagPolicyEntry entry : node.readTagPolicies()) {
            if (!entry.markedInherited() && !seen.add(entry.getTagKey())) {
                duplicated.add(entry.getTagKey());
            }
        }
        if (!duplicated.isEmpty()) {
            checks.add(check(CHECK_TAG_DUPLICATE, node, "标签策略重复", ValidationStatusEnum.WARNING,
                    displayName(node) + " 重复声明了标签 " + String.join(", ", duplicated)));
        }
        Set<String> conflicts = tagPolicyResolveDomainService.conflictingKeys(
                tagPolicyResolveDomainService.resolve(node, tree.nodes()));
        if (!conflicts.isEmpty()) {
            checks.add(check(CHECK_TAG_CONFLICT, node, "标签策略冲突", ValidationStatusEnum.WARNING,
                    displayName(node) + " 本地声明的标签 " + String.join(", ", conflicts) + " 与祖先继承的策略同名"));
        }
    }

    private List<HierarchyNodeEntity> earlierSiblings(HierarchyNodeEntity node, HierarchyTreeAggregate tree) {
        List<HierarchyNodeEntity> siblings = node.isRoot() ? tree.roots() : tree.childrenOf(node.getParentId());
        List<HierarchyNodeEntity> earlier = new ArrayList<>();
        for (HierarchyNodeEntity sibling : siblings) {
            if (sibling.getId().equals(node.getId())) {
                break;
            }
            earlier.add(sibling);
        }
        return earlier;
    }

    private ValidationCheck summary(List<ValidationCheck> checks) {
        int errorCount = 0;
        for (ValidationCheck check : checks) {
            if (check.isError()) {
                errorCount++;
            }
        }
        if (errorCount == 0) {
            return new ValidationCheck(CHECK_SUMMARY, "层级树完整性", ValidationStatusEnum.OK, "层级树结构完整");
        }
        return new ValidationCheck(CHECK_SUMMARY, "层级树完整性", ValidationStatusEnum.ERROR,
                "层级树存在 " + errorCount + " 个错误");
    }

    private ValidationCheck error(String checkKey, HierarchyNodeEntity node, String label, String message) {
        return check(checkKey, node, label, ValidationStatusEnum.ERROR, message);
    }

    private ValidationCheck check(String checkKey,
                                  HierarchyNodeEntity node,
                                  String label,
                                  ValidationStatusEnum status,
                                  String message) {
        return new ValidationCheck(checkKey + ":" + Constants.NODE_KEY_PREFIX + node.getId(), label, status, message);
    }

    private String displayName(HierarchyNodeEntity node) {
        if (node == null) {
            return "";
        }
        return node.getLabel() == null || node.getLabel().isEmpty() ? node.getId() : node.getLabel();
    }
}
