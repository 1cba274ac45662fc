package com.cloudgov.domain.hierarchy.service;

import com.cloudgov.domain.hierarchy.model.aggregate.HierarchyTreeAggregate;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyDesignSessionEntity;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.CidrInfo;
import com.cloudgov.domain.hierarchy.model.valobj.HierarchyLevelDef;
import com.cloudgov.domain.hierarchy.model.valobj.IntegrityReport;
import com.cloudgov.domain.hierarchy.model.valobj.IpamSummary;
import com.cloudgov.domain.hierarchy.model.valobj.NamingContext;
import com.cloudgov.domain.hierarchy.model.valobj.NodeSelection;
import com.cloudgov.domain.hierarchy.model.valobj.PlacementOption;
import com.cloudgov.domain.hierarchy.model.valobj.ProviderHierarchy;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyEntry;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyResolution;
import com.cloudgov.domain.hierarchy.model.valobj.ValidationCheck;
import com.cloudgov.types.common.Constants;
import com.cloudgov.types.enums.EnvironmentDesignationEnum;
import com.cloudgov.types.enums.ResponseCode;
import com.cloudgov.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 节点编辑领域服务：在设计会话上执行全部结构性变更。
 * <p>
 * 所有放置、引用、能力约束在修改树之前检查，违规时抛出 {@link AppException}，树保持不变。
 * 每次成功变更递增会话修订号。
 * </p>
 */
@Service
public class HierarchyNodeEditorDomainService {

    private final HierarchyPlacementDomainService placementDomainService;
    private final TagPolicyResolveDomainService tagPolicyResolveDomainService;
    private final NamingTemplateDomainService namingTemplateDomainService;
    private final NodeValidationMapperDomainService nodeValidationMapperDomainService;
    private final HierarchyIntegrityDomainService integrityDomainService;

    public HierarchyNodeEditorDomainService(HierarchyPlacementDomainService placementDomainService,
                                            TagPolicyResolveDomainService tagPolicyResolveDomainService,
                                            NamingTemplateDomainService namingTemplateDomainService,
                                            NodeValidationMapperDomainService nodeValidationMapperDomainService,
                                            HierarchyIntegrityDomainService integrityDomainService) {
        this.placementDomainService = placementDomainService;
        this.tagPolicyResolveDomainService = tagPolicyResolveDomainService;
        this.namingTemplateDomainService = namingTemplateDomainService;
        this.nodeValidationMapperDomainService = nodeValidationMapperDomainService;
        this.integrityDomainService = integrityDomainService;
    }

    // ---------------------------------------------------------------- 选中与放置

    public NodeSelection select(HierarchyDesignSessionEntity session, String nodeId) {
        NodeSelection selection = NodeSelection.of(nodeId);
        if (selection instanceof NodeSelection.Selected selected) {
            requireNode(session, selected.nodeId());
        }
        session.setSelection(selection);
        return selection;
    }

    public List<PlacementOption> palette(HierarchyDesignSessionEntity session) {
        return placementDomainService.palette(session.getSelection(), session.getTree(), session.getProviderHierarchy());
    }

    /**
     * 在当前选中节点下（未选中时作为根）添加一个层级节点，并选中新节点。
     */
    public HierarchyNodeEntity addLevel(HierarchyDesignSessionEntity session, String typeId) {
        ProviderHierarchy schema = session.getProviderHierarchy();
        HierarchyLevelDef levelDef = schema.findLevel(StringUtils.trimToNull(typeId));
        if (levelDef == null) {
            throw new AppException(ResponseCode.UNDECLARED_LEVEL.getCode(),
                    "层级类型 " + typeId + " 未在 " + schema.getProviderName() + " 中声明");
        }
        session.reconcileSelection();
        NodeSelection selection = session.getSelection();
        if (!placementDomainService.canPlace(levelDef.getTypeId(), selection, session.getTree(), schema)) {
            throw new AppException(ResponseCode.PLACEMENT_REJECTED.getCode(), placementRejectedMessage(session, levelDef));
        }
        HierarchyNodeEntity node = session.getTree().addNode(levelDef, selection.nodeIdOrNull());
        session.setSelection(NodeSelection.of(node.getId()));
        session.touch();
        return node;
    }

    // ---------------------------------------------------------------- 节点属性

    /**
     * 更新节点名称与属性。受能力约束的键（tagPolicies、ipam、environmentDesignation）
     * 与对应的专用操作执行相同的检查，全部通过后才改动节点。
     */
    public HierarchyNodeEntity updateNode(HierarchyDesignSessionEntity session,
                                          String nodeId,
                                          String label,
                                          Map<String, Object> partialProperties) {
        HierarchyNodeEntity node = requireNode(session, nodeId);
        Map<String, Object> partial = checkedPartialProperties(session, node, partialProperties);
        if (!partial.isEmpty() && session.getTree().updateNode(node.getId(), partial) == null) {
            throw nodeNotFound(nodeId);
        }
        if (label != null) {
            session.getTree().renameNode(node.getId(), label);
        }
        session.touch();
        return node;
    }

    /**
     * 级联删除节点及其全部后代，选中节点落在被删子树中时清空选中。
     *
     * @return 被删除的节点 ID，父节点在前
     */
    public List<String> removeNode(HierarchyDesignSessionEntity session, String nodeId) {
        HierarchyNodeEntity node = requireNode(session, nodeId);
        List<String> removedIds = session.getTree().subtreeIdsOf(node.getId());
        for (String removedId : removedIds) {
            session.getTree().removeNode(removedId);
            session.getNodeValidationErrors().remove(removedId);
        }
        session.reconcileSelection();
        session.touch();
        return removedIds;
    }

    /**
     * 添加本地标签策略；同 key 的已有本地条目被原位替换。
     */
    public HierarchyNodeEntity addTagPolicy(HierarchyDesignSessionEntity session, String nodeId, TagPolicyEntry entry) {
        HierarchyNodeEntity node = requireNode(session, nodeId);
        requireCapability(session, node, HierarchyLevelDef::isSupportsTags, "标签策略");
        if (entry == null || StringUtils.isBlank(entry.getTagKey())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "tagKey 不能为空");
        }
        TagPolicyEntry local = entry.localCopy();
        local.setTagKey(entry.getTagKey().trim());

        List<TagPolicyEntry> entries = new ArrayList<>();
        boolean replaced = false;
        for (TagPolicyEntry existing : node.readTagPolicies()) {
            if (existing.markedInherited()) {
                continue;
            }
            if (!replaced && local.getTagKey().equals(existing.getTagKey())) {
                entries.add(local);
                replaced = true;
            } else {
                entries.add(existing);
            }
        }
        if (!replaced) {
            entries.add(local);
        }
        node.writeTagPolicies(entries);
        session.touch();
        return node;
    }

    public HierarchyNodeEntity removeTagPolicy(HierarchyDesignSessionEntity session, String nodeId, String tagKey) {
        HierarchyNodeEntity node = requireNode(session, nodeId);
        String key = StringUtils.trimToEmpty(tagKey);
        List<TagPolicyEntry> entries = new ArrayList<>();
        for (TagPolicyEntry existing : node.readTagPolicies()) {
            if (!existing.markedInherited() && !key.equals(existing.getTagKey())) {
                entries.add(existing);
            }
        }
        node.writeTagPolicies(entries);
        session.touch();
        return node;
    }

    /**
     * 写入 CIDR。任意字符串原样保存以便编辑反馈，空白表示清除。
     */
    public HierarchyNodeEntity setCidr(HierarchyDesignSessionEntity session, String nodeId, String cidr) {
        HierarchyNodeEntity node = requireNode(session, nodeId);
        requireCapability(session, node, HierarchyLevelDef::isSupportsIpam, "IPAM 地址规划");
        node.writeNestedText(Constants.PROP_IPAM, Constants.PROP_IPAM_CIDR, StringUtils.isBlank(cidr) ? null : cidr.trim());
        session.touch();
        return node;
    }

    public HierarchyNodeEntity setNamingTemplate(HierarchyDesignSessionEntity session, String nodeId, String template) {
        HierarchyNodeEntity node = requireNode(session, nodeId);
        node.writeNestedText(Constants.PROP_NAMING_CONFIG, Constants.PROP_NAMING_TEMPLATE,
                StringUtils.isBlank(template) ? null : template);
        session.touch();
        return node;
    }

    /**
     * 设置环境标识，none 或空白表示清除。
     */
    public HierarchyNodeEntity setEnvironmentDesignation(HierarchyDesignSessionEntity session, String nodeId, String designation) {
        HierarchyNodeEntity node = requireNode(session, nodeId);
        requireCapability(session, node, HierarchyLevelDef::isSupportsEnvironment, "环境标识");
        EnvironmentDesignationEnum value = parseEnvironment(designation);
        Map<String, Object> partial = new LinkedHashMap<>();
        partial.put(Constants.PROP_ENVIRONMENT, value == EnvironmentDesignationEnum.NONE ? null : value.getCode());
        node.mergeProperties(partial);
        session.touch();
        return node;
    }

    // ---------------------------------------------------------------- 整树替换与校验

    /**
     * 整树替换（蓝图加载或后端重新同步），以最后一次调用为准。
     * 默认标签策略追加到尚未声明该 key 的每个根节点。
     */
    public HierarchyTreeAggregate replaceHierarchy(HierarchyDesignSessionEntity session,
                                                   List<HierarchyNodeEntity> nodes,
                                                   List<TagPolicyEntry> defaultTagPolicies) {
        ProviderHierarchy schema = session.getProviderHierarchy();
        List<HierarchyNodeEntity> incoming = nodes == null ? List.of() : nodes;
        for (HierarchyNodeEntity node : incoming) {
            if (node == null) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "节点不能为空");
            }
            if (!schema.isDeclared(node.getTypeId())) {
                throw new AppException(ResponseCode.UNDECLARED_LEVEL.getCode(),
                        "节点 " + node.getId() + " 的类型 " + node.getTypeId() + " 未在 " + schema.getProviderName() + " 中声明");
            }
            if (node.isRoot() && !schema.isRootType(node.getTypeId())) {
                throw new AppException(ResponseCode.HIERARCHY_INTEGRITY_VIOLATION.getCode(),
                        "节点 " + node.getId() + " 没有父节点，但类型不是根类型 " + schema.getRootType());
            }
        }
        for (HierarchyNodeEntity node : incoming) {
            node.dropInheritedTagPolicies();
        }
        HierarchyTreeAggregate replacement;
        try {
            replacement = new HierarchyTreeAggregate(incoming);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getMessage());
        }
        if (defaultTagPolicies != null && !defaultTagPolicies.isEmpty()) {
            for (HierarchyNodeEntity root : replacement.roots()) {
                applyDefaultTagPolicies(root, defaultTagPolicies);
            }
        }
        session.getTree().replaceAll(replacement.nodes());
        session.getNodeValidationErrors().clear();
        session.reconcileSelection();
        session.touch();
        return session.getTree();
    }

    /**
     * 外部校验结果回挂到节点，并保存到会话。
     */
    public Map<String, List<String>> applyValidation(HierarchyDesignSessionEntity session, List<ValidationCheck> checks) {
        Map<String, List<String>> nodeErrors = nodeValidationMapperDomainService.mapToNodes(checks);
        session.setNodeValidationErrors(nodeErrors);
        return nodeErrors;
    }

    public IntegrityReport runIntegrityCheck(HierarchyDesignSessionEntity session) {
        List<ValidationCheck> checks = integrityDomainService.check(session.getTree(), session.getProviderHierarchy());
        Map<String, List<String>> nodeErrors = applyValidation(session, checks);
        return new IntegrityReport(checks, nodeErrors, integrityDomainService.hasErrors(checks));
    }

    // ---------------------------------------------------------------- 只读派生

    public TagPolicyResolution resolveTagPolicies(HierarchyDesignSessionEntity session, String nodeId) {
        HierarchyNodeEntity node = requireNode(session, nodeId);
        return tagPolicyResolveDomainService.resolve(node, session.getTree().nodes());
    }

    public IpamSummary ipamSummary(HierarchyDesignSessionEntity session, String nodeId) {
        HierarchyNodeEntity node = requireNode(session, nodeId);
        CidrInfo info = CidrArithmeticService.parseCidr(node.readCidr());

        String parentCidr = null;
        boolean contained = true;
        HierarchyNodeEntity parent = node.isRoot() ? null : session.getTree().findById(node.getParentId());
        CidrInfo parentInfo = parent == null ? CidrInfo.INVALID : CidrArithmeticService.parseCidr(parent.readCidr());
        if (parentInfo.valid()) {
            parentCidr = parentInfo.notation();
            contained = !info.valid() || CidrArithmeticService.contains(parentInfo, info);
        }

        List<String> childCidrs = validChildCidrs(session.getTree(), node.getId());
        double utilization = info.valid() ? CidrArithmeticService.utilizationPercent(info.notation(), childCidrs) : 0D;
        return new IpamSummary(node.getId(), node.readCidr(), info,
                CidrArithmeticService.broadcastAddress(info), CidrArithmeticService.isPrivate(info),
                parentCidr, contained, childCidrs.size(), utilization);
    }

    /**
     * 在节点 CIDR 内为子节点建议下一个可用网段，无可用时返回 null。
     */
    public String suggestChildBlock(HierarchyDesignSessionEntity session, String nodeId, int prefix) {
        HierarchyNodeEntity node = requireNode(session, nodeId);
        requireCapability(session, node, HierarchyLevelDef::isSupportsIpam, "IPAM 地址规划");
        return CidrArithmeticService.nextAvailableBlock(node.readCidr(), validChildCidrs(session.getTree(), node.getId()), prefix);
    }

    /**
     * 命名预览，template 为空时使用节点存储的模板。
     */
    public String namingPreview(HierarchyDesignSessionEntity session,
                                String nodeId,
                                String template,
                                String sequence,
                                String region) {
        HierarchyNodeEntity node = requireNode(session, nodeId);
        String effectiveTemplate = template == null ? node.readNamingTemplate() : template;
        NamingContext context = new NamingContext(session.providerName(), node.readEnvironmentDesignation(),
                node.getTypeId(), node.getLabel(), sequence, region);
        return namingTemplateDomainService.render(effectiveTemplate, context);
    }

    public HierarchyNodeEntity requireNode(HierarchyDesignSessionEntity session, String nodeId) {
        HierarchyNodeEntity node = session.getTree().findById(nodeId);
        if (node == null) {
            throw nodeNotFound(nodeId);
        }
        return node;
    }

    private void requireCapability(HierarchyDesignSessionEntity session,
                                   HierarchyNodeEntity node,
                                   Predicate<HierarchyLevelDef> capability,
                                   String capabilityName) {
        HierarchyLevelDef level = session.getProviderHierarchy().findLevel(node.getTypeId());
        if (level == null) {
            throw new AppException(ResponseCode.UNDECLARED_LEVEL.getCode(), "层级类型 " + node.getTypeId() + " 未声明");
        }
        if (!capability.test(level)) {
            throw new AppException(ResponseCode.CAPABILITY_UNSUPPORTED.getCode(),
                    level.getLabel() + " 不支持" + capabilityName);
        }
    }

    private Map<String, Object> checkedPartialProperties(HierarchyDesignSessionEntity session,
                                                         HierarchyNodeEntity node,
                                                         Map<String, Object> partialProperties) {
        Map<String, Object> partial = new LinkedHashMap<>();
        if (partialProperties == null) {
            return partial;
        }
        partial.putAll(partialProperties);
        if (partial.get(Constants.PROP_TAG_POLICIES) != null) {
            requireCapability(session, node, HierarchyLevelDef::isSupportsTags, "标签策略");
        }
        if (partial.get(Constants.PROP_IPAM) != null) {
            requireCapability(session, node, HierarchyLevelDef::isSupportsIpam, "IPAM 地址规划");
        }
        if (partial.get(Constants.PROP_ENVIRONMENT) != null) {
            requireCapability(session, node, HierarchyLevelDef::isSupportsEnvironment, "环境标识");
            EnvironmentDesignationEnum value = parseEnvironment(String.valueOf(partial.get(Constants.PROP_ENVIRONMENT)));
            partial.put(Constants.PROP_ENVIRONMENT, value == EnvironmentDesignationEnum.NONE ? null : value.getCode());
        }
        return partial;
    }

    private EnvironmentDesignationEnum parseEnvironment(String designation) {
        if (StringUtils.isBlank(designation)) {
            return EnvironmentDesignationEnum.NONE;
        }
        try {
            return EnvironmentDesignationEnum.fromCode(designation);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "未知的环境标识: " + designation);
        }
    }

    private void applyDefaultTagPolicies(HierarchyNodeEntity root, List<TagPolicyEntry> defaults) {
        List<TagPolicyEntry> entries = new ArrayList<>();
        Set<String> keys = new HashSet<>();
        for (TagPolicyEntry existing : root.readTagPolicies()) {
            if (!existing.markedInherited()) {
                entries.add(existing);
                keys.add(existing.getTagKey());
            }
        }
        for (TagPolicyEntry entry : defaults) {
            if (entry != null && StringUtils.isNotBlank(entry.getTagKey()) && keys.add(entry.getTagKey())) {
                entries.add(entry.localCopy());
            }
        }
        root.writeTagPolicies(entries);
    }

    private List<String> validChildCidrs(HierarchyTreeAggregate tree, String nodeId) {
        List<String> cidrs = new ArrayList<>();
        for (HierarchyNodeEntity child : tree.childrenOf(nodeId)) {
            CidrInfo childInfo = CidrArithmeticService.parseCidr(child.readCidr());
            if (childInfo.valid()) {
                cidrs.add(childInfo.notation());
            }
        }
        return cidrs;
    }

    private String placementRejectedMessage(HierarchyDesignSessionEntity session, HierarchyLevelDef levelDef) {
        String selectedId = session.getSelection().nodeIdOrNull();
        if (selectedId == null) {
            return "未选中节点时只能添加根类型 " + session.getProviderHierarchy().getRootType();
        }
        HierarchyNodeEntity selected = session.getTree().findById(selectedId);
        String parentType = selected == null ? selectedId : selected.getTypeId();
        return levelDef.getLabel() + " 不能添加到 " + parentType + " 之下";
    }

    private AppException nodeNotFound(String nodeId) {
        return new AppException(ResponseCode.NODE_NOT_FOUND.getCode(), "节点不存在: " + nodeId);
    }
}
