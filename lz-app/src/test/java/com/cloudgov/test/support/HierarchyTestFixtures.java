package com.cloudgov.test.support;

import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.HierarchyLevelDef;
import com.cloudgov.domain.hierarchy.model.valobj.ProviderHierarchy;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyEntry;
import com.cloudgov.domain.hierarchy.service.HierarchyIntegrityDomainService;
import com.cloudgov.domain.hierarchy.service.HierarchyNodeEditorDomainService;
import com.cloudgov.domain.hierarchy.service.HierarchyPlacementDomainService;
import com.cloudgov.domain.hierarchy.service.NamingTemplateDomainService;
import com.cloudgov.domain.hierarchy.service.NodeValidationMapperDomainService;
import com.cloudgov.domain.hierarchy.service.TagPolicyResolveDomainService;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 层级测试数据构造。
 */
public final class HierarchyTestFixtures {

    private HierarchyTestFixtures() {
    }

    /**
     * 最小两级结构：org -> ou。
     */
    public static ProviderHierarchy orgOuSchema() {
        return new ProviderHierarchy("test", "org", List.of(
                HierarchyLevelDef.builder().typeId("org").label("Org").allowedChildren(List.of("ou")).build(),
                HierarchyLevelDef.builder().typeId("ou").label("OU").allowedChildren(List.of()).build()
        ));
    }

    public static ProviderHierarchy awsSchema() {
        return new ProviderHierarchy("aws", "organization", List.of(
                level("organization", "Organization", List.of("ou"), false, false),
                level("ou", "Organizational Unit", List.of("ou", "account"), false, false),
                level("account", "Account", List.of("vpc"), false, true),
                level("vpc", "VPC", List.of("subnet"), true, false),
                level("subnet", "Subnet", List.of(), true, false)
        ));
    }

    public static HierarchyNodeEntity node(String id, String parentId, String typeId, String label) {
        HierarchyNodeEntity node = new HierarchyNodeEntity();
        node.setId(id);
        node.setParentId(parentId);
        node.setTypeId(typeId);
        node.setLabel(label);
        return node;
    }

    public static HierarchyNodeEntity withCidr(HierarchyNodeEntity node, String cidr) {
        Map<String, Object> ipam = new LinkedHashMap<>();
        ipam.put("cidr", cidr);
        node.getProperties().put("ipam", ipam);
        return node;
    }

    public static HierarchyNodeEntity withTags(HierarchyNodeEntity node, TagPolicyEntry... entries) {
        List<Map<String, Object>> stored = new ArrayList<>();
        for (TagPolicyEntry entry : entries) {
            Map<String, Object> map = entry.toStorageMap();
            if (entry.markedInherited()) {
                map.put("inherited", true);
                map.put("inheritedFrom", entry.getInheritedFrom());
            }
            stored.add(map);
        }
        node.getProperties().put("tagPolicies", stored);
        return node;
    }

    public static TagPolicyEntry tag(String key, String defaultValue) {
        TagPolicyEntry entry = new TagPolicyEntry();
        entry.setTagKey(key);
        entry.setDisplayName(key);
        entry.setIsRequired(true);
        entry.setDefaultValue(defaultValue);
        return entry;
    }

    public static HierarchyNodeEditorDomainService newEditorDomainService() {
        TagPolicyResolveDomainService tagPolicyResolveDomainService = new TagPolicyResolveDomainService();
        return new HierarchyNodeEditorDomainService(
                new HierarchyPlacementDomainService(),
                tagPolicyResolveDomainService,
                new NamingTemplateDomainService(),
                new NodeValidationMapperDomainService(),
                new HierarchyIntegrityDomainService(tagPolicyResolveDomainService));
    }

    private static HierarchyLevelDef level(String typeId,
                                           String label,
                                           List<String> allowedChildren,
                                           boolean supportsIpam,
                                           boolean supportsEnvironment) {
        return HierarchyLevelDef.builder()
                .typeId(typeId)
                .label(label)
                .icon("folder")
                .allowedChildren(allowedChildren)
                .supportsTags(true)
                .supportsIpam(supportsIpam)
                .supportsEnvironment(supportsEnvironment)
                .build();
    }
}
