package com.cloudgov.trigger.application.common;

import com.cloudgov.api.dto.CidrInfoDTO;
import com.cloudgov.api.dto.HierarchyLevelDTO;
import com.cloudgov.api.dto.HierarchyNodeDTO;
import com.cloudgov.api.dto.HierarchyViewDTO;
import com.cloudgov.api.dto.IntegrityCheckResultDTO;
import com.cloudgov.api.dto.IpamSummaryDTO;
import com.cloudgov.api.dto.PlacementOptionDTO;
import com.cloudgov.api.dto.ProviderHierarchyDTO;
import com.cloudgov.api.dto.TagPolicyDTO;
import com.cloudgov.api.dto.TagPolicyResolutionDTO;
import com.cloudgov.api.dto.ValidationCheckDTO;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyDesignSessionEntity;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.CidrInfo;
import com.cloudgov.domain.hierarchy.model.valobj.HierarchyLevelDef;
import com.cloudgov.domain.hierarchy.model.valobj.IntegrityReport;
import com.cloudgov.domain.hierarchy.model.valobj.IpamSummary;
import com.cloudgov.domain.hierarchy.model.valobj.PlacementOption;
import com.cloudgov.domain.hierarchy.model.valobj.ProviderHierarchy;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyEntry;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyResolution;
import com.cloudgov.domain.hierarchy.model.valobj.ValidationCheck;
import com.cloudgov.domain.hierarchy.service.CidrArithmeticService;
import com.cloudgov.types.enums.ResponseCode;
import com.cloudgov.types.enums.ValidationStatusEnum;
import com.cloudgov.types.exception.AppException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 层级设计视图组装器：领域对象与 DTO 之间的双向映射。
 */
@Component
public class HierarchyViewAssembler {

    public HierarchyViewDTO toHierarchyView(HierarchyDesignSessionEntity session) {
        HierarchyViewDTO dto = new HierarchyViewDTO();
        dto.setZoneId(session.getZoneId());
        dto.setProviderName(session.providerName());
        dto.setRootType(session.getProviderHierarchy().getRootType());
        dto.setRevision(session.getRevision());
        dto.setSelectedNodeId(session.getSelection().nodeIdOrNull());
        dto.setNodes(toNodeDTOs(session.getTree().nodes()));
        dto.setNodeErrors(copyNodeErrors(session.getNodeValidationErrors()));
        dto.setUpdatedAt(session.getUpdatedAt());
        return dto;
    }

    public List<HierarchyNodeDTO> toNodeDTOs(List<HierarchyNodeEntity> nodes) {
        List<HierarchyNodeDTO> result = new ArrayList<>();
        if (nodes == null) {
            return result;
        }
        for (HierarchyNodeEntity node : nodes) {
            result.add(toNodeDTO(node));
        }
        return result;
    }

    public HierarchyNodeDTO toNodeDTO(HierarchyNodeEntity node) {
        if (node == null) {
            return null;
        }
        HierarchyNodeEntity copy = node.copy();
        HierarchyNodeDTO dto = new HierarchyNodeDTO();
        dto.setId(copy.getId());
        dto.setParentId(copy.getParentId());
        dto.setTypeId(copy.getTypeId());
        dto.setLabel(copy.getLabel());
        dto.setProperties(copy.getProperties());
        return dto;
    }

    public List<HierarchyNodeEntity> toNodeEntities(List<HierarchyNodeDTO> nodes) {
        List<HierarchyNodeEntity> result = new ArrayList<>();
        if (nodes == null) {
            return result;
        }
        for (HierarchyNodeDTO dto : nodes) {
            if (dto == null) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "节点不能为空");
            }
            HierarchyNodeEntity entity = new HierarchyNodeEntity();
            entity.setId(dto.getId());
            entity.setParentId(dto.getParentId());
            entity.setTypeId(dto.getTypeId());
            entity.setLabel(dto.getLabel());
            entity.setProperties(new LinkedHashMap<>());
            entity.mergeProperties(dto.getProperties());
            result.add(entity);
        }
        return result;
    }

    public ProviderHierarchyDTO toProviderHierarchyDTO(ProviderHierarchy hierarchy) {
        ProviderHierarchyDTO dto = new ProviderHierarchyDTO();
        dto.setProviderName(hierarchy.getProviderName());
        dto.setRootType(hierarchy.getRootType());
        List<HierarchyLevelDTO> levels = new ArrayList<>();
        for (HierarchyLevelDef level : hierarchy.getLevels()) {
            levels.add(toLevelDTO(level));
        }
        dto.setLevels(levels);
        return dto;
    }

    public HierarchyLevelDTO toLevelDTO(HierarchyLevelDef level) {
        HierarchyLevelDTO dto = new HierarchyLevelDTO();
        dto.setTypeId(level.getTypeId());
        dto.setLabel(level.getLabel());
        dto.setIcon(level.getIcon());
        dto.setAllowedChildren(new ArrayList<>(level.getAllowedChildren()));
        dto.setSupportsTags(level.isSupportsTags());
        dto.setSupportsIpam(level.isSupportsIpam());
        dto.setSupportsEnvironment(level.isSupportsEnvironment());
        return dto;
    }

    public List<PlacementOptionDTO> toPlacementOptionDTOs(List<PlacementOption> options) {
        List<PlacementOptionDTO> result = new ArrayList<>();
        for (PlacementOption option : options) {
            PlacementOptionDTO dto = new PlacementOptionDTO();
            dto.setTypeId(option.level().getTypeId());
            dto.setLabel(option.level().getLabel());
            dto.setIcon(option.level().getIcon());
            dto.setPlaceable(option.placeable());
            dto.setHint(option.hint());
            result.add(dto);
        }
        return result;
    }

    public TagPolicyEntry toTagPolicyEntry(TagPolicyDTO dto) {
        if (dto == null) {
            return null;
        }
        TagPolicyEntry entry = new TagPolicyEntry();
        entry.setTagKey(dto.getTagKey());
        entry.setDisplayName(dto.getDisplayName());
        entry.setIsRequired(dto.getIsRequired());
        entry.setAllowedValues(dto.getAllowedValues() == null ? null : new ArrayList<>(dto.getAllowedValues()));
        entry.setDefaultValue(dto.getDefaultValue());
        return entry;
    }

    public List<TagPolicyEntry> toTagPolicyEntries(List<TagPolicyDTO> dtos) {
        List<TagPolicyEntry> result = new ArrayList<>();
        if (dtos == null) {
            return result;
        }
        for (TagPolicyDTO dto : dtos) {
            TagPolicyEntry entry = toTagPolicyEntry(dto);
            if (entry != null) {
                result.add(entry);
            }
        }
        return result;
    }

    public TagPolicyResolutionDTO toTagPolicyResolutionDTO(String nodeId, TagPolicyResolution resolution) {
        TagPolicyResolutionDTO dto = new TagPolicyResolutionDTO();
        dto.setNodeId(nodeId);
        dto.setInherited(toTagPolicyDTOs(resolution.inherited()));
        dto.setLocal(toTagPolicyDTOs(resolution.local()));
        dto.setEffective(toTagPolicyDTOs(resolution.effective()));
        return dto;
    }

    public CidrInfoDTO toCidrInfoDTO(String input, CidrInfo info) {
        CidrInfoDTO dto = new CidrInfoDTO();
        dto.setInput(input);
        dto.setValid(info.valid());
        dto.setNetwork(info.network());
        dto.setPrefix(info.prefix());
        dto.setTotalAddresses(info.totalAddresses());
        dto.setUsableAddresses(info.usableAddresses());
        dto.setBroadcast(CidrArithmeticService.broadcastAddress(info));
        dto.setPrivateRange(CidrArithmeticService.isPrivate(info));
        return dto;
    }

    public IpamSummaryDTO toIpamSummaryDTO(IpamSummary summary) {
        IpamSummaryDTO dto = new IpamSummaryDTO();
        dto.setNodeId(summary.nodeId());
        dto.setRawCidr(summary.rawCidr());
        dto.setCidr(toCidrInfoDTO(summary.rawCidr(), summary.cidr()));
        dto.setParentCidr(summary.parentCidr());
        dto.setContainedInParent(summary.containedInParent());
        dto.setChildCount(summary.childCount());
        dto.setChildUtilizationPercent(summary.childUtilizationPercent());
        return dto;
    }

    /**
     * 外部校验结果转领域对象；未知 status 视为非法参数。
     */
    public List<ValidationCheck> toValidationChecks(List<ValidationCheckDTO> dtos) {
        List<ValidationCheck> result = new ArrayList<>();
        if (dtos == null) {
            return result;
        }
        for (ValidationCheckDTO dto : dtos) {
            if (dto == null) {
                continue;
            }
            ValidationStatusEnum status;
            try {
                status = ValidationStatusEnum.fromCode(dto.getStatus());
            } catch (IllegalArgumentException ex) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "未知的校验状态: " + dto.getStatus());
            }
            result.add(new ValidationCheck(dto.getKey(), dto.getLabel(), status, dto.getMessage()));
        }
        return result;
    }

    public IntegrityCheckResultDTO toIntegrityCheckResultDTO(IntegrityReport report) {
        IntegrityCheckResultDTO dto = new IntegrityCheckResultDTO();
        List<ValidationCheckDTO> checks = new ArrayList<>();
        for (ValidationCheck check : report.checks()) {
            ValidationCheckDTO checkDTO = new ValidationCheckDTO();
            checkDTO.setKey(check.key());
            checkDTO.setLabel(check.label());
            checkDTO.setStatus(check.status() == null ? null : check.status().getCode());
            checkDTO.setMessage(check.message());
            checks.add(checkDTO);
        }
        dto.setChecks(checks);
        dto.setNodeErrors(copyNodeErrors(report.nodeErrors()));
        dto.setHasErrors(report.hasErrors());
        return dto;
    }

    public Map<String, List<String>> copyNodeErrors(Map<String, List<String>> nodeErrors) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (nodeErrors == null) {
            return copy;
        }
        for (Map.Entry<String, List<String>> entry : nodeErrors.entrySet()) {
            copy.put(entry.getKey(), entry.getValue() == null ? Collections.emptyList() : new ArrayList<>(entry.getValue()));
        }
        return copy;
    }

    private List<TagPolicyDTO> toTagPolicyDTOs(List<TagPolicyEntry> entries) {
        List<TagPolicyDTO> result = new ArrayList<>();
        for (TagPolicyEntry entry : entries) {
            TagPolicyDTO dto = new TagPolicyDTO();
            dto.setTagKey(entry.getTagKey());
            dto.setDisplayName(entry.getDisplayName() == null ? entry.getTagKey() : entry.getDisplayName());
            dto.setIsRequired(entry.required());
            dto.setAllowedValues(entry.getAllowedValues());
            dto.setDefaultValue(entry.getDefaultValue());
            dto.setInherited(entry.markedInherited());
            dto.setInheritedFrom(entry.getInheritedFrom());
            result.add(dto);
        }
        return result;
    }
}
