package com.cloudgov.trigger.application.query;

import com.cloudgov.api.dto.CidrInfoDTO;
import com.cloudgov.api.dto.HierarchyViewDTO;
import com.cloudgov.api.dto.IpamSummaryDTO;
import com.cloudgov.api.dto.NamingPreviewDTO;
import com.cloudgov.api.dto.NextBlockDTO;
import com.cloudgov.api.dto.PlacementOptionDTO;
import com.cloudgov.api.dto.ProviderHierarchyDTO;
import com.cloudgov.api.dto.TagPolicyResolutionDTO;
import com.cloudgov.domain.hierarchy.adapter.repository.IHierarchyDesignSessionRepository;
import com.cloudgov.domain.hierarchy.adapter.repository.IProviderHierarchyRepository;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyDesignSessionEntity;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.ProviderHierarchy;
import com.cloudgov.domain.hierarchy.service.CidrArithmeticService;
import com.cloudgov.domain.hierarchy.service.HierarchyNodeEditorDomainService;
import com.cloudgov.trigger.application.common.HierarchyViewAssembler;
import com.cloudgov.types.enums.ResponseCode;
import com.cloudgov.types.exception.AppException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 层级设计器读用例：视图、面板、标签解析、地址规划与命名预览。
 */
@Service
public class HierarchyDesignQueryService {

    private final IProviderHierarchyRepository providerHierarchyRepository;
    private final IHierarchyDesignSessionRepository designSessionRepository;
    private final HierarchyNodeEditorDomainService nodeEditorDomainService;
    private final HierarchyViewAssembler hierarchyViewAssembler;

    @Value("${designer.naming.sample-sequence:001}")
    private String sampleSequence = "001";

    @Value("${designer.naming.sample-region:us-east-1}")
    private String sampleRegion = "us-east-1";

    public HierarchyDesignQueryService(IProviderHierarchyRepository providerHierarchyRepository,
                                       IHierarchyDesignSessionRepository designSessionRepository,
                                       HierarchyNodeEditorDomainService nodeEditorDomainService,
                                       HierarchyViewAssembler hierarchyViewAssembler) {
        this.providerHierarchyRepository = providerHierarchyRepository;
        this.designSessionRepository = designSessionRepository;
        this.nodeEditorDomainService = nodeEditorDomainService;
        this.hierarchyViewAssembler = hierarchyViewAssembler;
    }

    public List<ProviderHierarchyDTO> listProviders() {
        List<ProviderHierarchyDTO> result = new ArrayList<>();
        for (ProviderHierarchy hierarchy : providerHierarchyRepository.findAll()) {
            result.add(hierarchyViewAssembler.toProviderHierarchyDTO(hierarchy));
        }
        return result;
    }

    public ProviderHierarchyDTO getProvider(String providerName) {
        ProviderHierarchy hierarchy = providerHierarchyRepository.findByProvider(providerName);
        if (hierarchy == null) {
            throw new AppException(ResponseCode.PROVIDER_NOT_FOUND.getCode(), "不支持的云厂商: " + providerName);
        }
        return hierarchyViewAssembler.toProviderHierarchyDTO(hierarchy);
    }

    public HierarchyViewDTO hierarchy(String zoneId) {
        HierarchyDesignSessionEntity session = requireSession(zoneId);
        synchronized (session) {
            return hierarchyViewAssembler.toHierarchyView(session);
        }
    }

    public List<PlacementOptionDTO> palette(String zoneId) {
        HierarchyDesignSessionEntity session = requireSession(zoneId);
        synchronized (session) {
            return hierarchyViewAssembler.toPlacementOptionDTOs(nodeEditorDomainService.palette(session));
        }
    }

    public TagPolicyResolutionDTO resolveTagPolicies(String zoneId, String nodeId) {
        HierarchyDesignSessionEntity session = requireSession(zoneId);
        synchronized (session) {
            return hierarchyViewAssembler.toTagPolicyResolutionDTO(nodeId,
                    nodeEditorDomainService.resolveTagPolicies(session, nodeId));
        }
    }

    public IpamSummaryDTO ipamSummary(String zoneId, String nodeId) {
        HierarchyDesignSessionEntity session = requireSession(zoneId);
        synchronized (session) {
            return hierarchyViewAssembler.toIpamSummaryDTO(nodeEditorDomainService.ipamSummary(session, nodeId));
        }
    }

    public NextBlockDTO suggestChildBlock(String zoneId, String nodeId, int prefix) {
        HierarchyDesignSessionEntity session = requireSession(zoneId);
        synchronized (session) {
            NextBlockDTO dto = new NextBlockDTO();
            dto.setNodeId(nodeId);
            dto.setPrefix(prefix);
            dto.setCidr(nodeEditorDomainService.suggestChildBlock(session, nodeId, prefix));
            return dto;
        }
    }

    /**
     * 命名预览；template 为空时使用节点已保存的模板。
     */
    public NamingPreviewDTO namingPreview(String zoneId, String nodeId, String template) {
        HierarchyDesignSessionEntity session = requireSession(zoneId);
        synchronized (session) {
            HierarchyNodeEntity node = nodeEditorDomainService.requireNode(session, nodeId);
            String effectiveTemplate = template == null ? node.readNamingTemplate() : template;
            NamingPreviewDTO dto = new NamingPreviewDTO();
            dto.setNodeId(nodeId);
            dto.setTemplate(effectiveTemplate);
            dto.setPreview(nodeEditorDomainService.namingPreview(session, nodeId, effectiveTemplate, sampleSequence, sampleRegion));
            return dto;
        }
    }

    public Map<String, List<String>> nodeErrors(String zoneId) {
        HierarchyDesignSessionEntity session = requireSession(zoneId);
        synchronized (session) {
            return hierarchyViewAssembler.copyNodeErrors(session.getNodeValidationErrors());
        }
    }

    public CidrInfoDTO parseCidr(String value) {
        return hierarchyViewAssembler.toCidrInfoDTO(value, CidrArithmeticService.parseCidr(value));
    }

    private HierarchyDesignSessionEntity requireSession(String zoneId) {
        HierarchyDesignSessionEntity session = designSessionRepository.findByZoneId(zoneId);
        if (session == null) {
            throw new AppException(ResponseCode.SESSION_NOT_FOUND.getCode(), "设计会话不存在或已过期: " + zoneId);
        }
        return session;
    }
}
