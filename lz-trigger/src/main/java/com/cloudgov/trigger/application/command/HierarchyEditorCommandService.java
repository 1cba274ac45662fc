package com.cloudgov.trigger.application.command;

import com.cloudgov.api.dto.FlushResultDTO;
import com.cloudgov.api.dto.HierarchyNodeDTO;
import com.cloudgov.api.dto.HierarchyReplaceRequestDTO;
import com.cloudgov.api.dto.HierarchyViewDTO;
import com.cloudgov.api.dto.IntegrityCheckResultDTO;
import com.cloudgov.api.dto.NodeRemoveResultDTO;
import com.cloudgov.api.dto.NodeUpdateRequestDTO;
import com.cloudgov.api.dto.TagPolicyDTO;
import com.cloudgov.api.dto.ValidationCheckDTO;
import com.cloudgov.domain.hierarchy.adapter.repository.IHierarchyDesignSessionRepository;
import com.cloudgov.domain.hierarchy.adapter.repository.IHierarchySnapshotRepository;
import com.cloudgov.domain.hierarchy.adapter.repository.IProviderHierarchyRepository;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyDesignSessionEntity;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.IntegrityReport;
import com.cloudgov.domain.hierarchy.model.valobj.ProviderHierarchy;
import com.cloudgov.domain.hierarchy.service.HierarchyNodeEditorDomainService;
import com.cloudgov.trigger.application.common.HierarchyViewAssembler;
import com.cloudgov.types.enums.ResponseCode;
import com.cloudgov.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 层级设计器写用例：会话生命周期、节点编辑、整树替换、校验回挂与落库。
 * <p>
 * 同一 Landing Zone 的变更在会话对象上串行执行。
 * </p>
 */
@Slf4j
@Service
public class HierarchyEditorCommandService {

    private final IProviderHierarchyRepository providerHierarchyRepository;
    private final IHierarchyDesignSessionRepository designSessionRepository;
    private final IHierarchySnapshotRepository snapshotRepository;
    private final HierarchyNodeEditorDomainService nodeEditorDomainService;
    private final HierarchyViewAssembler hierarchyViewAssembler;

    @Value("${designer.integrity.block-flush-on-error:true}")
    private boolean blockFlushOnError = true;

    public HierarchyEditorCommandService(IProviderHierarchyRepository providerHierarchyRepository,
                                         IHierarchyDesignSessionRepository designSessionRepository,
                                         IHierarchySnapshotRepository snapshotRepository,
                                         HierarchyNodeEditorDomainService nodeEditorDomainService,
                                         HierarchyViewAssembler hierarchyViewAssembler) {
        this.providerHierarchyRepository = providerHierarchyRepository;
        this.designSessionRepository = designSessionRepository;
        this.snapshotRepository = snapshotRepository;
        this.nodeEditorDomainService = nodeEditorDomainService;
        this.hierarchyViewAssembler = hierarchyViewAssembler;
    }

    /**
     * 打开设计会话，已落库的快照会被加载；同一 zone 重复打开会替换旧会话。
     */
    public HierarchyViewDTO openSession(String zoneId, String providerName) {
        if (StringUtils.isBlank(zoneId)) {
            throw illegal("zoneId 不能为空");
        }
        ProviderHierarchy hierarchy = providerHierarchyRepository.findByProvider(providerName);
        if (hierarchy == null) {
            throw new AppException(ResponseCode.PROVIDER_NOT_FOUND.getCode(), "不支持的云厂商: " + providerName);
        }
        HierarchyDesignSessionEntity session = HierarchyDesignSessionEntity.open(zoneId, hierarchy);
        List<HierarchyNodeEntity> snapshot = snapshotRepository.findByZoneId(session.getZoneId());
        if (snapshot != null) {
            nodeEditorDomainService.replaceHierarchy(session, snapshot, null);
        }
        designSessionRepository.save(session);
        log.info("HIERARCHY_SESSION_OPENED zoneId={}, provider={}, nodeCount={}, fromSnapshot={}",
                session.getZoneId(), session.providerName(), session.getTree().size(), snapshot != null);
        return hierarchyViewAssembler.toHierarchyView(session);
    }

    public void closeSession(String zoneId) {
        requireSession(zoneId);
        designSessionRepository.remove(zoneId);
        log.info("HIERARCHY_SESSION_CLOSED zoneId={}", zoneId);
    }

    public HierarchyViewDTO select(String zoneId, String nodeId) {
        return mutate(zoneId, session -> {
            nodeEditorDomainService.select(session, nodeId);
            return hierarchyViewAssembler.toHierarchyView(session);
        });
    }

    public HierarchyNodeDTO addLevel(String zoneId, String typeId) {
        return mutate(zoneId, session -> {
            HierarchyNodeEntity node = nodeEditorDomainService.addLevel(session, typeId);
            log.info("HIERARCHY_NODE_ADDED zoneId={}, nodeId={}, typeId={}, parentId={}, revision={}",
                    zoneId, node.getId(), node.getTypeId(), node.getParentId(), session.getRevision());
            return hierarchyViewAssembler.toNodeDTO(node);
        });
    }

    public HierarchyNodeDTO updateNode(String zoneId, String nodeId, NodeUpdateRequestDTO request) {
        String label = request == null ? null : request.getLabel();
        Map<String, Object> properties = request == null ? null : request.getProperties();
        return mutate(zoneId, session -> {
            HierarchyNodeEntity node = nodeEditorDomainService.updateNode(session, nodeId, label, properties);
            log.info("HIERARCHY_NODE_UPDATED zoneId={}, nodeId={}, keys={}, revision={}",
                    zoneId, nodeId, properties == null ? "[]" : properties.keySet(), session.getRevision());
            return hierarchyViewAssembler.toNodeDTO(node);
        });
    }

    public NodeRemoveResultDTO removeNode(String zoneId, String nodeId) {
        return mutate(zoneId, session -> {
            List<String> removedIds = nodeEditorDomainService.removeNode(session, nodeId);
            log.info("HIERARCHY_NODE_REMOVED zoneId={}, nodeId={}, removedCount={}, revision={}",
                    zoneId, nodeId, removedIds.size(), session.getRevision());
            NodeRemoveResultDTO dto = new NodeRemoveResultDTO();
            dto.setRemovedNodeIds(removedIds);
            dto.setSelectedNodeId(session.getSelection().nodeIdOrNull());
            dto.setRevision(session.getRevision());
            return dto;
        });
    }

    public HierarchyNodeDTO addTagPolicy(String zoneId, String nodeId, TagPolicyDTO request) {
        return mutate(zoneId, session -> {
            HierarchyNodeEntity node = nodeEditorDomainService.addTagPolicy(session, nodeId,
                    hierarchyViewAssembler.toTagPolicyEntry(request));
            log.info("HIERARCHY_TAG_POLICY_SET zoneId={}, nodeId={}, tagKey={}, revision={}",
                    zoneId, nodeId, request == null ? null : request.getTagKey(), session.getRevision());
            return hierarchyViewAssembler.toNodeDTO(node);
        });
    }

    public HierarchyNodeDTO removeTagPolicy(String zoneId, String nodeId, String tagKey) {
        return mutate(zoneId, session -> {
            HierarchyNodeEntity node = nodeEditorDomainService.removeTagPolicy(session, nodeId, tagKey);
            log.info("HIERARCHY_TAG_POLICY_REMOVED zoneId={}, nodeId={}, tagKey={}, revision={}",
                    zoneId, nodeId, tagKey, session.getRevision());
            return hierarchyViewAssembler.toNodeDTO(node);
        });
    }

    public HierarchyNodeDTO setCidr(String zoneId, String nodeId, String cidr) {
        return mutate(zoneId, session -> {
            HierarchyNodeEntity node = nodeEditorDomainService.setCidr(session, nodeId, cidr);
            log.info("HIERARCHY_CIDR_SET zoneId={}, nodeId={}, cidr={}, revision={}",
                    zoneId, nodeId, node.readCidr(), session.getRevision());
            return hierarchyViewAssembler.toNodeDTO(node);
        });
    }

    public HierarchyNodeDTO setNamingTemplate(String zoneId, String nodeId, String template) {
        return mutate(zoneId, session -> {
            HierarchyNodeEntity node = nodeEditorDomainService.setNamingTemplate(session, nodeId, template);
            log.info("HIERARCHY_NAMING_TEMPLATE_SET zoneId={}, nodeId={}, revision={}", zoneId, nodeId, session.getRevision());
            return hierarchyViewAssembler.toNodeDTO(node);
        });
    }

    public HierarchyNodeDTO setEnvironmentDesignation(String zoneId, String nodeId, String designation) {
        return mutate(zoneId, session -> {
            HierarchyNodeEntity node = nodeEditorDomainService.setEnvironmentDesignation(session, nodeId, designation);
            log.info("HIERARCHY_ENVIRONMENT_SET zoneId={}, nodeId={}, environment={}, revision={}",
                    zoneId, nodeId, node.readEnvironmentDesignation(), session.getRevision());
            return hierarchyViewAssembler.toNodeDTO(node);
        });
    }

    public HierarchyViewDTO replaceHierarchy(String zoneId, HierarchyReplaceRequestDTO request) {
        List<HierarchyNodeEntity> nodes = hierarchyViewAssembler.toNodeEntities(request == null ? null : request.getNodes());
        List<TagPolicyDTO> defaults = request == null ? null : request.getDefaultTagPolicies();
        return mutate(zoneId, session -> {
            nodeEditorDomainService.replaceHierarchy(session, nodes, hierarchyViewAssembler.toTagPolicyEntries(defaults));
            log.info("HIERARCHY_REPLACED zoneId={}, nodeCount={}, defaultTagPolicies={}, revision={}",
                    zoneId, session.getTree().size(), defaults == null ? 0 : defaults.size(), session.getRevision());
            return hierarchyViewAssembler.toHierarchyView(session);
        });
    }

    public Map<String, List<String>> applyValidation(String zoneId, List<ValidationCheckDTO> checks) {
        return mutate(zoneId, session -> {
            Map<String, List<String>> nodeErrors = nodeEditorDomainService.applyValidation(session,
                    hierarchyViewAssembler.toValidationChecks(checks));
            log.info("HIERARCHY_VALIDATION_APPLIED zoneId={}, checkCount={}, nodesWithMessages={}",
                    zoneId, checks == null ? 0 : checks.size(), nodeErrors.size());
            return hierarchyViewAssembler.copyNodeErrors(nodeErrors);
        });
    }

    public IntegrityCheckResultDTO runIntegrityCheck(String zoneId) {
        return mutate(zoneId, session -> {
            IntegrityReport report = nodeEditorDomainService.runIntegrityCheck(session);
            log.info("HIERARCHY_INTEGRITY_CHECKED zoneId={}, checkCount={}, hasErrors={}",
                    zoneId, report.checks().size(), report.hasErrors());
            return hierarchyViewAssembler.toIntegrityCheckResultDTO(report);
        });
    }

    /**
     * 完整性校验通过后落库扁平节点快照。
     */
    public FlushResultDTO flush(String zoneId) {
        return mutate(zoneId, session -> {
            IntegrityReport report = nodeEditorDomainService.runIntegrityCheck(session);
            if (report.hasErrors() && blockFlushOnError) {
                log.warn("HIERARCHY_FLUSH_REJECTED zoneId={}, nodesWithErrors={}", zoneId, report.nodeErrors().keySet());
                throw new AppException(ResponseCode.HIERARCHY_INTEGRITY_VIOLATION.getCode(),
                        "层级树存在完整性错误，涉及 " + report.nodeErrors().size() + " 个节点");
            }
            List<HierarchyNodeEntity> nodes = session.getTree().snapshot();
            snapshotRepository.save(session.getZoneId(), nodes);
            log.info("HIERARCHY_FLUSHED zoneId={}, nodeCount={}, revision={}, hasErrors={}",
                    zoneId, nodes.size(), session.getRevision(), report.hasErrors());
            FlushResultDTO dto = new FlushResultDTO();
            dto.setZoneId(session.getZoneId());
            dto.setRevision(session.getRevision());
            dto.setNodeCount(nodes.size());
            dto.setFlushedAt(LocalDateTime.now());
            return dto;
        });
    }

    private <T> T mutate(String zoneId, Function<HierarchyDesignSessionEntity, T> action) {
        HierarchyDesignSessionEntity session = requireSession(zoneId);
        synchronized (session) {
            try {
                return action.apply(session);
            } catch (AppException ex) {
                log.warn("HIERARCHY_MUTATION_REJECTED zoneId={}, code={}, reason={}", zoneId, ex.getCode(), ex.getInfo());
                throw ex;
            } finally {
                designSessionRepository.save(session);
            }
        }
    }

    private HierarchyDesignSessionEntity requireSession(String zoneId) {
        HierarchyDesignSessionEntity session = designSessionRepository.findByZoneId(zoneId);
        if (session == null) {
            throw new AppException(ResponseCode.SESSION_NOT_FOUND.getCode(), "设计会话不存在或已过期: " + zoneId);
        }
        return session;
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), message);
    }
}
