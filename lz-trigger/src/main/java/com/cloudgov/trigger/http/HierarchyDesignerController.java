package com.cloudgov.trigger.http;

import com.cloudgov.api.dto.CidrValueRequestDTO;
import com.cloudgov.api.dto.DesignerOpenRequestDTO;
import com.cloudgov.api.dto.EnvironmentRequestDTO;
import com.cloudgov.api.dto.FlushResultDTO;
import com.cloudgov.api.dto.HierarchyNodeDTO;
import com.cloudgov.api.dto.HierarchyReplaceRequestDTO;
import com.cloudgov.api.dto.HierarchyViewDTO;
import com.cloudgov.api.dto.IntegrityCheckResultDTO;
import com.cloudgov.api.dto.IpamSummaryDTO;
import com.cloudgov.api.dto.NamingPreviewDTO;
import com.cloudgov.api.dto.NamingTemplateRequestDTO;
import com.cloudgov.api.dto.NextBlockDTO;
import com.cloudgov.api.dto.NodeAddRequestDTO;
import com.cloudgov.api.dto.NodeRemoveResultDTO;
import com.cloudgov.api.dto.NodeSelectionRequestDTO;
import com.cloudgov.api.dto.NodeUpdateRequestDTO;
import com.cloudgov.api.dto.PlacementOptionDTO;
import com.cloudgov.api.dto.TagPolicyDTO;
import com.cloudgov.api.dto.TagPolicyResolutionDTO;
import com.cloudgov.api.dto.ValidationRequestDTO;
import com.cloudgov.api.response.Response;
import com.cloudgov.trigger.application.command.HierarchyEditorCommandService;
import com.cloudgov.trigger.application.query.HierarchyDesignQueryService;
import com.cloudgov.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Landing Zone 层级设计器 API。
 */
@RestController
@RequestMapping("/api/landing-zones/{zoneId}/designer")
public class HierarchyDesignerController {

    private final HierarchyEditorCommandService hierarchyEditorCommandService;
    private final HierarchyDesignQueryService hierarchyDesignQueryService;

    public HierarchyDesignerController(HierarchyEditorCommandService hierarchyEditorCommandService,
                                       HierarchyDesignQueryService hierarchyDesignQueryService) {
        this.hierarchyEditorCommandService = hierarchyEditorCommandService;
        this.hierarchyDesignQueryService = hierarchyDesignQueryService;
    }

    @PostMapping
    public Response<HierarchyViewDTO> open(@PathVariable("zoneId") String zoneId,
                                           @RequestBody DesignerOpenRequestDTO request) {
        return success(hierarchyEditorCommandService.openSession(zoneId, request == null ? null : request.getProviderName()));
    }

    @GetMapping
    public Response<HierarchyViewDTO> hierarchy(@PathVariable("zoneId") String zoneId) {
        return success(hierarchyDesignQueryService.hierarchy(zoneId));
    }

    @DeleteMapping
    public Response<Void> close(@PathVariable("zoneId") String zoneId) {
        hierarchyEditorCommandService.closeSession(zoneId);
        return success(null);
    }

    @PutMapping("/hierarchy")
    public Response<HierarchyViewDTO> replaceHierarchy(@PathVariable("zoneId") String zoneId,
                                                       @RequestBody HierarchyReplaceRequestDTO request) {
        return success(hierarchyEditorCommandService.replaceHierarchy(zoneId, request));
    }

    @PutMapping("/selection")
    public Response<HierarchyViewDTO> select(@PathVariable("zoneId") String zoneId,
                                             @RequestBody NodeSelectionRequestDTO request) {
        return success(hierarchyEditorCommandService.select(zoneId, request == null ? null : request.getNodeId()));
    }

    @GetMapping("/palette")
    public Response<List<PlacementOptionDTO>> palette(@PathVariable("zoneId") String zoneId) {
        return success(hierarchyDesignQueryService.palette(zoneId));
    }

    @PostMapping("/nodes")
    public Response<HierarchyNodeDTO> addLevel(@PathVariable("zoneId") String zoneId,
                                               @RequestBody NodeAddRequestDTO request) {
        return success(hierarchyEditorCommandService.addLevel(zoneId, request == null ? null : request.getTypeId()));
    }

    @PatchMapping("/nodes/{nodeId}")
    public Response<HierarchyNodeDTO> updateNode(@PathVariable("zoneId") String zoneId,
                                                 @PathVariable("nodeId") String nodeId,
                                                 @RequestBody NodeUpdateRequestDTO request) {
        return success(hierarchyEditorCommandService.updateNode(zoneId, nodeId, request));
    }

    @DeleteMapping("/nodes/{nodeId}")
    public Response<NodeRemoveResultDTO> removeNode(@PathVariable("zoneId") String zoneId,
                                                    @PathVariable("nodeId") String nodeId) {
        return success(hierarchyEditorCommandService.removeNode(zoneId, nodeId));
    }

    @PostMapping("/nodes/{nodeId}/tag-policies")
    public Response<HierarchyNodeDTO> addTagPolicy(@PathVariable("zoneId") String zoneId,
                                                   @PathVariable("nodeId") String nodeId,
                                                   @RequestBody TagPolicyDTO request) {
        return success(hierarchyEditorCommandService.addTagPolicy(zoneId, nodeId, request));
    }

    @GetMapping("/nodes/{nodeId}/tag-policies")
    public Response<TagPolicyResolutionDTO> resolveTagPolicies(@PathVariable("zoneId") String zoneId,
                                                               @PathVariable("nodeId") String nodeId) {
        return success(hierarchyDesignQueryService.resolveTagPolicies(zoneId, nodeId));
    }

    @DeleteMapping("/nodes/{nodeId}/tag-policies/{tagKey}")
    public Response<HierarchyNodeDTO> removeTagPolicy(@PathVariable("zoneId") String zoneId,
                                                      @PathVariable("nodeId") String nodeId,
                                                      @PathVariable("tagKey") String tagKey) {
        return success(hierarchyEditorCommandService.removeTagPolicy(zoneId, nodeId, tagKey));
    }

    @PutMapping("/nodes/{nodeId}/cidr")
    public Response<HierarchyNodeDTO> setCidr(@PathVariable("zoneId") String zoneId,
                                              @PathVariable("nodeId") String nodeId,
                                              @RequestBody CidrValueRequestDTO request) {
        return success(hierarchyEditorCommandService.setCidr(zoneId, nodeId, request == null ? null : request.getCidr()));
    }

    @GetMapping("/nodes/{nodeId}/ipam")
    public Response<IpamSummaryDTO> ipamSummary(@PathVariable("zoneId") String zoneId,
                                                @PathVariable("nodeId") String nodeId) {
        return success(hierarchyDesignQueryService.ipamSummary(zoneId, nodeId));
    }

    @GetMapping("/nodes/{nodeId}/ipam/next-block")
    public Response<NextBlockDTO> suggestChildBlock(@PathVariable("zoneId") String zoneId,
                                                    @PathVariable("nodeId") String nodeId,
                                                    @RequestParam("prefix") int prefix) {
        return success(hierarchyDesignQueryService.suggestChildBlock(zoneId, nodeId, prefix));
    }

    @PutMapping("/nodes/{nodeId}/naming-template")
    public Response<HierarchyNodeDTO> setNamingTemplate(@PathVariable("zoneId") String zoneId,
                                                        @PathVariable("nodeId") String nodeId,
                                                        @RequestBody NamingTemplateRequestDTO request) {
        return success(hierarchyEditorCommandService.setNamingTemplate(zoneId, nodeId,
                request == null ? null : request.getTemplate()));
    }

    @GetMapping("/nodes/{nodeId}/naming-preview")
    public Response<NamingPreviewDTO> namingPreview(@PathVariable("zoneId") String zoneId,
                                                    @PathVariable("nodeId") String nodeId,
                                                    @RequestParam(value = "template", required = false) String template) {
        return success(hierarchyDesignQueryService.namingPreview(zoneId, nodeId, template));
    }

    @PutMapping("/nodes/{nodeId}/environment")
    public Response<HierarchyNodeDTO> setEnvironment(@PathVariable("zoneId") String zoneId,
                                                     @PathVariable("nodeId") String nodeId,
                                                     @RequestBody EnvironmentRequestDTO request) {
        return success(hierarchyEditorCommandService.setEnvironmentDesignation(zoneId, nodeId,
                request == null ? null : request.getEnvironmentDesignation()));
    }

    @PostMapping("/validation")
    public Response<Map<String, List<String>>> applyValidation(@PathVariable("zoneId") String zoneId,
                                                               @RequestBody ValidationRequestDTO request) {
        return success(hierarchyEditorCommandService.applyValidation(zoneId, request == null ? null : request.getChecks()));
    }

    @GetMapping("/validation/node-errors")
    public Response<Map<String, List<String>>> nodeErrors(@PathVariable("zoneId") String zoneId) {
        return success(hierarchyDesignQueryService.nodeErrors(zoneId));
    }

    @PostMapping("/integrity-check")
    public Response<IntegrityCheckResultDTO> integrityCheck(@PathVariable("zoneId") String zoneId) {
        return success(hierarchyEditorCommandService.runIntegrityCheck(zoneId));
    }

    @PostMapping("/flush")
    public Response<FlushResultDTO> flush(@PathVariable("zoneId") String zoneId) {
        return success(hierarchyEditorCommandService.flush(zoneId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
