package com.cloudgov.test;

import com.cloudgov.api.dto.FlushResultDTO;
import com.cloudgov.api.dto.HierarchyNodeDTO;
import com.cloudgov.api.dto.HierarchyReplaceRequestDTO;
import com.cloudgov.api.dto.HierarchyViewDTO;
import com.cloudgov.api.dto.IntegrityCheckResultDTO;
import com.cloudgov.api.dto.NamingPreviewDTO;
import com.cloudgov.api.dto.NodeRemoveResultDTO;
import com.cloudgov.api.dto.NodeUpdateRequestDTO;
import com.cloudgov.api.dto.PlacementOptionDTO;
import com.cloudgov.api.dto.TagPolicyDTO;
import com.cloudgov.api.dto.TagPolicyResolutionDTO;
import com.cloudgov.api.dto.ValidationCheckDTO;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyDesignSessionEntity;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.NodeSelection;
import com.cloudgov.trigger.application.command.HierarchyEditorCommandService;
import com.cloudgov.trigger.application.common.HierarchyViewAssembler;
import com.cloudgov.trigger.application.query.HierarchyDesignQueryService;
import com.cloudgov.types.enums.ResponseCode;
import com.cloudgov.types.exception.AppException;
import com.cloudgov.test.support.InMemoryHierarchyDesignSessionRepository;
import com.cloudgov.test.support.InMemoryHierarchySnapshotRepository;
import com.cloudgov.test.support.InMemoryProviderHierarchyRepository;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;

import static com.cloudgov.test.support.HierarchyTestFixtures.awsSchema;
import static com.cloudgov.test.support.HierarchyTestFixtures.newEditorDomainService;
import static com.cloudgov.test.support.HierarchyTestFixtures.node;
import static com.cloudgov.test.support.HierarchyTestFixtures.orgOuSchema;

public class HierarchyEditorCommandServiceTest {

    private InMemoryHierarchySnapshotRepository snapshotRepository;
    private InMemoryHierarchyDesignSessionRepository sessionRepository;
    private HierarchyEditorCommandService commandService;
    private HierarchyDesignQueryService queryService;

    @BeforeEach
    public void setUp() {
        InMemoryProviderHierarchyRepository providerRepository =
                new InMemoryProviderHierarchyRepository(awsSchema(), orgOuSchema());
        this.snapshotRepository = new InMemoryHierarchySnapshotRepository();
        this.sessionRepository = new InMemoryHierarchyDesignSessionRepository();
        HierarchyViewAssembler assembler = new HierarchyViewAssembler();
        this.commandService = new HierarchyEditorCommandService(providerRepository, sessionRepository,
                snapshotRepository, newEditorDomainService(), assembler);
        this.queryService = new HierarchyDesignQueryService(providerRepository, sessionRepository,
                newEditorDomainService(), assembler);
    }

    @Test
    public void shouldOpenEmptySessionForKnownProvider() {
        HierarchyViewDTO view = commandService.openSession("lz-1", "AWS");

        Assertions.assertEquals("lz-1", view.getZoneId());
        Assertions.assertEquals("aws", view.getProviderName());
        Assertions.assertEquals("organization", view.getRootType());
        Assertions.assertTrue(view.getNodes().isEmpty());
        Assertions.assertNull(view.getSelectedNodeId());
        Assertions.assertEquals(0L, view.getRevision());
    }

    @Test
    public void shouldRejectUnknownProviderAndMissingSession() {
        AppException provider = Assertions.assertThrows(AppException.class,
                () -> commandService.openSession("lz-1", "alibaba"));
        AppException blankZone = Assertions.assertThrows(AppException.class,
                () -> commandService.openSession(" ", "aws"));
        AppException session = Assertions.assertThrows(AppException.class,
                () -> commandService.addLevel("lz-unknown", "organization"));

        Assertions.assertEquals(ResponseCode.PROVIDER_NOT_FOUND.getCode(), provider.getCode());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), blankZone.getCode());
        Assertions.assertEquals(ResponseCode.SESSION_NOT_FOUND.getCode(), session.getCode());
    }

    @Test
    public void shouldBuildTreeThroughSelectionDrivenAdds() {
        commandService.openSession("lz-1", "aws");

        HierarchyNodeDTO org = commandService.addLevel("lz-1", "organization");
        HierarchyNodeDTO ou = commandService.addLevel("lz-1", "ou");
        commandService.select("lz-1", org.getId());
        HierarchyNodeDTO sibling = commandService.addLevel("lz-1", "ou");

        HierarchyViewDTO view = queryService.hierarchy("lz-1");
        Assertions.assertEquals(3, view.getNodes().size());
        Assertions.assertEquals(org.getId(), ou.getParentId());
        Assertions.assertEquals(org.getId(), sibling.getParentId());
        Assertions.assertEquals(sibling.getId(), view.getSelectedNodeId());
        Assertions.assertEquals(3L, view.getRevision());
    }

    @Test
    public void shouldKeepTreeWhenPlacementRejected() {
        commandService.openSession("lz-1", "aws");
        commandService.addLevel("lz-1", "organization");

        AppException ex = Assertions.assertThrows(AppException.class, () -> commandService.addLevel("lz-1", "vpc"));

        Assertions.assertEquals(ResponseCode.PLACEMENT_REJECTED.getCode(), ex.getCode());
        Assertions.assertEquals(1, queryService.hierarchy("lz-1").getNodes().size());
    }

    @Test
    public void shouldCascadeRemoveAndReportSelection() {
        commandService.openSession("lz-1", "aws");
        commandService.replaceHierarchy("lz-1", replaceRequest(
                node("org", null, "organization", "Acme"),
                node("ou", "org", "ou", "Workloads"),
                node("acct", "ou", "account", "Prod")));
        commandService.select("lz-1", "acct");

        NodeRemoveResultDTO result = commandService.removeNode("lz-1", "ou");

        Assertions.assertEquals(List.of("ou", "acct"), result.getRemovedNodeIds());
        Assertions.assertNull(result.getSelectedNodeId());
        Assertions.assertEquals(1, queryService.hierarchy("lz-1").getNodes().size());
    }

    @Test
    public void shouldResolveInheritedTagPoliciesAfterEdits() {
        commandService.openSession("lz-1", "aws");
        commandService.replaceHierarchy("lz-1", replaceRequest(
                node("org", null, "organization", "Acme"),
                node("ou", "org", "ou", "Workloads")));
        commandService.addTagPolicy("lz-1", "org", tagPolicy("cost-center"));
        commandService.addTagPolicy("lz-1", "ou", tagPolicy("app"));

        TagPolicyResolutionDTO resolution = queryService.resolveTagPolicies("lz-1", "ou");

        Assertions.assertEquals(1, resolution.getInherited().size());
        Assertions.assertEquals("cost-center", resolution.getInherited().get(0).getTagKey());
        Assertions.assertTrue(resolution.getInherited().get(0).getInherited());
        Assertions.assertEquals("Acme", resolution.getInherited().get(0).getInheritedFrom());
        Assertions.assertEquals(2, resolution.getEffective().size());
    }

    @Test
    public void shouldIgnoreEchoedInheritedTagPoliciesOnUpdate() {
        commandService.openSession("lz-1", "aws");
        commandService.replaceHierarchy("lz-1", replaceRequest(
                node("org", null, "organization", "Acme"),
                node("ou", "org", "ou", "Workloads")));
        commandService.addTagPolicy("lz-1", "org", tagPolicy("cost-center"));
        TagPolicyResolutionDTO before = queryService.resolveTagPolicies("lz-1", "ou");

        NodeUpdateRequestDTO update = new NodeUpdateRequestDTO();
        update.setProperties(Map.of("tagPolicies", List.of(Map.of(
                "tagKey", "cost-center",
                "inherited", true,
                "inheritedFrom", "Acme"))));
        HierarchyNodeDTO updated = commandService.updateNode("lz-1", "ou", update);
        TagPolicyResolutionDTO after = queryService.resolveTagPolicies("lz-1", "ou");

        Assertions.assertEquals(1, before.getEffective().size());
        Assertions.assertEquals(List.of(), updated.getProperties().get("tagPolicies"));
        Assertions.assertTrue(after.getLocal().isEmpty());
        Assertions.assertEquals(1, after.getEffective().size());
    }

    @Test
    public void shouldQueryPaletteWithoutTouchingSession() {
        commandService.openSession("lz-1", "aws");
        commandService.addLevel("lz-1", "organization");
        HierarchyDesignSessionEntity session = sessionRepository.findByZoneId("lz-1");
        session.setSelection(NodeSelection.of("ghost"));
        long revision = session.getRevision();

        List<PlacementOptionDTO> palette = queryService.palette("lz-1");

        Assertions.assertFalse(palette.isEmpty());
        Assertions.assertTrue(palette.stream().noneMatch(PlacementOptionDTO::isPlaceable));
        Assertions.assertEquals("ghost", session.getSelection().nodeIdOrNull());
        Assertions.assertEquals(revision, session.getRevision());
    }

    @Test
    public void shouldMapExternalValidationToNodes() {
        commandService.openSession("lz-1", "aws");
        commandService.replaceHierarchy("lz-1", replaceRequest(node("org", null, "organization", "Acme")));

        Map<String, List<String>> errors = commandService.applyValidation("lz-1", List.of(
                check("tag_required:node:org", "error", "owner required"),
                check("naming:node:org", "pass", "fine"),
                check("budget", "warning", "global")));

        Assertions.assertEquals(Map.of("org", List.of("owner required")), errors);
        Assertions.assertEquals(errors, queryService.nodeErrors("lz-1"));
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> commandService.applyValidation("lz-1", List.of(check("x:node:org", "fatal", "?"))));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldBlockFlushOnIntegrityErrors() {
        commandService.openSession("lz-1", "aws");
        commandService.replaceHierarchy("lz-1", replaceRequest(
                node("org", null, "organization", "Acme"),
                node("lost", "ghost", "ou", "Lost")));

        AppException ex = Assertions.assertThrows(AppException.class, () -> commandService.flush("lz-1"));

        Assertions.assertEquals(ResponseCode.HIERARCHY_INTEGRITY_VIOLATION.getCode(), ex.getCode());
        Assertions.assertEquals(0, snapshotRepository.getSaveCount());
        Assertions.assertTrue(queryService.nodeErrors("lz-1").containsKey("lost"));
    }

    @Test
    public void shouldFlushWhenBlockingDisabled() {
        ReflectionTestUtils.setField(commandService, "blockFlushOnError", false);
        commandService.openSession("lz-1", "aws");
        commandService.replaceHierarchy("lz-1", replaceRequest(node("lost", "ghost", "ou", "Lost")));

        FlushResultDTO result = commandService.flush("lz-1");

        Assertions.assertEquals(1, result.getNodeCount());
        Assertions.assertEquals(1, snapshotRepository.getSaveCount());
    }

    @Test
    public void shouldReloadFlushedSnapshotOnReopen() {
        commandService.openSession("lz-1", "aws");
        commandService.replaceHierarchy("lz-1", replaceRequest(
                node("org", null, "organization", "Acme"),
                node("ou", "org", "ou", "Workloads")));
        commandService.setNamingTemplate("lz-1", "ou", "{{provider}}-{{type}}-{{name}}");
        FlushResultDTO flushed = commandService.flush("lz-1");
        commandService.closeSession("lz-1");

        HierarchyViewDTO reopened = commandService.openSession("lz-1", "aws");
        NamingPreviewDTO preview = queryService.namingPreview("lz-1", "ou", null);

        Assertions.assertEquals("lz-1", flushed.getZoneId());
        Assertions.assertEquals(2, reopened.getNodes().size());
        Assertions.assertEquals("aws-ou-workloads", preview.getPreview());
        Assertions.assertThrows(AppException.class, () -> commandService.closeSession("lz-2"));
    }

    @Test
    public void shouldReportIntegrityResultWithSummary() {
        commandService.openSession("lz-1", "aws");
        commandService.replaceHierarchy("lz-1", replaceRequest(node("org", null, "organization", "Acme")));

        IntegrityCheckResultDTO result = commandService.runIntegrityCheck("lz-1");

        Assertions.assertFalse(result.isHasErrors());
        Assertions.assertEquals(1, result.getChecks().size());
        Assertions.assertEquals("ok", result.getChecks().get(0).getStatus());
    }

    private HierarchyReplaceRequestDTO replaceRequest(HierarchyNodeEntity... nodes) {
        HierarchyReplaceRequestDTO request = new HierarchyReplaceRequestDTO();
        request.setNodes(new HierarchyViewAssembler().toNodeDTOs(List.of(nodes)));
        return request;
    }

    private TagPolicyDTO tagPolicy(String key) {
        TagPolicyDTO dto = new TagPolicyDTO();
        dto.setTagKey(key);
        dto.setIsRequired(true);
        return dto;
    }

    private ValidationCheckDTO check(String key, String status, String message) {
        ValidationCheckDTO dto = new ValidationCheckDTO();
        dto.setKey(key);
        dto.setLabel(key);
        dto.setStatus(status);
        dto.setMessage(message);
        return dto;
    }
}
