package com.cloudgov.test.domain;

import com.cloudgov.domain.hierarchy.model.entity.HierarchyDesignSessionEntity;
import com.cloudgov.domain.hierarchy.model.entity.HierarchyNodeEntity;
import com.cloudgov.domain.hierarchy.model.valobj.IntegrityReport;
import com.cloudgov.domain.hierarchy.model.valobj.IpamSummary;
import com.cloudgov.domain.hierarchy.model.valobj.NodeSelection;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyEntry;
import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyResolution;
import com.cloudgov.domain.hierarchy.model.valobj.ValidationCheck;
import com.cloudgov.domain.hierarchy.service.HierarchyNodeEditorDomainService;
import com.cloudgov.types.enums.ResponseCode;
import com.cloudgov.types.enums.ValidationStatusEnum;
import com.cloudgov.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.cloudgov.test.support.HierarchyTestFixtures.awsSchema;
import static com.cloudgov.test.support.HierarchyTestFixtures.newEditorDomainService;
import static com.cloudgov.test.support.HierarchyTestFixtures.node;
import static com.cloudgov.test.support.HierarchyTestFixtures.orgOuSchema;
import static com.cloudgov.test.support.HierarchyTestFixtures.tag;
import static com.cloudgov.test.support.HierarchyTestFixtures.withCidr;
import static com.cloudgov.test.support.HierarchyTestFixtures.withTags;

public class HierarchyNodeEditorDomainServiceTest {

    private HierarchyNodeEditorDomainService editor;
    private HierarchyDesignSessionEntity session;

    @BeforeEach
    public void setUp() {
        editor = newEditorDomainService();
        session = HierarchyDesignSessionEntity.open("lz-1", awsSchema());
    }

    @Test
    public void shouldAddRootThenChildUnderSelection() {
        HierarchyNodeEntity root = editor.addLevel(session, "organization");
        HierarchyNodeEntity ou = editor.addLevel(session, "ou");

        Assertions.assertTrue(root.isRoot());
        Assertions.assertEquals(root.getId(), ou.getParentId());
        Assertions.assertEquals("New Organizational Unit", ou.getLabel());
        Assertions.assertEquals(ou.getId(), session.getSelection().nodeIdOrNull());
        Assertions.assertEquals(2L, session.getRevision());
    }

    @Test
    public void shouldRejectPlacementWithoutChangingTree() {
        HierarchyDesignSessionEntity orgSession = HierarchyDesignSessionEntity.open("lz-2", orgOuSchema());
        HierarchyNodeEntity root = editor.addLevel(orgSession, "org");

        AppException nested = Assertions.assertThrows(AppException.class, () -> editor.addLevel(orgSession, "org"));
        editor.select(orgSession, null);
        AppException unrooted = Assertions.assertThrows(AppException.class, () -> editor.addLevel(orgSession, "ou"));
        AppException undeclared = Assertions.assertThrows(AppException.class, () -> editor.addLevel(orgSession, "folder"));

        Assertions.assertEquals(ResponseCode.PLACEMENT_REJECTED.getCode(), nested.getCode());
        Assertions.assertEquals(ResponseCode.PLACEMENT_REJECTED.getCode(), unrooted.getCode());
        Assertions.assertEquals(ResponseCode.UNDECLARED_LEVEL.getCode(), undeclared.getCode());
        Assertions.assertEquals(1, orgSession.getTree().size());
        Assertions.assertTrue(orgSession.getTree().contains(root.getId()));
        Assertions.assertEquals(1L, orgSession.getRevision());
    }

    @Test
    public void shouldRejectSelectingUnknownNode() {
        editor.addLevel(session, "organization");

        AppException ex = Assertions.assertThrows(AppException.class, () -> editor.select(session, "ghost"));

        Assertions.assertEquals(ResponseCode.NODE_NOT_FOUND.getCode(), ex.getCode());
        Assertions.assertInstanceOf(NodeSelection.Selected.class, session.getSelection());
    }

    @Test
    public void shouldCascadeRemovalAndClearSelectionAndErrors() {
        loadAwsTree();
        editor.select(session, "acct");
        session.getNodeValidationErrors().put("vpc", List.of("stale"));
        session.getNodeValidationErrors().put("org", List.of("kept"));

        List<String> removed = editor.removeNode(session, "ou");

        Assertions.assertEquals(List.of("ou", "acct", "vpc"), removed);
        Assertions.assertEquals(1, session.getTree().size());
        Assertions.assertEquals(NodeSelection.none(), session.getSelection());
        Assertions.assertEquals(List.of("org"), List.copyOf(session.getNodeValidationErrors().keySet()));
    }

    @Test
    public void shouldReplaceTagPolicyInPlaceAndRemoveByKey() {
        loadAwsTree();
        editor.addTagPolicy(session, "ou", tag("owner", "a"));
        editor.addTagPolicy(session, "ou", tag("app", null));
        editor.addTagPolicy(session, "ou", tag("owner", "b"));

        List<TagPolicyEntry> local = session.getTree().findById("ou").readTagPolicies();
        Assertions.assertEquals(List.of("owner", "app"), keys(local));
        Assertions.assertEquals("b", local.get(0).getDefaultValue());

        editor.removeTagPolicy(session, "ou", "owner");
        Assertions.assertEquals(List.of("app"), keys(session.getTree().findById("ou").readTagPolicies()));

        AppException blank = Assertions.assertThrows(AppException.class,
                () -> editor.addTagPolicy(session, "ou", tag(" ", null)));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), blank.getCode());
    }

    @Test
    public void shouldResolveInheritedPoliciesThroughSession() {
        loadAwsTree();
        editor.addTagPolicy(session, "org", tag("cost-center", "cc-1"));

        TagPolicyResolution resolution = editor.resolveTagPolicies(session, "vpc");

        Assertions.assertEquals(List.of("cost-center"), keys(resolution.effective()));
        Assertions.assertEquals("Acme", resolution.effective().get(0).getInheritedFrom());
    }

    @Test
    public void shouldEnforceLevelCapabilities() {
        loadAwsTree();

        AppException cidrOnOu = Assertions.assertThrows(AppException.class,
                () -> editor.setCidr(session, "ou", "10.0.0.0/8"));
        AppException envOnVpc = Assertions.assertThrows(AppException.class,
                () -> editor.setEnvironmentDesignation(session, "vpc", "production"));
        AppException unknownEnv = Assertions.assertThrows(AppException.class,
                () -> editor.setEnvironmentDesignation(session, "acct", "qa"));

        Assertions.assertEquals(ResponseCode.CAPABILITY_UNSUPPORTED.getCode(), cidrOnOu.getCode());
        Assertions.assertEquals(ResponseCode.CAPABILITY_UNSUPPORTED.getCode(), envOnVpc.getCode());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), unknownEnv.getCode());
    }

    @Test
    public void shouldStoreAndClearEnvironmentAndCidr() {
        loadAwsTree();

        editor.setEnvironmentDesignation(session, "acct", "Production");
        Assertions.assertEquals("production", session.getTree().findById("acct").readEnvironmentDesignation());
        editor.setEnvironmentDesignation(session, "acct", "none");
        Assertions.assertNull(session.getTree().findById("acct").readEnvironmentDesignation());

        editor.setCidr(session, "vpc", "not-a-cidr");
        Assertions.assertEquals("not-a-cidr", session.getTree().findById("vpc").readCidr());
        editor.setCidr(session, "vpc", "  ");
        Assertions.assertNull(session.getTree().findById("vpc").readCidr());
        Assertions.assertFalse(session.getTree().findById("vpc").getProperties().containsKey("ipam"));
    }

    @Test
    public void shouldMergeUpdateAndRename() {
        loadAwsTree();
        Map<String, Object> partial = new LinkedHashMap<>();
        partial.put("description", "shared workloads");

        HierarchyNodeEntity updated = editor.updateNode(session, "ou", "Shared", partial);

        Assertions.assertEquals("Shared", updated.getLabel());
        Assertions.assertEquals("shared workloads", updated.getProperties().get("description"));
        Assertions.assertThrows(AppException.class, () -> editor.updateNode(session, "ghost", "x", partial));
    }

    @Test
    public void shouldNotStoreInheritedEntriesSentThroughUpdate() {
        loadAwsTree();
        editor.addTagPolicy(session, "org", tag("cost-center", "cc-001"));
        TagPolicyEntry echoed = inheritedTag("cost-center", "Acme");
        Map<String, Object> partial = new LinkedHashMap<>();
        partial.put("tagPolicies", List.of(echoed, tag("app", "web")));

        editor.updateNode(session, "ou", null, partial);
        TagPolicyResolution resolution = editor.resolveTagPolicies(session, "ou");

        Assertions.assertEquals(List.of("app"), keys(session.getTree().findById("ou").readTagPolicies()));
        Assertions.assertEquals(List.of("app"), keys(resolution.local()));
        Assertions.assertEquals(List.of("cost-center", "app"), keys(resolution.effective()));
    }

    @Test
    public void shouldNotStoreInheritedEntriesSentThroughReplace() {
        editor.replaceHierarchy(session, List.of(
                withTags(node("org", null, "organization", "Acme"), tag("cost-center", "cc-001")),
                withTags(node("ou", "org", "ou", "Workloads"), inheritedTag("cost-center", "Acme"))), null);

        TagPolicyResolution resolution = editor.resolveTagPolicies(session, "ou");

        Assertions.assertTrue(session.getTree().findById("ou").readTagPolicies().isEmpty());
        Assertions.assertTrue(resolution.local().isEmpty());
        Assertions.assertEquals(List.of("cost-center"), keys(resolution.effective()));
        Assertions.assertTrue(editor.runIntegrityCheck(session).checks().stream()
                .noneMatch(check -> check.key().startsWith("tag_policy_conflict")));
    }

    @Test
    public void shouldApplyCapabilityChecksToUpdatedProperties() {
        loadAwsTree();
        Map<String, Object> ipam = new LinkedHashMap<>();
        ipam.put("cidr", "10.0.0.0/8");
        Map<String, Object> cidrOnOrg = new LinkedHashMap<>();
        cidrOnOrg.put("ipam", ipam);
        Map<String, Object> envOnOrg = new LinkedHashMap<>();
        envOnOrg.put("environmentDesignation", "production");
        Map<String, Object> bogusEnv = new LinkedHashMap<>();
        bogusEnv.put("environmentDesignation", "bogus");

        AppException ipamRejected = Assertions.assertThrows(AppException.class,
                () -> editor.updateNode(session, "org", null, cidrOnOrg));
        AppException envRejected = Assertions.assertThrows(AppException.class,
                () -> editor.updateNode(session, "org", null, envOnOrg));
        AppException unknownEnv = Assertions.assertThrows(AppException.class,
                () -> editor.updateNode(session, "acct", null, bogusEnv));

        Assertions.assertEquals(ResponseCode.CAPABILITY_UNSUPPORTED.getCode(), ipamRejected.getCode());
        Assertions.assertEquals(ResponseCode.CAPABILITY_UNSUPPORTED.getCode(), envRejected.getCode());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), unknownEnv.getCode());
        Assertions.assertNull(session.getTree().findById("org").readCidr());
        Assertions.assertNull(session.getTree().findById("org").readEnvironmentDesignation());
        Assertions.assertNull(session.getTree().findById("acct").readEnvironmentDesignation());
    }

    @Test
    public void shouldNormalizeEnvironmentSentThroughUpdate() {
        loadAwsTree();
        Map<String, Object> partial = new LinkedHashMap<>();
        partial.put("environmentDesignation", "Staging");

        editor.updateNode(session, "acct", null, partial);
        Assertions.assertEquals("staging", session.getTree().findById("acct").readEnvironmentDesignation());

        partial.put("environmentDesignation", "none");
        editor.updateNode(session, "acct", null, partial);
        Assertions.assertFalse(session.getTree().findById("acct").getProperties().containsKey("environmentDesignation"));
    }

    @Test
    public void shouldKeepLabelWhenUpdateRejected() {
        HierarchyDesignSessionEntity orgSession = HierarchyDesignSessionEntity.open("lz-2", orgOuSchema());
        HierarchyNodeEntity root = editor.addLevel(orgSession, "org");
        long revision = orgSession.getRevision();
        Map<String, Object> partial = new LinkedHashMap<>();
        partial.put("tagPolicies", List.of(tag("x", null)));

        AppException rejected = Assertions.assertThrows(AppException.class,
                () -> editor.updateNode(orgSession, root.getId(), "After", partial));

        Assertions.assertEquals(ResponseCode.CAPABILITY_UNSUPPORTED.getCode(), rejected.getCode());
        Assertions.assertEquals("New Org", orgSession.getTree().findById(root.getId()).getLabel());
        Assertions.assertFalse(orgSession.getTree().findById(root.getId()).getProperties().containsKey("tagPolicies"));
        Assertions.assertEquals(revision, orgSession.getRevision());
    }

    @Test
    public void shouldRejectInvalidReplacementAndKeepCurrentTree() {
        loadAwsTree();

        AppException undeclared = Assertions.assertThrows(AppException.class, () -> editor.replaceHierarchy(session,
                List.of(node("x", null, "organization", "X"), node("y", "x", "folder", "Y")), null));
        AppException badRoot = Assertions.assertThrows(AppException.class, () -> editor.replaceHierarchy(session,
                List.of(node("x", null, "ou", "X")), null));
        AppException duplicate = Assertions.assertThrows(AppException.class, () -> editor.replaceHierarchy(session,
                List.of(node("x", null, "organization", "X"), node("x", null, "organization", "X")), null));

        Assertions.assertEquals(ResponseCode.UNDECLARED_LEVEL.getCode(), undeclared.getCode());
        Assertions.assertEquals(ResponseCode.HIERARCHY_INTEGRITY_VIOLATION.getCode(), badRoot.getCode());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), duplicate.getCode());
        Assertions.assertEquals(4, session.getTree().size());
    }

    @Test
    public void shouldApplyDefaultTagsToRootsOnReplace() {
        editor.replaceHierarchy(session, List.of(
                withTags(node("org", null, "organization", "Acme"), tag("owner", "platform")),
                node("ou", "org", "ou", "Workloads")), List.of(tag("owner", "default"), tag("cost-center", null)));

        List<TagPolicyEntry> rootTags = session.getTree().findById("org").readTagPolicies();
        Assertions.assertEquals(List.of("owner", "cost-center"), keys(rootTags));
        Assertions.assertEquals("platform", rootTags.get(0).getDefaultValue());
        Assertions.assertTrue(session.getTree().findById("ou").readTagPolicies().isEmpty());
    }

    @Test
    public void shouldMapIntegrityAndExternalChecksToNodes() {
        loadAwsTree();
        editor.setCidr(session, "vpc", "10.0.0.0/16");
        session.getTree().findById("acct").setTypeId("subnet");

        IntegrityReport report = editor.runIntegrityCheck(session);

        Assertions.assertTrue(report.hasErrors());
        Assertions.assertEquals(List.of("acct", "vpc"), List.copyOf(report.nodeErrors().keySet()));

        Map<String, List<String>> external = editor.applyValidation(session, List.of(
                new ValidationCheck("tag_required:node:org", "标签", ValidationStatusEnum.ERROR, "owner required")));
        Assertions.assertEquals(Map.of("org", List.of("owner required")), external);
        Assertions.assertEquals(external, session.getNodeValidationErrors());
    }

    @Test
    public void shouldSummarizeIpamAndSuggestBlocks() {
        editor.replaceHierarchy(session, List.of(
                node("org", null, "organization", "Acme"),
                node("ou", "org", "ou", "Workloads"),
                node("acct", "ou", "account", "Prod"),
                withCidr(node("vpc", "acct", "vpc", "Core"), "10.0.0.0/24"),
                withCidr(node("sn-a", "vpc", "subnet", "A"), "10.0.0.0/26"),
                withCidr(node("sn-b", "vpc", "subnet", "B"), "10.0.0.64/26"),
                withCidr(node("sn-c", "vpc", "subnet", "C"), "192.168.0.0/26")), null);

        IpamSummary vpc = editor.ipamSummary(session, "vpc");
        IpamSummary outside = editor.ipamSummary(session, "sn-c");

        Assertions.assertEquals(3, vpc.childCount());
        Assertions.assertEquals("10.0.0.255", vpc.broadcast());
        Assertions.assertTrue(vpc.privateRange());
        Assertions.assertTrue(vpc.containedInParent());
        Assertions.assertEquals("10.0.0.0/24", outside.parentCidr());
        Assertions.assertFalse(outside.containedInParent());
        Assertions.assertEquals("10.0.0.128/26", editor.suggestChildBlock(session, "vpc", 26));
    }

    @Test
    public void shouldPreviewNamingWithNodeContext() {
        loadAwsTree();
        editor.setEnvironmentDesignation(session, "acct", "production");
        editor.setNamingTemplate(session, "acct", "{{provider}}-{{env}}-{{type}}-{{name}}");

        Assertions.assertEquals("aws-production-account-prod-workloads",
                editor.namingPreview(session, "acct", null, "001", "us-east-1"));
        Assertions.assertEquals("core-dev-042",
                editor.namingPreview(session, "vpc", "{{name}}-{{env}}-{{seq}}", "042", null));
    }

    private void loadAwsTree() {
        editor.replaceHierarchy(session, List.of(
                node("org", null, "organization", "Acme"),
                node("ou", "org", "ou", "Workloads"),
                node("acct", "ou", "account", "Prod Workloads"),
                node("vpc", "acct", "vpc", "Core")), null);
    }

    private TagPolicyEntry inheritedTag(String key, String ancestorLabel) {
        return tag(key, null).inheritedCopy(ancestorLabel);
    }

    private List<String> keys(List<TagPolicyEntry> entries) {
        return entries.stream().map(TagPolicyEntry::getTagKey).collect(Collectors.toList());
    }
}
