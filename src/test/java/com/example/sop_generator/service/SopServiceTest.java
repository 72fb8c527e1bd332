package com.example.sop_generator.service;

import com.example.sop_generator.dto.*;
import com.example.sop_generator.exception.MalformedBpmnException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SopServiceTest {

    private final SopService sopService = new SopService();
    private String xml;

    @BeforeEach
    void setUp() throws IOException {
        TraversalService traversal = new TraversalService();
        GatewayCaseService gatewayCases = new GatewayCaseService();
        ReflectionTestUtils.setField(gatewayCases, "traversal", traversal);
        StepSynthesisService synthesis = new StepSynthesisService();
        ReflectionTestUtils.setField(synthesis, "traversal", traversal);
        ReflectionTestUtils.setField(synthesis, "gatewayCases", gatewayCases);
        MetadataService metadata = new MetadataService();
        ReflectionTestUtils.setField(metadata, "traversal", traversal);

        ReflectionTestUtils.setField(sopService, "loader", new BpmnLoaderService());
        ReflectionTestUtils.setField(sopService, "stepSynthesis", synthesis);
        ReflectionTestUtils.setField(sopService, "slaMerge", new SlaMergeService());
        ReflectionTestUtils.setField(sopService, "metadataService", metadata);
        ReflectionTestUtils.setField(sopService, "defaultIssuedBy", "Business Excellence");
        ReflectionTestUtils.setField(sopService, "defaultReleaseDate", "TBD");

        xml = StreamUtils.copyToString(new ClassPathResource("bpmn/purchase-request.bpmn").getInputStream(), StandardCharsets.UTF_8);
    }

    @Test
    void shouldGenerateStepsFromDocument() {
        SopContext ctx = sopService.generate(xml, null);

        List<String> refs = ctx.getSteps().stream().map(StepRecord::getRef).collect(Collectors.toList());
        assertEquals(List.of("1", "2", "2A", "2B", "3"), refs);

        StepRecord submit = ctx.getSteps().get(0);
        assertEquals("Submit purchase request", submit.getParagraphs().get(0).getText());
        assertEquals("The Requester shall fill in the purchase request form.", submit.getParagraphs().get(2).getText());
        assertEquals("Employee", submit.getRaci().getResponsible());
        assertEquals("N/A", submit.getRaci().getInformed());
        assertNull(submit.getSla());

        StepRecord review = ctx.getSteps().get(1);
        assertEquals("The Procurement shall check the budget and the attached quotes.", review.getParagraphs().get(2).getText());
        assertEquals("3 working days", review.getSla());
        assertEquals("Group_sla", review.getSlaGroup());

        StepRecord rejected = ctx.getSteps().get(2);
        assertEquals("Case A: Rejected", rejected.getParagraphs().get(0).getText());
        assertEquals("Budget or quotes are missing.", rejected.getParagraphs().get(2).getText());
        assertEquals("Revert to Step 1", rejected.getParagraphs().get(4).getText());
        assertEquals("Finance", rejected.getRaci().getConsulted());

        StepRecord order = ctx.getSteps().get(4);
        assertEquals("Process Ends (Order issued)", order.getParagraphs().get(order.getParagraphs().size() - 1).getText());

        assertEquals(1, ctx.getSlaMerges().size());
        assertEquals(1, ctx.getSlaMerges().get(0).getStart());
        assertEquals(4, ctx.getSlaMerges().get(0).getEnd());
        assertEquals("3 working days", ctx.getSlaMerges().get(0).getSla());
    }

    @Test
    void shouldFillHeaderFromDocumentAndDefaults() {
        SopContext ctx = sopService.generate(xml, new SopMetadata());

        assertEquals("Purchase Request", ctx.getProcessName());
        assertEquals("PR-001", ctx.getProcessCode());
        assertEquals("Ensure every purchase is reviewed and approved before an order is issued.", ctx.getPurpose());
        assertEquals("All purchases below the capital expenditure threshold.", ctx.getScope());
        assertEquals("Business Excellence", ctx.getIssuedBy());
        assertEquals("TBD", ctx.getReleaseDate());
        assertEquals("", ctx.getProcessOwner());
        assertEquals("1. Purchase need", ctx.getInputs());
        assertEquals("1. Order issued", ctx.getOutputs());
        assertEquals("Purchase Order", ctx.getAbbreviationsList().get(0).getDefinition());
        assertEquals("Requests above budget need a second approval.", ctx.getGeneralPoliciesList().get(0).getPolicy());

        List<ReferenceDocument> refs = ctx.getReferencesList();
        assertEquals(3, refs.size());
        assertEquals("N/A", refs.get(0).getId());
        assertEquals("Requester Approval", refs.get(0).getTitle());
        assertEquals("Procurement Approval", refs.get(1).getTitle());
        assertEquals("DGM- PR-001", refs.get(2).getId());
        assertEquals("Purchase Request Process Diagram        Notations Meaning", refs.get(2).getTitle());
    }

    @Test
    void shouldPreferRequestedHeaderValues() {
        SopMetadata requested = new SopMetadata();
        requested.setProcessName("  Procurement Request  ");
        requested.setProcessCode(" ");
        requested.setIssuedBy("Finance Office");
        requested.setProcessOwner("Head of Procurement");
        requested.setInputs("");
        requested.setAbbreviationsList(List.of());
        requested.setReferencesList(List.of(new ReferenceDocument("POL-7", "Purchasing Policy")));

        SopContext ctx = sopService.generate(xml, requested);

        assertEquals("Procurement Request", ctx.getProcessName());
        assertEquals("PR-001", ctx.getProcessCode());
        assertEquals("Finance Office", ctx.getIssuedBy());
        assertEquals("Head of Procurement", ctx.getProcessOwner());
        assertEquals("", ctx.getInputs());
        assertTrue(ctx.getAbbreviationsList().isEmpty());
        assertEquals(1, ctx.getReferencesList().size());
        assertEquals("POL-7", ctx.getReferencesList().get(0).getId());
    }

    @Test
    void shouldBuildDiagramReferenceWithoutCode() {
        List<ReferenceDocument> refs = SopService.defaultReferences(List.of(), "", "Onboarding");

        assertEquals(1, refs.size());
        assertEquals("DGM-", refs.get(0).getId());
        assertTrue(SopService.defaultReferences(List.of("Ops"), "", "").stream()
                .noneMatch(r -> r.getId().startsWith("DGM")));
    }

    @Test
    void shouldRejectMalformedDocument() {
        assertThrows(MalformedBpmnException.class, () -> sopService.generate("<definitions>", null));
        assertThrows(MalformedBpmnException.class, () -> sopService.extractMetadata(""));
    }

    @Test
    void shouldExtractMetadataOnly() {
        BpmnMetadata meta = sopService.extractMetadata(xml);

        assertEquals("Purchase Request", meta.getProcessName());
        assertEquals(List.of("Requester", "Procurement"), meta.getLaneNames());
    }
}
