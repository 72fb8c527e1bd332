package com.example.sop_generator.service;

import com.example.sop_generator.exception.MalformedBpmnException;
import com.example.sop_generator.model.*;
import com.example.sop_generator.support.BpmnXmlBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BpmnLoaderServiceTest {

    private final BpmnLoaderService loader = new BpmnLoaderService();

    @Test
    void shouldRejectEmptyDocument() {
        assertThrows(MalformedBpmnException.class, () -> loader.read(""));
        assertThrows(MalformedBpmnException.class, () -> loader.read("   "));
        assertThrows(MalformedBpmnException.class, () -> loader.read((String) null));
    }

    @Test
    void shouldRejectDocumentThatIsNotXml() {
        MalformedBpmnException e = assertThrows(MalformedBpmnException.class, () -> loader.read("<bpmn:definitions"));
        assertEquals("MALFORMED_BPMN", e.getCode());
    }

    @Test
    void shouldRejectXmlThatIsNotBpmn() {
        assertThrows(MalformedBpmnException.class, () -> loader.read("<order><id>1</id></order>"));
    }

    @Test
    void shouldParseLeadingStepNumber() {
        assertEquals(12, BpmnLoaderService.stepNumber("12. Review request"));
        assertEquals(3, BpmnLoaderService.stepNumber("3: Approve"));
        assertEquals(7, BpmnLoaderService.stepNumber("  7 - Ship"));
        assertEquals(4, BpmnLoaderService.stepNumber("4Archive"));
        assertNull(BpmnLoaderService.stepNumber("Review request"));
        assertNull(BpmnLoaderService.stepNumber(null));
        assertNull(BpmnLoaderService.stepNumber("99999999999. Too large"));
    }

    @Test
    void shouldCleanTaskLabels() {
        assertEquals("Review request", BpmnLoaderService.cleanLabel("1. Review\nrequest"));
        assertEquals("Send mail", BpmnLoaderService.cleanLabel("2:  Send \t mail "));
        assertEquals("", BpmnLoaderService.cleanLabel(null));
        assertEquals("Unnamed Process", BpmnLoaderService.subprocessName(null));
        assertEquals("Billing Process", BpmnLoaderService.subprocessName("Billing\nProcess"));
    }

    @Test
    void shouldBuildGraphFromDocument() {
        String xml = BpmnXmlBuilder.process()
                .lane("Lane_ops", "Operations", "Task_1", "Task_2")
                .laneRaci("Lane_ops", "Ops Officer", "Ops Manager", "", "Finance")
                .start("Start_1", "Request received")
                .task("Task_2", "2. Approve request")
                .task("Task_1", "1. Review\nrequest")
                .task("Task_note", "Check notes")
                .end("End_1", "Done")
                .flow("Flow_1", "Start_1", "Task_1")
                .flow("Flow_2", "Task_1", "Task_2")
                .flow("Flow_3", "Task_2", "End_1")
                .doc("Task_1", "check the request form\nattach evidence")
                .doc("Task_1", "application/x-sla", "2 days")
                .build();

        ProcessGraph g = loader.load(xml);

        List<String> order = g.numberedTasks().stream().map(TaskNode::getId).collect(Collectors.toList());
        assertEquals(List.of("Task_1", "Task_2"), order);
        assertEquals(3, g.getTasks().size());

        TaskNode review = g.task("Task_1");
        assertEquals("Review request", review.getLabel());
        assertEquals(1, review.getStep());
        assertEquals("Operations", review.getLaneName());
        assertEquals("Ops Officer", review.getRaci().getResponsible());
        assertEquals("N/A", review.getRaci().getConsulted());
        assertEquals("check the request form\nattach evidence", review.getDocumentation());
        assertEquals("2 days", review.getSla());
        assertEquals(List.of("Flow_1"), review.getIncoming());
        assertEquals(List.of("Flow_2"), review.getOutgoing());

        TaskNode note = g.task("Task_note");
        assertFalse(note.hasStep());
        assertEquals("[LANE UNREADABLE]", note.getLaneName());
        assertEquals("N/A", note.getRaci().getAccountable());

        assertEquals("Task_1", g.flow("Flow_2").getSourceId());
        assertEquals(EventType.START, g.event("Start_1").getType());
        assertEquals("Done", g.event("End_1").getName());
    }

    @Test
    void shouldStripCombiningMarksFromLaneName() {
        String xml = BpmnXmlBuilder.process()
                .lane("Lane_1", "Cafe\u0301 Team", "Task_1")
                .task("Task_1", "1. Serve")
                .build();

        assertEquals("Cafe Team", loader.load(xml).task("Task_1").getLaneName());
    }

    @Test
    void shouldClassifyGatewaysEventsAndSubprocesses() {
        String xml = BpmnXmlBuilder.process()
                .task("Task_1", "1. Collect")
                .xor("Gw_x", "Complete?")
                .and("Gw_a")
                .or("Gw_o")
                .subprocess("Sub_1", "Billing")
                .intermediate("Wait_1", "Payment received")
                .timer("Timer_1", "3 days", "Task_1", false)
                .end("End_1", null)
                .flow("Flow_1", "Task_1", "Gw_x")
                .flow("Flow_2", "Gw_x", "Gw_a", "Yes")
                .flow("Flow_3", "Gw_x", "Gw_o", "No")
                .flow("Flow_4", "Gw_a", "Sub_1")
                .flow("Flow_5", "Gw_o", "Wait_1")
                .flow("Flow_6", "Sub_1", "End_1")
                .flow("Flow_7", "Wait_1", "End_1")
                .flow("Flow_8", "Timer_1", "End_1")
                .build();

        ProcessGraph g = loader.load(xml);

        assertEquals(GatewayType.XOR, g.gateway("Gw_x").getType());
        assertEquals(GatewayType.AND, g.gateway("Gw_a").getType());
        assertEquals(GatewayType.OR, g.gateway("Gw_o").getType());
        assertTrue(g.gateway("Gw_x").isSplit());
        assertTrue(g.isSubprocess("Sub_1"));
        assertEquals(EventType.INTERMEDIATE, g.event("Wait_1").getType());
        assertFalse(g.event("End_1").hasName());

        List<BoundaryEventNode> boundary = g.boundaryEventsOf("Task_1");
        assertEquals(1, boundary.size());
        assertEquals(BoundaryKind.TIMER, boundary.get(0).getKind());
        assertFalse(boundary.get(0).isInterrupting());
        assertEquals(List.of("Flow_8"), boundary.get(0).getOutgoing());
        assertEquals("Yes", g.flow("Flow_2").getName());
        assertEquals("", g.flow("Flow_4").getName());
    }

    @Test
    void shouldAssignGroupSlaByShapeCentre() {
        String xml = BpmnXmlBuilder.process()
                .task("Task_1", "1. Inside")
                .task("Task_2", "2. Outside")
                .task("Task_3", "3. Own SLA")
                .doc("Task_3", "application/x-sla", "1 hour")
                .shape("Task_1", 120, 100, 100, 80)
                .shape("Task_2", 600, 100, 100, 80)
                .shape("Task_3", 130, 110, 100, 80)
                .group("Group_1", "5 working days", 100, 50, 300, 200)
                .build();

        ProcessGraph g = loader.load(xml);

        SlaAssignment inside = g.slaOf("Task_1");
        assertEquals("5 working days", inside.getSla());
        assertEquals("Group_1", inside.getGroupId());
        assertNull(g.slaOf("Task_2").getSla());
        assertEquals("1 hour", g.slaOf("Task_3").getSla());
        assertNull(g.slaOf("Task_3").getGroupId());
    }

    @Test
    void shouldSkipFlowToUnknownElement() {
        String xml = BpmnXmlBuilder.process()
                .task("Task_1", "1. Review")
                .task("Task_2", "2. Approve")
                .flow("Flow_1", "Task_1", "Task_2")
                .flow("Flow_2", "Task_1", "Missing_9")
                .flow("Flow_3", "Missing_8", "Task_2")
                .shape("Flow_2", 100, 100, 10, 10)
                .build();

        ProcessGraph g = loader.load(xml);

        assertNull(g.flow("Flow_2"));
        assertNull(g.flow("Flow_3"));
        assertEquals("Task_2", g.flow("Flow_1").getTargetId());
        assertEquals(List.of("Flow_1", "Flow_2"), g.task("Task_1").getOutgoing());
        assertEquals(2, g.numberedTasks().size());
    }

    @Test
    void shouldSkipBoundaryEventOnUnknownHost() {
        String xml = BpmnXmlBuilder.process()
                .lane("Lane_1", "Operations", "Task_1", "Timer_1")
                .task("Task_1", "1. Review")
                .end("End_1", "Expired")
                .timer("Timer_1", "2 days", "Task_9", true)
                .flow("Flow_1", "Timer_1", "End_1")
                .flow("Flow_2", "Task_1", "End_1")
                .build();

        ProcessGraph g = loader.load(xml);

        assertTrue(g.boundaryEventsOf("Task_9").isEmpty());
        assertTrue(g.boundaryEventsOf("Task_1").isEmpty());
        assertNull(g.flow("Flow_1"));
        assertEquals("End_1", g.flow("Flow_2").getTargetId());
        assertEquals("Operations", g.task("Task_1").getLaneName());
    }
}
