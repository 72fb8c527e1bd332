package com.example.sop_generator.service;

import com.example.sop_generator.dto.*;
import com.example.sop_generator.exception.SopGenerationException;
import com.example.sop_generator.model.ProcessGraph;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the engine: parses the BPMN XML once, synthesizes the step rows,
 * plans the SLA merges and fills the document header from the request and the diagram.
 */
@Service
public class SopService {

    private static final Logger log = LoggerFactory.getLogger(SopService.class);

    @Autowired
    private BpmnLoaderService loader;

    @Autowired
    private StepSynthesisService stepSynthesis;

    @Autowired
    private SlaMergeService slaMerge;

    @Autowired
    private MetadataService metadataService;

    @Value("${app.sop.default-issued-by:Business Excellence}")
    private String defaultIssuedBy;

    @Value("${app.sop.default-release-date:TBD}")
    private String defaultReleaseDate;

    public SopContext generate(String xml, SopMetadata requested) {
        BpmnModelInstance model = loader.read(xml);
        SopMetadata meta = requested != null ? requested : new SopMetadata();

        try {
            ProcessGraph g = loader.buildGraph(model);
            List<StepRecord> steps = stepSynthesis.synthesize(g);
            List<SlaMerge> merges = slaMerge.plan(steps);
            BpmnMetadata extracted = metadataService.extract(model, g);

            SopContext ctx = assemble(meta, extracted);
            ctx.setSteps(steps);
            ctx.setSlaMerges(merges);

            log.info("Generated SOP '{}': {} tasks, {} rows, {} SLA merges",
                    ctx.getProcessName(), g.getTasks().size(), steps.size(), merges.size());
            return ctx;
        } catch (SopGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SopGenerationException("SOP generation failed: " + e.getMessage(), e);
        }
    }

    public BpmnMetadata extractMetadata(String xml) {
        BpmnModelInstance model = loader.read(xml);
        try {
            return metadataService.extract(model, loader.buildGraph(model));
        } catch (RuntimeException e) {
            throw new SopGenerationException("Metadata extraction failed: " + e.getMessage(), e);
        }
    }

    /* ===================== Header ===================== */

    SopContext assemble(SopMetadata meta, BpmnMetadata extracted) {
        SopContext ctx = new SopContext();
        ctx.setProcessName(orElse(meta.getProcessName(), extracted.getProcessName()));
        ctx.setProcessCode(orElse(meta.getProcessCode(), extracted.getProcessCode()));
        ctx.setPurpose(orElse(meta.getPurpose(), extracted.getPurpose()));
        ctx.setScope(orElse(meta.getScope(), extracted.getScope()));

        ctx.setIssuedBy(meta.getIssuedBy() != null ? meta.getIssuedBy() : defaultIssuedBy);
        ctx.setReleaseDate(meta.getReleaseDate() != null ? meta.getReleaseDate() : defaultReleaseDate);
        ctx.setProcessOwner(nullToEmpty(meta.getProcessOwner()));
        ctx.setAbbreviations(nullToEmpty(meta.getAbbreviations()));
        ctx.setReferences(nullToEmpty(meta.getReferences()));
        ctx.setInputs(meta.getInputs() != null ? meta.getInputs() : extracted.getInputs());
        ctx.setOutputs(meta.getOutputs() != null ? meta.getOutputs() : extracted.getOutputs());

        ctx.setAbbreviationsList(meta.getAbbreviationsList() != null
                ? meta.getAbbreviationsList() : listOrEmpty(extracted.getAbbreviationsList()));
        ctx.setGeneralPoliciesList(meta.getGeneralPoliciesList() != null
                ? meta.getGeneralPoliciesList() : listOrEmpty(extracted.getGeneralPoliciesList()));
        ctx.setReferencesList(meta.getReferencesList() != null
                ? meta.getReferencesList()
                : defaultReferences(listOrEmpty(extracted.getLaneNames()), ctx.getProcessCode(), ctx.getProcessName()));
        return ctx;
    }

    /** One approval row per lane, then the process diagram row when a name or code is known. */
    static List<ReferenceDocument> defaultReferences(List<String> laneNames, String code, String name) {
        List<ReferenceDocument> refs = new ArrayList<>();
        for (String lane : laneNames) refs.add(new ReferenceDocument("N/A", lane + " Approval"));
        if (!code.isEmpty() || !name.isEmpty()) {
            String id = code.isEmpty() ? "DGM-" : "DGM- " + code;
            refs.add(new ReferenceDocument(id, name + " Process Diagram        Notations Meaning"));
        }
        return refs;
    }

    private static String orElse(String requested, String extracted) {
        if (requested != null && !requested.isBlank()) return requested.trim();
        return extracted != null ? extracted : "";
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static <T> List<T> listOrEmpty(List<T> list) {
        return list != null ? list : new ArrayList<>();
    }
}
