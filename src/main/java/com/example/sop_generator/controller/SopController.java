package com.example.sop_generator.controller;

import com.example.sop_generator.dto.BpmnMetadata;
import com.example.sop_generator.dto.GenerateRequest;
import com.example.sop_generator.dto.SopContext;
import com.example.sop_generator.exception.MalformedBpmnException;
import com.example.sop_generator.service.SopService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@CrossOrigin(origins = "${app.cors.allowed-origins}")
@RestController
@RequestMapping("/api/sop")
public class SopController {

    @Autowired
    private SopService sopService;

    /* ================= Generate SOP context ================= */
    @PostMapping("/generate")
    public ResponseEntity<SopContext> generate(@RequestBody GenerateRequest request) {
        String xml = requireXml(request);
        return ResponseEntity.ok(sopService.generate(xml, request.getMetadata()));
    }

    /* ================= Header fields only ================= */
    @PostMapping("/extract-metadata")
    public ResponseEntity<BpmnMetadata> extractMetadata(@RequestBody GenerateRequest request) {
        String xml = requireXml(request);
        return ResponseEntity.ok(sopService.extractMetadata(xml));
    }

    private static String requireXml(GenerateRequest request) {
        if (request == null || request.getXml() == null || request.getXml().isBlank()) {
            throw new MalformedBpmnException("No XML provided");
        }
        return request.getXml();
    }
}
