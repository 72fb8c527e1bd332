package com.example.sop_generator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes elements whose id references point nowhere before the document reaches schema validation.
 * <p>
 * Dropped: sequence flows with an unknown {@code sourceRef}/{@code targetRef}, boundary events with an
 * unknown {@code attachedToRef}, plus the lane {@code flowNodeRef}s, gateway {@code default}s and
 * diagram elements that named something dropped.
 */
final class DanglingReferenceFilter {

    private static final Logger log = LoggerFactory.getLogger(DanglingReferenceFilter.class);

    private DanglingReferenceFilter() {
    }

    /** Returns {@code xml} itself when nothing dangles, else the re-serialized cleaned document. */
    static byte[] filter(byte[] xml) throws ParserConfigurationException, SAXException, IOException, TransformerException {
        Document doc = parse(xml);

        Set<String> ids = new HashSet<>();
        for (Element el : elements(doc, "*", "*")) {
            String id = el.getAttribute("id");
            if (!id.isEmpty()) ids.add(id);
        }

        Set<String> dropped = new HashSet<>();

        for (Element boundary : elements(doc, BpmnLoaderService.BPMN_NS, "boundaryEvent")) {
            String host = localId(boundary.getAttribute("attachedToRef"));
            if (ids.contains(host)) continue;
            log.debug("Skipping boundary event {} attached to unknown element '{}'", boundary.getAttribute("id"), host);
            drop(boundary, ids, dropped);
        }

        for (Element flow : elements(doc, BpmnLoaderService.BPMN_NS, "sequenceFlow")) {
            String source = flow.getAttribute("sourceRef");
            String target = flow.getAttribute("targetRef");
            if (ids.contains(source) && ids.contains(target)) continue;
            log.debug("Skipping sequence flow {} from '{}' to '{}': unknown endpoint", flow.getAttribute("id"), source, target);
            drop(flow, ids, dropped);
        }

        if (dropped.isEmpty()) return xml;

        for (Element ref : elements(doc, BpmnLoaderService.BPMN_NS, "flowNodeRef")) {
            if (dropped.contains(ref.getTextContent().trim())) ref.getParentNode().removeChild(ref);
        }
        for (Element el : elements(doc, BpmnLoaderService.BPMN_NS, "*")) {
            if (el.hasAttribute("default") && dropped.contains(el.getAttribute("default"))) el.removeAttribute("default");
        }
        for (Element el : elements(doc, "*", "*")) {
            if (el.hasAttribute("bpmnElement") && dropped.contains(localId(el.getAttribute("bpmnElement")))) {
                el.getParentNode().removeChild(el);
            }
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(xml.length);
        TransformerFactory tf = TransformerFactory.newInstance();
        tf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        tf.newTransformer().transform(new DOMSource(doc), new StreamResult(out));
        return out.toByteArray();
    }

    private static Document parse(byte[] xml) throws ParserConfigurationException, SAXException, IOException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        dbf.setExpandEntityReferences(false);
        DocumentBuilder builder = dbf.newDocumentBuilder();
        // fatal errors throw; the default handler would also print them to stderr
        builder.setErrorHandler(new DefaultHandler());
        return builder.parse(new ByteArrayInputStream(xml));
    }

    private static void drop(Element el, Set<String> ids, Set<String> dropped) {
        String id = el.getAttribute("id");
        ids.remove(id);
        dropped.add(id);
        el.getParentNode().removeChild(el);
    }

    /** Snapshot of a live {@link NodeList}, so elements can be removed while iterating. */
    private static List<Element> elements(Document doc, String ns, String localName) {
        NodeList nodes = doc.getElementsByTagNameNS(ns, localName);
        List<Element> list = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) list.add((Element) nodes.item(i));
        return list;
    }

    /** QName-typed references may carry a prefix. */
    private static String localId(String ref) {
        int colon = ref.indexOf(':');
        return colon < 0 ? ref.trim() : ref.substring(colon + 1).trim();
    }
}
