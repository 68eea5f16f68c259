package com.swipesentinel.capture;

import com.swipesentinel.model.Bounds;
import com.swipesentinel.model.Observation;
import com.swipesentinel.model.UiNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a UiAutomator page-source dump into an {@link Observation}.
 *
 * Nodes are kept in document order with a 1-based ordinal. Visible strings are the
 * trimmed, de-duplicated {@code text} and {@code content-desc} values in the same order.
 */
public class UiHierarchyParser {

    public static final int DEFAULT_MAX_NODES = 3500;

    private static final Pattern BOUNDS = Pattern.compile("\\[(-?\\d+),(-?\\d+)]\\[(-?\\d+),(-?\\d+)]");

    private final int maxNodes;

    public UiHierarchyParser() {
        this(DEFAULT_MAX_NODES);
    }

    public UiHierarchyParser(int maxNodes) {
        if (maxNodes <= 0) throw new IllegalArgumentException("maxNodes must be > 0");
        this.maxNodes = maxNodes;
    }

    /**
     * @throws IllegalArgumentException when the source is empty or not well-formed XML
     */
    public Observation parse(String pageSource, byte[] screenshotPng, Instant capturedAt) {
        if (pageSource == null || pageSource.isBlank()) {
            throw new IllegalArgumentException("page source was empty");
        }
        Document doc = readDocument(pageSource);

        NodeList all = doc.getElementsByTagName("*");
        List<UiNode> nodes = new ArrayList<>();
        Set<String> strings = new LinkedHashSet<>();
        String packageName = null;

        for (int i = 0; i < all.getLength() && nodes.size() < maxNodes; i++) {
            Element el = (Element) all.item(i);
            if (packageName == null && !el.getAttribute("package").isEmpty()) {
                packageName = el.getAttribute("package");
            }
            UiNode node = new UiNode(
                nodes.size() + 1,
                emptyToNull(el.getAttribute("class")),
                emptyToNull(el.getAttribute("resource-id")),
                emptyToNull(el.getAttribute("text")),
                emptyToNull(el.getAttribute("content-desc")),
                "true".equals(el.getAttribute("clickable")),
                "true".equals(el.getAttribute("enabled")),
                parseBounds(el.getAttribute("bounds")));
            nodes.add(node);

            addString(strings, node.text());
            addString(strings, node.contentDesc());
        }

        return new Observation(new ArrayList<>(strings), nodes, packageName, screenshotPng,
            pageSource, capturedAt);
    }

    public static Bounds parseBounds(String raw) {
        if (raw == null || raw.isEmpty()) return null;
        Matcher m = BOUNDS.matcher(raw);
        if (!m.find()) return null;
        return new Bounds(
            Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
            Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)));
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private Document readDocument(String pageSource) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new ByteArrayInputStream(pageSource.trim().getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse page source XML: " + e.getMessage(), e);
        }
    }

    private static void addString(Set<String> strings, String value) {
        if (value == null) return;
        String normalized = value.trim();
        if (!normalized.isEmpty()) strings.add(normalized);
    }

    private static String emptyToNull(String value) {
        return (value == null || value.isEmpty()) ? null : value;
    }
}
