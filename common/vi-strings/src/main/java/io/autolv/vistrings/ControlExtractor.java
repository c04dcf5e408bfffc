package io.autolv.vistrings;

import io.autolv.panel.ControlDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Walks the repaired export and collects one {@link ControlDefinition} per {@code CONTROL} element.
 * <p>
 * {@code GROUPER} sections are flattened into the container that holds them. Type definitions are
 * unwrapped to the control they define, tab controls keep their pages, arrays of clusters keep their
 * element layout and clusters keep their members, all in export order.
 */
public final class ControlExtractor {

    private static final Logger log = LoggerFactory.getLogger(ControlExtractor.class);

    static final String TYPE_DEFINITION = "Type Definition";
    static final String TAB_CONTROL = "Tab Control";
    static final String ARRAY = "Array";
    static final String ARRAY_CLUSTER = "ArrayCluster";
    static final String CLUSTER = "Cluster";

    private static final String TYPE_DEF_PART = "Type Def's Control";
    private static final String RING_TEXT_PART = "ringtext";

    /**
     * Extracts the controls directly inside {@code container}, including those inside its groupers.
     *
     * @throws ViStringsFormatException when a control lacks a required element
     */
    public Map<String, ControlDefinition> extract(Element container) {
        Map<String, ControlDefinition> controls = new LinkedHashMap<>();
        for (Element child : childElements(container)) {
            switch (child.getTagName()) {
                case "GROUPER" -> childElements(child, "PARTS").forEach(parts -> putAll(controls, extract(parts), container));
                case "CONTROL" -> put(controls, control(child), container);
                default -> {
                }
            }
        }
        return controls;
    }

    private ControlDefinition control(Element control) {
        String type = control.getAttribute("type");
        ControlDefinition definition = switch (type) {
            case TYPE_DEFINITION -> typeDefinition(control);
            case TAB_CONTROL -> tabControl(control);
            case ARRAY -> array(control);
            default -> plain(control);
        };
        log.debug("Extracted {} '{}' as {}", type, definition.name(), definition.type());
        return definition;
    }

    private ControlDefinition typeDefinition(Element control) {
        Element parts = required(control, "PARTS");
        for (Element part : childElements(parts, "PART")) {
            if (!TYPE_DEF_PART.equals(part.getAttribute("type"))) {
                continue;
            }
            Map<String, ControlDefinition> inner = extract(part);
            if (inner.isEmpty()) {
                break;
            }
            Map<String, Object> attributes = new LinkedHashMap<>(inner.values().iterator().next().attributes());
            attributes.put(ControlDefinition.NAME, control.getAttribute("name"));
            text(required(control, "DESC")).ifPresent(desc -> attributes.put(ControlDefinition.DESCRIPTION, desc));
            text(required(control, "TIP")).ifPresent(tip -> attributes.put(ControlDefinition.TIP, tip));
            return ControlDefinition.of(attributes);
        }
        throw new ViStringsFormatException(
            "type definition '" + control.getAttribute("name") + "' has no " + TYPE_DEF_PART + " part");
    }

    private ControlDefinition tabControl(Element control) {
        Map<String, Object> attributes = common(control);
        Element captions = required(required(control, "PRIV"), "PAGE_CAPTIONS");
        List<String> names = new ArrayList<>();
        childElements(captions, "STRING").forEach(caption -> names.add(text(caption).orElse("")));
        List<Element> pageElements = childElements(control, "PAGE");
        if (names.size() != pageElements.size()) {
            throw new ViStringsFormatException("tab control '" + control.getAttribute("name") + "' has "
                + names.size() + " page captions for " + pageElements.size() + " pages");
        }
        Map<String, Map<String, ControlDefinition>> pages = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            if (pages.put(names.get(i), extract(pageElements.get(i))) != null) {
                throw new ViStringsFormatException(
                    "tab control '" + control.getAttribute("name") + "' has two pages named '" + names.get(i) + "'");
            }
        }
        attributes.put(ControlDefinition.PAGES, pages);
        return ControlDefinition.of(attributes);
    }

    private ControlDefinition array(Element control) {
        Map<String, Object> attributes = common(control);
        Element element = required(required(control, "CONTENT"), "CONTROL");
        String elementType = element.getAttribute("type");
        attributes.put("elementtype", elementType);
        if (CLUSTER.equals(elementType)) {
            attributes.put(ControlDefinition.TYPE, ARRAY_CLUSTER);
            attributes.put(ControlDefinition.ELEMENT, control(element));
        }
        return ControlDefinition.of(attributes);
    }

    private ControlDefinition plain(Element control) {
        Map<String, Object> attributes = common(control);
        for (Element part : childElements(required(control, "PARTS"), "PART")) {
            String partType = part.getAttribute("type").toLowerCase(Locale.ROOT).replace(" ", "");
            child(part, "LABEL")
                .flatMap(label -> child(label, "STEXT"))
                .flatMap(ControlExtractor::text)
                .ifPresent(label -> attributes.put(partType, label));
            if (RING_TEXT_PART.equals(partType)) {
                attributes.put(ControlDefinition.ITEMS, ringItems(control, part));
            }
        }
        child(control, "CONTENT").ifPresent(content -> attributes.put(ControlDefinition.MEMBERS, extract(content)));
        return ControlDefinition.of(attributes);
    }

    private List<String> ringItems(Element control, Element part) {
        Element strings = child(part, "MLABEL")
            .flatMap(label -> child(label, "STRINGS"))
            .orElseThrow(() -> new ViStringsFormatException(
                "ring text of '" + control.getAttribute("name") + "' has no MLABEL/STRINGS"));
        List<String> items = new ArrayList<>();
        childElements(strings, "STRING").forEach(item -> items.add(text(item).orElse("")));
        return items;
    }

    private Map<String, Object> common(Element control) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        NamedNodeMap raw = control.getAttributes();
        for (int i = 0; i < raw.getLength(); i++) {
            Node attribute = raw.item(i);
            attributes.put(attribute.getNodeName(), attribute.getNodeValue());
        }
        if (!attributes.containsKey(ControlDefinition.NAME)) {
            throw new ViStringsFormatException("control of type '" + control.getAttribute("type") + "' has no name");
        }
        attributes.put(ControlDefinition.DESCRIPTION, text(required(control, "DESC")).orElse(null));
        attributes.put(ControlDefinition.TIP, text(required(control, "TIP")).orElse(null));
        return attributes;
    }

    private static void put(Map<String, ControlDefinition> controls, ControlDefinition definition, Element container) {
        if (controls.putIfAbsent(definition.name(), definition) != null) {
            log.warn("Duplicate control '{}' in {}; keeping the first", definition.name(), container.getTagName());
        }
    }

    private static void putAll(Map<String, ControlDefinition> controls, Map<String, ControlDefinition> more, Element container) {
        more.values().forEach(definition -> put(controls, definition, container));
    }

    private static Element required(Element parent, String tag) {
        return child(parent, tag).orElseThrow(() -> new ViStringsFormatException(
            describe(parent) + " has no " + tag + " element"));
    }

    private static String describe(Element element) {
        String name = element.getAttribute("name");
        return name.isEmpty() ? element.getTagName() : element.getTagName() + " '" + name + "'";
    }

    static Optional<Element> child(Element parent, String tag) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element && tag.equals(element.getTagName())) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    static List<Element> childElements(Element parent, String tag) {
        List<Element> children = new ArrayList<>();
        for (Element element : childElements(parent)) {
            if (tag.equals(element.getTagName())) {
                children.add(element);
            }
        }
        return children;
    }

    static List<Element> childElements(Element parent) {
        List<Element> children = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element element) {
                children.add(element);
            }
        }
        return children;
    }

    /**
     * Text of an element with line-break markers rendered as newlines; empty text reads as absent.
     */
    static Optional<String> text(Element element) {
        StringBuilder text = new StringBuilder();
        appendText(element, text);
        return text.length() == 0 ? Optional.empty() : Optional.of(text.toString());
    }

    private static void appendText(Node node, StringBuilder text) {
        for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            switch (child.getNodeType()) {
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> text.append(child.getNodeValue());
                case Node.ELEMENT_NODE -> {
                    String tag = ((Element) child).getTagName();
                    if ("LF".equals(tag) || "CRLF".equals(tag)) {
                        text.append('\n');
                    } else {
                        appendText(child, text);
                    }
                }
                default -> {
                }
            }
        }
    }
}
