package io.autolv.vistrings;

import io.autolv.panel.ControlDefinition;
import java.io.IOException;
import java.io.StringReader;
import java.util.Map;
import java.util.Objects;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses LabVIEW "Export VI Strings" output into control definitions.
 * <p>
 * The export is not XML. It is first repaired by {@link ViStringsPreprocessor}, then parsed with
 * DTDs and external entities disabled, then walked by {@link ControlExtractor} starting at the
 * {@code CONTENT} element of the root {@code VI} element.
 */
public final class ViStringsParser {

    private static final Logger log = LoggerFactory.getLogger(ViStringsParser.class);

    private static final int EXCERPT_RADIUS = 40;

    private final ViStringsPreprocessor preprocessor;
    private final ControlExtractor extractor;

    public ViStringsParser() {
        this(new ViStringsPreprocessor(), new ControlExtractor());
    }

    public ViStringsParser(ViStringsPreprocessor preprocessor, ControlExtractor extractor) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /**
     * @throws ViStringsFormatException when the export cannot be repaired into a control tree
     */
    public ViStringsDocument parse(String exported) {
        Objects.requireNonNull(exported, "exported");
        if (exported.isBlank()) {
            throw new ViStringsFormatException("VI strings export is empty");
        }
        String repaired = preprocessor.repair(exported);
        Element root = parseXml(repaired).getDocumentElement();
        if (!"VI".equals(root.getTagName())) {
            throw new ViStringsFormatException("root element must be <VI>, found <" + root.getTagName() + ">");
        }
        Element content = ControlExtractor.child(root, "CONTENT")
            .orElseThrow(() -> new ViStringsFormatException("<VI> has no CONTENT element"));
        Map<String, ControlDefinition> definitions = extractor.extract(content);

        String name = emptyToNull(root.getAttribute("name"));
        String version = emptyToNull(root.getAttribute("LVversion"));
        log.info("Parsed VI strings of {} (LabVIEW {}): {} controls", name, version, definitions.size());
        return new ViStringsDocument(name, version, definitions);
    }

    /**
     * Top-level definitions only.
     */
    public Map<String, ControlDefinition> parseControls(String exported) {
        return parse(exported).definitions();
    }

    private static Document parseXml(String xml) {
        DocumentBuilder builder;
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            dbf.setExpandEntityReferences(false);
            dbf.setCoalescing(true);
            builder = dbf.newDocumentBuilder();
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser does not support secure processing", ex);
        }
        builder.setErrorHandler(new RethrowingErrorHandler());
        try {
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXParseException ex) {
            throw new ViStringsFormatException(
                "repaired VI strings are not well-formed at line " + ex.getLineNumber() + ", column "
                    + ex.getColumnNumber() + ": " + ex.getMessage(),
                ex.getLineNumber(), ex.getColumnNumber(), excerpt(xml, ex.getLineNumber(), ex.getColumnNumber()), ex);
        } catch (SAXException | IOException ex) {
            throw new ViStringsFormatException("failed to parse repaired VI strings", ex);
        }
    }

    static String excerpt(String text, int line, int column) {
        if (line < 1) {
            return null;
        }
        String[] lines = text.split("\\R", -1);
        if (line > lines.length) {
            return null;
        }
        String target = lines[line - 1];
        int at = Math.max(0, Math.min(target.length(), column - 1));
        int from = Math.max(0, at - EXCERPT_RADIUS);
        int to = Math.min(target.length(), at + EXCERPT_RADIUS);
        return target.substring(from, to);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static final class RethrowingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            log.warn("VI strings parser warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
