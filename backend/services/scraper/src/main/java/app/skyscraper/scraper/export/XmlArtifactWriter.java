package app.skyscraper.scraper.export;

import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.extraction.result.ExtractionResult;
import app.skyscraper.scraper.extraction.result.ExtractionResults;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes the result envelope as nested elements: object keys become element names, list
 * entries become repeated {@code item} elements and scalars become text.
 */
@Component
public class XmlArtifactWriter implements ArtifactWriter {

    static final String ROOT = "extraction";
    static final String ITEM = "item";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[^A-Za-z0-9_.-]");
    private static final Pattern INVALID_XML_CHARS = Pattern.compile(
            "[^\\x09\\x0A\\x0D\\x20-\\uD7FF\\uE000-\\uFFFD\\x{10000}-\\x{10FFFF}]");

    private final XMLOutputFactory outputFactory = XMLOutputFactory.newInstance();

    @Override
    public ExportFormat format() {
        return ExportFormat.xml;
    }

    @Override
    public String write(ExtractionResult result, ExportContext context) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter writer = outputFactory.createXMLStreamWriter(out);
            writer.writeStartDocument("UTF-8", "1.0");
            writer.writeStartElement(ROOT);
            writeFields(writer, ExtractionResults.toEnvelope(result));
            writer.writeEndElement();
            writer.writeEndDocument();
            writer.flush();
            writer.close();
        } catch (XMLStreamException ex) {
            throw new IllegalStateException("Failed to render XML export", ex);
        }
        return out.toString();
    }

    private void writeFields(XMLStreamWriter writer, JsonNode object) throws XMLStreamException {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            writeNode(writer, elementName(field.getKey()), field.getValue());
        }
    }

    private void writeNode(XMLStreamWriter writer, String name, JsonNode value) throws XMLStreamException {
        if (value == null || value.isNull() || value.isMissingNode()) {
            writer.writeEmptyElement(name);
            return;
        }
        writer.writeStartElement(name);
        if (value.isObject()) {
            writeFields(writer, value);
        } else if (value.isArray()) {
            for (JsonNode element : value) {
                writeNode(writer, ITEM, element);
            }
        } else {
            writer.writeCharacters(INVALID_XML_CHARS.matcher(value.asText()).replaceAll(""));
        }
        writer.writeEndElement();
    }

    static String elementName(String key) {
        String name = WHITESPACE.matcher(key == null ? "" : key.trim()).replaceAll("_");
        name = INVALID_NAME_CHARS.matcher(name).replaceAll("_");
        if (name.isEmpty()) {
            return "_";
        }
        char first = name.charAt(0);
        if (!(Character.isLetter(first) || first == '_') || name.regionMatches(true, 0, "xml", 0, 3)) {
            return "_" + name;
        }
        return name;
    }
}
