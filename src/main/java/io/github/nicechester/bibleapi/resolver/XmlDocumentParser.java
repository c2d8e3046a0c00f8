package io.github.nicechester.bibleapi.resolver;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jdom2.Document;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Parses raw document bytes into a {@link ParsedDocument}, classifying the format.
 * Parse errors degrade to a malformed document instead of propagating.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class XmlDocumentParser {

    private final FormatDetector formatDetector;

    public ParsedDocument parse(String sourcePath, byte[] content) {
        if (content == null || content.length == 0) {
            log.warn("Empty document: {}", sourcePath);
            return ParsedDocument.malformed(sourcePath);
        }

        long startTime = System.currentTimeMillis();
        try {
            Document document = newBuilder().build(new ByteArrayInputStream(content));
            ParsedDocument parsed = ParsedDocument.of(sourcePath, document,
                formatDetector.detect(document.getRootElement()));
            log.info("Parsed {} as {} in {}ms", sourcePath, parsed.format(),
                System.currentTimeMillis() - startTime);
            return parsed;
        } catch (JDOMException | IOException e) {
            log.warn("Malformed XML in {}: {}", sourcePath, e.getMessage());
            return ParsedDocument.malformed(sourcePath);
        }
    }

    private static SAXBuilder newBuilder() {
        SAXBuilder builder = new SAXBuilder();
        builder.setExpandEntities(false);
        builder.setFeature("http://xml.org/sax/features/external-general-entities", false);
        builder.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        builder.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        return builder;
    }
}
