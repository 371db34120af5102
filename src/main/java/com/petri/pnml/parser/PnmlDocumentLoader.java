package com.petri.pnml.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class PnmlDocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(PnmlDocumentLoader.class);

    public Element load(String content) {
        if (content == null || content.isBlank()) {
            throw new PnmlParseException(PnmlParseException.MALFORMED_XML, "Empty document", (String) null);
        }
        return build(new InputSource(new StringReader(content)));
    }

    public Element load(InputStream in) {
        return build(new InputSource(in));
    }

    public Element load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            InputSource source = new InputSource(in);
            source.setSystemId(file.toUri().toString());
            return build(source);
        } catch (IOException e) {
            throw new PnmlParseException(PnmlParseException.UNREADABLE_DOCUMENT, "Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private Element build(InputSource source) {
        try {
            Document doc = newBuilder().parse(source);
            return doc.getDocumentElement();
        } catch (SAXException e) {
            throw new PnmlParseException(PnmlParseException.MALFORMED_XML, "Malformed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new PnmlParseException(PnmlParseException.UNREADABLE_DOCUMENT, "Cannot read document: " + e.getMessage(), e);
        }
    }

    private DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
                }

                @Override
                public void error(SAXParseException e) throws SAXException {
                    throw e;
                }

                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }
}
