package com.captainsprep.engine.service.ingestion;

import org.apache.commons.io.FilenameUtils;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.Optional;

@Component
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentTextExtractor.class);

    @Override
    public ExtractedDocument extract(String filename, InputStream inputStream) {
        try {
            BodyContentHandler handler = new BodyContentHandler(-1);
            Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
            new AutoDetectParser().parse(inputStream, handler, metadata, new ParseContext());
            String text = Optional.ofNullable(handler.toString()).map(String::trim).orElse("");
            String title = Optional.ofNullable(metadata.get(TikaCoreProperties.TITLE))
                    .filter(value -> !value.isBlank())
                    .orElseGet(() -> defaultTitle(filename));
            return new ExtractedDocument(title, metadata.get(Metadata.CONTENT_TYPE), text);
        } catch (Exception e) {
            log.error("Failed to extract text from document {}", filename, e);
            throw new IngestionException(HttpStatus.UNPROCESSABLE_ENTITY, "Failed to extract document text", e);
        }
    }

    private String defaultTitle(String filename) {
        if (filename == null || filename.isBlank()) {
            return "Document";
        }
        String baseName = FilenameUtils.getBaseName(filename);
        return baseName.isBlank() ? "Document" : baseName;
    }
}
