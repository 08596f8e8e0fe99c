package com.apischema.core.renderer;

import com.apischema.core.model.ApiDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Dumps an {@link ApiDocument} as JSON or YAML.
 *
 * <p>Empty collections and null attributes are left out, so a link without fields has no
 * {@code fields} key and a node without children has no {@code children} key.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * ApiDocumentWriter writer = new ApiDocumentWriter();
 * writer.write(document, DocumentFormat.YAML, Paths.get("build/schema.yaml"));
 * }</pre>
 */
public class ApiDocumentWriter {

    private static final Logger log = LoggerFactory.getLogger(ApiDocumentWriter.class);

    private final ObjectMapper jsonMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    /**
     * Serializes a document.
     *
     * @param document document to dump
     * @param format output format
     * @return serialized document
     * @throws IllegalStateException if the document cannot be serialized
     */
    public String render(ApiDocument document, DocumentFormat format) {
        ObjectMapper mapper = format == DocumentFormat.YAML ? yamlMapper : jsonMapper;
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document as " + format, e);
        }
    }

    /**
     * Serializes a document to a file, creating parent directories as needed.
     *
     * @param document document to dump
     * @param format output format
     * @param target target file
     * @throws IllegalStateException if the file cannot be written
     */
    public void write(ApiDocument document, DocumentFormat format, Path target) {
        String content = render(document, format);
        try {
            Path parentDir = target.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(target, content);
            log.info("Wrote document: {} ({} bytes)", target, content.length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write document: " + target, e);
        }
    }
}
