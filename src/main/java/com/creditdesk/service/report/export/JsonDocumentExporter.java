package com.creditdesk.service.report.export;

import com.creditdesk.model.report.StructuredReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Exports the report as a pretty-printed JSON document wrapping the metadata and the report.
 */
@Component
@Slf4j
public class JsonDocumentExporter implements DocumentExporter {

    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;

    public JsonDocumentExporter(@Qualifier("snapshotObjectMapper") ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ExportedDocument export(StructuredReport report, ExportMetadata metadata) {
        ObjectNode document = objectMapper.createObjectNode();
        document.set("metadata", objectMapper.valueToTree(metadata));
        document.set("report", objectMapper.valueToTree(report));
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
            log.info("Exported report of dossier {} ({} bytes)", metadata.dossierId(), content.length);
            return new ExportedDocument(metadata.fileNameStem() + ".json", CONTENT_TYPE, content);
        } catch (JsonProcessingException e) {
            log.error("Failed to export report of dossier {}", metadata.dossierId(), e);
            throw new IllegalStateException("Failed to export report", e);
        }
    }
}
