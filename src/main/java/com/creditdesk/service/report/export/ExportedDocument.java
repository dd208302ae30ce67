package com.creditdesk.service.report.export;

import java.util.Arrays;

public record ExportedDocument(
        String fileName,
        String contentType,
        byte[] content
) {
    public ExportedDocument {
        content = content == null ? new byte[0] : content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ExportedDocument document
                && fileName.equals(document.fileName)
                && contentType.equals(document.contentType)
                && Arrays.equals(content, document.content);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * fileName.hashCode() + contentType.hashCode()) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "ExportedDocument[" + fileName + ", " + contentType + ", " + content.length + " bytes]";
    }
}
