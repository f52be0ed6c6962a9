package com.sitedigest.core.model;

/**
 * 페이지에 내장된 메타데이터(JSON-LD + Open Graph). 모든 필드는 nullable.
 */
public record StructuredData(
        String schemaDescription,
        String schemaName,
        String schemaType,
        String ogDescription,
        String ogTitle,
        String ogSiteName) {

    public static final StructuredData EMPTY = new StructuredData(null, null, null, null, null, null);

    public boolean isEmpty() {
        return schemaDescription == null && schemaName == null && schemaType == null
                && ogDescription == null && ogTitle == null && ogSiteName == null;
    }
}
