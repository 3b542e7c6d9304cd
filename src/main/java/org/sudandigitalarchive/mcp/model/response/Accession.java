package org.sudandigitalarchive.mcp.model.response;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An archival record with its bilingual Dublin Core metadata, as returned by the archive.
 * Identifiers are kept as strings whatever their JSON type.
 */
public record Accession(
    @JsonProperty(required = true) String id,
    @JsonProperty("is_private") Boolean isPrivate,
    String crawlStatus,
    String crawlTimestamp,
    String seedUrl,
    String dublinMetadataDate,
    String dublinMetadataFormat,
    Boolean hasEnglishMetadata,
    Boolean hasArabicMetadata,
    String titleEn,
    String titleAr,
    String descriptionEn,
    String descriptionAr,
    List<String> subjectsEn,
    List<String> subjectsEnIds,
    List<String> subjectsAr,
    List<String> subjectsArIds
) {
    /** One-line summary used in list output. */
    String summaryLine() {
        final StringBuilder sb = new StringBuilder();
        sb.append('[').append(id).append("] ");
        if (titleEn != null) {
            sb.append(titleEn);
        } else if (titleAr != null) {
            sb.append(titleAr);
        } else {
            sb.append("(untitled)");
        }
        if (seedUrl != null) sb.append(" - ").append(seedUrl);
        if (crawlStatus != null) sb.append(" (").append(crawlStatus).append(')');
        if (Boolean.TRUE.equals(isPrivate)) sb.append(" [private]");
        return sb.toString();
    }
}
