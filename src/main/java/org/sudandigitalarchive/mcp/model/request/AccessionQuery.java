package org.sudandigitalarchive.mcp.model.request;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.sudandigitalarchive.mcp.model.MetadataLanguage;

/**
 * Normalized filter for listing accessions. Null fields were not specified and produce no query parameter.
 */
public record AccessionQuery(
    PageRequest page,
    MetadataLanguage lang,
    List<String> metadataSubjects,
    boolean metadataSubjectsInclusiveFilter,
    String queryTerm,
    String urlFilter,
    String dateFrom,
    String dateTo
) {
    public AccessionQuery {
        page = page == null ? PageRequest.unpaged() : page;
        metadataSubjects = metadataSubjects == null ? null : List.copyOf(metadataSubjects);
    }

    /** A query with no filters and no pagination. */
    public static AccessionQuery all() {
        return new AccessionQuery(PageRequest.unpaged(), null, null, false, null, null, null, null);
    }

    /**
     * Query parameters in a stable order. Subject filters repeat the metadata_subjects key once per id.
     */
    public List<Map.Entry<String, String>> toQueryParams() {
        final List<Map.Entry<String, String>> query = new ArrayList<>();
        page.appendTo(query);
        if (lang != null) query.add(Map.entry("lang", lang.wireName()));
        if (metadataSubjects != null) {
            for (final String subject : metadataSubjects) {
                query.add(Map.entry("metadata_subjects", subject));
            }
        }
        if (metadataSubjectsInclusiveFilter) query.add(Map.entry("metadata_subjects_inclusive_filter", "true"));
        if (queryTerm != null) query.add(Map.entry("query_term", queryTerm));
        if (urlFilter != null) query.add(Map.entry("url_filter", urlFilter));
        if (dateFrom != null) query.add(Map.entry("date_from", dateFrom));
        if (dateTo != null) query.add(Map.entry("date_to", dateTo));
        return query;
    }
}
