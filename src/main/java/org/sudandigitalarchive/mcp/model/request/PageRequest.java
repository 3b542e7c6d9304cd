package org.sudandigitalarchive.mcp.model.request;

import java.util.List;
import java.util.Map;

/**
 * Normalized pagination. A null field was not specified by the caller and is left out of the request.
 *
 * @param page    requested page number, or null
 * @param perPage requested page size, or null
 */
public record PageRequest(Integer page, Integer perPage) {

    private static final PageRequest UNPAGED = new PageRequest(null, null);

    public PageRequest {
        if (page != null && page < 0) throw new IllegalArgumentException("page must not be negative");
        if (perPage != null && perPage < 0) throw new IllegalArgumentException("perPage must not be negative");
    }

    public static PageRequest unpaged() {
        return UNPAGED;
    }

    /**
     * Append page and per_page entries for the fields that are present.
     */
    public void appendTo(List<Map.Entry<String, String>> query) {
        if (page != null) query.add(Map.entry("page", page.toString()));
        if (perPage != null) query.add(Map.entry("per_page", perPage.toString()));
    }
}
