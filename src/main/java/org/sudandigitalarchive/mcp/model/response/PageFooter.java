package org.sudandigitalarchive.mcp.model.response;

/**
 * Pagination hint appended to list output so calling agents know other pages exist.
 */
final class PageFooter {
    private PageFooter() {}

    static String render(long page, long numPages, long perPage) {
        final StringBuilder sb = new StringBuilder();
        sb.append("\n--- PAGINATION INFO ---\n");
        sb.append(String.format("Page %d of %d total pages (%d items per page)\n", page, numPages, perPage));
        if (numPages > 1) {
            sb.append("MORE PAGES AVAILABLE: call this tool again with a different page value to see them.\n");
        } else {
            sb.append("All results shown (single page)\n");
        }
        sb.append("--- END PAGINATION INFO ---");
        return sb.toString();
    }
}
