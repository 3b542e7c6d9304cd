package org.sudandigitalarchive.mcp.model.response;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.sudandigitalarchive.mcp.model.Displayable;

public record AccessionPage(
    @JsonProperty(required = true) List<Accession> items,
    long numPages,
    long page,
    long perPage
) implements Displayable {
    public AccessionPage {
        items = List.copyOf(items);
    }

    @Override
    public String toDisplayText() {
        if (items.isEmpty()) {
            return "No accessions found." + PageFooter.render(page, numPages, perPage);
        }
        final StringBuilder sb = new StringBuilder();
        for (final Accession accession : items) {
            sb.append(accession.summaryLine()).append('\n');
        }
        sb.append(PageFooter.render(page, numPages, perPage));
        return sb.toString();
    }
}
