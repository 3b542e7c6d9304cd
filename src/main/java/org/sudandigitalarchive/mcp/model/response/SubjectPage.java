package org.sudandigitalarchive.mcp.model.response;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.sudandigitalarchive.mcp.model.Displayable;

public record SubjectPage(
    @JsonProperty(required = true) List<Subject> items,
    long numPages,
    long page,
    long perPage
) implements Displayable {
    public SubjectPage {
        items = List.copyOf(items);
    }

    @Override
    public String toDisplayText() {
        if (items.isEmpty()) {
            return "No subjects found." + PageFooter.render(page, numPages, perPage);
        }
        final StringBuilder sb = new StringBuilder();
        for (final Subject subject : items) {
            sb.append('[').append(subject.id()).append("] ").append(subject.label());
            if (subject.visibility() != null) sb.append(" (").append(subject.visibility().wireName()).append(')');
            sb.append('\n');
        }
        sb.append(PageFooter.render(page, numPages, perPage));
        return sb.toString();
    }
}
