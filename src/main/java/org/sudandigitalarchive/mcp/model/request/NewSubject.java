package org.sudandigitalarchive.mcp.model.request;

import java.util.Objects;

import org.sudandigitalarchive.mcp.model.MetadataLanguage;
import org.sudandigitalarchive.mcp.model.Visibility;

/**
 * Body of a subject creation request. Visibility and language are omitted when null.
 */
public record NewSubject(String label, Visibility visibility, MetadataLanguage lang) {
    public NewSubject {
        Objects.requireNonNull(label, "label");
    }
}
