package org.sudandigitalarchive.mcp.model.request;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.sudandigitalarchive.mcp.model.MetadataLanguage;

/**
 * Body of an accession update. Only non-null fields are serialized, so the archive
 * receives exactly the fields the caller asked to change.
 */
public record AccessionPatch(
    @JsonProperty("is_private") Boolean isPrivate,
    String metadataDescription,
    MetadataLanguage metadataLanguage,
    List<String> metadataSubjects,
    String metadataTime,
    String metadataTitle
) {
    public AccessionPatch {
        metadataSubjects = metadataSubjects == null ? null : List.copyOf(metadataSubjects);
    }

    /** True when no field is set. */
    @JsonIgnore
    public boolean isEmpty() {
        return isPrivate == null && metadataDescription == null && metadataLanguage == null
            && metadataSubjects == null && metadataTime == null && metadataTitle == null;
    }
}
