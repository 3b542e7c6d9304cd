package org.sudandigitalarchive.mcp.model.response;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.sudandigitalarchive.mcp.model.Visibility;

/**
 * A metadata subject. The archive may name the label field "subject"; both spellings decode.
 */
public record Subject(
    @JsonProperty(required = true) String id,
    @JsonAlias("subject") String label,
    Visibility visibility
) {}
