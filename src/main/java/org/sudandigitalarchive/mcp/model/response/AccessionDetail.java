package org.sudandigitalarchive.mcp.model.response;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single accession together with the download URL of its WACZ archive.
 */
public record AccessionDetail(
    @JsonProperty(required = true) Accession accession,
    String waczUrl
) {}
