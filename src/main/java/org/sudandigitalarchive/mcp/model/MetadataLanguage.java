package org.sudandigitalarchive.mcp.model;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Language of accession and subject metadata, as the archive API names it.
 */
public enum MetadataLanguage {
    ENGLISH("english"),
    ARABIC("arabic");

    private final String wireName;

    MetadataLanguage(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Case-insensitive lookup by wire name.
     */
    public static Optional<MetadataLanguage> fromWireName(String name) {
        if (name == null) return Optional.empty();
        var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (var lang : values()) {
            if (lang.wireName.equals(normalized)) return Optional.of(lang);
        }
        return Optional.empty();
    }

    @JsonCreator
    static MetadataLanguage fromJson(String name) {
        return fromWireName(name).orElse(null);
    }
}
