package org.sudandigitalarchive.mcp.model;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Visibility scope of subjects and accessions.
 */
public enum Visibility {
    PUBLIC("public"),
    PRIVATE("private");

    private final String wireName;

    Visibility(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isPrivate() {
        return this == PRIVATE;
    }

    public static Optional<Visibility> fromWireName(String name) {
        if (name == null) return Optional.empty();
        var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (var visibility : values()) {
            if (visibility.wireName.equals(normalized)) return Optional.of(visibility);
        }
        return Optional.empty();
    }

    @JsonCreator
    static Visibility fromJson(String name) {
        return fromWireName(name).orElse(null);
    }
}
