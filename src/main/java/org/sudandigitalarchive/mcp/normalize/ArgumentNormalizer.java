package org.sudandigitalarchive.mcp.normalize;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.sudandigitalarchive.mcp.model.MetadataLanguage;
import org.sudandigitalarchive.mcp.model.Visibility;
import org.sudandigitalarchive.mcp.model.request.AccessionPatch;
import org.sudandigitalarchive.mcp.model.request.AccessionQuery;
import org.sudandigitalarchive.mcp.model.request.NewSubject;
import org.sudandigitalarchive.mcp.model.request.PageRequest;

/**
 * Turns raw tool arguments into request values.
 * <p>
 * Tools have no optional parameters; "unspecified" travels in-band as a sentinel:
 * {@link #UNSET} for integers, {@link #UNSET_TEXT} for strings and an empty list for lists.
 * Every sentinel becomes null here, and nothing downstream of this class ever sees one.
 * All failures are {@link ValidationException}s naming the offending parameter.
 */
public final class ArgumentNormalizer {

    /** Integer sentinel for "not specified". */
    public static final int UNSET = -1;

    /** String sentinel for "not specified". */
    public static final String UNSET_TEXT = "";

    private ArgumentNormalizer() {}

    /**
     * A pagination number: the sentinel becomes null, other negatives are rejected.
     */
    public static Integer pageNumber(String name, int value) {
        if (value == UNSET) return null;
        if (value < 0) {
            throw new ValidationException(name, "must be " + UNSET + " (unspecified) or a non-negative integer, got " + value);
        }
        return value;
    }

    public static PageRequest page(int page, int perPage) {
        return new PageRequest(pageNumber("page", page), pageNumber("per_page", perPage));
    }

    /**
     * Free text: null, empty and whitespace-only values are unspecified; others are stripped.
     */
    public static String text(String value) {
        if (value == null) return null;
        final String stripped = value.strip();
        return stripped.isEmpty() ? null : stripped;
    }

    /**
     * A required identifier, stripped of surrounding whitespace.
     */
    public static String identifier(String name, String value) {
        final String id = text(value);
        if (id == null) throw new ValidationException(name, "must not be empty");
        return id;
    }

    public static MetadataLanguage language(String name, String value) {
        final String raw = text(value);
        if (raw == null) return null;
        return MetadataLanguage.fromWireName(raw)
            .orElseThrow(() -> new ValidationException(name, "must be 'english' or 'arabic', got '" + raw + "'"));
    }

    public static Visibility visibility(String name, String value) {
        final String raw = text(value);
        if (raw == null) return null;
        return Visibility.fromWireName(raw)
            .orElseThrow(() -> new ValidationException(name, "must be 'public' or 'private', got '" + raw + "'"));
    }

    /**
     * Subject id list: an empty list is unspecified, blank entries are rejected.
     */
    public static List<String> subjectIds(String name, List<String> values) {
        if (values == null || values.isEmpty()) return null;
        final List<String> ids = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            final String id = text(values.get(i));
            if (id == null) throw new ValidationException(name, "entry " + i + " is empty");
            ids.add(id);
        }
        return ids;
    }

    /**
     * Build a listing query. Dates are passed through as given; only when both ends are plain
     * ISO dates is the range order checked.
     */
    public static AccessionQuery accessionQuery(int page, int perPage, String lang, List<String> metadataSubjects,
            boolean metadataSubjectsInclusiveFilter, String queryTerm, String urlFilter,
            String dateFrom, String dateTo) {
        final String from = text(dateFrom);
        final String to = text(dateTo);
        checkDateRange(from, to);

        return new AccessionQuery(
            page(page, perPage),
            language("lang", lang),
            subjectIds("metadata_subjects", metadataSubjects),
            metadataSubjectsInclusiveFilter,
            text(queryTerm),
            text(urlFilter),
            from,
            to);
    }

    /**
     * Build an update body holding only the specified fields.
     *
     * @throws ValidationException when no field is specified
     */
    public static AccessionPatch accessionPatch(String metadataTitle, String metadataDescription, String metadataTime,
            String metadataLanguage, List<String> metadataSubjects, String visibility) {
        final Visibility scope = visibility("visibility", visibility);
        final AccessionPatch patch = new AccessionPatch(
            scope == null ? null : scope.isPrivate(),
            text(metadataDescription),
            language("metadata_language", metadataLanguage),
            subjectIds("metadata_subjects", metadataSubjects),
            text(metadataTime),
            text(metadataTitle));
        if (patch.isEmpty()) {
            throw new ValidationException(null, "Nothing to update: specify at least one field");
        }
        return patch;
    }

    public static NewSubject newSubject(String label, String visibility, String lang) {
        return new NewSubject(
            identifier("label", label),
            visibility("visibility", visibility),
            language("lang", lang));
    }

    private static void checkDateRange(String from, String to) {
        final Optional<LocalDate> start = isoDate(from);
        final Optional<LocalDate> end = isoDate(to);
        if (start.isPresent() && end.isPresent() && start.get().isAfter(end.get())) {
            throw new ValidationException("date_from", "must not be after date_to (" + from + " > " + to + ")");
        }
    }

    private static Optional<LocalDate> isoDate(String value) {
        if (value == null) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(value));
        } catch (DateTimeParseException e) {
            // partial or free-form dates are left for the archive to interpret
            return Optional.empty();
        }
    }
}
