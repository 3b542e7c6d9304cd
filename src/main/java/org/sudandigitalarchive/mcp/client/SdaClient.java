package org.sudandigitalarchive.mcp.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sudandigitalarchive.mcp.config.ServerConfig;
import org.sudandigitalarchive.mcp.model.MetadataLanguage;
import org.sudandigitalarchive.mcp.model.request.AccessionPatch;
import org.sudandigitalarchive.mcp.model.request.AccessionQuery;
import org.sudandigitalarchive.mcp.model.request.NewSubject;
import org.sudandigitalarchive.mcp.model.request.PageRequest;
import org.sudandigitalarchive.mcp.model.response.AccessionDetail;
import org.sudandigitalarchive.mcp.model.response.AccessionPage;
import org.sudandigitalarchive.mcp.model.response.Subject;
import org.sudandigitalarchive.mcp.model.response.SubjectPage;
import org.sudandigitalarchive.mcp.utils.HttpUtils;
import org.sudandigitalarchive.mcp.utils.Json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Client for the Sudan Digital Archive API.
 * Each method issues exactly one authenticated request and either returns the decoded
 * response or fails with an {@link ApiException} classifying the failure. No retries.
 * Arguments are expected to be normalized already.
 */
public class SdaClient {
    private static final Logger log = LoggerFactory.getLogger(SdaClient.class);

    static final String API_KEY_HEADER = "x-api-key";
    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final int MAX_ERROR_MESSAGE_LENGTH = 500;

    private static final String ACCESSIONS = "/api/v1/accessions";
    private static final String PRIVATE_ACCESSIONS = "/api/v1/accessions/private";
    private static final String SUBJECTS = "/api/v1/metadata-subjects";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    /**
     * Creates a client with its own HttpClient, configured from the server configuration.
     */
    public SdaClient(ServerConfig config) {
        this(config, HttpClient.newBuilder()
            .connectTimeout(config.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
    }

    /**
     * Creates a client on a caller-supplied HttpClient.
     */
    public SdaClient(ServerConfig config, HttpClient httpClient) {
        this.httpClient = httpClient;
        this.baseUrl = config.baseUrl();
        this.apiKey = config.apiKey();
        this.requestTimeout = config.requestTimeout();
    }

    /**
     * Fetches a page of public accessions.
     */
    public AccessionPage listAccessions(AccessionQuery query) throws ApiException {
        return send(get(ACCESSIONS, query.toQueryParams()), AccessionPage.class);
    }

    /**
     * Fetches a page of private accessions. Visibility is filtered by the archive itself,
     * so page counts stay consistent with the returned items.
     */
    public AccessionPage listPrivateAccessions(AccessionQuery query) throws ApiException {
        return send(get(PRIVATE_ACCESSIONS, query.toQueryParams()), AccessionPage.class);
    }

    /**
     * Retrieves a single public accession.
     */
    public AccessionDetail getAccession(String id) throws ApiException {
        return send(get(ACCESSIONS + "/" + HttpUtils.encodePathSegment(id), List.of()), AccessionDetail.class);
    }

    /**
     * Retrieves a single private accession.
     */
    public AccessionDetail getPrivateAccession(String id) throws ApiException {
        return send(get(PRIVATE_ACCESSIONS + "/" + HttpUtils.encodePathSegment(id), List.of()), AccessionDetail.class);
    }

    /**
     * Updates the given fields of an accession and returns the updated record.
     */
    public AccessionDetail updateAccession(String id, AccessionPatch patch) throws ApiException {
        final HttpRequest request = withBody(ACCESSIONS + "/" + HttpUtils.encodePathSegment(id), "PUT", patch);
        return send(request, AccessionDetail.class);
    }

    /**
     * Lists metadata subjects.
     */
    public SubjectPage listSubjects(PageRequest page) throws ApiException {
        final List<Map.Entry<String, String>> query = new ArrayList<>();
        page.appendTo(query);
        return send(get(SUBJECTS, query), SubjectPage.class);
    }

    /**
     * Creates a metadata subject. The archive may answer with the full subject or with its bare id;
     * in the latter case the label and visibility are taken from the request.
     */
    public Subject createSubject(NewSubject subject) throws ApiException {
        final HttpResponse<String> response = execute(withBody(SUBJECTS, "POST", subject));
        final JsonNode node = parse(response.body());

        if (node.isTextual() || node.isNumber()) {
            final String id = node.asText();
            if (id.isBlank()) throw ApiException.decode("Archive returned an empty subject id", null);
            return new Subject(id, subject.label(), subject.visibility());
        }
        if (!node.isObject()) {
            throw ApiException.decode("Unexpected subject creation response: " + node.getNodeType(), null);
        }

        final Subject created;
        try {
            created = Json.decode(node.toString(), Subject.class);
        } catch (JsonProcessingException e) {
            throw ApiException.decode("Unexpected subject creation response: " + e.getOriginalMessage(), e);
        }
        if (created.id() == null || created.id().isBlank()) {
            throw ApiException.decode("Archive returned a subject without an id", null);
        }
        return new Subject(
            created.id(),
            created.label() != null ? created.label() : subject.label(),
            created.visibility() != null ? created.visibility() : subject.visibility());
    }

    /**
     * Deletes a metadata subject. A language, when given, is sent as a {"lang": ...} body.
     * A missing subject is reported by the archive as a status error like any other.
     */
    public void deleteSubject(String id, MetadataLanguage lang) throws ApiException {
        final String path = SUBJECTS + "/" + HttpUtils.encodePathSegment(id);
        final HttpRequest request = lang == null
            ? newRequest(path).DELETE().build()
            : withBody(path, "DELETE", Map.of("lang", lang));
        execute(request);
    }

    private HttpRequest get(String path, List<Map.Entry<String, String>> query) {
        return newRequest(path + HttpUtils.buildQueryString(query)).GET().build();
    }

    private HttpRequest withBody(String path, String method, Object body) {
        return newRequest(path)
            .header("Content-Type", JSON_CONTENT_TYPE)
            .method(method, HttpRequest.BodyPublishers.ofString(Json.serialize(body)))
            .build();
    }

    private HttpRequest.Builder newRequest(String pathAndQuery) {
        return HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + pathAndQuery))
            .timeout(requestTimeout)
            .header(API_KEY_HEADER, apiKey)
            .header("Accept", JSON_CONTENT_TYPE);
    }

    private <T> T send(HttpRequest request, Class<T> type) throws ApiException {
        final HttpResponse<String> response = execute(request);
        final String body = response.body();
        if (body == null || body.isBlank()) {
            throw ApiException.decode("Archive returned an empty body for " + type.getSimpleName(), null);
        }
        final T decoded;
        try {
            decoded = Json.decode(body, type);
        } catch (JsonProcessingException e) {
            throw ApiException.decode("Could not decode " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
        // a literal null body decodes to null
        if (decoded == null) {
            throw ApiException.decode("Archive returned null instead of " + type.getSimpleName(), null);
        }
        return decoded;
    }

    /**
     * Issue the request and reject non-2xx answers. Bodies are never logged.
     */
    private HttpResponse<String> execute(HttpRequest request) throws ApiException {
        final long start = System.nanoTime();
        final HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.warn("{} {} timed out after {}", request.method(), request.uri().getPath(), requestTimeout);
            throw ApiException.transport("Request to the archive timed out after " + requestTimeout.toSeconds() + "s", e);
        } catch (IOException e) {
            log.warn("{} {} failed: {}", request.method(), request.uri().getPath(), e.toString());
            throw ApiException.transport("Could not reach the archive: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ApiException.transport("Interrupted while waiting for the archive", e);
        }

        final int status = response.statusCode();
        if (log.isDebugEnabled()) {
            log.debug("{} {} -> {} ({} ms)", request.method(), request.uri().getPath(), status,
                (System.nanoTime() - start) / 1_000_000);
        }
        if (status < 200 || status >= 300) {
            throw ApiException.httpStatus(status, remoteMessage(status, response.body()));
        }
        return response;
    }

    private static JsonNode parse(String body) throws ApiException {
        if (body == null || body.isBlank()) {
            throw ApiException.decode("Archive returned an empty body", null);
        }
        try {
            return Json.decode(body, JsonNode.class);
        } catch (JsonProcessingException e) {
            throw ApiException.decode("Archive returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Message for a failed status: a message field of a JSON error body, else short plain text,
     * else the status line.
     */
    static String remoteMessage(int status, String body) {
        if (body == null || body.isBlank()) return HttpUtils.statusLine(status);

        final String trimmed = body.trim();
        try {
            final JsonNode node = Json.decode(trimmed, JsonNode.class);
            if (node.isObject()) {
                for (final String field : List.of("message", "error", "detail")) {
                    final JsonNode value = node.get(field);
                    if (value != null && value.isTextual() && !value.asText().isBlank()) {
                        return HttpUtils.abbreviate(value.asText(), MAX_ERROR_MESSAGE_LENGTH);
                    }
                }
                return HttpUtils.statusLine(status);
            }
            if (node.isTextual() && !node.asText().isBlank()) {
                return HttpUtils.abbreviate(node.asText(), MAX_ERROR_MESSAGE_LENGTH);
            }
            return HttpUtils.statusLine(status);
        } catch (JsonProcessingException e) {
            // not JSON: an HTML error page is not a useful message
            if (trimmed.startsWith("<")) return HttpUtils.statusLine(status);
            return HttpUtils.abbreviate(trimmed, MAX_ERROR_MESSAGE_LENGTH);
        }
    }

    private static String describe(IOException e) {
        final String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
