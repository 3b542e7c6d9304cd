package org.sudandigitalarchive.mcp.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sudandigitalarchive.mcp.config.ServerConfig;
import org.sudandigitalarchive.mcp.model.MetadataLanguage;
import org.sudandigitalarchive.mcp.model.Visibility;
import org.sudandigitalarchive.mcp.model.request.AccessionPatch;
import org.sudandigitalarchive.mcp.model.request.AccessionQuery;
import org.sudandigitalarchive.mcp.model.request.NewSubject;
import org.sudandigitalarchive.mcp.model.request.PageRequest;
import org.sudandigitalarchive.mcp.model.response.AccessionDetail;
import org.sudandigitalarchive.mcp.model.response.AccessionPage;
import org.sudandigitalarchive.mcp.model.response.Subject;
import org.sudandigitalarchive.mcp.model.response.SubjectPage;
import org.sudandigitalarchive.test.StubArchive;
import org.sudandigitalarchive.test.StubArchive.RecordedRequest;

class SdaClientTest {

    private static final String ACCESSION_JSON = """
        {"accession": {"id": 42, "is_private": false, "seed_url": "https://example.sd",
         "title_en": "Khartoum news", "subjects_en": ["Health"], "subjects_en_ids": ["7"]},
         "wacz_url": "https://files.example/42.wacz"}""";

    private StubArchive archive;
    private SdaClient client;

    @BeforeEach
    void setUp() throws IOException {
        archive = StubArchive.start();
        client = new SdaClient(archive.config());
    }

    @AfterEach
    void tearDown() {
        archive.close();
    }

    // =========================================================================
    // Request shape
    // =========================================================================

    @Test
    @DisplayName("Unspecified pagination leaves page and per_page out of the query")
    void testListAccessions_NoPaginationParams() throws Exception {
        archive.respond("GET", "/api/v1/accessions", 200,
            "{\"items\": [], \"num_pages\": 0, \"page\": 0, \"per_page\": 0}");

        client.listAccessions(AccessionQuery.all());

        final RecordedRequest request = archive.lastRequest();
        assertNull(request.rawQuery());
        assertEquals(List.of(), request.queryValues("page"));
        assertEquals(List.of(), request.queryValues("per_page"));
    }

    @Test
    void testListAccessions_SendsFiltersAndAuthHeaders() throws Exception {
        archive.respond("GET", "/api/v1/accessions", 200, """
            {"items": [{"id": "1", "title_en": "First"}], "num_pages": 3, "page": 2, "per_page": 1}""");

        final AccessionQuery query = new AccessionQuery(new PageRequest(2, 1), MetadataLanguage.ARABIC,
            List.of("7", "9"), true, "war diary", null, "2020-01-01", null);
        final AccessionPage page = client.listAccessions(query);

        assertEquals(1, page.items().size());
        assertEquals("First", page.items().get(0).titleEn());
        assertEquals(3, page.numPages());

        final RecordedRequest request = archive.lastRequest();
        assertEquals("GET", request.method());
        assertEquals(StubArchive.API_KEY, request.header("x-api-key"));
        assertEquals("application/json", request.header("Accept"));
        assertEquals(List.of("2"), request.queryValues("page"));
        assertEquals(List.of("1"), request.queryValues("per_page"));
        assertEquals(List.of("arabic"), request.queryValues("lang"));
        assertEquals(List.of("7", "9"), request.queryValues("metadata_subjects"));
        assertEquals(List.of("true"), request.queryValues("metadata_subjects_inclusive_filter"));
        assertEquals(List.of("war+diary"), request.queryValues("query_term"));
        assertEquals(List.of("2020-01-01"), request.queryValues("date_from"));
        assertEquals(List.of(), request.queryValues("url_filter"));
        assertEquals(List.of(), request.queryValues("date_to"));
    }

    @Test
    void testListPrivateAccessions_UsesPrivateEndpoint() throws Exception {
        archive.respond("GET", "/api/v1/accessions/private", 200,
            "{\"items\": [{\"id\": \"5\", \"is_private\": true}], \"num_pages\": 1, \"page\": 0, \"per_page\": 50}");

        final AccessionPage page = client.listPrivateAccessions(AccessionQuery.all());

        assertEquals(Boolean.TRUE, page.items().get(0).isPrivate());
        assertEquals("/api/v1/accessions/private", archive.lastRequest().rawPath());
    }

    @Test
    void testGetAccession_DecodesDetailAndNumericId() throws Exception {
        archive.respond("GET", "/api/v1/accessions/42", 200, ACCESSION_JSON);

        final AccessionDetail detail = client.getAccession("42");

        assertEquals("42", detail.accession().id());
        assertEquals("https://files.example/42.wacz", detail.waczUrl());
        assertEquals(List.of("Health"), detail.accession().subjectsEn());
    }

    @Test
    void testGetPrivateAccession_EncodesIdAsOnePathSegment() throws Exception {
        archive.respond("GET", "/api/v1/accessions/private/a%2Fb%20c", 200, ACCESSION_JSON);

        client.getPrivateAccession("a/b c");

        assertEquals("/api/v1/accessions/private/a%2Fb%20c", archive.lastRequest().rawPath());
    }

    @Test
    void testUpdateAccession_PutsOnlySpecifiedFields() throws Exception {
        archive.respond("PUT", "/api/v1/accessions/42", 200, ACCESSION_JSON);

        client.updateAccession("42", new AccessionPatch(true, null, MetadataLanguage.ENGLISH, null, null, "New title"));

        final RecordedRequest request = archive.lastRequest();
        assertEquals("PUT", request.method());
        assertEquals("application/json", request.header("Content-Type"));
        assertEquals("{\"is_private\":true,\"metadata_language\":\"english\",\"metadata_title\":\"New title\"}",
            request.body());
    }

    @Test
    void testListSubjects_DecodesLabelAlias() throws Exception {
        archive.respond("GET", "/api/v1/metadata-subjects", 200, """
            {"items": [{"id": 3, "subject": "Health", "visibility": "public"}],
             "num_pages": 1, "page": 0, "per_page": 20}""");

        final SubjectPage page = client.listSubjects(new PageRequest(0, 20));

        assertEquals(new Subject("3", "Health", Visibility.PUBLIC), page.items().get(0));
        assertEquals(List.of("0"), archive.lastRequest().queryValues("page"));
        assertEquals(List.of("20"), archive.lastRequest().queryValues("per_page"));
    }

    // =========================================================================
    // Subject creation and deletion
    // =========================================================================

    @Test
    @DisplayName("create_subject sends exactly one POST with the exact body")
    void testCreateSubject_ExactBody() throws Exception {
        archive.respond("POST", "/api/v1/metadata-subjects", 201,
            "{\"id\": \"s-1\", \"label\": \"Health\", \"visibility\": \"public\"}");

        final Subject created = client.createSubject(new NewSubject("Health", Visibility.PUBLIC, null));

        assertEquals("s-1", created.id());
        assertEquals(1, archive.requestCount());
        final RecordedRequest request = archive.lastRequest();
        assertEquals("POST", request.method());
        assertEquals("{\"label\":\"Health\",\"visibility\":\"public\"}", request.body());
    }

    @Test
    void testCreateSubject_BareIdResponse() throws Exception {
        archive.respond("POST", "/api/v1/metadata-subjects", 201, "17");

        final Subject created = client.createSubject(new NewSubject("Health", Visibility.PRIVATE, MetadataLanguage.ENGLISH));

        assertEquals(new Subject("17", "Health", Visibility.PRIVATE), created);
        assertEquals("{\"label\":\"Health\",\"visibility\":\"private\",\"lang\":\"english\"}",
            archive.lastRequest().body());
    }

    @Test
    void testCreateSubject_FillsMissingFieldsFromRequest() throws Exception {
        archive.respond("POST", "/api/v1/metadata-subjects", 200, "{\"id\": 8}");

        final Subject created = client.createSubject(new NewSubject("Culture", Visibility.PUBLIC, null));

        assertEquals(new Subject("8", "Culture", Visibility.PUBLIC), created);
    }

    @Test
    void testCreateSubject_UnexpectedShapeIsDecodeError() {
        archive.respond("POST", "/api/v1/metadata-subjects", 201, "[1, 2]");

        final ApiException e = assertThrows(ApiException.class,
            () -> client.createSubject(new NewSubject("Health", null, null)));

        assertEquals(ApiException.Origin.DECODE, e.getOrigin());
    }

    @Test
    void testCreateSubject_NullIdIsDecodeError() {
        archive.respond("POST", "/api/v1/metadata-subjects", 201, "{\"id\": null, \"label\": \"Health\"}");

        final ApiException e = assertThrows(ApiException.class,
            () -> client.createSubject(new NewSubject("Health", Visibility.PUBLIC, null)));

        assertEquals(ApiException.Origin.DECODE, e.getOrigin());
        assertEquals(1, archive.requestCount());
    }

    @Test
    void testCreateSubject_BlankIdIsDecodeError() {
        archive.respond("POST", "/api/v1/metadata-subjects", 201, "{\"id\": \" \", \"label\": \"Health\"}");

        final ApiException e = assertThrows(ApiException.class,
            () -> client.createSubject(new NewSubject("Health", null, null)));

        assertEquals(ApiException.Origin.DECODE, e.getOrigin());
    }

    @Test
    void testDeleteSubject_WithoutLanguageSendsNoBody() throws Exception {
        archive.respond("DELETE", "/api/v1/metadata-subjects/7", 204, "");

        client.deleteSubject("7", null);

        final RecordedRequest request = archive.lastRequest();
        assertEquals("DELETE", request.method());
        assertEquals("", request.body());
    }

    @Test
    void testDeleteSubject_WithLanguageSendsLangBody() throws Exception {
        archive.respond("DELETE", "/api/v1/metadata-subjects/7", 200, "{\"deleted\": true}");

        client.deleteSubject("7", MetadataLanguage.ARABIC);

        assertEquals("{\"lang\":\"arabic\"}", archive.lastRequest().body());
    }

    @Test
    void testDeleteSubject_NotFoundIsStatusError() {
        archive.respond("DELETE", "/api/v1/metadata-subjects/missing-id", 404, "{\"message\": \"Subject not found\"}");

        final ApiException e = assertThrows(ApiException.class, () -> client.deleteSubject("missing-id", null));

        assertEquals(ApiException.Origin.HTTP_STATUS, e.getOrigin());
        assertEquals(404, e.getStatusCode().getAsInt());
        assertEquals("Subject not found", e.getMessage());
    }

    // =========================================================================
    // Failure classification
    // =========================================================================

    @Test
    void testGetAccession_NotFound() {
        archive.respond("GET", "/api/v1/accessions/abc", 404, "");

        final ApiException e = assertThrows(ApiException.class, () -> client.getAccession("abc"));

        assertEquals(ApiException.Origin.HTTP_STATUS, e.getOrigin());
        assertEquals(404, e.getStatusCode().getAsInt());
        assertEquals("HTTP 404 Not Found", e.getMessage());
    }

    @Test
    void testGetAccession_MalformedJsonIsDecodeError() {
        archive.respond("GET", "/api/v1/accessions/abc", 200, "{\"accession\": ");

        final ApiException e = assertThrows(ApiException.class, () -> client.getAccession("abc"));

        assertEquals(ApiException.Origin.DECODE, e.getOrigin());
        assertTrue(e.getStatusCode().isEmpty());
    }

    @Test
    @DisplayName("A literal null body on 200 is a decode failure, not an empty success")
    void testGetAccession_NullBodyIsDecodeError() {
        archive.respond("GET", "/api/v1/accessions/abc", 200, "null");

        final ApiException e = assertThrows(ApiException.class, () -> client.getAccession("abc"));

        assertEquals(ApiException.Origin.DECODE, e.getOrigin());
        assertTrue(e.getStatusCode().isEmpty());
    }

    @Test
    void testListSubjects_NullBodyIsDecodeError() {
        archive.respond("GET", "/api/v1/metadata-subjects", 200, "null");

        final ApiException e = assertThrows(ApiException.class, () -> client.listSubjects(PageRequest.unpaged()));

        assertEquals(ApiException.Origin.DECODE, e.getOrigin());
    }

    @Test
    void testGetAccession_MissingRequiredFieldIsDecodeError() {
        archive.respond("GET", "/api/v1/accessions/abc", 200, "{\"wacz_url\": \"x\"}");

        final ApiException e = assertThrows(ApiException.class, () -> client.getAccession("abc"));

        assertEquals(ApiException.Origin.DECODE, e.getOrigin());
    }

    @Test
    void testServerErrorUsesPlainTextBody() {
        archive.respond("GET", "/api/v1/accessions/abc", 503, "maintenance window");

        final ApiException e = assertThrows(ApiException.class, () -> client.getAccession("abc"));

        assertEquals(503, e.getStatusCode().getAsInt());
        assertEquals("maintenance window", e.getMessage());
    }

    @Test
    void testConnectionRefusedIsTransportError() throws IOException {
        final int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        final ServerConfig config = new ServerConfig("k", "http://127.0.0.1:" + closedPort, "127.0.0.1", 0,
            Duration.ofSeconds(2), Duration.ofSeconds(1), null);

        final ApiException e = assertThrows(ApiException.class, () -> new SdaClient(config).getAccession("abc"));

        assertEquals(ApiException.Origin.TRANSPORT, e.getOrigin());
        assertTrue(e.getStatusCode().isEmpty());
    }

    @Test
    void testRemoteMessage_Fallbacks() {
        assertEquals("Bad key", SdaClient.remoteMessage(401, "{\"error\": \"Bad key\"}"));
        assertEquals("Too late", SdaClient.remoteMessage(422, "{\"detail\": \"Too late\"}"));
        assertEquals("HTTP 500 Internal Server Error", SdaClient.remoteMessage(500, "{\"code\": 1}"));
        assertEquals("HTTP 502 Bad Gateway", SdaClient.remoteMessage(502, "<html>oops</html>"));
        assertEquals("HTTP 418", SdaClient.remoteMessage(418, "  "));
    }
}
