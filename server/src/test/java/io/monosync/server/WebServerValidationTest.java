// file: server/src/test/java/io/monosync/server/WebServerValidationTest.java
package io.monosync.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.monosync.server.check.ChangesetChecker;
import io.monosync.server.diff.ChangesetDiffer;
import io.monosync.server.identity.IdentifierResolver;
import io.monosync.server.identity.Schemes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for WebServer routing, validation and error semantics.
 *
 * Focus:
 *  - Invalid JSON -> 400 "invalid JSON".
 *  - Too-large body -> 413 "request body too large".
 *  - Unknown repo -> 404, conflicting push -> 409.
 *  - A push through the small repo is visible via lookup and bookmarks.
 */
class WebServerValidationTest {

    private static final int PORT = 18080; // test-only port
    private final ObjectMapper json = new ObjectMapper();
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        TestRepos t = TestRepos.defaults();
        RepoService service = new RepoService(
                t.registry,
                new IdentifierResolver(Schemes.all(t.altHashes)),
                t.redirector,
                new ChangesetDiffer(t.manifests),
                new ChangesetChecker(t.registry)
        );
        server = new WebServer(PORT, service);
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    private String baseUrl() {
        return "http://localhost:" + PORT;
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder().uri(URI.create(baseUrl() + path)).GET().build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + path))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/json")
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static String commit(String parent, String message, String path, String base64) {
        String parents = parent == null ? "[]" : "[\"" + parent + "\"]";
        return """
                {"parents": %s, "author": "tester", "date": 1700000000, "tzOffset": 0,
                 "message": "%s", "changes": {"%s": {"contentBase64": "%s"}}}
                """.formatted(parents, message, path, base64);
    }

    private static String pushBody(String bookmark, String... commits) {
        return "{\"bookmark\": \"" + bookmark + "\", \"commits\": [" + String.join(",", commits) + "]}";
    }

    @Test
    void health_reports_ok() throws Exception {
        HttpResponse<String> resp = get("/admin/health");
        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("ok"));
    }

    @Test
    void invalid_json_returns_400_for_push() throws Exception {
        HttpResponse<String> resp = post("/repos/small/push", "{ invalid-json");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void too_large_body_returns_413_for_push() throws Exception {
        // Build a body larger than MAX_BODY_BYTES (10 MiB).
        String big = "x".repeat(11 * 1024 * 1024);
        HttpResponse<String> resp = post("/repos/small/push", big);
        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }

    @Test
    void unknown_repo_returns_404() throws Exception {
        HttpResponse<String> resp = get("/repos/nope/bookmarks");
        assertEquals(404, resp.statusCode());
        assertEquals("NotFound", json.readTree(resp.body()).get("error").asText());
    }

    @Test
    void missing_parameter_returns_400() throws Exception {
        HttpResponse<String> resp = get("/repos/large/lookup");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("id is required"));
    }

    @Test
    void push_to_small_is_visible_through_lookup_and_bookmarks() throws Exception {
        HttpResponse<String> pushed = post("/repos/small/push",
                pushBody("master", commit(null, "first", "README", "aGVsbG8=")));
        assertEquals(200, pushed.statusCode(), pushed.body());
        JsonNode result = json.readTree(pushed.body());
        String smallHead = result.get("head").asText();
        assertEquals("small", result.get("repo").asText());

        HttpResponse<String> bookmarks = get("/repos/large/bookmarks");
        JsonNode entries = json.readTree(bookmarks.body()).get("bookmarks");
        assertEquals(1, entries.size());
        String largeHead = entries.get(0).get("target").asText();

        HttpResponse<String> lookup = get("/repos/large/lookup?id=1&kind=legacy&want=native,legacy");
        assertEquals(200, lookup.statusCode(), lookup.body());
        JsonNode names = json.readTree(lookup.body()).get("identifiers");
        assertEquals(largeHead, names.get("native").asText());
        assertEquals("1", names.get("legacy").asText());

        HttpResponse<String> smallLookup = get("/repos/small/lookup?id=master");
        assertEquals(smallHead, json.readTree(smallLookup.body()).get("changeset").asText());

        HttpResponse<String> check = get("/admin/check/large");
        assertTrue(json.readTree(check.body()).get("ok").asBoolean());
    }

    @Test
    void conflicting_push_returns_409() throws Exception {
        HttpResponse<String> first = post("/repos/large/push",
                pushBody("master", commit(null, "base", "f", "YQ==")));
        assertEquals(200, first.statusCode(), first.body());
        String base = json.readTree(first.body()).get("head").asText();

        HttpResponse<String> second = post("/repos/large/push",
                pushBody("master", commit(base, "edit one", "f", "Yg==")));
        assertEquals(200, second.statusCode(), second.body());

        HttpResponse<String> third = post("/repos/large/push",
                pushBody("master", commit(base, "edit two", "f", "Yw==")));
        assertEquals(409, third.statusCode());
        JsonNode err = json.readTree(third.body());
        assertEquals("RebaseConflict", err.get("error").asText());
    }

    @Test
    void unsupported_method_returns_405() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + "/repos/large/push"))
                .GET()
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        assertEquals(405, resp.statusCode());
    }
}
