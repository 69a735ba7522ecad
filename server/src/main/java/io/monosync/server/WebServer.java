// file: server/src/main/java/io/monosync/server/WebServer.java
package io.monosync.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.monosync.core.DivergedHistoryException;
import io.monosync.core.InvalidChangesetException;
import io.monosync.core.MonosyncException;
import io.monosync.core.NotFoundException;
import io.monosync.core.RebaseConflictException;
import io.monosync.core.StaleBookmarkException;
import io.monosync.core.TooManyRetriesException;
import io.monosync.core.UnsyncedAncestorException;
import io.monosync.server.dto.BookmarkUpdateRequest;
import io.monosync.server.dto.PushRequest;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over {@link RepoService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map engine exceptions to HTTP status codes.
 *  - Emit per-request logging via {@link RequestLogger}.
 *
 * Path layout:
 *   - GET    /admin/health
 *   - GET    /admin/check/{repo}
 *   - GET    /repos/{repo}/lookup?id=..[&kind=..][&want=native,legacy,alt]
 *   - GET    /repos/{repo}/diff?base=..&other=..
 *   - GET    /repos/{repo}/bookmarks[?prefix=..&limit=..]
 *   - POST   /repos/{repo}/push
 *   - PUT    /repos/{repo}/bookmarks/{name}
 *   - DELETE /repos/{repo}/bookmarks/{name}[?expected=..]
 *
 * Errors are JSON: {"error": kind, "message": ..., plus the failure's context}.
 * Status mapping:
 *   400 bad input, 404 NotFound, 409 RebaseConflict / StaleBookmark,
 *   413 body over 10 MiB, 422 UnsyncedAncestor / InvalidChangeset,
 *   503 TooManyRetries, 500 anything else (including MappingConflict).
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final RepoService repos;

    @FunctionalInterface
    private interface Action {
        Object run() throws Exception;
    }

    @FunctionalInterface
    private interface BodyAction {
        Object run(byte[] body) throws Exception;
    }

    public WebServer(int port, RepoService repos) {
        this.repos = repos;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    if (exchange.isInIoThread()) {
                        // engine calls block on fsync and bookmark CAS retries
                        exchange.dispatch(this::route);
                        return;
                    }
                    route(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void route(HttpServerExchange exchange) {
        String path = exchange.getRequestPath();
        String method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if ("/admin/health".equals(path)) {
            send(exchange, 200, Map.of("status", "ok"));
            RequestLogger.logRequest(method, path, 200, 0, -1, null);
        } else if (path.startsWith("/admin/check/") && "GET".equals(method)) {
            String repo = path.substring("/admin/check/".length());
            handle(exchange, () -> repos.check(repo));
        } else if (path.startsWith("/repos/")) {
            routeRepo(exchange, method, path.substring("/repos/".length()));
        } else {
            notFound(exchange, method, path);
        }
    }

    private void routeRepo(HttpServerExchange exchange, String method, String rest) {
        int slash = rest.indexOf('/');
        if (slash <= 0) {
            notFound(exchange, method, exchange.getRequestPath());
            return;
        }
        String repo = rest.substring(0, slash);
        String sub = rest.substring(slash + 1);

        switch (sub) {
            case "lookup" -> {
                if (!"GET".equals(method)) {
                    methodNotAllowed(exchange, method);
                    return;
                }
                handle(exchange, () -> repos.lookup(repo, query(exchange, "id"), query(exchange, "kind"),
                        queryAll(exchange, "want")));
            }
            case "diff" -> {
                if (!"GET".equals(method)) {
                    methodNotAllowed(exchange, method);
                    return;
                }
                handle(exchange, () -> repos.diff(repo, query(exchange, "base"), query(exchange, "other")));
            }
            case "bookmarks" -> {
                if (!"GET".equals(method)) {
                    methodNotAllowed(exchange, method);
                    return;
                }
                handle(exchange, () -> repos.listBookmarks(repo, query(exchange, "prefix"), query(exchange, "limit")));
            }
            case "push" -> {
                if (!"POST".equals(method)) {
                    methodNotAllowed(exchange, method);
                    return;
                }
                handleBody(exchange, body -> repos.push(repo, json.readValue(body, PushRequest.class)));
            }
            default -> {
                if (!sub.startsWith("bookmarks/") || sub.length() == "bookmarks/".length()) {
                    notFound(exchange, method, exchange.getRequestPath());
                    return;
                }
                String name = sub.substring("bookmarks/".length());
                switch (method) {
                    case "PUT" -> handleBody(exchange, body -> {
                        BookmarkUpdateRequest req = json.readValue(body, BookmarkUpdateRequest.class);
                        if (req == null) throw new IllegalArgumentException("missing body");
                        return repos.setBookmark(repo, name, req.target, req.expected);
                    });
                    case "DELETE" -> handle(exchange, () -> repos.deleteBookmark(repo, name, query(exchange, "expected")));
                    default -> methodNotAllowed(exchange, method);
                }
            }
        }
    }

    // ---------- handlers ----------

    /** Runs a request without a body, timing the engine call. */
    private void handle(HttpServerExchange ex, Action action) {
        String method = ex.getRequestMethod().toString();
        long start = System.nanoTime();
        int status = 200;
        long engineMs = -1L;
        Throwable error = null;
        try {
            long eStart = System.nanoTime();
            Object result = action.run();
            engineMs = (System.nanoTime() - eStart) / 1_000_000L;
            send(ex, status, result);
        } catch (Exception e) {
            status = statusFor(e);
            error = e;
            send(ex, status, errorBody(e));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, ex.getRequestPath(), status, totalMs, engineMs, error);
        }
    }

    /** Reads the full body, rejects it if too large, then runs like {@link #handle}. */
    private void handleBody(HttpServerExchange ex, BodyAction action) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    if (data.length > MAX_BODY_BYTES) {
                        String method = exchange.getRequestMethod().toString();
                        send(exchange, 413, Map.of("error", "request body too large"));
                        RequestLogger.logRequest(method, exchange.getRequestPath(), 413, 0, -1, null);
                        return;
                    }
                    handle(exchange, () -> action.run(data));
                },
                (exchange, ioEx) -> {
                    String method = exchange.getRequestMethod().toString();
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(method, exchange.getRequestPath(), status, 0, -1, ioEx);
                }
        );
    }

    private void notFound(HttpServerExchange ex, String method, String path) {
        send(ex, 404, Map.of("error", "not found"));
        RequestLogger.logRequest(method, path, 404, 0, -1, null);
    }

    private void methodNotAllowed(HttpServerExchange ex, String method) {
        send(ex, 405, Map.of("error", "method not allowed"));
        RequestLogger.logRequest(method, ex.getRequestPath(), 405, 0, -1, null);
    }

    // ---------- error mapping ----------

    static int statusFor(Throwable e) {
        if (e instanceof JsonProcessingException) return 400;
        if (e instanceof IllegalArgumentException) return 400;
        if (e instanceof NotFoundException) return 404;
        if (e instanceof RebaseConflictException || e instanceof StaleBookmarkException
                || e instanceof DivergedHistoryException) return 409;
        if (e instanceof UnsyncedAncestorException || e instanceof InvalidChangesetException) return 422;
        if (e instanceof TooManyRetriesException) return 503;
        return 500;
    }

    static Map<String, Object> errorBody(Throwable e) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (e instanceof JsonProcessingException) {
            body.put("error", "invalid JSON");
            body.put("message", ((JsonProcessingException) e).getOriginalMessage());
        } else if (e instanceof MonosyncException m) {
            body.put("error", m.kind());
            body.put("message", m.getMessage());
            body.putAll(m.context());
        } else if (e instanceof IllegalArgumentException) {
            body.put("error", "InvalidArgument");
            body.put("message", e.getMessage());
        } else {
            body.put("error", e.getClass().getSimpleName());
            body.put("message", String.valueOf(e.getMessage()));
        }
        return body;
    }

    // ---------- helpers ----------

    private static String query(HttpServerExchange ex, String name) {
        Deque<String> values = ex.getQueryParameters().get(name);
        return (values == null || values.isEmpty()) ? null : values.getFirst();
    }

    private static List<String> queryAll(HttpServerExchange ex, String name) {
        Deque<String> values = ex.getQueryParameters().get(name);
        return values == null ? List.of() : new ArrayList<>(values);
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
