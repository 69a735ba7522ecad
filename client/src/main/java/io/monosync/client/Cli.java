// file: client/src/main/java/io/monosync/client/Cli.java
package io.monosync.client;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Simple CLI for a running monosync server over HTTP. Responses are printed as
 * the server's JSON.
 *
 * Usage:
 *   monosync-cli [--base-url http://host:port] lookup <repo> <identifier> [kinds]
 *   monosync-cli [--base-url http://host:port] diff <repo> <base> <other>
 *   monosync-cli [--base-url http://host:port] bookmarks <repo> [prefix]
 *   monosync-cli [--base-url http://host:port] set-bookmark <repo> <name> <target> [expected]
 *   monosync-cli [--base-url http://host:port] delete-bookmark <repo> <name> [expected]
 *   monosync-cli [--base-url http://host:port] push <repo> <request.json>
 *   monosync-cli [--base-url http://host:port] check <repo>
 *
 * Examples:
 *   monosync-cli lookup large master native,legacy,alt
 *   monosync-cli set-bookmark small release 42
 *   monosync-cli push small push.json
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;

    Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(parsed.getKey());

            switch (cmd) {
                case "lookup" -> {
                    requireArgs(rest, 3, 4, "lookup requires <repo> <identifier> [kinds]");
                    String path = "/repos/" + segment(rest[1]) + "/lookup?id=" + param(rest[2])
                            + (rest.length == 4 ? "&want=" + param(rest[3]) : "");
                    cli.print(cli.send("GET", path, null));
                }
                case "diff" -> {
                    requireArgs(rest, 4, 4, "diff requires <repo> <base> <other>");
                    cli.print(cli.send("GET", "/repos/" + segment(rest[1]) + "/diff?base=" + param(rest[2])
                            + "&other=" + param(rest[3]), null));
                }
                case "bookmarks" -> {
                    requireArgs(rest, 2, 3, "bookmarks requires <repo> [prefix]");
                    cli.print(cli.send("GET", "/repos/" + segment(rest[1]) + "/bookmarks"
                            + (rest.length == 3 ? "?prefix=" + param(rest[2]) : ""), null));
                }
                case "set-bookmark" -> {
                    requireArgs(rest, 4, 5, "set-bookmark requires <repo> <name> <target> [expected]");
                    String body = bookmarkBody(rest[3], rest.length == 5 ? rest[4] : null);
                    cli.print(cli.send("PUT", "/repos/" + segment(rest[1]) + "/bookmarks/" + rest[2], body));
                }
                case "delete-bookmark" -> {
                    requireArgs(rest, 3, 4, "delete-bookmark requires <repo> <name> [expected]");
                    cli.print(cli.send("DELETE", "/repos/" + segment(rest[1]) + "/bookmarks/" + rest[2]
                            + (rest.length == 4 ? "?expected=" + param(rest[3]) : ""), null));
                }
                case "push" -> {
                    requireArgs(rest, 3, 3, "push requires <repo> <request.json>");
                    String body = Files.readString(Path.of(rest[2]), StandardCharsets.UTF_8);
                    cli.print(cli.send("POST", "/repos/" + segment(rest[1]) + "/push", body));
                }
                case "check" -> {
                    requireArgs(rest, 2, 2, "check requires <repo>");
                    HttpResponse<String> resp = cli.send("GET", "/admin/check/" + segment(rest[1]), null);
                    cli.print(resp);
                    if (!resp.body().contains("\"ok\":true")) {
                        System.exit(3);
                    }
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /** JSON body for PUT /repos/{repo}/bookmarks/{name}; identifiers are plain tokens, so no escaping beyond quotes. */
    static String bookmarkBody(String target, String expected) {
        StringBuilder sb = new StringBuilder("{\"target\":").append(quote(target));
        if (expected != null) {
            sb.append(",\"expected\":").append(quote(expected));
        }
        return sb.append('}').toString();
    }

    static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    static String param(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    static String segment(String value) {
        return param(value).replace("+", "%20");
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder req = HttpRequest.newBuilder().uri(URI.create(baseUrl + path));
        if (body != null) {
            req.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            req.method(method, HttpRequest.BodyPublishers.noBody());
        }
        HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 404 && resp.body().contains("\"NotFound\"")) {
            throw new CliException("not found: " + resp.body());
        }
        if (resp.statusCode() != 200) {
            throw new CliException(method + " " + path + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return resp;
    }

    private void print(HttpResponse<String> resp) {
        System.out.println(resp.body());
    }

    private static void requireArgs(String[] rest, int min, int max, String msg) {
        if (rest.length < min || rest.length > max) {
            usageAndExit(msg);
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  monosync-cli [--base-url http://host:port] lookup <repo> <identifier> [kinds]
                  monosync-cli [--base-url http://host:port] diff <repo> <base> <other>
                  monosync-cli [--base-url http://host:port] bookmarks <repo> [prefix]
                  monosync-cli [--base-url http://host:port] set-bookmark <repo> <name> <target> [expected]
                  monosync-cli [--base-url http://host:port] delete-bookmark <repo> <name> [expected]
                  monosync-cli [--base-url http://host:port] push <repo> <request.json>
                  monosync-cli [--base-url http://host:port] check <repo>
                """);
        System.exit(1);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
