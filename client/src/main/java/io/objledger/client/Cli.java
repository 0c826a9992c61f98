// file: client/src/main/java/io/objledger/client/Cli.java
package io.objledger.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Base64;

/**
 * Simple CLI for interacting with a running validator over HTTP.
 *
 * Usage:
 *   objledger-cli [--base-url http://host:port] object <objectId>
 *   objledger-cli [--base-url http://host:port] effects <txDigest>
 *   objledger-cli [--base-url http://host:port] submit <sender> <txBytesBase64 | @file>
 *
 * Examples:
 *   objledger-cli object 0x5
 *   objledger-cli submit 0xa11ce @tx.bcs
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:9000";

    static final String USAGE = """
            Usage:
              objledger-cli [--base-url http://host:port] object <objectId>
              objledger-cli [--base-url http://host:port] effects <txDigest>
              objledger-cli [--base-url http://host:port] submit <sender> <txBytesBase64 | @file>
            """;

    private final HttpClient http;
    private final String baseUrl;
    private final ObjectMapper json = new ObjectMapper();
    private final PrintStream out;

    Cli(String baseUrl, PrintStream out) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run one command and return the process exit code:
     * 0 on success, 1 for usage or server-side errors, 2 for unexpected failures.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            String baseUrl = DEFAULT_BASE_URL;
            String[] rest = args;
            if (rest.length >= 1 && "--base-url".equals(rest[0])) {
                if (rest.length < 2) throw new CliException("--base-url requires a value");
                baseUrl = rest[1];
                rest = Arrays.copyOfRange(rest, 2, rest.length);
            }
            if (rest.length == 0) throw new CliException("missing command");

            Cli cli = new Cli(baseUrl, out);
            switch (rest[0]) {
                case "object" -> {
                    if (rest.length != 2) throw new CliException("object requires <objectId>");
                    cli.getObject(rest[1]);
                }
                case "effects" -> {
                    if (rest.length != 2) throw new CliException("effects requires <txDigest>");
                    cli.getEffects(rest[1]);
                }
                case "submit" -> {
                    if (rest.length != 3) throw new CliException("submit requires <sender> <txBytesBase64 | @file>");
                    cli.submit(rest[1], txBytesBase64(rest[2]));
                }
                default -> throw new CliException("unknown command: " + rest[0]);
            }
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            if (e.showUsage) err.println(USAGE);
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    /** {@code @path} reads raw transaction bytes from a file; anything else is taken as base64. */
    static String txBytesBase64(String arg) throws IOException {
        if (arg.startsWith("@")) {
            return Base64.getEncoder().encodeToString(Files.readAllBytes(Path.of(arg.substring(1))));
        }
        try {
            Base64.getDecoder().decode(arg);
        } catch (IllegalArgumentException e) {
            throw new CliException("transaction bytes are not valid base64");
        }
        return arg;
    }

    private void getObject(String id) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/objects/" + id))
                .GET()
                .build();
        print("GET object", http.send(req, HttpResponse.BodyHandlers.ofString()));
    }

    private void getEffects(String digest) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/effects/" + digest))
                .GET()
                .build();
        print("GET effects", http.send(req, HttpResponse.BodyHandlers.ofString()));
    }

    private void submit(String sender, String txBytesBase64) throws Exception {
        ObjectNode body = json.createObjectNode();
        body.put("txBytesBase64", txBytesBase64);
        body.put("sender", sender);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/transactions"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(json.writeValueAsBytes(body)))
                .build();
        print("submit", http.send(req, HttpResponse.BodyHandlers.ofString()));
    }

    /** Pretty-print a 200 response; turn anything else into a CliException carrying the server's error. */
    private void print(String what, HttpResponse<String> resp) throws IOException {
        if (resp.statusCode() != 200) {
            String detail = resp.body();
            if (detail.startsWith("{")) {
                JsonNode error = json.readTree(detail);
                if (error.hasNonNull("error")) {
                    detail = error.get("error").asText()
                            + (error.hasNonNull("message") ? ": " + error.get("message").asText() : "");
                }
            }
            throw new CliException(what + " failed (" + resp.statusCode() + "): " + detail, false);
        }
        out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(json.readTree(resp.body())));
    }

    static final class CliException extends RuntimeException {
        final boolean showUsage;

        CliException(String msg) {
            this(msg, true);
        }

        CliException(String msg, boolean showUsage) {
            super(msg);
            this.showUsage = showUsage;
        }
    }
}
