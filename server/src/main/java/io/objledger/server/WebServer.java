// file: server/src/main/java/io/objledger/server/WebServer.java
package io.objledger.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.objledger.core.AccountAddress;
import io.objledger.core.ObjectID;
import io.objledger.core.TransactionDigest;
import io.objledger.core.effects.TransactionEffects;
import io.objledger.core.error.UserInputError;
import io.objledger.core.error.UserInputException;
import io.objledger.server.dto.EffectsResponse;
import io.objledger.server.dto.ObjectResponse;
import io.objledger.server.dto.SubmitRequest;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Thin HTTP adapter over {@link AuthorityState}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert results back into JSON.
 *  - Map exceptions to HTTP status codes:
 *      UserInputException -> 400 (404 for ObjectNotFound),
 *      IllegalArgumentException and bad JSON -> 400,
 *      anything else -> 500.
 *
 * Path layout:
 *   - GET    /objects/{id}         Latest live object
 *   - POST   /transactions         Execute a transaction, returns effects
 *   - GET    /effects/{digest}     Effects of a committed transaction
 *   - GET    /admin/health         Basic health check
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final AuthorityState authority;

    public WebServer(int port, AuthorityState authority) {
        this.authority = authority;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if (path.startsWith("/objects/") && "GET".equals(method)) {
                        handleGetObject(exchange, path.substring("/objects/".length()));
                    } else if ("/transactions".equals(path) && "POST".equals(method)) {
                        handleSubmit(exchange);
                    } else if (path.startsWith("/effects/") && "GET".equals(method)) {
                        handleGetEffects(exchange, path.substring("/effects/".length()));
                    } else if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        RequestLogger.logRequest(method, path, 200, 0, -1, null);
                    } else if ("/transactions".equals(path) || path.startsWith("/objects/")
                            || path.startsWith("/effects/")) {
                        send(exchange, 405, Map.of("error", "method not allowed"));
                        RequestLogger.logRequest(method, path, 405, 0, -1, null);
                    } else {
                        send(exchange, 404, Map.of("error", "not found"));
                        RequestLogger.logRequest(method, path, 404, 0, -1, null);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- handlers ----------

    /** GET /objects/{id} */
    private void handleGetObject(HttpServerExchange ex, String id) {
        long start = System.nanoTime();
        int status = 200;
        long execMs = -1L;
        Throwable error = null;
        try {
            ObjectID objectId = ObjectID.fromHex(id);
            long eStart = System.nanoTime();
            AuthorityState.ObjectInfo info = authority.getObjectInfo(objectId);
            execMs = (System.nanoTime() - eStart) / 1_000_000L;
            send(ex, status, ObjectResponse.from(info.object()));
        } catch (Exception e) {
            error = e;
            status = fail(ex, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, execMs, error);
        }
    }

    /** GET /effects/{digest} */
    private void handleGetEffects(HttpServerExchange ex, String digest) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            Optional<TransactionEffects> effects = authority.getEffects(TransactionDigest.fromHex(digest));
            if (effects.isPresent()) {
                send(ex, status, EffectsResponse.from(effects.get()));
            } else {
                status = 404;
                send(ex, status, Map.of("error", "TransactionNotFound", "message", digest));
            }
        } catch (Exception e) {
            error = e;
            status = fail(ex, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, -1, error);
        }
    }

    /** POST /transactions */
    private void handleSubmit(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status = 200;
                    long execMs = -1L;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var req = json.readValue(data, SubmitRequest.class);
                            if (req.txBytesBase64 == null || req.sender == null) {
                                throw new IllegalArgumentException("txBytesBase64 and sender are required");
                            }
                            byte[] txBytes = Base64.getDecoder().decode(req.txBytesBase64);
                            AccountAddress signer = AccountAddress.fromHex(req.sender);
                            long eStart = System.nanoTime();
                            TransactionEffects effects = authority.submit(txBytes, signer);
                            execMs = (System.nanoTime() - eStart) / 1_000_000L;
                            send(exchange, status, EffectsResponse.from(effects));
                        }
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        error = e;
                        status = fail(exchange, e);
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest("POST", path, status, totalMs, execMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), status, 0, -1, ioEx);
                }
        );
    }

    // ---------- helpers ----------

    /** Write the error response for {@code e} and return its status. */
    private int fail(HttpServerExchange ex, Exception e) {
        if (e instanceof UserInputException u) {
            int status = u.kind() == UserInputError.Kind.OBJECT_NOT_FOUND ? 404 : 400;
            send(ex, status, error(u.kind().wireName(), u.error().detail()));
            return status;
        }
        if (e instanceof IllegalArgumentException) {
            send(ex, 400, error("InvalidRequest", e.getMessage()));
            return 400;
        }
        send(ex, 500, error(e.getClass().getSimpleName(), e.getMessage()));
        return 500;
    }

    private static Map<String, String> error(String kind, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", kind);
        body.put("message", message == null ? "" : message);
        return body;
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
