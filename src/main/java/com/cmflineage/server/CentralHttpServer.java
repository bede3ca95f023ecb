package com.cmflineage.server;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmflineage.query.ExecutionField;
import com.cmflineage.query.ExecutionQuery;
import com.cmflineage.query.NotFoundException;
import com.cmflineage.query.QueryEngine;
import com.cmflineage.query.SortOrder;
import com.cmflineage.store.InvalidReferenceException;
import com.cmflineage.store.TransactionCancelledException;
import com.cmflineage.sync.CentralSyncService;
import com.cmflineage.sync.OriginCollisionException;
import com.cmflineage.sync.PullRequest;
import com.cmflineage.sync.SyncBatch;
import com.cmflineage.sync.SyncJson;
import com.cmflineage.sync.UnknownPushSessionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

public class CentralHttpServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CentralHttpServer.class);

    private final CentralSyncService sync;
    private final QueryEngine queries;
    private final ObjectMapper mapper = SyncJson.mapper();
    private final HttpServer server;
    private final ExecutorService executor;

    public CentralHttpServer(CentralSyncService sync, String host, int port, int threads) throws IOException {
        this.sync = sync;
        this.queries = new QueryEngine(sync.store());
        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads));
        server.createContext("/sync/push", exchange -> handle(exchange, "POST", this::push));
        server.createContext("/sync/pull", exchange -> handle(exchange, "POST", this::pull));
        server.createContext("/sync/sessions", exchange -> handle(exchange, "POST", this::session));
        server.createContext("/pipelines", exchange -> handle(exchange, "GET", this::pipelines));
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        log.info("server.started address={} port={}", server.getAddress().getHostString(), port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
        log.info("server.stopped port={}", port());
    }

    private Object push(HttpExchange exchange) throws IOException {
        SyncBatch batch = readBody(exchange, SyncBatch.class);
        return sync.push(batch);
    }

    private Object pull(HttpExchange exchange) throws IOException {
        PullRequest request = readBody(exchange, PullRequest.class);
        return sync.pull(request);
    }

    private Object session(HttpExchange exchange) throws IOException {
        List<String> segments = pathSegments(exchange.getRequestURI());
        if (segments.size() == 2) {
            JsonNode body = readBody(exchange, JsonNode.class);
            String source = body.path("sourceStoreId").asText("");
            if (source.isBlank()) {
                throw new IllegalArgumentException("sourceStoreId is required");
            }
            return Map.of("sessionId", sync.openPush(source));
        }
        if (segments.size() != 4) {
            throw new NotFoundException("No resource at " + exchange.getRequestURI().getPath());
        }
        String sessionId = segments.get(2);
        switch (segments.get(3)) {
            case "entries":
                SyncBatch chunk = readBody(exchange, SyncBatch.class);
                return Map.of("staged", sync.appendEntries(sessionId, chunk.entries()));
            case "commit":
                JsonNode body = readBody(exchange, JsonNode.class);
                return sync.commitPush(sessionId, body.path("highWaterMark").asLong(0L));
            case "abort":
                sync.abortPush(sessionId);
                return Map.of("aborted", sessionId);
            default:
                throw new NotFoundException("No resource at " + exchange.getRequestURI().getPath());
        }
    }

    private Object pipelines(HttpExchange exchange) {
        List<String> segments = pathSegments(exchange.getRequestURI());
        if (segments.size() == 1) {
            return queries.listPipelines().toList();
        }
        String pipeline = segments.get(1);
        String resource = segments.size() > 2 ? segments.get(2) : "";
        if (segments.size() == 3 && resource.equals("executions")) {
            return queries.listExecutions(pipeline, executionQuery(parseQuery(exchange.getRequestURI())));
        }
        if (segments.size() == 3 && resource.equals("artifacts")) {
            return queries.listArtifacts(pipeline);
        }
        if (segments.size() == 3 && resource.equals("execution-types")) {
            return queries.getExecutionTypes(pipeline);
        }
        if (segments.size() == 4 && resource.equals("lineage") && segments.get(3).equals("artifacts")) {
            return queries.getArtifactLineage(pipeline);
        }
        if (segments.size() == 6 && resource.equals("lineage") && segments.get(3).equals("executions")) {
            return queries.getExecutionLineage(pipeline, segments.get(4), segments.get(5));
        }
        throw new NotFoundException("No resource at " + exchange.getRequestURI().getPath());
    }

    static ExecutionQuery executionQuery(Map<String, String> params) {
        int page = parseInt(params.get("page"), 1, "page");
        int pageSize = parseInt(params.get("pageSize"), ExecutionQuery.DEFAULT_PAGE_SIZE, "pageSize");
        String filterField = params.get("filterField");
        ExecutionField filter = filterField == null || filterField.isBlank() ? null : ExecutionField.parse(filterField);
        return new ExecutionQuery(page, pageSize, filter, filter == null ? null : params.getOrDefault("filterValue", ""),
                ExecutionField.parse(params.get("sortField")), SortOrder.parse(params.get("sortOrder")));
    }

    private void handle(HttpExchange exchange, String method, Route route) throws IOException {
        try {
            if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                writeJson(exchange, Map.of("error", "method not allowed"), 405);
                return;
            }
            Object body;
            try {
                body = route.handle(exchange);
            } catch (NotFoundException e) {
                writeJson(exchange, Map.of("error", e.getMessage()), 404);
                return;
            } catch (UnknownPushSessionException e) {
                writeJson(exchange, Map.of("error", e.getMessage()), 410);
                return;
            } catch (InvalidReferenceException | OriginCollisionException e) {
                writeJson(exchange, Map.of("error", e.getMessage()), 409);
                return;
            } catch (JsonProcessingException | IllegalArgumentException e) {
                writeJson(exchange, Map.of("error", String.valueOf(e.getMessage())), 400);
                return;
            } catch (TransactionCancelledException e) {
                writeJson(exchange, Map.of("error", e.getMessage()), 503);
                return;
            } catch (RuntimeException e) {
                log.error("server.request.failed method={} path={}", exchange.getRequestMethod(),
                        exchange.getRequestURI().getPath(), e);
                writeJson(exchange, Map.of("error", String.valueOf(e.getMessage())), 500);
                return;
            }
            writeJson(exchange, body, 200);
        } finally {
            exchange.close();
        }
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            return mapper.readValue(in, type);
        }
    }

    private void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static List<String> pathSegments(URI uri) {
        List<String> segments = new ArrayList<>();
        for (String raw : uri.getRawPath().split("/")) {
            if (!raw.isEmpty()) {
                segments.add(URLDecoder.decode(raw, StandardCharsets.UTF_8));
            }
        }
        return segments;
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                out.put(URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
            }
        }
        return out;
    }

    private static int parseInt(String value, int defaultValue, String name) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    @FunctionalInterface
    private interface Route {
        Object handle(HttpExchange exchange) throws IOException;
    }
}
