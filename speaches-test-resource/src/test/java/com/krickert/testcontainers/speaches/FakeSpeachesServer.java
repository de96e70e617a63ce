package com.krickert.testcontainers.speaches;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-process stand-in for the Speaches endpoints used during provisioning.
 * A successful load adds the model to the loaded-models listing.
 */
public class FakeSpeachesServer implements AutoCloseable {

    private final HttpServer httpServer;

    private final Map<String, String> registryBodies = new ConcurrentHashMap<>();
    private final Set<String> loadedModels = Collections.synchronizedSet(new LinkedHashSet<>());
    private final List<String> loadPaths = new CopyOnWriteArrayList<>();
    private final List<String> authorizationHeaders = new CopyOnWriteArrayList<>();
    private final List<String> registryQueries = new CopyOnWriteArrayList<>();

    private final AtomicInteger healthCount = new AtomicInteger();
    private final AtomicInteger listCount = new AtomicInteger();
    private final AtomicInteger loadCount = new AtomicInteger();

    private volatile int healthStatus = 200;
    private volatile int registryStatus = 200;
    private volatile int loadStatus = 200;
    private volatile String loadFailureBody = "{\"detail\":\"Model not found\"}";

    private FakeSpeachesServer() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        httpServer.createContext("/health", this::handleHealth);
        httpServer.createContext("/v1/registry", this::handleRegistry);
        httpServer.createContext("/v1/models", this::handleModels);
        httpServer.start();
    }

    public static FakeSpeachesServer start() throws IOException {
        return new FakeSpeachesServer();
    }

    public String getHost() {
        return httpServer.getAddress().getHostString();
    }

    public int getPort() {
        return httpServer.getAddress().getPort();
    }

    public String getBaseUrl() {
        return "http://" + getHost() + ":" + getPort();
    }

    public FakeSpeachesServer withRegistry(String task, String body) {
        registryBodies.put(task, body);
        return this;
    }

    public FakeSpeachesServer withLoadedModel(String modelId) {
        loadedModels.add(modelId);
        return this;
    }

    public FakeSpeachesServer withHealthStatus(int status) {
        this.healthStatus = status;
        return this;
    }

    public FakeSpeachesServer withRegistryStatus(int status) {
        this.registryStatus = status;
        return this;
    }

    public FakeSpeachesServer withLoadFailure(int status, String body) {
        this.loadStatus = status;
        this.loadFailureBody = body;
        return this;
    }

    public int getHealthCount() {
        return healthCount.get();
    }

    public int getListCount() {
        return listCount.get();
    }

    public int getLoadCount() {
        return loadCount.get();
    }

    /** Raw (still percent-encoded) paths of load requests, in arrival order. */
    public List<String> getLoadPaths() {
        return new ArrayList<>(loadPaths);
    }

    public List<String> getAuthorizationHeaders() {
        return new ArrayList<>(authorizationHeaders);
    }

    public List<String> getRegistryQueries() {
        return new ArrayList<>(registryQueries);
    }

    @Override
    public void close() {
        httpServer.stop(0);
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        healthCount.incrementAndGet();
        recordAuthorization(exchange);
        respond(exchange, healthStatus, "OK");
    }

    private void handleRegistry(HttpExchange exchange) throws IOException {
        recordAuthorization(exchange);
        String query = exchange.getRequestURI().getRawQuery();
        registryQueries.add(query);
        if (registryStatus != 200) {
            respond(exchange, registryStatus, "{\"detail\":\"registry unavailable\"}");
            return;
        }
        String task = query != null && query.startsWith("task=")
                ? URLDecoder.decode(query.substring("task=".length()), StandardCharsets.UTF_8)
                : "";
        respond(exchange, 200, registryBodies.getOrDefault(task, "[]"));
    }

    private void handleModels(HttpExchange exchange) throws IOException {
        recordAuthorization(exchange);
        String rawPath = exchange.getRequestURI().getRawPath();
        if ("GET".equals(exchange.getRequestMethod()) && "/v1/models".equals(rawPath)) {
            listCount.incrementAndGet();
            respond(exchange, 200, listing());
            return;
        }
        if ("POST".equals(exchange.getRequestMethod()) && rawPath.startsWith("/v1/models/")) {
            loadCount.incrementAndGet();
            loadPaths.add(rawPath);
            if (loadStatus < 200 || loadStatus > 299) {
                respond(exchange, loadStatus, loadFailureBody);
                return;
            }
            String modelId = URLDecoder.decode(rawPath.substring("/v1/models/".length()), StandardCharsets.UTF_8);
            loadedModels.add(modelId);
            respond(exchange, loadStatus, "");
            return;
        }
        respond(exchange, 404, "{\"detail\":\"Not Found\"}");
    }

    private String listing() {
        List<String> ids;
        synchronized (loadedModels) {
            ids = new ArrayList<>(loadedModels);
        }
        return ids.stream()
                .map(id -> "{\"id\":\"" + id + "\",\"object\":\"model\"}")
                .collect(Collectors.joining(",", "{\"data\":[", "],\"object\":\"list\"}"));
    }

    private void recordAuthorization(HttpExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst("Authorization");
        if (header != null) {
            authorizationHeaders.add(header);
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getRequestBody().close();
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }
}
