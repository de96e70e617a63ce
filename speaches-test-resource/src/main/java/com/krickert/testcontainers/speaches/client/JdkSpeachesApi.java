package com.krickert.testcontainers.speaches.client;

import com.krickert.testcontainers.speaches.SpeachesConfig;
import com.krickert.testcontainers.speaches.model.CapabilityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link SpeachesApi} on top of the JDK {@link HttpClient}.
 */
public class JdkSpeachesApi implements SpeachesApi {

    private static final Logger LOG = LoggerFactory.getLogger(JdkSpeachesApi.class);

    private final String baseUrl;
    private final SpeachesConfig config;
    private final HttpClient httpClient;

    public JdkSpeachesApi(String baseUrl, SpeachesConfig config) {
        this(baseUrl, config, HttpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout())
                .build());
    }

    JdkSpeachesApi(String baseUrl, SpeachesConfig config, HttpClient httpClient) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public ApiResponse health() throws IOException, InterruptedException {
        return send(get("/health", config.getPollRequestTimeout()));
    }

    @Override
    public ApiResponse registry(CapabilityType capability) throws IOException, InterruptedException {
        String task = URLEncoder.encode(capability.getTask(), StandardCharsets.UTF_8);
        return send(get("/v1/registry?task=" + task, config.getRegistryTimeout()));
    }

    @Override
    public ApiResponse listModels() throws IOException, InterruptedException {
        return send(get("/v1/models", config.getPollRequestTimeout()));
    }

    @Override
    public ApiResponse loadModel(String modelId) throws IOException, InterruptedException {
        HttpRequest request = authorized(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/models/" + encodePathSegment(modelId)))
                .POST(HttpRequest.BodyPublishers.noBody())
                .timeout(config.getLoadTimeout()))
                .build();
        return send(request);
    }

    /**
     * Percent-encodes a model id so that it occupies exactly one path segment;
     * {@code Systran/faster-whisper-base} becomes {@code Systran%2Ffaster-whisper-base}.
     */
    public static String encodePathSegment(String modelId) {
        return URLEncoder.encode(modelId, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpRequest get(String pathAndQuery, Duration timeout) {
        return authorized(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + pathAndQuery))
                .GET()
                .timeout(timeout))
                .build();
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        config.getApiKey().ifPresent(key -> builder.header("Authorization", "Bearer " + key));
        return builder;
    }

    private ApiResponse send(HttpRequest request) throws IOException, InterruptedException {
        LOG.trace("{} {}", request.method(), request.uri());
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        LOG.trace("{} {} -> {}", request.method(), request.uri(), response.statusCode());
        return new ApiResponse(response.statusCode(), response.body());
    }
}
