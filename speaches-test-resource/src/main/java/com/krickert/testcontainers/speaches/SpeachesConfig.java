package com.krickert.testcontainers.speaches;

import com.krickert.testcontainers.speaches.model.CapabilityType;
import com.krickert.testcontainers.speaches.provision.RegistryCheckPolicy;
import io.micronaut.core.convert.ConversionService;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the shared Speaches container and the model provisioning flow.
 * <p>
 * Values can be supplied programmatically through {@link #builder()} or read from a flat
 * property map ({@link #fromProperties(Map)}), for example the system properties of a test run:
 * <pre>
 * speaches.image=ghcr.io/speaches-ai/speaches:0.9.0-rc.3-cpu
 * speaches.host-port=28001
 * speaches.registry-check=strict
 * speaches.ready.max-wait=2m
 * </pre>
 */
public final class SpeachesConfig {

    public static final String PREFIX = "speaches";

    public static final String PROPERTY_IMAGE = PREFIX + ".image";
    public static final String PROPERTY_HOST_PORT = PREFIX + ".host-port";
    public static final String PROPERTY_MODEL_CACHE_DIR = PREFIX + ".model-cache-dir";
    public static final String PROPERTY_API_KEY = PREFIX + ".api-key";
    public static final String PROPERTY_LOG_LEVEL = PREFIX + ".log-level";
    public static final String PROPERTY_REGISTRY_CHECK = PREFIX + ".registry-check";
    public static final String PROPERTY_PROPERTY_PREFIX = PREFIX + ".property-prefix";
    public static final String PROPERTY_STARTUP_TIMEOUT = PREFIX + ".startup-timeout";
    public static final String PROPERTY_CONNECT_TIMEOUT = PREFIX + ".http.connect-timeout";
    public static final String PROPERTY_LOAD_TIMEOUT = PREFIX + ".http.load-timeout";
    public static final String PROPERTY_REGISTRY_TIMEOUT = PREFIX + ".http.registry-timeout";
    public static final String PROPERTY_POLL_REQUEST_TIMEOUT = PREFIX + ".http.poll-timeout";
    public static final String PROPERTY_READY_MAX_WAIT = PREFIX + ".ready.max-wait";
    public static final String PROPERTY_READY_POLL_INTERVAL = PREFIX + ".ready.poll-interval";
    public static final String PROPERTY_SETTLE_DELAY = PREFIX + ".ready.settle-delay";
    public static final String PROPERTY_TTS_SETTLE_DELAY = PREFIX + ".ready.tts-settle-delay";

    public static final String DEFAULT_IMAGE = "ghcr.io/speaches-ai/speaches:0.9.0-rc.3-cpu";
    public static final String CONTAINER_MODEL_CACHE_DIR = "/home/ubuntu/.cache/huggingface/hub";
    public static final String OFFICIAL_MODEL_PREFIX = "speaches-ai/";

    private final String imageName;
    private final Integer hostPort;
    private final Path modelCacheDir;
    private final String apiKey;
    private final String logLevel;
    private final RegistryCheckPolicy registryCheckPolicy;
    private final String propertyPrefix;
    private final Duration startupTimeout;
    private final Duration connectTimeout;
    private final Duration loadTimeout;
    private final Duration registryTimeout;
    private final Duration pollRequestTimeout;
    private final Duration readyMaxWait;
    private final Duration readyPollInterval;
    private final Duration settleDelay;
    private final Duration ttsSettleDelay;

    private SpeachesConfig(Builder builder) {
        this.imageName = builder.imageName;
        this.hostPort = builder.hostPort;
        this.modelCacheDir = builder.modelCacheDir;
        this.apiKey = builder.apiKey;
        this.logLevel = builder.logLevel;
        this.registryCheckPolicy = builder.registryCheckPolicy;
        this.propertyPrefix = builder.propertyPrefix;
        this.startupTimeout = builder.startupTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.loadTimeout = builder.loadTimeout;
        this.registryTimeout = builder.registryTimeout;
        this.pollRequestTimeout = builder.pollRequestTimeout;
        this.readyMaxWait = builder.readyMaxWait;
        this.readyPollInterval = builder.readyPollInterval;
        this.settleDelay = builder.settleDelay;
        this.ttsSettleDelay = builder.ttsSettleDelay;
    }

    public static SpeachesConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code speaches.*} keys from the given map; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static SpeachesConfig fromProperties(Map<String, ?> properties) {
        Builder builder = builder();
        string(properties, PROPERTY_IMAGE).ifPresent(builder::imageName);
        string(properties, PROPERTY_HOST_PORT).ifPresent(value -> builder.hostPort(parseInt(PROPERTY_HOST_PORT, value)));
        string(properties, PROPERTY_MODEL_CACHE_DIR).ifPresent(value -> builder.modelCacheDir(Path.of(value)));
        string(properties, PROPERTY_API_KEY).ifPresent(builder::apiKey);
        string(properties, PROPERTY_LOG_LEVEL).ifPresent(builder::logLevel);
        string(properties, PROPERTY_REGISTRY_CHECK).ifPresent(value -> builder.registryCheckPolicy(RegistryCheckPolicy.from(value)));
        string(properties, PROPERTY_PROPERTY_PREFIX).ifPresent(builder::propertyPrefix);
        duration(properties, PROPERTY_STARTUP_TIMEOUT).ifPresent(builder::startupTimeout);
        duration(properties, PROPERTY_CONNECT_TIMEOUT).ifPresent(builder::connectTimeout);
        duration(properties, PROPERTY_LOAD_TIMEOUT).ifPresent(builder::loadTimeout);
        duration(properties, PROPERTY_REGISTRY_TIMEOUT).ifPresent(builder::registryTimeout);
        duration(properties, PROPERTY_POLL_REQUEST_TIMEOUT).ifPresent(builder::pollRequestTimeout);
        duration(properties, PROPERTY_READY_MAX_WAIT).ifPresent(builder::readyMaxWait);
        duration(properties, PROPERTY_READY_POLL_INTERVAL).ifPresent(builder::readyPollInterval);
        duration(properties, PROPERTY_SETTLE_DELAY).ifPresent(builder::settleDelay);
        duration(properties, PROPERTY_TTS_SETTLE_DELAY).ifPresent(builder::ttsSettleDelay);
        return builder.build();
    }

    public static SpeachesConfig fromSystemProperties() {
        Map<String, Object> properties = new HashMap<>();
        System.getProperties().forEach((key, value) -> properties.put(String.valueOf(key), value));
        return fromProperties(properties);
    }

    /**
     * Converts a duration string with Micronaut's conversion service, the same way
     * {@code @Value} injected durations are read: {@code 500ms}, {@code 30s}, {@code 2m},
     * {@code 1h}, {@code 1d} or an ISO-8601 duration such as {@code PT2M}.
     */
    static Duration parseDuration(String key, String value) {
        Optional<Duration> duration;
        try {
            duration = ConversionService.SHARED.convert(value.trim(), Duration.class);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid duration for '" + key + "': " + value, e);
        }
        return duration.orElseThrow(() -> new IllegalArgumentException("Invalid duration for '" + key + "': " + value));
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for '" + key + "': " + value, e);
        }
    }

    private static Optional<String> string(Map<String, ?> properties, String key) {
        Object value = properties.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(value).trim());
    }

    private static Optional<Duration> duration(Map<String, ?> properties, String key) {
        return string(properties, key).map(value -> parseDuration(key, value));
    }

    public String getImageName() {
        return imageName;
    }

    /**
     * Fixed host port to publish the container port on, so that a container started by hand and
     * the test run agree on the address. Empty means a random port chosen by Docker.
     */
    public Optional<Integer> getHostPort() {
        return Optional.ofNullable(hostPort);
    }

    public Path getModelCacheDir() {
        return modelCacheDir;
    }

    public Optional<String> getApiKey() {
        return Optional.ofNullable(apiKey);
    }

    public String getLogLevel() {
        return logLevel;
    }

    public RegistryCheckPolicy getRegistryCheckPolicy() {
        return registryCheckPolicy;
    }

    public String getPropertyPrefix() {
        return propertyPrefix;
    }

    public Duration getStartupTimeout() {
        return startupTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getLoadTimeout() {
        return loadTimeout;
    }

    public Duration getRegistryTimeout() {
        return registryTimeout;
    }

    public Duration getPollRequestTimeout() {
        return pollRequestTimeout;
    }

    public Duration getReadyMaxWait() {
        return readyMaxWait;
    }

    public Duration getReadyPollInterval() {
        return readyPollInterval;
    }

    /**
     * Extra wait after a model first appears in the loaded-models listing.
     * Text-to-speech models initialise noticeably slower than the others.
     */
    public Duration getSettleDelay(CapabilityType capability) {
        return capability == CapabilityType.TEXT_TO_SPEECH ? ttsSettleDelay : settleDelay;
    }

    public Builder toBuilder() {
        return builder()
                .imageName(imageName)
                .hostPort(hostPort)
                .modelCacheDir(modelCacheDir)
                .apiKey(apiKey)
                .logLevel(logLevel)
                .registryCheckPolicy(registryCheckPolicy)
                .propertyPrefix(propertyPrefix)
                .startupTimeout(startupTimeout)
                .connectTimeout(connectTimeout)
                .loadTimeout(loadTimeout)
                .registryTimeout(registryTimeout)
                .pollRequestTimeout(pollRequestTimeout)
                .readyMaxWait(readyMaxWait)
                .readyPollInterval(readyPollInterval)
                .settleDelay(settleDelay)
                .ttsSettleDelay(ttsSettleDelay);
    }

    public static final class Builder {
        private String imageName = DEFAULT_IMAGE;
        private Integer hostPort;
        private Path modelCacheDir = Path.of(System.getProperty("user.home"), ".cache", "speaches-tc", "huggingface", "hub");
        private String apiKey;
        private String logLevel = "info";
        private RegistryCheckPolicy registryCheckPolicy = RegistryCheckPolicy.ADVISORY;
        private String propertyPrefix = PREFIX;
        private Duration startupTimeout = Duration.ofMinutes(5);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration loadTimeout = Duration.ofMinutes(10);
        private Duration registryTimeout = Duration.ofSeconds(30);
        private Duration pollRequestTimeout = Duration.ofSeconds(5);
        private Duration readyMaxWait = Duration.ofMinutes(2);
        private Duration readyPollInterval = Duration.ofSeconds(2);
        private Duration settleDelay = Duration.ofSeconds(2);
        private Duration ttsSettleDelay = Duration.ofSeconds(5);

        private Builder() {
        }

        public Builder imageName(String imageName) {
            this.imageName = Objects.requireNonNull(imageName, "imageName");
            return this;
        }

        public Builder hostPort(Integer hostPort) {
            this.hostPort = hostPort;
            return this;
        }

        public Builder modelCacheDir(Path modelCacheDir) {
            this.modelCacheDir = Objects.requireNonNull(modelCacheDir, "modelCacheDir");
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey;
            return this;
        }

        public Builder logLevel(String logLevel) {
            this.logLevel = Objects.requireNonNull(logLevel, "logLevel");
            return this;
        }

        public Builder registryCheckPolicy(RegistryCheckPolicy registryCheckPolicy) {
            this.registryCheckPolicy = Objects.requireNonNull(registryCheckPolicy, "registryCheckPolicy");
            return this;
        }

        public Builder propertyPrefix(String propertyPrefix) {
            this.propertyPrefix = Objects.requireNonNull(propertyPrefix, "propertyPrefix");
            return this;
        }

        public Builder startupTimeout(Duration startupTimeout) {
            this.startupTimeout = positive("startupTimeout", startupTimeout);
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = positive("connectTimeout", connectTimeout);
            return this;
        }

        public Builder loadTimeout(Duration loadTimeout) {
            this.loadTimeout = positive("loadTimeout", loadTimeout);
            return this;
        }

        public Builder registryTimeout(Duration registryTimeout) {
            this.registryTimeout = positive("registryTimeout", registryTimeout);
            return this;
        }

        public Builder pollRequestTimeout(Duration pollRequestTimeout) {
            this.pollRequestTimeout = positive("pollRequestTimeout", pollRequestTimeout);
            return this;
        }

        public Builder readyMaxWait(Duration readyMaxWait) {
            this.readyMaxWait = notNegative("readyMaxWait", readyMaxWait);
            return this;
        }

        public Builder readyPollInterval(Duration readyPollInterval) {
            this.readyPollInterval = positive("readyPollInterval", readyPollInterval);
            return this;
        }

        public Builder settleDelay(Duration settleDelay) {
            this.settleDelay = notNegative("settleDelay", settleDelay);
            return this;
        }

        public Builder ttsSettleDelay(Duration ttsSettleDelay) {
            this.ttsSettleDelay = notNegative("ttsSettleDelay", ttsSettleDelay);
            return this;
        }

        public SpeachesConfig build() {
            return new SpeachesConfig(this);
        }

        private static Duration positive(String name, Duration value) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }

        private static Duration notNegative(String name, Duration value) {
            Objects.requireNonNull(value, name);
            if (value.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative: " + value);
            }
            return value;
        }
    }
}
