package com.krickert.testcontainers.speaches;

import org.slf4j.LoggerFactory;
import org.testcontainers.containers.BindMode;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.output.Slf4jLogConsumer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.utility.DockerImageName;

import java.util.List;

/**
 * Testcontainers definition of the Speaches server: local speech-to-text, text-to-speech and
 * speaker embedding behind an OpenAI compatible HTTP API.
 * <p>
 * Exposed port:
 * <ul>
 *     <li>HTTP: 8000</li>
 * </ul>
 * The host model cache is bind-mounted so downloads survive container restarts, and models
 * never unload (TTL -1) so a shared container keeps them resident for the whole test run.
 */
public class SpeachesContainer extends GenericContainer<SpeachesContainer> {

    public static final int CONTAINER_PORT = 8000;
    public static final String LABEL_KEY = "com.krickert.testcontainers.label";

    private final String label;

    /**
     * Constructs a SpeachesContainer from the given settings.
     *
     * @param config image, optional fixed host port, model cache directory, log level, API key and startup timeout
     * @param label  value of the {@link #LABEL_KEY} Docker label, used to find the container again
     */
    public SpeachesContainer(SpeachesConfig config, String label) {
        super(DockerImageName.parse(config.getImageName()));
        this.label = label;

        withFileSystemBind(
                config.getModelCacheDir().toAbsolutePath().toString(),
                SpeachesConfig.CONTAINER_MODEL_CACHE_DIR,
                BindMode.READ_WRITE);

        withExposedPorts(CONTAINER_PORT);
        config.getHostPort().ifPresent(hostPort -> setPortBindings(List.of(hostPort + ":" + CONTAINER_PORT)));

        withEnv("host", "0.0.0.0");
        withEnv("port", String.valueOf(CONTAINER_PORT));
        // -1 never unloads, 0 unloads right after use
        withEnv("stt_model_ttl", "-1");
        withEnv("tts_model_ttl", "-1");
        withEnv("vad_model_ttl", "-1");
        withEnv("log_level", config.getLogLevel());
        withEnv("enable_ui", "False");
        config.getApiKey().ifPresent(apiKey -> withEnv("api_key", apiKey));

        withLogConsumer(new Slf4jLogConsumer(LoggerFactory.getLogger("SpeachesContainer")).withPrefix("speaches"));

        // forPort takes the container port, not the mapped one
        waitingFor(Wait.forHttp("/health")
                .forPort(CONTAINER_PORT)
                .forStatusCode(200)
                .withStartupTimeout(config.getStartupTimeout()));

        withLabel(LABEL_KEY, label);
    }

    public String getLabel() {
        return label;
    }

    public String getBaseUrl() {
        return "http://" + getHost() + ":" + getMappedPort(CONTAINER_PORT);
    }
}
