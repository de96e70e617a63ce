package com.krickert.testcontainers.speaches;

import com.krickert.testcontainers.speaches.client.JdkSpeachesApi;
import com.krickert.testcontainers.speaches.client.SpeachesApi;
import com.krickert.testcontainers.speaches.model.CapabilityType;
import com.krickert.testcontainers.speaches.model.ModelDescriptor;
import com.krickert.testcontainers.speaches.model.ProvisioningOutcome;
import com.krickert.testcontainers.speaches.provision.ModelProvisioner;
import org.rnorth.ducttape.TimeoutException;
import org.rnorth.ducttape.ratelimits.RateLimiter;
import org.rnorth.ducttape.ratelimits.RateLimiterBuilder;
import org.rnorth.ducttape.unreliables.Unreliables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Starts the shared Speaches service at most once per label and makes the requested models
 * ready before handing the instance to a test.
 * <p>
 * Sharing one container across a test run avoids starting and stopping it for every test class.
 * All work for a label, from the start-or-reuse decision through the provisioning pass, runs
 * under that label's lock, so concurrent callers never create a second instance and never see
 * it before their models are provisioned. Provisioning is sequential to bound the load on the
 * single instance. Shutdown is left to the Testcontainers resource reaper.
 */
public class SpeachesContainerManager {

    private static final Logger LOG = LoggerFactory.getLogger(SpeachesContainerManager.class);

    public static final String DEFAULT_LABEL = "Speeches";

    private static final RateLimiter HEALTH_CHECK_RATE_LIMITER = RateLimiterBuilder.newBuilder()
            .withRate(2, TimeUnit.SECONDS)
            .withConstantThroughput()
            .build();

    private static volatile SpeachesContainerManager sharedInstance;

    private final SpeachesConfig config;
    private final SpeachesContext context;
    private final ServiceInstanceFactory instanceFactory;
    private final Function<ServiceInstance, SpeachesApi> apiFactory;

    /**
     * Constructs a manager that starts real containers and shares the process-wide context.
     *
     * @param config container and provisioning settings
     */
    public SpeachesContainerManager(SpeachesConfig config) {
        this(config,
                SpeachesContext.shared(),
                new SpeachesContainerLauncher(config),
                instance -> new JdkSpeachesApi(instance.getBaseUrl(), config));
    }

    /**
     * Constructs a manager with explicit collaborators.
     *
     * @param config          container and provisioning settings
     * @param context         holder of the per-label locks and instances
     * @param instanceFactory starts (or finds) an instance for a label
     * @param apiFactory      creates the HTTP client used to talk to an instance
     */
    public SpeachesContainerManager(SpeachesConfig config,
                                    SpeachesContext context,
                                    ServiceInstanceFactory instanceFactory,
                                    Function<ServiceInstance, SpeachesApi> apiFactory) {
        this.config = config;
        this.context = context;
        this.instanceFactory = instanceFactory;
        this.apiFactory = apiFactory;
    }

    /**
     * Process-wide manager configured from system properties.
     */
    public static SpeachesContainerManager getInstance() {
        SpeachesContainerManager manager = sharedInstance;
        if (manager == null) {
            synchronized (SpeachesContainerManager.class) {
                manager = sharedInstance;
                if (manager == null) {
                    LOG.info("Initializing shared SpeachesContainerManager");
                    manager = new SpeachesContainerManager(SpeachesConfig.fromSystemProperties());
                    sharedInstance = manager;
                }
            }
        }
        return manager;
    }

    public SpeachesConfig getConfig() {
        return config;
    }

    /**
     * Returns the running instance for the label, starting one if there is none yet or the
     * registered one has stopped. Blocks until {@code /health} answers 200.
     *
     * @throws IllegalStateException if the instance does not become healthy within the startup timeout
     */
    public ServiceInstance ensureStarted(String label) {
        return context.withLock(label, () -> {
            Optional<ServiceInstance> existing = context.getInstance(label);
            if (existing.isPresent()) {
                if (existing.get().isRunning()) {
                    LOG.debug("Reusing Speaches instance for label '{}' at {}", label, existing.get().getBaseUrl());
                    return existing.get();
                }
                LOG.warn("Speaches instance for label '{}' is no longer running, starting a new one", label);
                context.remove(label);
            }

            LOG.info("Starting Speaches instance for label '{}'", label);
            ServiceInstance instance = instanceFactory.start(label);
            awaitHealthy(instance);
            context.register(instance);
            LOG.info("Speaches instance for label '{}' is up at {}", label, instance.getBaseUrl());
            return instance;
        });
    }

    /**
     * Provisions the given models one after another, in order, on the instance.
     *
     * @return the same instance
     * @throws com.krickert.testcontainers.speaches.provision.ModelProvisioningException if a model
     *         is unsupported or cannot be loaded; later models are not attempted
     */
    public ServiceInstance ensureReady(ServiceInstance instance, List<ModelDescriptor> models) {
        return context.withLock(instance.getLabel(), () -> {
            if (models.isEmpty()) {
                return instance;
            }
            ModelProvisioner provisioner = new ModelProvisioner(apiFactory.apply(instance), config);
            for (ModelDescriptor model : models) {
                ProvisioningOutcome outcome = provisioner.provision(model);
                LOG.info("Provisioned {} on '{}': {}", model, instance.getLabel(), outcome);
            }
            return instance;
        });
    }

    /**
     * Starts (or reuses) the instance for the label and provisions the models, all under the
     * label's lock.
     *
     * @param models model id per capability, e.g. {@code SPEECH_TO_TEXT -> Systran/faster-whisper-base}
     */
    public ServiceInstance startIfNeeded(String label, Map<CapabilityType, String> models) {
        return context.withLock(label, () -> {
            ServiceInstance instance = ensureStarted(label);
            ensureReady(instance, toDescriptors(models));
            config.getApiKey().ifPresent(key -> LOG.info(
                    "Note: API key specified. It only applies to Speaches containers created by this manager; "
                            + "a reused container keeps the environment it was started with."));
            return instance;
        });
    }

    public ServiceInstance startIfNeeded(Map<CapabilityType, String> models) {
        return startIfNeeded(DEFAULT_LABEL, models);
    }

    /**
     * Properties a test publishes into its application configuration to reach the instance.
     */
    public Map<String, String> resolveProperties(ServiceInstance instance) {
        String prefix = config.getPropertyPrefix();
        Map<String, String> properties = new LinkedHashMap<>();
        properties.put(prefix + ".base-url", instance.getBaseUrl());
        properties.put(prefix + ".host", instance.getHost());
        properties.put(prefix + ".port", String.valueOf(instance.getPort()));
        config.getApiKey().ifPresent(key -> properties.put(prefix + ".api-key", key));
        return properties;
    }

    public Optional<ServiceInstance> getRunningInstance(String label) {
        return context.getInstance(label).filter(ServiceInstance::isRunning);
    }

    /**
     * Converts a capability-to-model mapping into descriptors, keeping the map's iteration order.
     */
    public static List<ModelDescriptor> toDescriptors(Map<CapabilityType, String> models) {
        List<ModelDescriptor> descriptors = new ArrayList<>(models.size());
        models.forEach((capability, modelId) -> descriptors.add(new ModelDescriptor(modelId, capability)));
        return descriptors;
    }

    /**
     * Parses a mapping keyed by capability name, alias ({@code STT}, {@code TTS}, {@code EMBEDDING})
     * or registry task label.
     *
     * @throws IllegalArgumentException for an unknown capability
     */
    public static Map<CapabilityType, String> parseModels(Map<String, String> models) {
        Map<CapabilityType, String> parsed = new LinkedHashMap<>();
        models.forEach((type, modelId) -> parsed.put(CapabilityType.from(type), modelId));
        return parsed;
    }

    private void awaitHealthy(ServiceInstance instance) {
        SpeachesApi api = apiFactory.apply(instance);
        int timeoutSeconds = (int) Math.max(1, config.getStartupTimeout().toSeconds());
        try {
            Unreliables.retryUntilTrue(timeoutSeconds, TimeUnit.SECONDS,
                    () -> HEALTH_CHECK_RATE_LIMITER.getWhenReady(() -> isHealthy(api)));
        } catch (TimeoutException e) {
            throw new IllegalStateException(String.format(
                    "Speaches instance for label '%s' at %s did not report healthy within %d seconds",
                    instance.getLabel(), api.baseUrl(), timeoutSeconds), e);
        }
    }

    private static boolean isHealthy(SpeachesApi api) throws InterruptedException {
        try {
            return api.health().statusCode() == 200;
        } catch (IOException e) {
            LOG.debug("Health check against {} failed: {}", api.baseUrl(), e.getMessage());
            return false;
        }
    }
}
