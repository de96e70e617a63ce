package com.krickert.testcontainers.speaches.provision;

import com.krickert.testcontainers.speaches.SpeachesConfig;
import com.krickert.testcontainers.speaches.client.ApiResponse;
import com.krickert.testcontainers.speaches.client.SpeachesApi;
import com.krickert.testcontainers.speaches.model.CapabilityType;
import com.krickert.testcontainers.speaches.model.ModelDescriptor;
import com.krickert.testcontainers.speaches.model.ProvisioningOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReadinessPollerTest {

    private static final ModelDescriptor KOKORO = ModelDescriptor.of(CapabilityType.TEXT_TO_SPEECH, "speaches-ai/Kokoro-82M-v1.0-ONNX");
    private static final ModelDescriptor WHISPER = ModelDescriptor.of(CapabilityType.SPEECH_TO_TEXT, "Systran/faster-whisper-base");

    private static final ApiResponse EMPTY = new ApiResponse(200, "{\"data\":[],\"object\":\"list\"}");

    @Mock
    private SpeachesApi api;

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static SpeachesConfig.Builder fast() {
        return SpeachesConfig.builder()
                .readyMaxWait(Duration.ofMillis(300))
                .readyPollInterval(Duration.ofMillis(20))
                .settleDelay(Duration.ZERO)
                .ttsSettleDelay(Duration.ZERO);
    }

    private static ApiResponse listing(String modelId) {
        return new ApiResponse(200, "{\"data\":[{\"id\":\"" + modelId + "\"}],\"object\":\"list\"}");
    }

    @Test
    void readyAfterSeveralPolls() throws Exception {
        when(api.listModels()).thenReturn(EMPTY, EMPTY, listing(WHISPER.modelId()));

        ProvisioningOutcome outcome = new ReadinessPoller(api, fast().build()).awaitReady(WHISPER);

        assertThat(outcome).isEqualTo(ProvisioningOutcome.LOADED_NOW);
        verify(api, times(3)).listModels();
    }

    @Test
    void timesOutWithinMaxWaitPlusOneInterval() throws Exception {
        when(api.listModels()).thenReturn(EMPTY);
        SpeachesConfig config = fast().build();

        long start = System.nanoTime();
        ProvisioningOutcome outcome = new ReadinessPoller(api, config).awaitReady(WHISPER);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertThat(outcome).isEqualTo(ProvisioningOutcome.READY_TIMEOUT);
        assertThat(elapsed).isGreaterThanOrEqualTo(config.getReadyMaxWait());
        // generous slack for slow CI machines
        assertThat(elapsed).isLessThan(config.getReadyMaxWait().plus(config.getReadyPollInterval()).plusSeconds(2));
        verify(api, atLeast(2)).listModels();
    }

    @Test
    void zeroMaxWaitStillPollsOnce() throws Exception {
        when(api.listModels()).thenReturn(listing(WHISPER.modelId()));

        ProvisioningOutcome outcome = new ReadinessPoller(api, fast().readyMaxWait(Duration.ZERO).build()).awaitReady(WHISPER);

        assertThat(outcome).isEqualTo(ProvisioningOutcome.LOADED_NOW);
        verify(api, times(1)).listModels();
    }

    @Test
    void transportErrorsAreRetried() throws Exception {
        when(api.listModels())
                .thenThrow(new IOException("Connection refused"))
                .thenReturn(listing(WHISPER.modelId()));

        assertThat(new ReadinessPoller(api, fast().build()).awaitReady(WHISPER)).isEqualTo(ProvisioningOutcome.LOADED_NOW);
    }

    @Test
    void nonOkListingDoesNotCount() throws Exception {
        when(api.listModels()).thenReturn(new ApiResponse(503, WHISPER.modelId()));

        assertThat(new ReadinessPoller(api, fast().build()).awaitReady(WHISPER)).isEqualTo(ProvisioningOutcome.READY_TIMEOUT);
    }

    @Test
    void textToSpeechSettlesLonger() throws Exception {
        when(api.listModels()).thenReturn(listing(KOKORO.modelId()));
        SpeachesConfig config = fast()
                .settleDelay(Duration.ofMillis(10))
                .ttsSettleDelay(Duration.ofMillis(250))
                .build();

        long start = System.nanoTime();
        ProvisioningOutcome outcome = new ReadinessPoller(api, config).awaitReady(KOKORO);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertThat(outcome).isEqualTo(ProvisioningOutcome.LOADED_NOW);
        assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(250));
    }

    @Test
    void interruptIsPropagated() throws Exception {
        when(api.listModels()).thenThrow(new InterruptedException());

        assertThatThrownBy(() -> new ReadinessPoller(api, fast().build()).awaitReady(WHISPER))
                .isInstanceOf(ModelProvisioningException.class)
                .hasCauseInstanceOf(InterruptedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
