package com.krickert.testcontainers.speaches.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelDescriptorTest {

    @Test
    void trimsModelId() {
        ModelDescriptor model = ModelDescriptor.of(CapabilityType.SPEECH_TO_TEXT, "  Systran/faster-whisper-base ");

        assertThat(model.modelId()).isEqualTo("Systran/faster-whisper-base");
        assertThat(model).hasToString("Systran/faster-whisper-base (automatic-speech-recognition)");
    }

    @Test
    void rejectsBlankIdOrMissingCapability() {
        assertThatThrownBy(() -> ModelDescriptor.of(CapabilityType.TEXT_TO_SPEECH, " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelDescriptor.of(null, "a/b"))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void cacheDirectoryName() {
        assertThat(ModelDescriptor.of(CapabilityType.TEXT_TO_SPEECH, "speaches-ai/Kokoro-82M-v1.0-ONNX").cacheDirectoryName())
                .isEqualTo("models--speaches-ai--Kokoro-82M-v1.0-ONNX");
    }

    @Test
    void registryResultKeepsOrderAndIsReadOnly() {
        RegistrySupportResult result = RegistrySupportResult.of(CapabilityType.TEXT_TO_SPEECH, List.of("c/d", "a/b", "c/d"));

        assertThat(result.modelIds()).containsExactly("c/d", "a/b");
        assertThatThrownBy(() -> result.modelIds().add("e/f")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(RegistrySupportResult.unavailable(CapabilityType.TEXT_TO_SPEECH).available()).isFalse();
    }

    @Test
    void fatalOutcomes() {
        assertThat(ProvisioningOutcome.UNSUPPORTED.isFatal()).isTrue();
        assertThat(ProvisioningOutcome.LOAD_FAILED.isFatal()).isTrue();
        assertThat(ProvisioningOutcome.READY_TIMEOUT.isFatal()).isFalse();
        assertThat(ProvisioningOutcome.ALREADY_LOADED.isFatal()).isFalse();
    }
}
