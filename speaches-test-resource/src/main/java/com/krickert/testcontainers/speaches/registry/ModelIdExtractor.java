package com.krickert.testcontainers.speaches.registry;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Recovers model ids from a Speaches listing whose layout is not fixed by any contract.
 * <p>
 * Each {@link ResponseShape} has its own decoder. Decoders are tried in declaration order of
 * {@link ResponseShape} and the first one that yields at least one id wins. Ids keep the order
 * of their first occurrence and are de-duplicated. Text no decoder recognises yields an empty
 * list; this class never throws for bad input.
 */
public class ModelIdExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ModelIdExtractor.class);

    /** Separates the owner from the model name, e.g. {@code Systran/faster-whisper-base}. */
    public static final char SEPARATOR = '/';

    private final ObjectMapper objectMapper;
    private final List<ModelIdDecoder> decoders = List.of(
            new ObjectArrayDecoder(),
            new LooseIdScanDecoder(),
            new StringArrayDecoder(),
            new ModelsWrapperDecoder(),
            new SingleObjectDecoder(),
            new PlainTextLinesDecoder());

    public ModelIdExtractor() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public ModelIdExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<String> extract(String responseBody) {
        return decode(responseBody).modelIds();
    }

    public Extraction decode(String responseBody) {
        ResponseText text = ResponseText.parse(responseBody, objectMapper);
        for (ModelIdDecoder decoder : decoders) {
            try {
                List<String> ids = decoder.decode(text);
                if (!ids.isEmpty()) {
                    LOG.debug("Listing decoded as {}: {}", decoder.shape(), ids);
                    return Extraction.of(decoder.shape(), ids);
                }
            } catch (RuntimeException e) {
                LOG.debug("Decoder for {} rejected listing: {}", decoder.shape(), e.getMessage());
            }
        }
        LOG.debug("No model ids recognised in listing of {} chars", text.raw().length());
        return Extraction.none();
    }

    static boolean looksLikeModelId(String value) {
        return value != null && !value.isBlank() && value.indexOf(SEPARATOR) >= 0;
    }
}
