package com.threatsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.threatsentinel.core.model.RawSecurityEvent;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into a
 * {@link RawSecurityEvent}.
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}), so a
 * single bad record does not crash the pipeline. Validation of the event
 * itself is left to the engine.
 * </p>
 */
public class EventDeserializationSchema implements DeserializationSchema<RawSecurityEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(EventDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public RawSecurityEvent deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, RawSecurityEvent.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize security event, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(RawSecurityEvent nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<RawSecurityEvent> getProducedType() {
        return TypeInformation.of(RawSecurityEvent.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
