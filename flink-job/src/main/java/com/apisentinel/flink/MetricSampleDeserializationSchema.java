package com.apisentinel.flink;

import com.apisentinel.core.model.MetricSample;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes →
 * {@link MetricSample}.
 * <p>
 * Unparseable messages are logged and dropped (returns {@code null}) so a
 * single bad record does not crash the pipeline. Field-level validation
 * (blank ids, negative values) is left to the engine, which counts such
 * samples as discarded.
 * </p>
 */
public class MetricSampleDeserializationSchema implements DeserializationSchema<MetricSample> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricSampleDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public MetricSample deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, MetricSample.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize metric sample – skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(MetricSample nextElement) {
        return false;
    }

    @Override
    public TypeInformation<MetricSample> getProducedType() {
        return TypeInformation.of(MetricSample.class);
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
