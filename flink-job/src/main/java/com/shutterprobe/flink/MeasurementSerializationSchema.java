package com.shutterprobe.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts {@link ShutterMeasurement}
 * → JSON bytes for publishing to the Kafka measurements topic.
 */
public class MeasurementSerializationSchema implements SerializationSchema<ShutterMeasurement> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MeasurementSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(ShutterMeasurement measurement) {
        try {
            return objectMapper().writeValueAsBytes(measurement);
        } catch (Exception e) {
            LOG.error("Failed to serialize measurement for session {}: {}",
                    measurement.getSessionId(), e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
