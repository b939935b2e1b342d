package com.shutterprobe.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes →
 * {@link BrightnessFrame}.
 * <p>
 * Malformed messages, and messages that carry neither a brightness nor a
 * known control command, are logged and dropped (returns {@code null}).
 * </p>
 */
public class BrightnessFrameDeserializationSchema implements DeserializationSchema<BrightnessFrame> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(BrightnessFrameDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public BrightnessFrame deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        BrightnessFrame frame;
        try {
            frame = objectMapper().readValue(message, BrightnessFrame.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize brightness frame – skipping: {}", e.getMessage());
            return null;
        }
        if (frame == null) {
            return null;
        }
        if (frame.resolveControl().isEmpty()) {
            if (frame.getControl() != null) {
                LOG.warn("Unknown control command '{}' for session {} – skipping",
                        frame.getControl(), frame.resolveSessionId());
                return null;
            }
            if (frame.getBrightness() == null || !Double.isFinite(frame.getBrightness())) {
                LOG.warn("Frame without a finite brightness for session {} – skipping",
                        frame.resolveSessionId());
                return null;
            }
        }
        return frame;
    }

    @Override
    public boolean isEndOfStream(BrightnessFrame nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<BrightnessFrame> getProducedType() {
        return TypeInformation.of(BrightnessFrame.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
