package com.shutterprobe.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MeasurementSerializationSchema}.
 */
class MeasurementSerializationSchemaTest {

    private final MeasurementSerializationSchema schema = new MeasurementSerializationSchema();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Calibration message omits event fields and writes an ISO timestamp")
    void shouldSerializeCalibration() throws IOException {
        ShutterMeasurement m = new ShutterMeasurement();
        m.setSessionId("bench-1");
        m.setType(ShutterMeasurement.Type.CALIBRATION_COMPLETE);
        m.setTimestamp(Instant.parse("2024-03-01T10:15:30Z"));
        m.setBaseline(20.0);
        m.setThreshold(204.0);

        JsonNode json = mapper.readTree(schema.serialize(m));

        assertThat(json.get("sessionId").asText()).isEqualTo("bench-1");
        assertThat(json.get("type").asText()).isEqualTo("CALIBRATION_COMPLETE");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-01T10:15:30Z");
        assertThat(json.get("threshold").asDouble()).isEqualTo(204.0);
        assertThat(json.has("eventIndex")).isFalse();
        assertThat(json.has("measuredSpeed")).isFalse();
    }

    @Test
    @DisplayName("Event message carries frames and speed")
    void shouldSerializeEvent() throws IOException {
        ShutterMeasurement m = new ShutterMeasurement();
        m.setSessionId("bench-1");
        m.setType(ShutterMeasurement.Type.EVENT_DETECTED);
        m.setTimestamp(Instant.EPOCH);
        m.setEventIndex(2);
        m.setStartFrame(15L);
        m.setEndFrame(17L);
        m.setMeasuredSpeed("1/80");
        m.setUnterminated(false);

        JsonNode json = mapper.readTree(schema.serialize(m));

        assertThat(json.get("eventIndex").asInt()).isEqualTo(2);
        assertThat(json.get("startFrame").asLong()).isEqualTo(15L);
        assertThat(json.get("endFrame").asLong()).isEqualTo(17L);
        assertThat(json.get("measuredSpeed").asText()).isEqualTo("1/80");
        assertThat(json.get("unterminated").asBoolean()).isFalse();
        assertThat(json.has("expectedSpeed")).isFalse();
    }
}
