package com.shutterprobe.flink;

import com.shutterprobe.core.config.AnalysisProfile;
import com.shutterprobe.core.config.AnalysisProfileLoader;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Main entry point for the Shutter Probe Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (brightness-frames topic)
 *     → Deserialize JSON → BrightnessFrame
 *     → Key by sessionId
 *     → ShutterSessionProcessFunction (calibration + live detection)
 *     → Serialize ShutterMeasurement → JSON
 *     → Kafka (shutter-measurements topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Kafka and Flink settings come from environment variables via
 * {@link JobConfig}; calibration and expected speeds come from the
 * {@link AnalysisProfile}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps each session's calibration and event state
 * across failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class ShutterProbeJob {

        private static final Logger LOG = LoggerFactory.getLogger(ShutterProbeJob.class);

        private ShutterProbeJob() {
                // entry-point class — not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Shutter Probe with config: {}", config);

                // 2. Load analysis profile
                AnalysisProfile profile = loadProfile(config);
                LOG.info("Using analysis profile '{}' at {} fps with {} expected speed(s)",
                                profile.getName(), profile.getRecordingFps(),
                                profile.getExpectedSpeeds().size());

                // 3. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 4. Build pipeline
                buildPipeline(env, config, profile);

                // 5. Execute
                env.execute("Shutter Probe – Live Measurement");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        AnalysisProfile profile) {
                KafkaSource<BrightnessFrame> kafkaSource = KafkaSource.<BrightnessFrame>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new BrightnessFrameDeserializationSchema())
                                .build();

                DataStream<BrightnessFrame> frames = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.<BrightnessFrame>forBoundedOutOfOrderness(Duration.ofSeconds(5))
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-frames-source");

                DataStream<ShutterMeasurement> measurements = frames
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(BrightnessFrame::resolveSessionId)
                                .process(new ShutterSessionProcessFunction(profile))
                                .name("shutter-measurement");

                KafkaSink<ShutterMeasurement> kafkaSink = KafkaSink.<ShutterMeasurement>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaOutputTopic())
                                                                .setValueSerializationSchema(
                                                                                new MeasurementSerializationSchema())
                                                                .build())
                                .build();

                measurements.sinkTo(kafkaSink).name("kafka-measurements-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static AnalysisProfile loadProfile(JobConfig config) {
                String profilePath = config.getAnalysisProfilePath();
                if (profilePath != null && !profilePath.isBlank()) {
                        return AnalysisProfileLoader.fromFile(profilePath);
                }
                return AnalysisProfileLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // keep checkpoints on cancellation so sessions can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
