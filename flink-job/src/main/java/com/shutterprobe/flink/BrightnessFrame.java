package com.shutterprobe.flink;

import java.io.Serializable;
import java.util.Locale;
import java.util.Optional;

/**
 * One message of the input topic: a frame's brightness for a recording
 * session, or a control command for that session.
 *
 * <pre>
 * {"sessionId": "bench-1", "brightness": 182.4, "timestampNanos": 1200000}
 * {"sessionId": "bench-1", "control": "reset-events"}
 * </pre>
 *
 * @since 1.0.0
 */
public class BrightnessFrame implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Key used when a message carries no session id. */
    public static final String UNKNOWN_SESSION = "__unknown__";

    /** Session-level commands carried in the {@code control} field. */
    public enum Control {
        /** Drop calibration and events, then calibrate again. */
        RESET("reset"),
        /** Drop detected events, keep the calibrated threshold. */
        RESET_EVENTS("reset-events"),
        /** End of recording: report an event still open as unterminated. */
        FINISH("finish");

        private final String wireName;

        Control(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }

        static Optional<Control> fromWireName(String name) {
            if (name == null || name.isBlank()) {
                return Optional.empty();
            }
            String normalised = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (Control control : values()) {
                if (control.wireName.equals(normalised)) {
                    return Optional.of(control);
                }
            }
            return Optional.empty();
        }
    }

    private String sessionId;
    private Double brightness;
    private long timestampNanos;
    private String control;

    public BrightnessFrame() {
        // for Jackson
    }

    public BrightnessFrame(String sessionId, double brightness, long timestampNanos) {
        this.sessionId = sessionId;
        this.brightness = brightness;
        this.timestampNanos = timestampNanos;
    }

    /**
     * @param sessionId session the command applies to
     * @param control   the command
     * @return a control message
     */
    public static BrightnessFrame control(String sessionId, Control control) {
        BrightnessFrame frame = new BrightnessFrame();
        frame.setSessionId(sessionId);
        frame.setControl(control.getWireName());
        return frame;
    }

    /**
     * @return the session id, or {@value #UNKNOWN_SESSION} when absent
     */
    public String resolveSessionId() {
        return (sessionId != null && !sessionId.isBlank()) ? sessionId : UNKNOWN_SESSION;
    }

    /**
     * @return the recognised control command, if any
     */
    public Optional<Control> resolveControl() {
        return Control.fromWireName(control);
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public Double getBrightness() {
        return brightness;
    }

    public void setBrightness(Double brightness) {
        this.brightness = brightness;
    }

    public long getTimestampNanos() {
        return timestampNanos;
    }

    public void setTimestampNanos(long timestampNanos) {
        this.timestampNanos = timestampNanos;
    }

    public String getControl() {
        return control;
    }

    public void setControl(String control) {
        this.control = control;
    }

    @Override
    public String toString() {
        return "BrightnessFrame{" +
                "sessionId='" + sessionId + '\'' +
                ", brightness=" + brightness +
                ", timestampNanos=" + timestampNanos +
                ", control='" + control + '\'' +
                '}';
    }
}
