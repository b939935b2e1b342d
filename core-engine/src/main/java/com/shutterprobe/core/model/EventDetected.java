package com.shutterprobe.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Emitted when a shutter event closes (or is flushed unterminated).
 *
 * @since 1.0.0
 */
public final class EventDetected implements FrameResult, Serializable {

    private static final long serialVersionUID = 1L;

    private final ShutterEvent event;

    public EventDetected(ShutterEvent event) {
        this.event = Objects.requireNonNull(event, "ShutterEvent must not be null");
    }

    public ShutterEvent getEvent() {
        return event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventDetected that))
            return false;
        return event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return event.hashCode();
    }

    @Override
    public String toString() {
        return "EventDetected{event=" + event + '}';
    }
}
