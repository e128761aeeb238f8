package com.waypoint.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings under the {@code waypoint} prefix.
 */
@Component
@ConfigurationProperties(prefix = "waypoint")
public class WaypointProperties {

    private final External external = new External();
    private final Graph graph = new Graph();
    private final Timeline timeline = new Timeline();
    private final Reasoning reasoning = new Reasoning();
    private final Calendar calendar = new Calendar();

    public External getExternal() {
        return external;
    }

    public Graph getGraph() {
        return graph;
    }

    public Timeline getTimeline() {
        return timeline;
    }

    public Reasoning getReasoning() {
        return reasoning;
    }

    public Calendar getCalendar() {
        return calendar;
    }

    public static class External {

        /** Upper bound for a single reasoning or calendar call. */
        private Duration timeout = Duration.ofSeconds(30);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Graph {

        /** Lock snapshots kept per goal; the revision history itself is never trimmed. */
        private int snapshotRetention = 10;

        public int getSnapshotRetention() {
            return snapshotRetention;
        }

        public void setSnapshotRetention(int snapshotRetention) {
            this.snapshotRetention = snapshotRetention;
        }
    }

    public static class Timeline {

        private int defaultSpanDays = 14;

        public int getDefaultSpanDays() {
            return defaultSpanDays;
        }

        public void setDefaultSpanDays(int defaultSpanDays) {
            this.defaultSpanDays = defaultSpanDays;
        }
    }

    public static class Reasoning {

        /** Propose one starter session when the model returns an empty activation plan. */
        private boolean activationFallback = true;

        public boolean isActivationFallback() {
            return activationFallback;
        }

        public void setActivationFallback(boolean activationFallback) {
            this.activationFallback = activationFallback;
        }
    }

    public static class Calendar {

        /** Appended to the notes of every calendar item created during activation. */
        private String notesSuffix = "Scheduled via Waypoint";

        public String getNotesSuffix() {
            return notesSuffix;
        }

        public void setNotesSuffix(String notesSuffix) {
            this.notesSuffix = notesSuffix;
        }
    }
}
