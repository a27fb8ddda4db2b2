package com.opsforge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * An infrastructure alert as seen by the analytics core.
 *
 * <p>
 * Instances are immutable. {@code id}, {@code title}, {@code host},
 * {@code severity} and {@code timestamp} are required; {@code description} is
 * optional.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Omitting a required field, or supplying a blank
 * string for one, throws {@link MalformedInputException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String title;
    private final String host;
    private final Severity severity;
    private final Instant timestamp;
    private final String description;

    private AlertRecord(Builder builder) {
        this.id = requireText(builder.id, "id");
        this.title = requireText(builder.title, "title");
        this.host = requireText(builder.host, "host");
        if (builder.severity == null) {
            throw new MalformedInputException("Alert '" + id + "' is missing required field 'severity'");
        }
        if (builder.timestamp == null) {
            throw new MalformedInputException("Alert '" + id + "' is missing required field 'timestamp'");
        }
        this.severity = builder.severity;
        this.timestamp = builder.timestamp;
        this.description = builder.description;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AlertRecord}.
     */
    public static class Builder {
        private String id;
        private String title;
        private String host;
        private Severity severity;
        private Instant timestamp;
        private String description;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * @return a new {@link AlertRecord}
         * @throws MalformedInputException if a required field is missing or blank
         */
        public AlertRecord build() {
            return new AlertRecord(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getHost() {
        return host;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the free-text description, or {@code null} if none was supplied
     */
    public String getDescription() {
        return description;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MalformedInputException("Alert is missing required field '" + field + "'");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRecord that))
            return false;
        return id.equals(that.id)
                && title.equals(that.title)
                && host.equals(that.host)
                && severity == that.severity
                && timestamp.equals(that.timestamp)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, host, severity, timestamp, description);
    }

    @Override
    public String toString() {
        return "AlertRecord{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", host='" + host + '\'' +
                ", severity=" + severity +
                ", timestamp=" + timestamp +
                '}';
    }
}
