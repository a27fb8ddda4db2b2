package com.opsforge.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Objects;

/**
 * Converts {@link RawRecord}s from ingestion into typed alerts and metric points.
 *
 * <h3>Timestamp policy</h3>
 * <p>
 * Alert timestamps are parsed <strong>strictly</strong>: correlation scores
 * time proximity, so an unparseable value raises
 * {@link MalformedInputException}. Metric timestamps are parsed
 * <strong>leniently</strong>: an unparseable value is logged and replaced with
 * the parser clock's current instant, because forecast grouping tolerates
 * imprecise ordering. The asymmetry is intentional and kept until product
 * intent says otherwise.
 * </p>
 *
 * <p>
 * Accepted timestamp shapes: {@link Instant}, {@link OffsetDateTime},
 * {@link ZonedDateTime}, {@link LocalDateTime} (read as UTC), {@link Date},
 * epoch milliseconds as a number, and ISO-8601 strings with an offset,
 * a trailing {@code Z}, or no zone at all (read as UTC).
 * </p>
 *
 * @since 1.0.0
 */
public class RecordParser {

    private static final Logger LOG = LoggerFactory.getLogger(RecordParser.class);

    private final Clock clock;

    public RecordParser() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of "now" for the lenient metric fallback
     */
    public RecordParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Convert a raw alert. Accepts {@code id} or {@code alert_id} as the identifier.
     *
     * @param raw the raw record; must not be {@code null}
     * @return the typed alert
     * @throws MalformedInputException if a required field is missing, the
     *                                 severity is unknown, or the timestamp
     *                                 cannot be parsed
     */
    public AlertRecord parseAlert(RawRecord raw) {
        Objects.requireNonNull(raw, "Raw alert must not be null");
        String id = raw.getFirstField("id", "alert_id").map(Object::toString).orElse(null);
        Object timestamp = raw.getField("timestamp")
                .orElseThrow(() -> new MalformedInputException(
                        "Alert '" + id + "' is missing required field 'timestamp'"));

        return AlertRecord.builder()
                .id(id)
                .title(raw.getStringField("title").orElse(null))
                .host(raw.getStringField("host").orElse(null))
                .severity(Severity.parse(raw.getStringField("severity").orElse(null)))
                .timestamp(parseTimestamp(timestamp))
                .description(raw.getStringField("description").orElse(null))
                .build();
    }

    /**
     * Convert a raw metric observation. The timestamp falls back to "now" when
     * it is missing or unparseable; every other field is required.
     *
     * @param raw the raw record; must not be {@code null}
     * @return the typed metric point
     * @throws MalformedInputException if host, metric name or a finite numeric value is missing
     */
    public MetricPoint parseMetric(RawRecord raw) {
        Objects.requireNonNull(raw, "Raw metric must not be null");
        String host = raw.getStringField("host")
                .filter(s -> !s.isBlank())
                .orElseThrow(() -> new MalformedInputException("Metric is missing required field 'host'"));
        String name = raw.getFirstField("metric_name", "metricName")
                .map(Object::toString)
                .filter(s -> !s.isBlank())
                .orElseThrow(() -> new MalformedInputException(
                        "Metric on host '" + host + "' is missing required field 'metric_name'"));
        double value = raw.getNumericField("value")
                .orElseThrow(() -> new MalformedInputException(
                        "Metric " + host + "/" + name + " has no numeric 'value'"));
        if (!Double.isFinite(value)) {
            throw new MalformedInputException("Metric " + host + "/" + name + " has non-finite value " + value);
        }

        return new MetricPoint(host, name, value, lenientTimestamp(raw.getField("timestamp").orElse(null)));
    }

    /**
     * Strictly parse a timestamp value.
     *
     * @param value one of the accepted timestamp shapes
     * @return the instant
     * @throws MalformedInputException if the value is {@code null} or cannot be parsed
     */
    public static Instant parseTimestamp(Object value) {
        if (value == null) {
            throw new MalformedInputException("Timestamp must not be null");
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        if (value instanceof CharSequence text) {
            return parseIsoString(text.toString().trim());
        }
        throw new MalformedInputException("Unsupported timestamp type: " + value.getClass().getName());
    }

    private Instant lenientTimestamp(Object value) {
        try {
            return parseTimestamp(value);
        } catch (MalformedInputException e) {
            Instant now = clock.instant();
            LOG.warn("Unparseable metric timestamp '{}' ({}), grouping it at {}", value, e.getMessage(), now);
            return now;
        }
    }

    private static Instant parseIsoString(String text) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text,
                    ZonedDateTime::from, LocalDateTime::from);
            return parsed instanceof ZonedDateTime zdt
                    ? zdt.toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedInputException("Unparseable timestamp: '" + text + "'", e);
        }
    }
}
