package com.telemetryrollup.core.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetryrollup.core.json.JsonSupport;
import com.telemetryrollup.core.model.ItemFailure;
import com.telemetryrollup.core.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses a stored reading object into a {@link Reading}.
 *
 * <h3>Accepted shape</h3>
 * <ul>
 * <li>{@code sensor_id}: required, non-blank string</li>
 * <li>one number per configured channel (e.g. {@code temperature},
 * {@code humidity}): optional, but numeric when present</li>
 * <li>{@code data_quality_score}: optional number, 0 when absent</li>
 * <li>{@code timestamp}: optional ISO-8601 date-time; without an offset it
 * is read as UTC, and an unparsable value is dropped while the reading is
 * kept</li>
 * </ul>
 * <p>
 * Every other field is ignored. Violations produce a failed
 * {@link ItemOutcome} rather than an exception.
 * </p>
 *
 * @since 1.0.0
 */
public class ReadingParser {

    private static final Logger LOG = LoggerFactory.getLogger(ReadingParser.class);

    static final String DEVICE_FIELD = "sensor_id";
    static final String QUALITY_FIELD = "data_quality_score";
    static final String TIMESTAMP_FIELD = "timestamp";

    private final ObjectMapper mapper = JsonSupport.objectMapper();
    private final List<String> channels;

    /**
     * @param channels channel fields to extract
     */
    public ReadingParser(List<String> channels) {
        this.channels = List.copyOf(Objects.requireNonNull(channels, "channels must not be null"));
    }

    /**
     * @param key  object key, used in failure reports
     * @param body raw object body
     * @return the parsed reading, or a {@link ItemFailure.Stage#PARSE} failure
     */
    public ItemOutcome<Reading> parse(String key, byte[] body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            return fail(key, "malformed JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            return fail(key, "unreadable body: " + e.getMessage());
        }
        if (root == null || !root.isObject()) {
            return fail(key, "body is not a JSON object");
        }

        JsonNode device = root.get(DEVICE_FIELD);
        if (device == null || !device.isTextual() || device.asText().isBlank()) {
            return fail(key, "missing or blank '" + DEVICE_FIELD + "'");
        }

        Map<String, Double> values = new LinkedHashMap<>();
        for (String channel : channels) {
            JsonNode node = root.get(channel);
            if (node == null || node.isNull()) {
                continue;
            }
            if (!node.isNumber()) {
                return fail(key, "channel '" + channel + "' is not a number");
            }
            values.put(channel, node.doubleValue());
        }

        double quality = 0.0;
        JsonNode qualityNode = root.get(QUALITY_FIELD);
        if (qualityNode != null && !qualityNode.isNull()) {
            if (!qualityNode.isNumber()) {
                return fail(key, "'" + QUALITY_FIELD + "' is not a number");
            }
            quality = qualityNode.doubleValue();
        }

        Instant timestamp = null;
        JsonNode timestampNode = root.get(TIMESTAMP_FIELD);
        if (timestampNode != null && !timestampNode.isNull()) {
            timestamp = parseTimestamp(timestampNode.asText());
            if (timestamp == null) {
                LOG.debug("Ignoring unparsable '{}' in object {}: {}", TIMESTAMP_FIELD, key, timestampNode.asText());
            }
        }

        return ItemOutcome.success(new Reading(device.asText(), values, timestamp, quality));
    }

    /**
     * @param text ISO-8601 date-time, with an offset or without one (read as UTC)
     * @return the instant, or {@code null} if {@code text} is neither form
     */
    static Instant parseTimestamp(String text) {
        String value = text.strip();
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            LOG.trace("'{}' has no offset, trying local date-time: {}", value, e.getMessage());
        }
        try {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static ItemOutcome<Reading> fail(String key, String reason) {
        return ItemOutcome.failure(new ItemFailure(ItemFailure.Stage.PARSE, key, reason));
    }
}
