package com.p14n.pgtopics.topic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.pgtopics.data.Event;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Serializes events as CloudEvents JSON envelopes and headers as a JSON
 * object of strings.
 *
 * <pre>
 * {
 *   "specversion": "1.0",
 *   "type": "com.example.UserCreated",
 *   "source": "com.example.Users.create",
 *   "id": "user_created_...",
 *   "time": "2024-01-01T00:00:00Z",
 *   "datacontenttype": "application/json; charset=utf-8",
 *   "data": { ... }
 * }
 * </pre>
 *
 * @param <T> payload type
 */
public class EventCodec<T> {

    public static final String SPEC_VERSION = "1.0";
    public static final String CONTENT_TYPE = "application/json; charset=utf-8";

    private static final TypeReference<Map<String, String>> HEADERS_TYPE = new TypeReference<>() {
    };

    private final Class<T> type;
    private final ObjectMapper mapper;

    public EventCodec(Class<T> type) {
        this(type, new ObjectMapper());
    }

    public EventCodec(Class<T> type, ObjectMapper mapper) {
        this.type = type;
        this.mapper = mapper;
    }

    public byte[] encode(Event<T> event) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.put("specversion", SPEC_VERSION);
        root.put("type", event.type());
        root.put("source", event.source());
        root.put("id", event.id());
        if (event.time() != null) {
            root.put("time", event.time().toString());
        }
        root.put("datacontenttype", CONTENT_TYPE);
        root.set("data", mapper.valueToTree(event.payload()));
        return mapper.writeValueAsBytes(root);
    }

    /**
     * @throws IOException if the bytes are not an envelope carrying a {@code T}
     */
    public Event<T> decode(byte[] message) throws IOException {
        JsonNode root = mapper.readTree(message);
        if (root == null || !root.isObject()) {
            throw new IOException("Event envelope must be a JSON object");
        }
        String version = text(root, "specversion");
        if (!SPEC_VERSION.equals(version)) {
            throw new IOException("Unsupported specversion " + version);
        }
        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            throw new IOException("Event envelope has no data");
        }
        Instant time = null;
        String timeText = text(root, "time");
        if (timeText != null) {
            try {
                time = Instant.parse(timeText);
            } catch (DateTimeParseException e) {
                throw new IOException("Invalid event time " + timeText, e);
            }
        }
        try {
            return new Event<>(text(root, "id"), text(root, "source"), text(root, "type"), time,
                    mapper.treeToValue(data, type));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid event envelope: " + e.getMessage(), e);
        }
    }

    public byte[] encodeHeaders(Map<String, String> headers) throws JsonProcessingException {
        return mapper.writeValueAsBytes(headers);
    }

    /**
     * @return the headers, empty for an empty column
     */
    public Map<String, String> decodeHeaders(byte[] headers) throws IOException {
        if (headers == null || headers.length == 0) {
            return Map.of();
        }
        Map<String, String> decoded = mapper.readValue(headers, HEADERS_TYPE);
        return decoded == null ? Map.of() : decoded;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
