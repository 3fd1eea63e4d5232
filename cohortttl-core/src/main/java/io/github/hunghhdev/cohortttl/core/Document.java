package io.github.hunghhdev.cohortttl.core;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A record held by a {@link DocumentStore}: an id plus a flat map of attributes.
 *
 * <p>Instances are immutable; the {@code with} methods return copies.</p>
 */
public final class Document {

    public static final String ID = "id";

    private final Map<String, Object> fields;

    public Document(Map<String, ?> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
    }

    public static Document of(String id) {
        return new Document(Collections.singletonMap(ID, id));
    }

    public static Document of(String id, Map<String, ?> attributes) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ID, id);
        fields.putAll(attributes);
        fields.put(ID, id);
        return new Document(fields);
    }

    public String getId() {
        Object id = fields.get(ID);
        return id != null ? id.toString() : null;
    }

    public boolean hasId() {
        return getId() != null && !getId().isEmpty();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value != null ? value.toString() : null;
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    /**
     * Reads a timestamp attribute. Accepts {@link Instant}, {@link Date}, epoch milliseconds and
     * ISO-8601 strings (with or without offset). Anything else reads as empty.
     */
    public Optional<Instant> getInstant(String field) {
        Object value = fields.get(field);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Instant) {
            return Optional.of((Instant) value);
        }
        if (value instanceof Date) {
            return Optional.of(((Date) value).toInstant());
        }
        if (value instanceof Number) {
            return Optional.of(Instant.ofEpochMilli(((Number) value).longValue()));
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(OffsetDateTime.parse(text).toInstant());
            } catch (DateTimeParseException ignored) {
                try {
                    return Optional.of(Instant.ofEpochMilli(Long.parseLong(text)));
                } catch (NumberFormatException notANumber) {
                    return Optional.empty();
                }
            }
        }
    }

    public boolean isTrue(String field) {
        Object value = fields.get(field);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && "true".equalsIgnoreCase(value.toString());
    }

    public Document with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new Document(copy);
    }

    public Document withAll(Map<String, ?> changes) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.putAll(changes);
        return new Document(copy);
    }

    /**
     * Returns an unmodifiable view of all attributes, including {@code id}.
     */
    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Document)) {
            return false;
        }
        return fields.equals(((Document) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Document" + fields;
    }
}
