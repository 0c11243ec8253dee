package com.event.resolution.core.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.io.IOException;

/**
 * One concrete date/time instance of an event.
 * Serialized as a 4-element JSON array: {@code [start_date, start_time, end_date, end_time]}.
 *
 * <p>An empty {@code endDate} means the occurrence ends on its start day. Equal tuples are
 * true duplicates within an event.</p>
 *
 * @param startDate ISO date string ({@code yyyy-MM-dd})
 * @param startTime standardized time, may be empty
 * @param endDate   ISO date string or empty
 * @param endTime   standardized time, may be empty
 */
@JsonSerialize(using = Occurrence.ArraySerializer.class)
@JsonDeserialize(using = Occurrence.ArrayDeserializer.class)
public record Occurrence(String startDate, String startTime, String endDate, String endTime) {

    public Occurrence {
        startDate = startDate != null ? startDate : "";
        startTime = startTime != null ? startTime : "";
        endDate = endDate != null ? endDate : "";
        endTime = endTime != null ? endTime : "";
    }

    public boolean hasStartDate() {
        return !startDate.isEmpty();
    }

    /**
     * Returns the end date, falling back to the start date when the occurrence has none.
     */
    public String effectiveEndDate() {
        return endDate.isEmpty() ? startDate : endDate;
    }

    static class ArraySerializer extends JsonSerializer<Occurrence> {
        @Override
        public void serialize(Occurrence value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartArray();
            gen.writeString(value.startDate());
            gen.writeString(value.startTime());
            gen.writeString(value.endDate());
            gen.writeString(value.endTime());
            gen.writeEndArray();
        }
    }

    static class ArrayDeserializer extends JsonDeserializer<Occurrence> {
        @Override
        public Occurrence deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String[] parts = p.readValueAs(String[].class);
            if (parts == null) {
                return null;
            }
            return new Occurrence(
                    parts.length > 0 ? parts[0] : "",
                    parts.length > 1 ? parts[1] : "",
                    parts.length > 2 ? parts[2] : "",
                    parts.length > 3 ? parts[3] : "");
        }
    }
}
