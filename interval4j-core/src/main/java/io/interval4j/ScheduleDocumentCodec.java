package io.interval4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.interval4j.core.IntervalUnit;
import io.interval4j.core.MisfireInstruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Maps calendar-interval schedules to and from their persisted form.
 *
 * <p>Decoding restores the stored misfire code verbatim, even one outside the documented set;
 * the firing engine is left to reject it. Where the JSON or map comes from is up to the caller.
 */
public class ScheduleDocumentCodec {
    private static final Logger log = LoggerFactory.getLogger(ScheduleDocumentCodec.class);

    private final ObjectMapper objectMapper;
    private final ObjectReader documentReader;

    public ScheduleDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        // stored intervals are whole numbers; 1.9 must fail, not become 1
        this.documentReader = objectMapper.readerFor(ScheduleDocument.class)
                .without(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    }

    public ScheduleDocument toDocument(TriggerDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");

        ScheduleDocument doc = new ScheduleDocument();
        doc.setRepeatInterval(descriptor.getRepeatInterval());
        doc.setRepeatIntervalUnit(descriptor.getRepeatIntervalUnit() == null
                ? null
                : descriptor.getRepeatIntervalUnit().name());
        doc.setMisfireInstruction(descriptor.getMisfireInstruction());
        return doc;
    }

    public Map<String, Object> toMap(TriggerDescriptor descriptor) {
        return objectMapper.convertValue(toDocument(descriptor), new TypeReference<>() {
        });
    }

    public String toJson(TriggerDescriptor descriptor) {
        try {
            return objectMapper.writeValueAsString(toDocument(descriptor));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize schedule: " + descriptor, ex);
        }
    }

    /**
     * Rebuild a schedule builder from its persisted form.
     *
     * @throws IllegalArgumentException if the interval or unit is missing or invalid
     */
    public CalendarIntervalScheduleBuilder fromDocument(ScheduleDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");

        if (doc.getRepeatInterval() == null) {
            throw new IllegalArgumentException("repeatInterval must not be null");
        }
        IntervalUnit unit = parseUnit(doc.getRepeatIntervalUnit());
        int misfire = doc.getMisfireInstruction() != null
                ? doc.getMisfireInstruction()
                : MisfireInstruction.SMART_POLICY.value();

        log.debug("Restoring calendar-interval schedule: interval={}, unit={}, misfireInstruction={}",
                doc.getRepeatInterval(), unit, misfire);

        return CalendarIntervalScheduleBuilder.create()
                .withInterval(doc.getRepeatInterval(), unit)
                .withMisfireHandlingInstruction(misfire);
    }

    public CalendarIntervalScheduleBuilder fromMap(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw must not be null");

        ScheduleDocument doc;
        try {
            JsonNode tree = objectMapper.valueToTree(raw);
            doc = documentReader.readValue(tree);
        } catch (IOException | IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid schedule document: " + raw, ex);
        }
        return fromDocument(doc);
    }

    public CalendarIntervalScheduleBuilder fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("json must not be blank");
        }

        ScheduleDocument doc;
        try {
            doc = documentReader.readValue(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid schedule JSON: " + ex.getOriginalMessage(), ex);
        }
        if (doc == null) {
            throw new IllegalArgumentException("Invalid schedule JSON: " + json);
        }
        return fromDocument(doc);
    }

    private static IntervalUnit parseUnit(String unit) {
        if (unit == null || unit.isBlank()) {
            throw new IllegalArgumentException("repeatIntervalUnit must not be blank");
        }
        try {
            return IntervalUnit.valueOf(unit.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported interval unit: " + unit);
        }
    }
}
