package com.agilab.file_retrieval.domain.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event to publish for every newly discovered file.
 */
public record EventDefinition(String eventType, Map<String, Object> eventData) {

    public EventDefinition {
        if (StringUtils.isBlank(eventType)) {
            throw new IllegalArgumentException("Event type cannot be empty");
        }
        if (eventType.length() > 200) {
            throw new IllegalArgumentException("Event type cannot exceed 200 characters");
        }
        eventData = eventData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(eventData));
    }
}
