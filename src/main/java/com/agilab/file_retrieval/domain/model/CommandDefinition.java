package com.agilab.file_retrieval.domain.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command to send to {@code targetEndpoint} for every newly discovered file.
 */
public record CommandDefinition(String commandType, String targetEndpoint, Map<String, Object> commandData) {

    public CommandDefinition {
        if (StringUtils.isBlank(commandType)) {
            throw new IllegalArgumentException("Command type cannot be empty");
        }
        if (commandType.length() > 200) {
            throw new IllegalArgumentException("Command type cannot exceed 200 characters");
        }
        if (StringUtils.isBlank(targetEndpoint)) {
            throw new IllegalArgumentException("Target endpoint cannot be empty");
        }
        if (targetEndpoint.length() > 200) {
            throw new IllegalArgumentException("Target endpoint cannot exceed 200 characters");
        }
        commandData = commandData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(commandData));
    }
}
