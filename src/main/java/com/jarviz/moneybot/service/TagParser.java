package com.jarviz.moneybot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Turns the loose tag notations found in user input and in legacy rows into a list.
 * Accepts a JSON array ("[\"fuel\",\"car\"]"), a JSON string, or a comma separated list.
 */
@Component
public class TagParser {

    private final ObjectMapper objectMapper;

    public TagParser() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @return the tags, or {@code null} when the input carries none
     */
    public List<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        JsonNode node = readJson(trimmed);
        if (node != null && node.isArray()) {
            List<String> tags = new ArrayList<>();
            for (JsonNode element : node) {
                if (!element.isNull() && !element.asText().isBlank()) {
                    tags.add(element.asText().trim());
                }
            }
            return tags;
        }
        if (node != null && node.isTextual()) {
            return splitCommaSeparated(node.asText());
        }
        return splitCommaSeparated(trimmed);
    }

    // null when the text is not JSON
    private JsonNode readJson(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public String toJson(List<String> tags) {
        if (tags == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize tags " + tags, e);
        }
    }

    private static List<String> splitCommaSeparated(String value) {
        List<String> tags = Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .collect(Collectors.toList());
        return tags.isEmpty() ? null : tags;
    }
}
