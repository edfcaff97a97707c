package com.planner.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a task collection from JSON.
 * <p>
 * Accepts either an array of task objects carrying an {@code id} field, or an object
 * keyed by task id:
 * <pre>
 * [{"id": "A", "priority": 5, "dependencies": ["B"], "duration": 60,
 *   "estimatedTimeToComplete": null, "deadline": 1020, "fixedStart": null, "fixedEnd": null}]
 * </pre>
 * All times are minutes from the start of the week (Monday 00:00).
 */
public class TaskSetReader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parse tasks from a JSON string.
     *
     * @param json JSON array or object
     * @return tasks in document order
     */
    public static List<Task> read(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return fromTree(objectMapper.readTree(json));
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid task set JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Parse tasks from a JSON stream. The stream is not closed.
     */
    public static List<Task> read(InputStream inputStream) {
        try {
            return fromTree(objectMapper.readTree(inputStream));
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid task set JSON: " + e.getMessage(), e);
        }
    }

    private static List<Task> fromTree(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        List<Task> tasks = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) {
                tasks.add(toTask(text(node, "id"), node));
            }
        } else if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                tasks.add(toTask(entry.getKey(), entry.getValue()));
            }
        } else {
            throw new IllegalArgumentException("Task set must be a JSON array or object");
        }
        return tasks;
    }

    private static Task toTask(String id, JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Task '" + id + "' must be a JSON object");
        }
        Task.Builder builder = Task.builder(id)
                .priority(node.path("priority").asInt(0))
                .duration(integer(node, "duration"))
                .estimatedTimeToComplete(integer(node, "estimatedTimeToComplete"))
                .deadline(integer(node, "deadline"));

        JsonNode deps = node.path("dependencies");
        if (deps.isArray()) {
            for (JsonNode dep : deps) {
                builder.dependsOn(dep.asText());
            }
        }

        Integer fixedStart = integer(node, "fixedStart");
        Integer fixedEnd = integer(node, "fixedEnd");
        if (fixedStart != null && fixedEnd != null) {
            builder.fixed(fixedStart, fixedEnd);
        } else if (fixedStart != null || fixedEnd != null) {
            throw new IllegalArgumentException("Task '" + id + "' must set both fixedStart and fixedEnd");
        }
        return builder.build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException("Field '" + field + "' must be an integer, got: " + value);
        }
        return value.asInt();
    }
}
