package com.locus.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashSet;
import java.util.Set;

/**
 * Parses Claude's {@code --output-format stream-json} events.
 *
 * <p>{@code assistant} events announce tool calls (reported once per tool id);
 * the {@code result} event carries the final answer and replaces any output
 * collected before it. Lines that are not JSON objects pass through as output.
 */
public class ClaudeStreamParser implements StreamParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RunnerListener listener;
    private final Set<String> seenToolIds = new HashSet<>();
    private final StringBuilder output = new StringBuilder();

    public ClaudeStreamParser(RunnerListener listener) {
        this.listener = listener;
    }

    @Override
    public void onLine(String line) {
        if (line.isBlank()) {
            return;
        }
        JsonNode event;
        try {
            event = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            passThrough(line);
            return;
        }
        if (event == null || !event.isObject()) {
            passThrough(line);
            return;
        }

        switch (event.path("type").asText()) {
            case "assistant" -> {
                for (JsonNode item : event.path("message").path("content")) {
                    String id = item.path("id").asText("");
                    if ("tool_use".equals(item.path("type").asText()) && !id.isEmpty() && seenToolIds.add(id)) {
                        listener.onToolActivity(formatToolCall(item.path("name").asText(""), item.path("input")));
                    }
                }
            }
            case "result" -> {
                String text = event.path("result").asText("");
                output.setLength(0);
                output.append(text);
                listener.onOutput(text);
            }
            default -> { }
        }
    }

    @Override
    public String output() {
        return output.toString();
    }

    private void passThrough(String line) {
        String text = line + "\n";
        output.append(text);
        listener.onOutput(text);
    }

    /**
     * Short human-readable description of a Claude tool call.
     */
    static String formatToolCall(String name, JsonNode input) {
        return switch (name) {
            case "Read" -> "reading " + input.path("file_path").asText("");
            case "Write" -> "writing " + input.path("file_path").asText("");
            case "Edit", "MultiEdit" -> "editing " + input.path("file_path").asText("");
            case "Bash" -> "running: " + truncate(input.path("command").asText(""), 60);
            case "Glob" -> "glob " + input.path("pattern").asText("");
            case "Grep" -> "grep " + input.path("pattern").asText("");
            case "LS" -> "ls " + input.path("path").asText("");
            case "WebFetch" -> "fetching " + truncate(input.path("url").asText(""), 50);
            case "WebSearch" -> "searching: " + input.path("query").asText("");
            case "Task" -> "spawning agent";
            default -> name;
        };
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max) : value;
    }
}
