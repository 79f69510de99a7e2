package com.locus.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses {@code codex exec --json} events.
 *
 * <p>Agent messages are held back and emitted as a single output at
 * {@code turn.completed} (or end of stream), so a status indicator can keep
 * showing tool activity while the turn is still running.
 */
public class CodexStreamParser implements StreamParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern BOLD = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    private static final Pattern ITALIC = Pattern.compile("(?<!\\*)\\*([^*]+)\\*(?!\\*)");

    private final RunnerListener listener;
    private final List<String> agentMessages = new ArrayList<>();
    private final StringBuilder output = new StringBuilder();

    public CodexStreamParser(RunnerListener listener) {
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

        String type = event.path("type").asText();
        JsonNode item = event.path("item");
        String itemType = item.path("type").asText();

        if ("item.started".equals(type) && "command_execution".equals(itemType)) {
            listener.onToolActivity("running: " + firstLine(item.path("command").asText(""), 80));
        } else if ("item.completed".equals(type) && "command_execution".equals(itemType)) {
            JsonNode code = item.path("exit_code");
            listener.onToolActivity(code.isInt() && code.asInt() == 0 ? "done" : "exit " + code.asText());
        } else if ("item.completed".equals(type) && "reasoning".equals(itemType)) {
            String text = stripEmphasis(item.path("text").asText("").trim());
            if (!text.isEmpty()) {
                listener.onThinking(text);
            }
        } else if ("item.completed".equals(type) && "agent_message".equals(itemType)) {
            String text = item.path("text").asText("");
            if (!text.isEmpty()) {
                agentMessages.add(text);
                listener.onToolActivity(firstLine(text, 80));
            }
        } else if ("turn.completed".equals(type)) {
            flushAgentMessages();
        }
    }

    @Override
    public void finish() {
        flushAgentMessages();
    }

    @Override
    public String output() {
        return output.toString();
    }

    private void flushAgentMessages() {
        if (agentMessages.isEmpty()) {
            return;
        }
        String text = String.join("\n\n", agentMessages);
        agentMessages.clear();
        if (output.length() > 0) {
            output.append("\n\n");
        }
        output.append(text);
        listener.onOutput(text);
    }

    private void passThrough(String line) {
        String text = line + "\n";
        output.append(text);
        listener.onOutput(text);
    }

    static String stripEmphasis(String text) {
        String withoutBold = BOLD.matcher(text).replaceAll("$1");
        return ITALIC.matcher(withoutBold).replaceAll("$1");
    }

    private static String firstLine(String text, int max) {
        int newline = text.indexOf('\n');
        String first = newline >= 0 ? text.substring(0, newline) : text;
        return first.length() > max ? first.substring(0, max) : first;
    }
}
