package com.locus.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClaudeStreamParserTest {

    private final List<String> outputs = new ArrayList<>();
    private final List<String> tools = new ArrayList<>();
    private ClaudeStreamParser parser;

    @BeforeEach
    void setUp() {
        parser = new ClaudeStreamParser(new RunnerListener() {
            @Override
            public void onOutput(String text) {
                outputs.add(text);
            }

            @Override
            public void onToolActivity(String activity) {
                tools.add(activity);
            }
        });
    }

    @Test
    void reportsEachToolCallOnce() {
        String event = """
                {"type":"assistant","message":{"content":[
                  {"type":"text","text":"Let me look"},
                  {"type":"tool_use","id":"tu_1","name":"Read","input":{"file_path":"src/App.java"}}]}}"""
                .replace("\n", "");

        parser.onLine(event);
        parser.onLine(event);

        assertEquals(List.of("reading src/App.java"), tools);
    }

    @Test
    void resultEventReplacesEarlierOutput() {
        parser.onLine("warming up");
        parser.onLine("{\"type\":\"result\",\"result\":\"Done. <promise>COMPLETE</promise>\"}");

        assertEquals("Done. <promise>COMPLETE</promise>", parser.output());
        assertEquals(List.of("warming up\n", "Done. <promise>COMPLETE</promise>"), outputs);
    }

    @Test
    void nonObjectJsonPassesThrough() {
        parser.onLine("[1,2]");
        parser.onLine("   ");

        assertEquals("[1,2]\n", parser.output());
    }

    @Test
    void ignoresOtherEventTypes() {
        parser.onLine("{\"type\":\"system\",\"subtype\":\"init\"}");

        assertEquals("", parser.output());
        assertTrue(outputs.isEmpty());
    }

    @Test
    void formatsToolCalls() throws Exception {
        var mapper = new ObjectMapper();

        assertEquals("running: npm test",
                ClaudeStreamParser.formatToolCall("Bash", mapper.readTree("{\"command\":\"npm test\"}")));
        assertEquals("editing a.txt",
                ClaudeStreamParser.formatToolCall("MultiEdit", mapper.readTree("{\"file_path\":\"a.txt\"}")));
        assertEquals("spawning agent", ClaudeStreamParser.formatToolCall("Task", mapper.createObjectNode()));
        assertEquals("TodoWrite", ClaudeStreamParser.formatToolCall("TodoWrite", mapper.createObjectNode()));
        assertEquals(69, ClaudeStreamParser.formatToolCall("Bash",
                mapper.readTree("{\"command\":\"" + "x".repeat(100) + "\"}")).length());
    }
}
