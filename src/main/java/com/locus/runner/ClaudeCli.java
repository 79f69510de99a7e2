package com.locus.runner;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class ClaudeCli implements AgentCli {

    @Override
    public String name() {
        return "claude";
    }

    @Override
    public String binary() {
        return "claude";
    }

    @Override
    public List<String> arguments(String model) {
        var args = new ArrayList<>(List.of(
                "--print",
                "--dangerously-skip-permissions",
                "--no-session-persistence"));
        if (model != null) {
            args.add("--model");
            args.add(model);
        }
        args.addAll(List.of("--verbose", "--output-format", "stream-json"));
        return args;
    }

    @Override
    public StreamParser newParser(RunnerListener listener) {
        return new ClaudeStreamParser(listener);
    }

    @Override
    public String parseVersion(String versionOutput) {
        return versionOutput.trim().replaceFirst("(?i)^claude\\s*", "");
    }

    // Nested sessions are refused when these are inherited from a parent Claude process.
    @Override
    public Set<String> removedEnvironment() {
        return Set.of("CLAUDECODE", "CLAUDE_CODE");
    }
}
