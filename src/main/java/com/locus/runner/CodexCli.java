package com.locus.runner;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class CodexCli implements AgentCli {

    @Override
    public String name() {
        return "codex";
    }

    @Override
    public String binary() {
        return "codex";
    }

    @Override
    public List<String> arguments(String model) {
        var args = new ArrayList<>(List.of("exec", "--full-auto", "--skip-git-repo-check", "--json"));
        if (model != null) {
            args.add("--model");
            args.add(model);
        }
        // read the prompt from stdin
        args.add("-");
        return args;
    }

    @Override
    public StreamParser newParser(RunnerListener listener) {
        return new CodexStreamParser(listener);
    }

    @Override
    public String parseVersion(String versionOutput) {
        return versionOutput.trim().replaceFirst("(?i)^codex(-cli)?\\s*", "");
    }

    @Override
    public Optional<String> sandboxPackage() {
        return Optional.of("@openai/codex");
    }
}
