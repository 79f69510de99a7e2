package com.locus.sandbox;

import com.locus.git.CommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Removes files listed in {@code .sandboxignore} from a sandbox's synced workspace.
 *
 * <p>The file uses gitignore-like syntax: one {@code find -name} pattern per
 * line, {@code #} comments, {@code !} negations that protect matching names
 * from every rule, and a trailing {@code /} for directories. Enforcement is
 * best effort; failures are logged and execution continues.
 */
public class SandboxIgnorePolicy {

    private static final Logger log = LoggerFactory.getLogger(SandboxIgnorePolicy.class);

    record Rule(String pattern, boolean negated, boolean directory) {}

    private final String ignoreFileName;
    private final Duration timeout;

    public SandboxIgnorePolicy(String ignoreFileName, Duration timeout) {
        this.ignoreFileName = ignoreFileName;
        this.timeout = timeout;
    }

    /**
     * Applies the rules from {@code <workspace>/.sandboxignore} inside {@code sandboxName}.
     */
    public void enforce(SandboxProvider provider, String sandboxName, Path workspace) {
        Path ignoreFile = workspace.resolve(ignoreFileName);
        if (!Files.isRegularFile(ignoreFile)) {
            return;
        }
        String script;
        try {
            script = buildCleanupScript(parse(Files.readString(ignoreFile)), workspace.toString());
        } catch (IOException e) {
            log.warn("Could not read {}: {}", ignoreFile, e.getMessage());
            return;
        }
        if (script == null) {
            return;
        }

        try {
            var result = provider.exec(sandboxName, timeout, List.of("sh", "-c", script));
            if (result.ok()) {
                log.debug("Applied {} in sandbox {}", ignoreFileName, sandboxName);
            } else {
                log.warn("{} enforcement in sandbox {} exited with {}: {}",
                        ignoreFileName, sandboxName, result.exitCode(), result.errorText());
            }
        } catch (CommandException e) {
            log.warn("{} enforcement in sandbox {} failed: {}", ignoreFileName, sandboxName, e.getMessage());
        }
    }

    static List<Rule> parse(String content) {
        var rules = new ArrayList<Rule>();
        for (var raw : content.split("\n")) {
            var line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            boolean negated = line.startsWith("!");
            var pattern = negated ? line.substring(1) : line;
            boolean directory = pattern.endsWith("/");
            if (directory) {
                pattern = pattern.substring(0, pattern.length() - 1);
            }
            if (!pattern.isEmpty()) {
                rules.add(new Rule(pattern, negated, directory));
            }
        }
        return rules;
    }

    /**
     * Builds one {@code find} command per positive rule, separated so that one
     * failing command does not stop the rest.
     *
     * @return the shell script, or null when there is nothing to remove
     */
    static String buildCleanupScript(List<Rule> rules, String workspacePath) {
        var positive = rules.stream().filter(r -> !r.negated()).toList();
        if (positive.isEmpty()) {
            return null;
        }
        String exclusions = rules.stream()
                .filter(Rule::negated)
                .map(r -> "! -name '" + shellEscape(r.pattern()) + "'")
                .collect(Collectors.joining(" "));

        var commands = new ArrayList<String>();
        for (var rule : positive) {
            var parts = new ArrayList<String>();
            parts.add("find");
            parts.add("'" + shellEscape(workspacePath) + "'");
            if (rule.directory()) {
                parts.add("-type d");
            }
            parts.add("-name '" + shellEscape(rule.pattern()) + "'");
            if (!exclusions.isEmpty()) {
                parts.add(exclusions);
            }
            parts.add(rule.directory() ? "-exec rm -rf {} +" : "-delete");
            commands.add(String.join(" ", parts));
        }
        return String.join(" 2>/dev/null ; ", commands) + " 2>/dev/null";
    }

    static String shellEscape(String value) {
        return value.replace("'", "'\\''");
    }
}
