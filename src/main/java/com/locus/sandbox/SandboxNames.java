package com.locus.sandbox;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives sandbox names: {@code locus-<project>[-<work id>]-<millis>}.
 *
 * <p>The work id is an issue or task reference parsed from the free-text
 * activity label ("Fix #42", "issue 42", "LOC-17", "task abc123"). The
 * timestamp keeps repeated runs for the same work from colliding.
 */
public final class SandboxNames {

    private static final int MAX_SEGMENT = 30;

    private static final List<IdPattern> ID_PATTERNS = List.of(
            new IdPattern(Pattern.compile("(?i)\\bissue[\\s:#-]*(\\d+)"), "issue-"),
            new IdPattern(Pattern.compile("#(\\d+)\\b"), "issue-"),
            new IdPattern(Pattern.compile("\\b([A-Z][A-Z0-9]+-\\d+)\\b"), ""),
            new IdPattern(Pattern.compile("(?i)\\btask[\\s:#-]+([A-Za-z0-9_-]+)"), "task-")
    );

    private record IdPattern(Pattern pattern, String prefix) {}

    private SandboxNames() {}

    public static String generate(Path projectPath, String activity, long timestampMillis) {
        var name = new StringBuilder("locus-").append(projectSegment(projectPath));
        String workId = workId(activity);
        if (workId != null) {
            name.append('-').append(workId);
        }
        return name.append('-').append(timestampMillis).toString();
    }

    /**
     * Issue or task reference found in the activity label, sanitized, or null.
     */
    static String workId(String activity) {
        if (activity == null || activity.isBlank()) {
            return null;
        }
        for (var idPattern : ID_PATTERNS) {
            Matcher matcher = idPattern.pattern().matcher(activity);
            if (matcher.find()) {
                String id = sanitize(idPattern.prefix() + matcher.group(1));
                return id.isEmpty() ? null : id;
            }
        }
        return null;
    }

    static String projectSegment(Path projectPath) {
        var fileName = projectPath == null ? null : projectPath.toAbsolutePath().normalize().getFileName();
        String segment = fileName == null ? "" : sanitize(fileName.toString());
        return segment.isEmpty() ? "workspace" : segment;
    }

    private static String sanitize(String value) {
        String clean = value.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-|-$", "");
        return clean.length() > MAX_SEGMENT ? clean.substring(0, MAX_SEGMENT).replaceAll("-$", "") : clean;
    }
}
