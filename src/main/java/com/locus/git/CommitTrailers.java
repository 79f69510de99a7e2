package com.locus.git;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds agent commit messages with traceability trailers:
 *
 * <pre>
 * feat(agent): Add health check endpoint
 *
 * Task-ID: task-42
 * Agent: agent-7f3a
 * Co-authored-by: LocusAI &lt;agent@locusai.team&gt;
 * Co-authored-by: octocat &lt;octocat@users.noreply.github.com&gt;
 * </pre>
 */
public final class CommitTrailers {

    private CommitTrailers() {}

    public static String taskCommitMessage(String title, String taskId, String agentId,
                                           String botName, String botEmail, Optional<String> operator) {
        return "feat(agent): " + title + "\n\n" + String.join("\n", trailers(taskId, agentId, botName, botEmail, operator));
    }

    public static List<String> trailers(String taskId, String agentId, String botName, String botEmail,
                                        Optional<String> operator) {
        var lines = new ArrayList<String>();
        if (taskId != null) {
            lines.add("Task-ID: " + taskId);
        }
        lines.add("Agent: " + agentId);
        lines.add("Co-authored-by: %s <%s>".formatted(botName, botEmail));
        operator.ifPresent(user ->
                lines.add("Co-authored-by: %s <%s@users.noreply.github.com>".formatted(user, user)));
        return lines;
    }
}
