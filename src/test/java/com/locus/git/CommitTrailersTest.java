package com.locus.git;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CommitTrailersTest {

    @Test
    void taskMessageCarriesAllTrailers() {
        String message = CommitTrailers.taskCommitMessage("Add health check", "task-42", "agent-7f3a",
                "LocusAI", "agent@locusai.team", Optional.of("octocat"));

        assertEquals("""
                feat(agent): Add health check

                Task-ID: task-42
                Agent: agent-7f3a
                Co-authored-by: LocusAI <agent@locusai.team>
                Co-authored-by: octocat <octocat@users.noreply.github.com>""", message);
    }

    @Test
    void operatorAndTaskIdAreOptional() {
        var trailers = CommitTrailers.trailers(null, "agent-1", "LocusAI", "agent@locusai.team", Optional.empty());

        assertEquals(2, trailers.size());
        assertEquals("Agent: agent-1", trailers.get(0));
    }
}
