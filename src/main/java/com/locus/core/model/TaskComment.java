package com.locus.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * A comment on a task, either from a human reviewer or a worker.
 *
 * @param author    display name or agent id
 * @param text      comment body (markdown)
 * @param createdAt creation time, may be null for comments not yet persisted
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskComment(
    String author,
    String text,
    Instant createdAt
) {

    public static TaskComment of(String author, String text) {
        return new TaskComment(author, text, null);
    }
}
