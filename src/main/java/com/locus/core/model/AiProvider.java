package com.locus.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * The AI coding CLI a worker drives.
 */
public enum AiProvider {
    CLAUDE("claude"),
    CODEX("codex");

    private static final Logger log = LoggerFactory.getLogger(AiProvider.class);

    private final String id;

    AiProvider(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Parses a provider name. Unknown or blank values fall back to {@link #CLAUDE}.
     */
    public static AiProvider parse(String value) {
        if (value == null || value.isBlank()) {
            return CLAUDE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AiProvider provider : values()) {
            if (provider.id.equals(normalized)) {
                return provider;
            }
        }
        log.warn("Unknown provider '{}', falling back to {}", value, CLAUDE.id);
        return CLAUDE;
    }
}
