package com.locus.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the GitHub login of the operator running the worker, via the
 * {@code gh} CLI. Resolved once and cached; absence is not an error.
 */
public class GitHubIdentity {

    private static final Logger log = LoggerFactory.getLogger(GitHubIdentity.class);

    private final CommandExecutor executor;
    private volatile Optional<String> username;

    public GitHubIdentity(CommandExecutor executor) {
        this.executor = executor;
    }

    public Optional<String> username() {
        var cached = username;
        if (cached != null) {
            return cached;
        }
        synchronized (this) {
            if (username == null) {
                username = lookup();
            }
            return username;
        }
    }

    private Optional<String> lookup() {
        try {
            var result = executor.run(null, Duration.ofSeconds(15), List.of("gh", "api", "user", "--jq", ".login"));
            if (result.ok() && !result.out().isEmpty()) {
                log.info("Resolved GitHub user {}", result.out());
                return Optional.of(result.out());
            }
            log.debug("gh api user failed: {}", result.errorText());
        } catch (CommandException e) {
            log.debug("gh CLI not available: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
