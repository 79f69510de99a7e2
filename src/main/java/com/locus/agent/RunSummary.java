package com.locus.agent;

import java.util.List;

/**
 * Counts of what one worker run did, plus the pull requests it opened.
 */
public record RunSummary(int completed, int blocked, int failed, List<String> prUrls) {

    public RunSummary {
        prUrls = prUrls == null ? List.of() : List.copyOf(prUrls);
    }

    public int processed() {
        return completed + blocked + failed;
    }
}
