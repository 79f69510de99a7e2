package com.locus.runner;

/**
 * Receives live events from a running agent CLI. All methods default to no-ops.
 */
public interface RunnerListener {

    RunnerListener NONE = new RunnerListener() {};

    /** Assistant text or raw non-JSON output. */
    default void onOutput(String text) {}

    /** Short description of a tool the agent started or finished. */
    default void onToolActivity(String activity) {}

    /** Reasoning fragments, where the CLI exposes them. */
    default void onThinking(String text) {}
}
