package com.locus.core.model;

/**
 * Coarse worker state reported with every heartbeat.
 */
public enum AgentState {
    IDLE,
    WORKING,
    COMPLETED,
    FAILED
}
