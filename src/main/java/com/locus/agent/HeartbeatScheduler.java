package com.locus.agent;

import com.locus.api.WorkspaceApi;
import com.locus.core.metrics.WorkerMetrics;
import com.locus.core.model.AgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sends liveness heartbeats on its own thread so a long agent run never delays them.
 * Failures are logged and counted, never thrown.
 */
public class HeartbeatScheduler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);

    private final WorkspaceApi api;
    private final String workspaceId;
    private final String agentId;
    private final Duration interval;
    private final WorkerMetrics metrics;
    private final ScheduledExecutorService scheduler;

    private volatile String currentTaskId;
    private volatile boolean started;

    public HeartbeatScheduler(WorkspaceApi api, String workspaceId, String agentId,
                              Duration interval, WorkerMetrics metrics) {
        this.api = api;
        this.workspaceId = workspaceId;
        this.agentId = agentId;
        this.interval = interval;
        this.metrics = metrics;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "heartbeat");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Sends the first heartbeat right away, then one every interval.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        scheduler.scheduleAtFixedRate(this::beat, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Changes the reported task and sends a heartbeat without waiting for the next tick.
     *
     * @param taskId task being worked on, or null when idle
     */
    public void setCurrentTask(String taskId) {
        currentTaskId = taskId;
        try {
            scheduler.execute(this::beat);
        } catch (RejectedExecutionException e) {
            log.debug("Heartbeat scheduler already stopped");
        }
    }

    public String currentTaskId() {
        return currentTaskId;
    }

    /**
     * Stops periodic heartbeats. Idempotent.
     */
    public void stop() {
        scheduler.shutdownNow();
    }

    public boolean isStopped() {
        return scheduler.isShutdown();
    }

    /**
     * Sends a final heartbeat on the calling thread.
     */
    public void sendFinal(AgentState state) {
        send(null, state);
    }

    void beat() {
        String taskId = currentTaskId;
        send(taskId, taskId == null ? AgentState.IDLE : AgentState.WORKING);
    }

    private void send(String taskId, AgentState state) {
        try {
            api.sendHeartbeat(workspaceId, agentId, taskId, state);
            log.debug("Heartbeat sent ({}, task {})", state, taskId);
        } catch (RuntimeException e) {
            log.warn("Heartbeat failed: {}", e.getMessage());
            if (metrics != null) {
                metrics.incrementHeartbeatFailures();
            }
        }
    }
}
