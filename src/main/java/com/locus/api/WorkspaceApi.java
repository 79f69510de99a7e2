package com.locus.api;

import com.locus.core.model.AgentState;
import com.locus.core.model.Sprint;
import com.locus.core.model.Task;
import com.locus.core.model.TaskComment;
import com.locus.core.model.TaskPatch;

import java.util.Optional;

/**
 * Operations the worker consumes from the workspace server.
 * Implementations throw {@link ApiException} on transport or HTTP errors.
 */
public interface WorkspaceApi {

    /**
     * Claims the next eligible task for this agent.
     *
     * @return the claimed task, or empty when the server has nothing to dispatch
     */
    Optional<Task> dispatchNextTask(String workspaceId, String agentId, String sprintId);

    /**
     * Loads full task detail including comments.
     */
    Task getTaskDetail(String taskId, String workspaceId);

    void updateTaskStatus(String taskId, String workspaceId, TaskPatch patch);

    void addTaskComment(String taskId, String workspaceId, TaskComment comment);

    /**
     * Liveness signal. Callers treat failures as non-fatal.
     *
     * @param currentTaskId task being worked on, or null when idle
     */
    void sendHeartbeat(String workspaceId, String agentId, String currentTaskId, AgentState state);

    /**
     * Looks up a sprint by id, or the workspace's active sprint when {@code sprintId} is null.
     */
    Optional<Sprint> findSprint(String workspaceId, String sprintId);
}
