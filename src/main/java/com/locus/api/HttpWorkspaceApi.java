package com.locus.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.locus.core.model.AgentState;
import com.locus.core.model.Sprint;
import com.locus.core.model.Task;
import com.locus.core.model.TaskComment;
import com.locus.core.model.TaskPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * HTTP client for the workspace REST API.
 *
 * <p>Authenticates with the worker's API key as a bearer token. Responses wrap
 * their payload in a named field ({@code {"task": {...}}}).
 */
public class HttpWorkspaceApi implements WorkspaceApi {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkspaceApi.class);

    private final String apiBase;
    private final String apiKey;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public HttpWorkspaceApi(String apiBase, String apiKey, Duration connectTimeout, Duration requestTimeout) {
        this(apiBase, apiKey, HttpClient.newBuilder().connectTimeout(connectTimeout).build(), requestTimeout);
    }

    HttpWorkspaceApi(String apiBase, String apiKey, HttpClient httpClient, Duration requestTimeout) {
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.apiKey = apiKey;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true);
    }

    @Override
    public Optional<Task> dispatchNextTask(String workspaceId, String agentId, String sprintId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("workerId", agentId);
        if (sprintId != null) {
            body.put("sprintId", sprintId);
        }
        try {
            var response = send("POST", "/workspaces/" + encode(workspaceId) + "/dispatch", body.toString());
            var task = response.get("task");
            if (task == null || task.isNull()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.treeToValue(task, Task.class));
        } catch (ApiException e) {
            if (e.isNotFound()) {
                log.debug("Dispatch returned 404 for workspace {}", workspaceId);
                return Optional.empty();
            }
            throw e;
        } catch (IOException e) {
            throw new ApiException("Malformed dispatch response", e);
        }
    }

    @Override
    public Task getTaskDetail(String taskId, String workspaceId) {
        var response = send("GET", taskPath(taskId, "", workspaceId), null);
        return readField(response, "task", Task.class);
    }

    @Override
    public void updateTaskStatus(String taskId, String workspaceId, TaskPatch patch) {
        ObjectNode body = objectMapper.createObjectNode();
        if (patch.status() != null) {
            body.put("status", patch.status().name());
        }
        if (patch.clearAssignee()) {
            body.putNull("assignedTo");
        } else if (patch.assignedTo() != null) {
            body.put("assignedTo", patch.assignedTo());
        }
        if (patch.prUrl() != null) {
            body.put("prUrl", patch.prUrl());
        }
        send("PATCH", taskPath(taskId, "", workspaceId), body.toString());
    }

    @Override
    public void addTaskComment(String taskId, String workspaceId, TaskComment comment) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("author", comment.author());
        body.put("text", comment.text());
        send("POST", taskPath(taskId, "/comment", workspaceId), body.toString());
    }

    @Override
    public void sendHeartbeat(String workspaceId, String agentId, String currentTaskId, AgentState state) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("agentId", agentId);
        if (currentTaskId != null) {
            body.put("currentTaskId", currentTaskId);
        } else {
            body.putNull("currentTaskId");
        }
        body.put("status", state.name());
        send("POST", "/workspaces/" + encode(workspaceId) + "/agents/heartbeat", body.toString());
    }

    @Override
    public Optional<Sprint> findSprint(String workspaceId, String sprintId) {
        String path = sprintId != null
                ? "/sprints/" + encode(sprintId) + "?workspaceId=" + encode(workspaceId)
                : "/sprints/active?workspaceId=" + encode(workspaceId);
        try {
            var response = send("GET", path, null);
            var sprint = response.get("sprint");
            if (sprint == null || sprint.isNull()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.treeToValue(sprint, Sprint.class));
        } catch (ApiException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        } catch (IOException e) {
            throw new ApiException("Malformed sprint response", e);
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  TRANSPORT
    // ═══════════════════════════════════════════════════════════════════

    JsonNode send(String method, String path, String body) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + path))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Accept", "application/json");
        if (body != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        try {
            log.debug("{} {}", method, path);
            var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new ApiException("API %s %s failed (HTTP %d): %s"
                        .formatted(method, path, response.statusCode(), abbreviate(response.body())),
                        response.statusCode());
            }
            var text = response.body();
            if (text == null || text.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(text);
        } catch (IOException e) {
            throw new ApiException("API request failed: %s %s".formatted(method, path), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException("API request interrupted: %s %s".formatted(method, path), e);
        }
    }

    private <T> T readField(JsonNode response, String field, Class<T> type) {
        var node = response.get(field);
        if (node == null || node.isNull()) {
            throw new ApiException("Response is missing '%s'".formatted(field), 0);
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (IOException e) {
            throw new ApiException("Malformed '%s' in response".formatted(field), e);
        }
    }

    private static String taskPath(String taskId, String suffix, String workspaceId) {
        return "/tasks/" + encode(taskId) + suffix + "?workspaceId=" + encode(workspaceId);
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
