package com.locus.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "locus")
public class LocusProperties {

    private Worker worker = new Worker();
    private Git git = new Git();
    private Sandbox sandbox = new Sandbox();
    private Api api = new Api();

    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }
    public Api getApi() { return api; }
    public void setApi(Api api) { this.api = api; }

    public static class Worker {
        private int maxTasks = 50;
        private Duration heartbeatInterval = Duration.ofSeconds(60);
        private int dispatchMaxAttempts = 10;
        private Duration dispatchDelay = Duration.ofSeconds(30);
        private Duration postCleanupDelay = Duration.ofSeconds(5);

        public int getMaxTasks() { return maxTasks; }
        public void setMaxTasks(int maxTasks) { this.maxTasks = maxTasks; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
        public int getDispatchMaxAttempts() { return dispatchMaxAttempts; }
        public void setDispatchMaxAttempts(int dispatchMaxAttempts) { this.dispatchMaxAttempts = dispatchMaxAttempts; }
        public Duration getDispatchDelay() { return dispatchDelay; }
        public void setDispatchDelay(Duration dispatchDelay) { this.dispatchDelay = dispatchDelay; }
        public Duration getPostCleanupDelay() { return postCleanupDelay; }
        public void setPostCleanupDelay(Duration postCleanupDelay) { this.postCleanupDelay = postCleanupDelay; }
    }

    public static class Git {
        private String remote = "origin";
        private String branchPrefix = "locus";
        private String baseBranch = "";
        private String worktreeRoot = ".locus-worktrees";
        private String cleanupPolicy = "retain-on-failure";
        private String botName = "LocusAI";
        private String botEmail = "agent@locusai.team";

        public String getRemote() { return remote; }
        public void setRemote(String remote) { this.remote = remote; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
        public String getBaseBranch() { return baseBranch; }
        public void setBaseBranch(String baseBranch) { this.baseBranch = baseBranch; }
        public String getWorktreeRoot() { return worktreeRoot; }
        public void setWorktreeRoot(String worktreeRoot) { this.worktreeRoot = worktreeRoot; }
        public String getCleanupPolicy() { return cleanupPolicy; }
        public void setCleanupPolicy(String cleanupPolicy) { this.cleanupPolicy = cleanupPolicy; }
        public String getBotName() { return botName; }
        public void setBotName(String botName) { this.botName = botName; }
        public String getBotEmail() { return botEmail; }
        public void setBotEmail(String botEmail) { this.botEmail = botEmail; }
    }

    public static class Sandbox {
        private String ignoreFile = ".sandboxignore";
        private Duration ignoreTimeout = Duration.ofSeconds(15);
        private Duration installTimeout = Duration.ofSeconds(120);
        private String agent = "claude";

        public String getIgnoreFile() { return ignoreFile; }
        public void setIgnoreFile(String ignoreFile) { this.ignoreFile = ignoreFile; }
        public Duration getIgnoreTimeout() { return ignoreTimeout; }
        public void setIgnoreTimeout(Duration ignoreTimeout) { this.ignoreTimeout = ignoreTimeout; }
        public Duration getInstallTimeout() { return installTimeout; }
        public void setInstallTimeout(Duration installTimeout) { this.installTimeout = installTimeout; }
        public String getAgent() { return agent; }
        public void setAgent(String agent) { this.agent = agent; }
    }

    public static class Api {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(60);

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }
}
