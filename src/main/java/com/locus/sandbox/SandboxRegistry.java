package com.locus.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sandboxes currently alive in this process, so a forced shutdown can remove
 * them. Owned by the worker; sandboxes register and unregister themselves.
 */
public class SandboxRegistry {

    private static final Logger log = LoggerFactory.getLogger(SandboxRegistry.class);

    private final Map<String, SandboxLifecycle> active = new ConcurrentHashMap<>();

    public void register(SandboxLifecycle sandbox) {
        active.put(sandbox.name(), sandbox);
    }

    public void unregister(SandboxLifecycle sandbox) {
        active.remove(sandbox.name(), sandbox);
    }

    public Set<String> activeNames() {
        return Set.copyOf(active.keySet());
    }

    /**
     * Destroys every registered sandbox. Errors are logged per sandbox so one
     * failure does not leave the others running.
     */
    public void cleanupAll() {
        var sandboxes = new ArrayList<>(active.values());
        if (sandboxes.isEmpty()) {
            return;
        }
        log.info("Cleaning up {} active sandbox(es)", sandboxes.size());
        for (var sandbox : sandboxes) {
            try {
                sandbox.destroy();
            } catch (RuntimeException e) {
                log.warn("Failed to clean up sandbox {}: {}", sandbox.name(), e.getMessage());
            }
        }
    }
}
