package com.locus.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Turns SIGTERM/SIGINT into a forced worker shutdown with exit code 1.
 *
 * <p>Registered as a JVM shutdown hook. Runs at most once, and does nothing
 * when the worker already finished normally.
 */
public class ShutdownHandler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ShutdownHandler.class);

    static final int EXIT_CODE = 1;

    private final AgentWorker worker;
    private final IntConsumer exit;
    private final AtomicBoolean handled = new AtomicBoolean();
    private Thread hook;

    public ShutdownHandler(AgentWorker worker) {
        // halt: System.exit would block inside a shutdown hook
        this(worker, code -> Runtime.getRuntime().halt(code));
    }

    ShutdownHandler(AgentWorker worker, IntConsumer exit) {
        this.worker = worker;
        this.exit = exit;
    }

    public synchronized void register() {
        if (hook == null) {
            hook = new Thread(this, "locus-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
        }
    }

    /**
     * Removes the hook after a normal finish. Ignored when the JVM is already shutting down.
     */
    public synchronized void unregister() {
        if (hook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
        hook = null;
    }

    @Override
    public void run() {
        if (!handled.compareAndSet(false, true)) {
            return;
        }
        if (!worker.shutdown()) {
            return;
        }
        log.warn("Worker shut down before finishing; exiting with code {}", EXIT_CODE);
        exit.accept(EXIT_CODE);
    }
}
