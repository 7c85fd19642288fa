package com.amcrest2mqtt.core;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for process termination.
 * <p>
 * The first request runs the registered shutdown actions in registration order and then exits with the
 * requested status. Any further request (a second SIGINT, a fatal error raised while closing) halts the
 * process at once with status 1, skipping every remaining action.
 */
public class ShutdownCoordinator implements FatalErrorHandler {
    final static Logger LOGGER = LoggerFactory.getLogger(ShutdownCoordinator.class);
    static final String SHUTDOWN_COORDINATOR = "ShutdownCoordinator";
    static final int FORCED_EXIT_STATUS = 1;

    static final class NamedAction {
        final String name;
        final ShutdownAction action;

        NamedAction(String name, ShutdownAction action) {
            this.name = name;
            this.action = action;
        }
    }

    final AtomicBoolean exiting = new AtomicBoolean(false);
    final CountDownLatch actionsDone = new CountDownLatch(1);
    final List<NamedAction> actions = new CopyOnWriteArrayList<>();
    final ProcessTerminator terminator;
    final BridgeEventNotifier eventNotifier;

    public ShutdownCoordinator(ProcessTerminator terminator, BridgeEventNotifier eventNotifier) {
        this.terminator = checkNotNull(terminator);
        this.eventNotifier = checkNotNull(eventNotifier);
    }

    public void addShutdownAction(String name, ShutdownAction action) {
        actions.add(new NamedAction(checkNotNull(name), checkNotNull(action)));
    }

    public boolean isShuttingDown() {
        return exiting.get();
    }

    public void requestShutdown(int exitCode, String reason) {
        if (!exiting.compareAndSet(false, true)) {
            LOGGER.error("Termination requested again ({}) while shutting down, exiting immediately", reason);
            terminator.halt(FORCED_EXIT_STATUS);
            return;
        }

        int status = toProcessStatus(exitCode);
        eventNotifier.notifyEvent(SHUTDOWN_COORDINATOR, BridgeEventType.SHUTDOWN_REQUESTED, null,
                "Shutting down", String.format("Reason: %s; exit status %d", reason, status));

        for (NamedAction namedAction : actions) {
            try {
                LOGGER.info("Shutdown: {}", namedAction.name);
                namedAction.action.run();
            } catch (Exception e) {
                LOGGER.error("Shutdown action [{}] failed", namedAction.name, e);
            }
        }

        actionsDone.countDown();

        LOGGER.info("Exiting with status {}", status);
        terminator.exit(status);
    }

    /** Blocks until a shutdown request has run every shutdown action. */
    public void awaitShutdown() throws InterruptedException {
        actionsDone.await();
    }

    @Override
    public void fatal(int exitCode, String reason) {
        LOGGER.error("Fatal: {}", reason);
        requestShutdown(exitCode == 0 ? 1 : exitCode, reason);
    }

    /** Process statuses are 8 bit; codes that don't fit become 1 so they never read as success. */
    static int toProcessStatus(int exitCode) {
        if (exitCode == 0) {
            return 0;
        }
        return exitCode > 0 && exitCode < 256 ? exitCode : 1;
    }
}
