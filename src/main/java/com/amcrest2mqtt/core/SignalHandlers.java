package com.amcrest2mqtt.core;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

/**
 * Routes SIGINT / SIGTERM to the {@link ShutdownCoordinator}.
 * <p>
 * JVM shutdown hooks can't tell a first interrupt from a second one, so the signals are taken over directly.
 * Each delivery runs on its own dispatch thread, which lets a second signal reach the coordinator while the
 * first one is still closing the connection.
 */
public final class SignalHandlers {
    final static Logger LOGGER = LoggerFactory.getLogger(SignalHandlers.class);
    static final ImmutableList<String> SIGNALS = ImmutableList.of("INT", "TERM");

    private SignalHandlers() {}

    public static void install(ShutdownCoordinator coordinator) {
        for (String name : SIGNALS) {
            try {
                Signal.handle(new Signal(name),
                        signal -> coordinator.requestShutdown(0, "SIG" + signal.getName()));
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Can't install SIG{} handler: {}", name, e.getMessage());
            }
        }
    }
}
