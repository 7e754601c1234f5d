package io.forkrecovery.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class RecoveryMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter sessionsStarted = registry.counter("recovery.sessions.started");
    private static final Counter sessionsRecovered = registry.counter("recovery.sessions.recovered");
    private static final Counter blocksVerified = registry.counter("recovery.blocks.verified");
    private static final Counter fetchRetries = registry.counter("recovery.fetch.retries");
    private static final Timer stepTime = Timer.builder("recovery.step.time")
            .description("Fetch + validate time of one recovery step")
            .register(registry);

    private RecoveryMetrics() {}

    public static void sessionStarted() {
        sessionsStarted.increment();
    }

    public static void sessionRecovered() {
        sessionsRecovered.increment();
    }

    public static void sessionAborted(String reason) {
        Counter.builder("recovery.sessions.aborted")
                .description("Recovery sessions that ended without adopting the target")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public static void blockVerified() {
        blocksVerified.increment();
    }

    public static void fetchRetried() {
        fetchRetries.increment();
    }

    public static <T> T recordStep(Supplier<T> step) {
        return stepTime.record(step);
    }

    public static double count(String name) {
        Counter counter = registry.find(name).counter();
        return counter == null ? 0.0 : counter.count();
    }

    public static double abortedCount(String reason) {
        Counter counter = registry.find("recovery.sessions.aborted").tag("reason", reason).counter();
        return counter == null ? 0.0 : counter.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }
}
