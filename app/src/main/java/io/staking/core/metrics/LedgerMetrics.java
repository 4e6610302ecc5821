package io.staking.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Timer operationTime = registry.timer("ledger.operation.time");

    public static <T> T recordOperation(Supplier<T> operation) {
        return operationTime.record(operation);
    }

    /** One count per ledger call, tagged with the call and either "ok" or the error kind. */
    public static void countOperation(String operation, String outcome) {
        Counter.builder("ledger.operations")
                .description("Ledger operations by outcome")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public static double operationCount(String operation, String outcome) {
        Counter c = registry.find("ledger.operations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .counter();
        return c == null ? 0.0 : c.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{");
                for (Tag tag : m.getId().getTags()) {
                    sb.append(tag.getKey()).append('=').append(tag.getValue()).append(',');
                }
                sb.append("stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
