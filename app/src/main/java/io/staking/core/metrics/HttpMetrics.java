package io.staking.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.staking.core.protocol.StakingError;

/**
 * RPC meters, kept in the ledger registry so {@code /metrics} shows them next
 * to the operation counters.
 */
public final class HttpMetrics {
    private static final MeterRegistry REGISTRY = LedgerMetrics.registry();

    private HttpMetrics() {}

    public static Timer.Sample start() {
        return Timer.start(REGISTRY);
    }

    /** Request duration per endpoint, tagged with the status and its class (2xx, 4xx, 5xx). */
    public static void stop(Timer.Sample sample, String method, String path, int status) {
        Timer timer = Timer
                .builder("rpc.requests")
                .description("RPC request duration by endpoint and status")
                .tag("method", method)
                .tag("path", path)
                .tag("status", Integer.toString(status))
                .tag("outcome", (status / 100) + "xx")
                .register(REGISTRY);
        sample.stop(timer);
    }

    /** A ledger rejection returned to an RPC caller, tagged with the error's wire name and code. */
    public static void countLedgerError(String path, StakingError error) {
        Counter.builder("rpc.ledger.errors")
                .description("Ledger errors returned over RPC")
                .tag("path", path)
                .tag("error", error.wireName())
                .tag("code", Integer.toString(error.code()))
                .register(REGISTRY)
                .increment();
    }

    public static double ledgerErrorCount(String path, StakingError error) {
        Counter c = REGISTRY.find("rpc.ledger.errors")
                .tag("path", path)
                .tag("error", error.wireName())
                .counter();
        return c == null ? 0.0 : c.count();
    }
}
