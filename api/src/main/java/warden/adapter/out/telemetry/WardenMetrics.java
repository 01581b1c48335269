package warden.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.port.out.Metrics;

/**
 * Central service for recording metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.store.timeouts.total} - Store commands that timed out, by store and operation</li>
 *   <li>{@code warden.store.failures.total} - Store commands that failed, by store and operation</li>
 *   <li>{@code warden.ratelimit.rejected.total} - Rate-limited requests by endpoint class</li>
 *   <li>{@code warden.session.operations.total} - Session operations by operation and outcome</li>
 * </ul>
 */
@ApplicationScoped
public class WardenMetrics implements Metrics {

    private final MeterRegistry registry;

    @Inject
    public WardenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean isEnabled() {
        return registry != null;
    }

    @Override
    public void recordStoreTimeout(String store, String operation) {
        Counter.builder("warden.store.timeouts.total")
                .description("Store commands that exceeded their timeout")
                .tag("store", store)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String store, String operation) {
        Counter.builder("warden.store.failures.total")
                .description("Store commands that failed")
                .tag("store", store)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordRateLimited(String endpointClass) {
        Counter.builder("warden.ratelimit.rejected.total")
                .description("Requests rejected by the rate limiter")
                .tag("endpoint_class", endpointClass)
                .register(registry)
                .increment();
    }

    @Override
    public void recordSessionOutcome(String operation, String outcome) {
        Counter.builder("warden.session.operations.total")
                .description("Session lifecycle operations by outcome")
                .tag("operation", operation)
                .tag("outcome", outcome.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
