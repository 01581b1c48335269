package warden.adapter.out.telemetry;

import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.jboss.logging.Logger;

import warden.core.service.admission.AdmissionController;

/**
 * Exposes admission control state as Micrometer meters.
 *
 * <p>Metrics exposed:
 * <ul>
 *   <li>{@code warden.admission.active} - Requests holding a permit</li>
 *   <li>{@code warden.admission.queued} - Requests waiting for a permit</li>
 *   <li>{@code warden.admission.utilization} - Fraction of permits in use</li>
 *   <li>{@code warden.admission.max_concurrent} - Configured permit count</li>
 *   <li>{@code warden.admission.admitted.total} - Permits granted</li>
 *   <li>{@code warden.admission.rejected.total} - Requests rejected as overloaded</li>
 *   <li>{@code warden.admission.timeouts.total} - Requests that gave up waiting</li>
 * </ul>
 */
@ApplicationScoped
public class AdmissionMetrics implements MeterBinder {

    private static final Logger LOG = Logger.getLogger(AdmissionMetrics.class);

    private final AdmissionController admissionController;
    private final AtomicBoolean registered = new AtomicBoolean(false);

    @Inject
    public AdmissionMetrics(AdmissionController admissionController) {
        this.admissionController = admissionController;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        if (!admissionController.isEnabled()) {
            LOG.debug("Admission metrics disabled (admission control not enabled)");
            return;
        }

        if (!registered.compareAndSet(false, true)) {
            LOG.debug("Admission metrics already registered, skipping");
            return;
        }

        final var controller = admissionController;

        Gauge.builder("warden.admission.active", controller, c -> c.snapshot().active())
                .description("Requests currently holding an admission permit")
                .register(registry);

        Gauge.builder("warden.admission.queued", controller, c -> c.snapshot().queued())
                .description("Requests waiting for an admission permit")
                .register(registry);

        Gauge.builder("warden.admission.utilization", controller, c -> c.snapshot().utilization())
                .description("Fraction of admission permits in use")
                .register(registry);

        Gauge.builder("warden.admission.max_concurrent", controller, c -> c.snapshot().maxConcurrent())
                .description("Configured number of admission permits")
                .register(registry);

        FunctionCounter.builder("warden.admission.admitted.total", controller, c -> c.snapshot().totalAdmitted())
                .description("Admission permits granted")
                .register(registry);

        FunctionCounter.builder("warden.admission.rejected.total", controller, c -> c.snapshot().totalRejected())
                .description("Requests rejected because the service was overloaded")
                .register(registry);

        FunctionCounter.builder("warden.admission.timeouts.total", controller, c -> c.snapshot().totalTimedOut())
                .description("Requests that timed out waiting for an admission permit")
                .register(registry);
    }
}
