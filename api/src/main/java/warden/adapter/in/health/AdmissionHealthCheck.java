package warden.adapter.in.health;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import warden.core.service.admission.AdmissionController;

/**
 * Readiness check reporting admission control utilization.
 *
 * <p>Always reports UP. Saturation is a load condition handled by rejecting
 * requests with 503, and is alerted on through the {@code status} field and the
 * {@code warden.admission.*} metrics rather than by leaving the load balancer
 * rotation.
 */
@Readiness
@ApplicationScoped
public class AdmissionHealthCheck implements HealthCheck {

    private final AdmissionController admissionController;

    @Inject
    public AdmissionHealthCheck(AdmissionController admissionController) {
        this.admissionController = admissionController;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("admission");
        builder.withData("enabled", admissionController.isEnabled());

        if (admissionController.isEnabled()) {
            final var snapshot = admissionController.snapshot();
            builder.withData("status", snapshot.status());
            builder.withData("active", snapshot.active());
            builder.withData("queued", snapshot.queued());
            builder.withData("max_concurrent", snapshot.maxConcurrent());
            builder.withData("queue_capacity", snapshot.queueCapacity());
            builder.withData("utilization", String.format(Locale.ROOT, "%.2f", snapshot.utilization()));
            builder.withData("total_rejected", snapshot.totalRejected());
            builder.withData("total_timed_out", snapshot.totalTimedOut());
        }

        return builder.up().build();
    }
}
