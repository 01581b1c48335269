package warden.system.filter;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import warden.core.model.admission.AdmissionPermit;
import warden.core.service.admission.AdmissionController;

/**
 * Gates every request through the {@link AdmissionController}.
 *
 * <p>The permit is held in a request property from the request filter until
 * the response filter closes it. Rejections propagate as
 * {@code AuthException(OVERLOADED | QUEUE_TIMEOUT)} and are mapped to 503.
 */
public class AdmissionFilter {

    static final String PERMIT_ATTR = "warden.admission.permit";

    private final AdmissionController admissionController;

    @Inject
    public AdmissionFilter(AdmissionController admissionController) {
        this.admissionController = admissionController;
    }

    @ServerRequestFilter(priority = Priorities.AUTHENTICATION - 200)
    public Uni<Response> acquire(ContainerRequestContext requestContext) {
        if (!admissionController.isEnabled()) {
            return Uni.createFrom().nullItem();
        }
        final var path = requestContext.getUriInfo().getPath();
        if (admissionController.isBypassed(path)) {
            return Uni.createFrom().nullItem();
        }

        return admissionController.acquire().map(permit -> {
            requestContext.setProperty(PERMIT_ATTR, permit);
            return null;
        });
    }

    @ServerResponseFilter
    public void release(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        final var permit = requestContext.getProperty(PERMIT_ATTR);
        if (permit instanceof AdmissionPermit admissionPermit) {
            requestContext.removeProperty(PERMIT_ATTR);
            admissionPermit.close();
        }
    }
}
