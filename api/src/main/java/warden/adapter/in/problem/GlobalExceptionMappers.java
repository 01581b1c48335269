package warden.adapter.in.problem;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;
import warden.core.model.common.StoreUnavailableException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Responses never carry exception messages. Unclassified failures are logged
 * with their stack trace and answered with a fixed 500.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";
    private static final String RETRY_AFTER_HEADER = "Retry-After";
    private static final Duration STORE_RETRY_AFTER = Duration.ofSeconds(1);

    @ServerExceptionMapper
    public Response mapAuthException(AuthException e) {
        LOG.debugv("Request rejected: {0}", e.code());
        final var response = Response.status(AuthProblem.statusFor(e.code()))
                .type(PROBLEM_JSON)
                .entity(AuthProblem.from(e));
        if (e.retryAfter().isPresent()) {
            response.header(RETRY_AFTER_HEADER, e.retryAfterSeconds());
        }
        return response.build();
    }

    @ServerExceptionMapper
    public Response mapStoreUnavailable(StoreUnavailableException e) {
        LOG.warnv(e, "Store {0} unavailable", e.store());
        return mapAuthException(new AuthException(AuthErrorCode.STORE_UNAVAILABLE, STORE_RETRY_AFTER, e));
    }

    @ServerExceptionMapper
    public Response mapConstraintViolation(ConstraintViolationException e) {
        final var violations = e.getConstraintViolations().stream()
                .map(violation -> fieldName(violation.getPropertyPath()) + ": " + violation.getMessage())
                .sorted()
                .toList();
        LOG.debugv("Request rejected: {0}", violations);
        return toResponse(AuthProblem.invalidRequest(violations));
    }

    @ServerExceptionMapper
    public Response mapUnexpected(RuntimeException e) {
        if (e instanceof WebApplicationException wae) {
            return wae.getResponse();
        }
        LOG.errorv(e, "Unhandled exception while processing request");
        return toResponse(AuthProblem.internalError());
    }

    /** Last node of the path, e.g. {@code email} for {@code login.request.email}. */
    private static String fieldName(Path path) {
        String name = null;
        for (final var node : path) {
            if (node.getName() != null) {
                name = node.getName();
            }
        }
        return name == null ? "request" : name;
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
