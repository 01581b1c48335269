package warden.system.filter;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import warden.adapter.in.problem.AuthProblem;
import warden.core.model.ratelimit.EndpointClass;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.service.ratelimit.RateLimitService;

/**
 * Enforces per-client request budgets on the credential endpoints.
 *
 * <p>Runs after admission control and before any resource method. A rejected
 * request is answered with 429 and {@code Retry-After},
 * {@code X-RateLimit-Limit}, {@code X-RateLimit-Remaining} and
 * {@code X-RateLimit-Window} headers. Allowed requests get the same budget
 * headers on their response when {@code warden.rate-limit.include-headers} is set.
 *
 * <p>Clients are keyed by {@link ClientAddress}; forwarding headers count only
 * when the peer is one of {@code warden.rate-limit.trusted-proxies}.
 */
public class RateLimitFilter {

    static final String RATE_LIMIT_DECISION_ATTR = "warden.ratelimit.decision";
    private static final String AUTH_PATH_PREFIX = "/auth";
    private static final String PROBLEM_JSON = "application/problem+json";

    private final RateLimitService rateLimitService;
    private final TrustedProxies trustedProxies;

    @Inject
    public RateLimitFilter(RateLimitService rateLimitService, TrustedProxies trustedProxies) {
        this.rateLimitService = rateLimitService;
        this.trustedProxies = trustedProxies;
    }

    @ServerRequestFilter(priority = Priorities.AUTHENTICATION - 100)
    public Uni<Response> filter(ContainerRequestContext requestContext, HttpServerRequest request) {
        final var path = requestContext.getUriInfo().getPath();
        if (path == null || !path.startsWith(AUTH_PATH_PREFIX)) {
            return Uni.createFrom().nullItem();
        }

        final var clientIp = ClientAddress.resolve(requestContext, request, trustedProxies);
        final var endpointClass = EndpointClass.forPath(path);

        return rateLimitService.check(clientIp, endpointClass).map(decision -> {
            requestContext.setProperty(RATE_LIMIT_DECISION_ATTR, decision);
            if (!decision.allowed()) {
                return buildRateLimitResponse(decision);
            }
            return null;
        });
    }

    @ServerResponseFilter
    public void addHeaders(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (!rateLimitService.includeHeaders()) {
            return;
        }
        final var decision = (RateLimitDecision) requestContext.getProperty(RATE_LIMIT_DECISION_ATTR);
        if (decision != null && decision.allowed() && decision.windowSeconds() > 0) {
            responseContext.getHeaders().putSingle("X-RateLimit-Limit", decision.limit());
            responseContext.getHeaders().putSingle("X-RateLimit-Remaining", decision.remaining());
            responseContext.getHeaders().putSingle("X-RateLimit-Window", decision.windowSeconds());
        }
    }

    private Response buildRateLimitResponse(RateLimitDecision decision) {
        return Response.status(Response.Status.TOO_MANY_REQUESTS)
                .type(PROBLEM_JSON)
                .header("Retry-After", decision.retryAfterSeconds())
                .header("X-RateLimit-Limit", decision.limit())
                .header("X-RateLimit-Remaining", 0)
                .header("X-RateLimit-Window", decision.windowSeconds())
                .entity(AuthProblem.tooManyRequests(decision))
                .build();
    }
}
