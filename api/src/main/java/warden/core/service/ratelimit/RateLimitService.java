package warden.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.RateLimitConfig;
import warden.core.model.common.SecurityEvent;
import warden.core.model.ratelimit.EndpointClass;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.port.out.Metrics;
import warden.core.port.out.RateLimiter;
import warden.core.port.out.SecurityMonitoring;
import warden.core.util.SecureHash;

/**
 * Applies per-client, per-endpoint-class request budgets.
 *
 * <p>Client identifiers are hashed before they become part of a counter key.
 */
@ApplicationScoped
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    private static final int CLIENT_HASH_LENGTH = 16;

    private final RateLimiter rateLimiter;
    private final RateLimitConfig config;
    private final Metrics metrics;
    private final SecurityMonitoring securityMonitoring;
    private final Clock clock;

    public RateLimitService(
            RateLimiter rateLimiter,
            RateLimitConfig config,
            Metrics metrics,
            SecurityMonitoring securityMonitoring,
            Clock clock) {
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.metrics = metrics;
        this.securityMonitoring = securityMonitoring;
        this.clock = clock;
    }

    /**
     * Fail startup on budgets the counter keys cannot represent.
     *
     * @param event the startup event
     */
    void onStart(@Observes StartupEvent event) {
        validateLimits();
    }

    /**
     * Windows are counted in whole seconds, so each must be at least one second long.
     *
     * @throws IllegalStateException if any endpoint class is misconfigured
     */
    void validateLimits() {
        final var errors = new ArrayList<String>();
        for (final var endpointClass : EndpointClass.values()) {
            final var limit = limitFor(endpointClass);
            if (limit.window() == null || limit.window().toSeconds() < 1) {
                errors.add(endpointClass.key() + ".window must be at least PT1S, got: " + limit.window());
            }
            if (limit.requests() < 1) {
                errors.add(endpointClass.key() + ".requests must be at least 1, got: " + limit.requests());
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid warden.rate-limit configuration: " + String.join("; ", errors));
        }
        LOG.debug("Rate limit configuration validated");
    }

    /**
     * Budget of one endpoint class.
     *
     * @param requests requests per window
     * @param window   window length
     */
    public record EndpointLimit(long requests, Duration window) {}

    /**
     * Count a request and decide whether it may proceed.
     *
     * @param clientId      raw client identifier (address)
     * @param endpointClass endpoint class of the request
     * @return Uni with the decision
     */
    public Uni<RateLimitDecision> check(String clientId, EndpointClass endpointClass) {
        if (!config.enabled() || !rateLimiter.isEnabled()) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }

        final var limit = limitFor(endpointClass);
        final var clientHash = SecureHash.truncatedSha256(clientId == null ? "unknown" : clientId, CLIENT_HASH_LENGTH);
        final var key = RateLimitKey.forWindow(clientHash, endpointClass, limit.window(), clock.instant());

        return rateLimiter.checkAndIncrement(key, limit.requests(), limit.window()).invoke(decision -> {
            if (!decision.allowed()) {
                LOG.debugf(
                        "Rate limit exceeded for %s on %s (%d/%d)",
                        clientHash, endpointClass.key(), decision.requestCount(), decision.limit());
                metrics.recordRateLimited(endpointClass.key());
                securityMonitoring.record(new SecurityEvent.RateLimitExceeded(
                        clock.instant(), clientHash, endpointClass.key(), decision.requestCount(), decision.limit()));
            }
        });
    }

    public EndpointLimit limitFor(EndpointClass endpointClass) {
        return switch (endpointClass) {
            case LOGIN -> new EndpointLimit(config.login().requests(), config.login().window());
            case REFRESH -> new EndpointLimit(config.refresh().requests(), config.refresh().window());
            case LOGOUT -> new EndpointLimit(config.logout().requests(), config.logout().window());
            case DEFAULT -> new EndpointLimit(config.defaults().requests(), config.defaults().window());
        };
    }

    public boolean includeHeaders() {
        return config.includeHeaders();
    }
}
