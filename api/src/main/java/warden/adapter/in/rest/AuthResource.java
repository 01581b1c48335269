package warden.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import warden.adapter.in.dto.LoginRequest;
import warden.adapter.in.dto.RefreshRequest;
import warden.adapter.in.dto.RevokeAllResponse;
import warden.adapter.in.dto.SessionResponse;
import warden.adapter.in.dto.TokenResponse;
import warden.adapter.in.problem.AuthProblem;
import warden.core.model.auth.ClientContext;
import warden.core.port.in.SessionManagement;
import warden.core.service.auth.AccessTokenAuthenticator;
import warden.system.filter.ClientAddress;
import warden.system.filter.TrustedProxies;

/**
 * REST resource for the session lifecycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /auth/login} - exchange credentials for a token pair</li>
 *   <li>{@code POST /auth/refresh} - rotate a refresh token</li>
 *   <li>{@code POST /auth/logout} - end the session of the bearer token</li>
 *   <li>{@code DELETE /auth/sessions} - end every session of the bearer's subject</li>
 *   <li>{@code GET /auth/sessions} - list the bearer's active sessions</li>
 * </ul>
 */
@Path("/auth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionManagement sessions;
    private final AccessTokenAuthenticator authenticator;
    private final TrustedProxies trustedProxies;

    public AuthResource(
            SessionManagement sessions, AccessTokenAuthenticator authenticator, TrustedProxies trustedProxies) {
        this.sessions = sessions;
        this.authenticator = authenticator;
        this.trustedProxies = trustedProxies;
    }

    @POST
    @Path("/login")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<TokenResponse> login(
            @Valid @NotNull LoginRequest request,
            @Context HttpHeaders headers,
            @Context HttpServerRequest httpRequest) {
        final var client = new ClientContext(
                ClientAddress.resolve(
                        headers.getHeaderString("Forwarded"),
                        headers.getHeaderString("X-Forwarded-For"),
                        ClientAddress.remoteHost(httpRequest),
                        trustedProxies),
                headers.getHeaderString(HttpHeaders.USER_AGENT),
                request.deviceInfo());

        return sessions.login(request.email(), request.password().toCharArray(), client)
                .map(TokenResponse::from);
    }

    @POST
    @Path("/refresh")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<TokenResponse> refresh(@Valid @NotNull RefreshRequest request) {
        return sessions.refresh(request.refreshToken()).map(TokenResponse::from);
    }

    @POST
    @Path("/logout")
    public Uni<Response> logout(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var token = bearerToken(authorization);
        return sessions.logout(token).map(ignored -> Response.noContent().build());
    }

    @DELETE
    @Path("/sessions")
    public Uni<RevokeAllResponse> revokeAll(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var token = bearerToken(authorization);
        return authenticator
                .authenticate(token)
                .chain(claims -> {
                    LOG.infof("Revoke-all requested by subject %s", claims.subject());
                    return sessions.revokeAll(claims.subject());
                })
                .map(RevokeAllResponse::from);
    }

    @GET
    @Path("/sessions")
    public Uni<List<SessionResponse>> listSessions(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var token = bearerToken(authorization);
        return authenticator
                .authenticate(token)
                .chain(claims -> sessions.listSessions(claims.subject()))
                .map(records -> records.stream().map(SessionResponse::from).toList());
    }

    static String bearerToken(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw AuthProblem.unauthorized("Bearer token required");
        }
        final var token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw AuthProblem.unauthorized("Bearer token required");
        }
        return token;
    }
}
