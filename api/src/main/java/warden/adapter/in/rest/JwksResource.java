package warden.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import warden.core.port.out.TokenCodec;

/**
 * Publishes the public signing key so other services can verify access tokens.
 *
 * <p>The response follows the JWKS format defined in RFC 7517.
 */
@Path("/.well-known/jwks.json")
@ApplicationScoped
public class JwksResource {

    private static final int CACHE_MAX_AGE_SECONDS = 3600;

    private final TokenCodec tokenCodec;

    public JwksResource(TokenCodec tokenCodec) {
        this.tokenCodec = tokenCodec;
    }

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public Response getJwks() {
        return Response.ok(tokenCodec.publicKeySetJson())
                .header("Cache-Control", "public, max-age=" + CACHE_MAX_AGE_SECONDS)
                .build();
    }
}
