package warden.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.ClientContext;
import warden.core.model.auth.TokenPair;
import warden.core.model.session.RefreshTokenRecord;
import warden.core.model.session.RevokeAllResult;

/**
 * Use cases for the session lifecycle.
 *
 * <p>Failures are reported as {@link warden.core.model.auth.AuthException}.
 */
public interface SessionManagement {

    /**
     * Authenticate with email and password and open a new session.
     *
     * @param email    login email
     * @param password password; wiped once verified
     * @param client   request metadata, device info included
     * @return Uni with the access and refresh tokens
     */
    Uni<TokenPair> login(String email, char[] password, ClientContext client);

    /**
     * Exchange a refresh token for a new token pair, revoking the presented one.
     *
     * @param refreshToken the opaque refresh secret
     * @return Uni with the new token pair
     */
    Uni<TokenPair> refresh(String refreshToken);

    /**
     * End the session an access token belongs to. Expired tokens are accepted.
     *
     * @param accessToken the compact JWS
     * @return Uni completing when the session is ended
     */
    Uni<Void> logout(String accessToken);

    /**
     * Revoke every session and access token of a subject.
     *
     * @param subjectId the subject
     * @return Uni with revocation counts
     */
    Uni<RevokeAllResult> revokeAll(String subjectId);

    /**
     * List a subject's unrevoked, unexpired sessions, newest first.
     *
     * @param subjectId the subject
     * @return Uni with one record per live session
     */
    Uni<List<RefreshTokenRecord>> listSessions(String subjectId);
}
