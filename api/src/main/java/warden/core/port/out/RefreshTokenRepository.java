package warden.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.LoginRecord;
import warden.core.model.session.RefreshTokenRecord;

/**
 * Durable refresh-token records.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>{@link #rotate} MUST be linearizable per record across processes: of any
 *       number of concurrent calls for the same {@code currentId}, at most one
 *       returns true. In-process locks do not satisfy this.</li>
 *   <li>Records are only ever mutated by setting {@code revoked_at}.</li>
 *   <li>Store failures MUST surface as
 *       {@link warden.core.model.common.StoreUnavailableException}.</li>
 * </ul>
 */
public interface RefreshTokenRepository {

    /**
     * Find a record by the hash of its refresh secret, regardless of state.
     *
     * @param tokenHash SHA-256 hex of the secret
     * @return Uni with the record, or empty
     */
    Uni<Optional<RefreshTokenRecord>> findByTokenHash(String tokenHash);

    /**
     * Persist a login in one transaction: insert the refresh record, update the
     * account's last login time and append the login history row.
     *
     * @param record the new refresh record
     * @param login  the login history row
     * @return Uni completing when committed
     */
    Uni<Void> saveLogin(RefreshTokenRecord record, LoginRecord login);

    /**
     * Append a failed login attempt against a known account to the login history.
     *
     * @param attempt the failed attempt ({@code success == false})
     * @return Uni completing when written
     */
    Uni<Void> recordFailedLogin(LoginRecord attempt);

    /**
     * Revoke {@code currentId} and insert {@code successor} in one transaction,
     * only if {@code currentId} is still unrevoked.
     *
     * @param currentId the record being rotated
     * @param successor the record replacing it
     * @param now       revocation time
     * @return Uni with true if this call performed the rotation, false if the
     *         record had already been revoked (a concurrent rotation won)
     */
    Uni<Boolean> rotate(UUID currentId, RefreshTokenRecord successor, Instant now);

    /**
     * Revoke the session chain of the record issued together with an access token.
     *
     * <p>The paired record may already have been rotated; every unrevoked record
     * of the same chain is revoked, so logging out with an older access token
     * still ends the session.
     *
     * @param subjectId owning subject
     * @param accessJti jti of the paired access token
     * @param now       revocation time
     * @return Uni with the number of records revoked
     */
    Uni<Integer> revokeChainByAccessJti(String subjectId, String accessJti, Instant now);

    /**
     * Revoke every unrevoked record of a session chain.
     *
     * @param chainId the chain
     * @param now     revocation time
     * @return Uni with the number of records revoked
     */
    Uni<Integer> revokeChain(UUID chainId, Instant now);

    /**
     * Revoke every unrevoked record of a subject.
     *
     * @param subjectId the subject
     * @param now       revocation time
     * @return Uni with the number of records revoked
     */
    Uni<Integer> revokeAllForSubject(String subjectId, Instant now);

    /**
     * List a subject's unrevoked, unexpired records, newest first.
     *
     * @param subjectId the subject
     * @param now       reference time for expiry
     * @return Uni with the records
     */
    Uni<List<RefreshTokenRecord>> findActiveBySubject(String subjectId, Instant now);
}
