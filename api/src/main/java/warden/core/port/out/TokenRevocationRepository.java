package warden.core.port.out;

import java.time.Duration;
import java.util.Set;

import io.smallrye.mutiny.Uni;

/**
 * Storage for the revocation registry.
 *
 * <p>Holds two kinds of entries:
 * <ul>
 *   <li>{@code blacklist:{jti}} - revoked access-token ids, each expiring when
 *       the token itself would have expired</li>
 *   <li>{@code active_tokens:{subject}} - the set of access-token ids issued to a
 *       subject and not yet expired, used to revoke every session at once</li>
 * </ul>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Entries MUST expire automatically based on the provided TTL</li>
 *   <li>All operations MUST be non-blocking</li>
 *   <li>Store failures MUST surface as
 *       {@link warden.core.model.common.StoreUnavailableException}; a failed
 *       lookup must never be reported as "not blacklisted"</li>
 *   <li>Every operation MUST be idempotent</li>
 * </ul>
 *
 * @see warden.adapter.out.storage.redis.RedisTokenRevocationRepository
 */
public interface TokenRevocationRepository {

    /**
     * Record a jti as active for a subject.
     *
     * <p>The set's expiry is refreshed to {@code ttl}, so it outlives every
     * member and disappears once the newest token has expired.
     *
     * @param subjectId the subject
     * @param jti       the access-token id
     * @param ttl       access-token lifetime
     * @return Uni completing when stored
     */
    Uni<Void> registerActive(String subjectId, String jti, Duration ttl);

    /**
     * Remove a jti from a subject's active set.
     *
     * @param subjectId the subject
     * @param jti       the access-token id
     * @return Uni completing when removed
     */
    Uni<Void> unregisterActive(String subjectId, String jti);

    /**
     * Check whether a jti is blacklisted.
     *
     * @param jti the access-token id
     * @return Uni with true if blacklisted
     */
    Uni<Boolean> isBlacklisted(String jti);

    /**
     * Blacklist a jti.
     *
     * <p>A zero or negative {@code ttl} means the token has already expired;
     * nothing is written.
     *
     * @param jti the access-token id
     * @param ttl remaining lifetime of the token
     * @return Uni completing when stored
     */
    Uni<Void> blacklist(String jti, Duration ttl);

    /**
     * Read every jti currently in a subject's active set.
     *
     * @param subjectId the subject
     * @return Uni with the jtis, empty when none
     */
    Uni<Set<String>> activeJtis(String subjectId);

    /**
     * Delete a subject's active set.
     *
     * @param subjectId the subject
     * @return Uni completing when deleted
     */
    Uni<Void> clearActive(String subjectId);
}
