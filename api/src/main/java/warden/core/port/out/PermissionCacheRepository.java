package warden.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.SubjectAuthorization;

/**
 * Shared cache of resolved authorization snapshots, keyed {@code permissions:{subject}}.
 *
 * <p>The cache is advisory. Entries may disappear at any time; the relational
 * store remains the source of truth.
 */
public interface PermissionCacheRepository {

    /**
     * Look up a cached snapshot.
     *
     * @param subjectId the subject
     * @return Uni with the snapshot, or empty on a miss
     */
    Uni<Optional<SubjectAuthorization>> get(String subjectId);

    /**
     * Store a snapshot.
     *
     * @param subjectId     the subject
     * @param authorization the snapshot
     * @param ttl           entry lifetime
     * @return Uni completing when stored
     */
    Uni<Void> put(String subjectId, SubjectAuthorization authorization, Duration ttl);

    /**
     * Remove a subject's snapshot.
     *
     * @param subjectId the subject
     * @return Uni with true if an entry was removed
     */
    Uni<Boolean> invalidate(String subjectId);

    /**
     * Remove every snapshot without blocking the store (incremental scan and delete).
     *
     * @return Uni with the number of entries removed
     */
    Uni<Long> invalidateAll();
}
