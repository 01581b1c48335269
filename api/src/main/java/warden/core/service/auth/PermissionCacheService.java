package warden.core.service.auth;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.PermissionCacheConfig;
import warden.core.model.auth.SubjectAuthorization;
import warden.core.port.out.PermissionCacheRepository;
import warden.core.port.out.RbacRepository;
import warden.core.service.common.StoreRetry;

/**
 * Cache-aside resolution of a subject's roles and permissions.
 *
 * <p>Cache reads degrade to a miss and cache writes are best-effort; the RBAC
 * tables are the source of truth. Invalidations are retried and then fail,
 * so a mutation never reports success while the old entry may survive. A
 * resolve racing an invalidation may write a stale entry; the TTL bounds it.
 */
@ApplicationScoped
public class PermissionCacheService {

    private static final Logger LOG = Logger.getLogger(PermissionCacheService.class);

    private final PermissionCacheRepository cache;
    private final RbacRepository rbac;
    private final PermissionCacheConfig config;
    private final StoreRetry storeRetry;
    private final Clock clock;

    public PermissionCacheService(
            PermissionCacheRepository cache,
            RbacRepository rbac,
            PermissionCacheConfig config,
            StoreRetry storeRetry,
            Clock clock) {
        this.cache = cache;
        this.rbac = rbac;
        this.config = config;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    /**
     * Resolve a subject's authorization, from the cache when present.
     *
     * @param subjectId the subject
     * @return Uni with the snapshot
     */
    public Uni<SubjectAuthorization> resolve(String subjectId) {
        return cache.get(subjectId)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Permission cache read failed for {0}, treating as miss: {1}", subjectId, error.getMessage());
                    return Optional.empty();
                })
                .chain(cached -> {
                    if (cached.isPresent()) {
                        LOG.debugf("Permission cache hit for %s", subjectId);
                        return Uni.createFrom().item(cached.get());
                    }
                    return load(subjectId);
                });
    }

    /**
     * Drop one subject's cached entry.
     *
     * @param subjectId the subject
     * @return Uni with true if an entry existed
     */
    public Uni<Boolean> invalidate(String subjectId) {
        return storeRetry.failClosed(() -> cache.invalidate(subjectId), "invalidatePermissions");
    }

    /**
     * Drop every cached entry.
     *
     * @return Uni with the number of entries removed
     */
    public Uni<Long> invalidateAll() {
        return storeRetry.failClosed(cache::invalidateAll, "invalidateAllPermissions");
    }

    /**
     * Drop the entries of several subjects, or every entry when more subjects
     * are affected than the configured fan-out limit.
     *
     * @param subjectIds affected subjects
     * @return Uni completing when invalidated
     */
    public Uni<Void> invalidateSubjects(List<String> subjectIds) {
        if (subjectIds.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        if (subjectIds.size() > config.roleFanoutLimit()) {
            LOG.infof(
                    "%d subjects affected (limit %d), invalidating all permission cache entries",
                    subjectIds.size(), config.roleFanoutLimit());
            return invalidateAll().replaceWithVoid();
        }
        return Multi.createFrom()
                .iterable(subjectIds)
                .onItem()
                .transformToUniAndConcatenate(this::invalidate)
                .collect()
                .last()
                .replaceWithVoid();
    }

    private Uni<SubjectAuthorization> load(String subjectId) {
        return storeRetry
                .failClosed(() -> rbac.resolveAuthorization(subjectId, clock.instant()), "resolveAuthorization")
                .call(authorization -> cache.put(subjectId, authorization, config.ttl())
                        .onFailure()
                        .recoverWithItem(error -> {
                            LOG.warnv("Permission cache write failed for {0}: {1}", subjectId, error.getMessage());
                            return null;
                        }));
    }
}
