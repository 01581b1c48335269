package warden.core.service.auth;

import java.time.Clock;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.AuthErrorCode;
import warden.core.model.auth.AuthException;
import warden.core.model.auth.Permission;
import warden.core.port.in.AuthorizationManagement;
import warden.core.port.out.RbacRepository;
import warden.core.service.common.StoreRetry;

/**
 * RBAC mutations with permission cache invalidation.
 *
 * <p>The table change is committed first and the cache invalidated after it,
 * so a concurrent resolve cannot re-cache the old snapshot once the mutation
 * has returned (apart from the race bounded by the cache TTL).
 */
@ApplicationScoped
public class AuthorizationAdminService implements AuthorizationManagement {

    private static final Logger LOG = Logger.getLogger(AuthorizationAdminService.class);

    private final RbacRepository rbac;
    private final PermissionCacheService permissionCache;
    private final StoreRetry storeRetry;
    private final Clock clock;

    public AuthorizationAdminService(
            RbacRepository rbac, PermissionCacheService permissionCache, StoreRetry storeRetry, Clock clock) {
        this.rbac = rbac;
        this.permissionCache = permissionCache;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    @Override
    public Uni<Boolean> assignRole(String subjectId, String roleName, Instant expiresAt) {
        return storeRetry
                .failClosed(() -> rbac.assignRole(subjectId, roleName, expiresAt), "assignRole")
                .call(assigned -> assigned ? permissionCache.invalidate(subjectId) : Uni.createFrom().voidItem())
                .invoke(assigned -> LOG.infof("Assign role %s to %s: %s", roleName, subjectId, assigned));
    }

    @Override
    public Uni<Boolean> unassignRole(String subjectId, String roleName) {
        return storeRetry
                .failClosed(() -> rbac.unassignRole(subjectId, roleName), "unassignRole")
                .call(removed -> removed ? permissionCache.invalidate(subjectId) : Uni.createFrom().voidItem())
                .invoke(removed -> LOG.infof("Unassign role %s from %s: %s", roleName, subjectId, removed));
    }

    @Override
    public Uni<Boolean> grantPermission(String roleName, Permission permission) {
        return storeRetry
                .failClosed(() -> rbac.grantPermission(roleName, permission), "grantPermission")
                .call(granted -> granted ? invalidateRoleHolders(roleName) : Uni.createFrom().voidItem())
                .invoke(granted -> LOG.infof("Grant %s to role %s: %s", permission, roleName, granted));
    }

    @Override
    public Uni<Boolean> revokePermission(String roleName, Permission permission) {
        return storeRetry
                .failClosed(() -> rbac.revokePermission(roleName, permission), "revokePermission")
                .call(revoked -> revoked ? invalidateRoleHolders(roleName) : Uni.createFrom().voidItem())
                .invoke(revoked -> LOG.infof("Revoke %s from role %s: %s", permission, roleName, revoked));
    }

    @Override
    public Uni<Boolean> deleteRole(String roleName) {
        return storeRetry.failClosed(() -> rbac.findRole(roleName), "findRole").chain(role -> {
            if (role.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            if (role.get().system()) {
                LOG.warnv("Refusing to delete system role {0}", roleName);
                return Uni.createFrom().failure(new AuthException(AuthErrorCode.SYSTEM_ROLE_PROTECTED));
            }
            // Holders must be read before the role disappears from the join
            return storeRetry
                    .failClosed(() -> rbac.findSubjectsWithRole(roleName), "findSubjectsWithRole")
                    .chain(holders -> storeRetry
                            .failClosed(() -> rbac.deleteRole(roleName, clock.instant()), "deleteRole")
                            .call(deleted -> deleted
                                    ? permissionCache.invalidateSubjects(holders)
                                    : Uni.createFrom().voidItem()))
                    .invoke(deleted -> LOG.infof("Delete role %s: %s", roleName, deleted));
        });
    }

    private Uni<Void> invalidateRoleHolders(String roleName) {
        return storeRetry
                .failClosed(() -> rbac.findSubjectsWithRole(roleName), "findSubjectsWithRole")
                .chain(permissionCache::invalidateSubjects);
    }
}
