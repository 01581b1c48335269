package warden.core.port.in;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.Permission;

/**
 * Use cases for changing role assignments and role grants.
 *
 * <p>Every successful mutation invalidates the cached authorization of the
 * affected subjects before it completes.
 */
public interface AuthorizationManagement {

    /**
     * Assign a role to a subject.
     *
     * @param subjectId the subject
     * @param roleName  the role
     * @param expiresAt assignment expiry, null for none
     * @return Uni with true if the role exists and was assigned
     */
    Uni<Boolean> assignRole(String subjectId, String roleName, Instant expiresAt);

    /**
     * Remove a role from a subject.
     *
     * @return Uni with true if an assignment was removed
     */
    Uni<Boolean> unassignRole(String subjectId, String roleName);

    /**
     * Grant a permission to a role.
     *
     * @return Uni with true if the role exists
     */
    Uni<Boolean> grantPermission(String roleName, Permission permission);

    /**
     * Revoke a permission from a role.
     *
     * @return Uni with true if a grant was removed
     */
    Uni<Boolean> revokePermission(String roleName, Permission permission);

    /**
     * Delete a role. System roles cannot be deleted.
     *
     * @return Uni with true if the role was deleted; fails with SYSTEM_ROLE_PROTECTED for system roles
     */
    Uni<Boolean> deleteRole(String roleName);
}
