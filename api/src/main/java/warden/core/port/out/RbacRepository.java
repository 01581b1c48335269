package warden.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.Permission;
import warden.core.model.auth.Role;
import warden.core.model.auth.SubjectAuthorization;

/**
 * Role-based access control tables: roles, permissions, role assignments and
 * role-permission grants. Soft-deleted rows are invisible to every method.
 */
public interface RbacRepository {

    /**
     * Resolve a subject's roles and permissions with a single join query.
     *
     * <p>Assignments that expired before {@code now} are ignored.
     *
     * @param subjectId the subject
     * @param now       reference time for assignment expiry
     * @return Uni with the snapshot (empty lists when the subject has no roles)
     */
    Uni<SubjectAuthorization> resolveAuthorization(String subjectId, Instant now);

    /**
     * List subjects holding a role, expired assignments included.
     *
     * @param roleName the role
     * @return Uni with subject ids
     */
    Uni<List<String>> findSubjectsWithRole(String roleName);

    /**
     * Find a role by name.
     *
     * @param roleName the role
     * @return Uni with the role, or empty
     */
    Uni<Optional<Role>> findRole(String roleName);

    /**
     * Assign a role, replacing the expiry of an existing assignment.
     *
     * @param subjectId the subject
     * @param roleName  the role
     * @param expiresAt assignment expiry, null for none
     * @return Uni with true if the role exists and was assigned
     */
    Uni<Boolean> assignRole(String subjectId, String roleName, Instant expiresAt);

    /**
     * Remove a role assignment.
     *
     * @return Uni with true if an assignment was removed
     */
    Uni<Boolean> unassignRole(String subjectId, String roleName);

    /**
     * Grant a permission to a role, creating the permission if needed.
     *
     * @return Uni with true if the role exists and the grant is in place
     */
    Uni<Boolean> grantPermission(String roleName, Permission permission);

    /**
     * Remove a permission from a role.
     *
     * @return Uni with true if a grant was removed
     */
    Uni<Boolean> revokePermission(String roleName, Permission permission);

    /**
     * Soft-delete a role.
     *
     * @return Uni with true if a role was deleted
     */
    Uni<Boolean> deleteRole(String roleName, Instant now);
}
