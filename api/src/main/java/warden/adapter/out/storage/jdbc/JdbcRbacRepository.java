package warden.adapter.out.storage.jdbc;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.Permission;
import warden.core.model.auth.Role;
import warden.core.model.auth.SubjectAuthorization;
import warden.core.port.out.RbacRepository;

/**
 * PostgreSQL RBAC tables.
 *
 * <p>Soft-deleted roles and permissions are filtered in every query; role
 * assignments and grants are hard-deleted.
 */
public class JdbcRbacRepository implements RbacRepository {

    private static final String RESOLVE_AUTHORIZATION =
            """
            SELECT r.name AS role_name, p.resource, p.action
            FROM role_assignments ra
            JOIN roles r ON r.id = ra.role_id AND r.deleted_at IS NULL
            LEFT JOIN role_permissions rp ON rp.role_id = r.id
            LEFT JOIN permissions p ON p.id = rp.permission_id AND p.deleted_at IS NULL
            WHERE ra.subject_id = ?
              AND (ra.expires_at IS NULL OR ra.expires_at > ?)
            """;

    private static final String FIND_SUBJECTS_WITH_ROLE =
            """
            SELECT ra.subject_id
            FROM role_assignments ra
            JOIN roles r ON r.id = ra.role_id
            WHERE r.name = ? AND r.deleted_at IS NULL
            ORDER BY ra.subject_id
            """;

    private static final String FIND_ROLE =
            "SELECT name, description, is_system FROM roles WHERE name = ? AND deleted_at IS NULL";

    private static final String ASSIGN_ROLE =
            """
            INSERT INTO role_assignments (subject_id, role_id, expires_at)
            SELECT ?, id, ? FROM roles WHERE name = ? AND deleted_at IS NULL
            ON CONFLICT (subject_id, role_id) DO UPDATE SET expires_at = EXCLUDED.expires_at
            """;

    private static final String UNASSIGN_ROLE =
            """
            DELETE FROM role_assignments
            WHERE subject_id = ?
              AND role_id = (SELECT id FROM roles WHERE name = ? AND deleted_at IS NULL)
            """;

    private static final String FIND_ROLE_ID = "SELECT id FROM roles WHERE name = ? AND deleted_at IS NULL";

    private static final String UPSERT_PERMISSION =
            """
            INSERT INTO permissions (resource, action) VALUES (?, ?)
            ON CONFLICT (resource, action) DO UPDATE SET deleted_at = NULL
            RETURNING id
            """;

    private static final String GRANT_PERMISSION =
            "INSERT INTO role_permissions (role_id, permission_id) VALUES (?, ?) ON CONFLICT DO NOTHING";

    private static final String REVOKE_PERMISSION =
            """
            DELETE FROM role_permissions
            WHERE role_id = (SELECT id FROM roles WHERE name = ? AND deleted_at IS NULL)
              AND permission_id = (SELECT id FROM permissions WHERE resource = ? AND action = ?)
            """;

    private static final String DELETE_ROLE =
            "UPDATE roles SET deleted_at = ? WHERE name = ? AND deleted_at IS NULL AND is_system = FALSE";

    private final JdbcExecutor jdbc;

    public JdbcRbacRepository(JdbcExecutor jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Uni<SubjectAuthorization> resolveAuthorization(String subjectId, Instant now) {
        return jdbc.query("resolveAuthorization", connection -> {
            try (var ps = jdbc.prepare(connection, RESOLVE_AUTHORIZATION)) {
                ps.setString(1, subjectId);
                ps.setTimestamp(2, JdbcExecutor.timestamp(now));
                try (var rs = ps.executeQuery()) {
                    final var roles = new ArrayList<String>();
                    final var permissions = new ArrayList<String>();
                    while (rs.next()) {
                        roles.add(rs.getString("role_name"));
                        final var resource = rs.getString("resource");
                        if (resource != null) {
                            permissions.add(new Permission(resource, rs.getString("action")).value());
                        }
                    }
                    return new SubjectAuthorization(roles, permissions);
                }
            }
        });
    }

    @Override
    public Uni<List<String>> findSubjectsWithRole(String roleName) {
        return jdbc.query("findSubjectsWithRole", connection -> {
            try (var ps = jdbc.prepare(connection, FIND_SUBJECTS_WITH_ROLE)) {
                ps.setString(1, roleName);
                try (var rs = ps.executeQuery()) {
                    final var subjects = new ArrayList<String>();
                    while (rs.next()) {
                        subjects.add(rs.getString(1));
                    }
                    return List.copyOf(subjects);
                }
            }
        });
    }

    @Override
    public Uni<Optional<Role>> findRole(String roleName) {
        return jdbc.query("findRole", connection -> {
            try (var ps = jdbc.prepare(connection, FIND_ROLE)) {
                ps.setString(1, roleName);
                try (var rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<Role>empty();
                    }
                    return Optional.of(new Role(
                            rs.getString("name"), rs.getString("description"), rs.getBoolean("is_system")));
                }
            }
        });
    }

    @Override
    public Uni<Boolean> assignRole(String subjectId, String roleName, Instant expiresAt) {
        return jdbc.query("assignRole", connection -> {
            try (var ps = jdbc.prepare(connection, ASSIGN_ROLE)) {
                ps.setString(1, subjectId);
                ps.setTimestamp(2, JdbcExecutor.timestamp(expiresAt));
                ps.setString(3, roleName);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public Uni<Boolean> unassignRole(String subjectId, String roleName) {
        return jdbc.query("unassignRole", connection -> {
            try (var ps = jdbc.prepare(connection, UNASSIGN_ROLE)) {
                ps.setString(1, subjectId);
                ps.setString(2, roleName);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public Uni<Boolean> grantPermission(String roleName, Permission permission) {
        return jdbc.inTransaction("grantPermission", connection -> {
            final long roleId;
            try (var ps = jdbc.prepare(connection, FIND_ROLE_ID)) {
                ps.setString(1, roleName);
                try (var rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return false;
                    }
                    roleId = rs.getLong(1);
                }
            }
            final long permissionId;
            try (var ps = jdbc.prepare(connection, UPSERT_PERMISSION)) {
                ps.setString(1, permission.resource());
                ps.setString(2, permission.action());
                try (var rs = ps.executeQuery()) {
                    rs.next();
                    permissionId = rs.getLong(1);
                }
            }
            try (var ps = jdbc.prepare(connection, GRANT_PERMISSION)) {
                ps.setLong(1, roleId);
                ps.setLong(2, permissionId);
                ps.executeUpdate();
            }
            return true;
        });
    }

    @Override
    public Uni<Boolean> revokePermission(String roleName, Permission permission) {
        return jdbc.query("revokePermission", connection -> {
            try (var ps = jdbc.prepare(connection, REVOKE_PERMISSION)) {
                ps.setString(1, roleName);
                ps.setString(2, permission.resource());
                ps.setString(3, permission.action());
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public Uni<Boolean> deleteRole(String roleName, Instant now) {
        return jdbc.query("deleteRole", connection -> {
            try (var ps = jdbc.prepare(connection, DELETE_ROLE)) {
                ps.setTimestamp(1, JdbcExecutor.timestamp(now));
                ps.setString(2, roleName);
                return ps.executeUpdate() > 0;
            }
        });
    }
}
