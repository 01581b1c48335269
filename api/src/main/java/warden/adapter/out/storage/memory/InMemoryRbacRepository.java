package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.Permission;
import warden.core.model.auth.Role;
import warden.core.model.auth.SubjectAuthorization;
import warden.core.port.out.RbacRepository;

/**
 * In-memory RBAC tables for development and testing.
 *
 * <p>Deleted roles are removed outright together with their grants and
 * assignments.
 */
public class InMemoryRbacRepository implements RbacRepository {

    private final Map<String, Role> roles = new HashMap<>();
    private final Map<String, Set<Permission>> grants = new HashMap<>();
    // subject -> role -> expiry (null for none)
    private final Map<String, Map<String, Instant>> assignments = new HashMap<>();

    @Override
    public Uni<SubjectAuthorization> resolveAuthorization(String subjectId, Instant now) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                final var roleNames = new ArrayList<String>();
                final var permissions = new ArrayList<String>();
                assignments.getOrDefault(subjectId, Map.of()).forEach((roleName, expiresAt) -> {
                    if (!roles.containsKey(roleName) || (expiresAt != null && !now.isBefore(expiresAt))) {
                        return;
                    }
                    roleNames.add(roleName);
                    grants.getOrDefault(roleName, Set.of()).forEach(p -> permissions.add(p.value()));
                });
                return new SubjectAuthorization(roleNames, permissions);
            }
        });
    }

    @Override
    public Uni<List<String>> findSubjectsWithRole(String roleName) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                return assignments.entrySet().stream()
                        .filter(e -> e.getValue().containsKey(roleName))
                        .map(Map.Entry::getKey)
                        .sorted()
                        .toList();
            }
        });
    }

    @Override
    public Uni<Optional<Role>> findRole(String roleName) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                return Optional.ofNullable(roles.get(roleName));
            }
        });
    }

    @Override
    public Uni<Boolean> assignRole(String subjectId, String roleName, Instant expiresAt) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                if (!roles.containsKey(roleName)) {
                    return false;
                }
                assignments.computeIfAbsent(subjectId, k -> new HashMap<>()).put(roleName, expiresAt);
                return true;
            }
        });
    }

    @Override
    public Uni<Boolean> unassignRole(String subjectId, String roleName) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                final var held = assignments.get(subjectId);
                if (held == null || !held.containsKey(roleName)) {
                    return false;
                }
                held.remove(roleName);
                return true;
            }
        });
    }

    @Override
    public Uni<Boolean> grantPermission(String roleName, Permission permission) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                if (!roles.containsKey(roleName)) {
                    return false;
                }
                grants.computeIfAbsent(roleName, k -> new LinkedHashSet<>()).add(permission);
                return true;
            }
        });
    }

    @Override
    public Uni<Boolean> revokePermission(String roleName, Permission permission) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                final var granted = grants.get(roleName);
                return granted != null && granted.remove(permission);
            }
        });
    }

    @Override
    public Uni<Boolean> deleteRole(String roleName, Instant now) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                if (roles.remove(roleName) == null) {
                    return false;
                }
                grants.remove(roleName);
                assignments.values().forEach(held -> held.remove(roleName));
                return true;
            }
        });
    }

    /**
     * Create or replace a role.
     */
    public synchronized void saveRole(Role role) {
        roles.put(role.name(), role);
    }
}
