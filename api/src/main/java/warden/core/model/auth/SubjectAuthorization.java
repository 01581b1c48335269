package warden.core.model.auth;

import java.util.List;

/**
 * The resolved (roles, permissions) snapshot for a subject.
 *
 * <p>Both lists are sorted and free of duplicates so that equal snapshots
 * serialize identically in tokens and cache entries.
 *
 * @param roles       role names
 * @param permissions permissions rendered as {@code resource:action}
 */
public record SubjectAuthorization(List<String> roles, List<String> permissions) {

    public SubjectAuthorization {
        roles = roles == null ? List.of() : roles.stream().distinct().sorted().toList();
        permissions = permissions == null
                ? List.of()
                : permissions.stream().distinct().sorted().toList();
    }

    public static SubjectAuthorization empty() {
        return new SubjectAuthorization(List.of(), List.of());
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }
}
