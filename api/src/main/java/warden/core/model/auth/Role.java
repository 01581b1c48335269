package warden.core.model.auth;

import java.util.Objects;

/**
 * A named bundle of permissions.
 *
 * @param name        unique role name
 * @param description human-readable description, may be null
 * @param system      true for built-in roles that cannot be deleted
 */
public record Role(String name, String description, boolean system) {

    public Role {
        Objects.requireNonNull(name, "name cannot be null");
    }
}
