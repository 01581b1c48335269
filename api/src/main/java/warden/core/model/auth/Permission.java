package warden.core.model.auth;

import java.util.Objects;

/**
 * A globally unique (resource, action) pair.
 *
 * <p>Rendered into tokens and cache entries as {@code resource:action}.
 *
 * @param resource the protected resource, e.g. {@code users}
 * @param action   the operation on that resource, e.g. {@code read}
 */
public record Permission(String resource, String action) {

    private static final String SEPARATOR = ":";

    public Permission {
        Objects.requireNonNull(resource, "resource cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
        if (resource.isBlank() || action.isBlank()) {
            throw new IllegalArgumentException("resource and action cannot be blank");
        }
    }

    /**
     * Parse a {@code resource:action} string.
     *
     * @param value the rendered permission
     * @return the permission
     * @throws IllegalArgumentException if the value has no separator
     */
    public static Permission parse(String value) {
        final var index = value == null ? -1 : value.lastIndexOf(SEPARATOR);
        if (index <= 0 || index == value.length() - 1) {
            throw new IllegalArgumentException("Permission must be in resource:action form: " + value);
        }
        return new Permission(value.substring(0, index), value.substring(index + 1));
    }

    /**
     * Render as {@code resource:action}.
     */
    public String value() {
        return resource + SEPARATOR + action;
    }

    @Override
    public String toString() {
        return value();
    }
}
