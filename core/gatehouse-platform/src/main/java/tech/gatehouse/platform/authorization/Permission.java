package tech.gatehouse.platform.authorization;

import java.util.Objects;

/**
 * A (resource, action) pair. Its canonical string form is {@code resource:action}.
 */
public record Permission(String resource, String action) {

    public static final String SEPARATOR = ":";

    public Permission {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(action, "action");
    }

    public String canonical() {
        return canonical(resource, action);
    }

    public static String canonical(String resource, String action) {
        return resource + SEPARATOR + action;
    }
}
