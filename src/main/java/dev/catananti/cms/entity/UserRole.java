package dev.catananti.cms.entity;

/**
 * Roles carried in JWT claims, derived from the user's staff and superuser flags.
 */
public enum UserRole {
    ADMIN,
    STAFF,
    USER;

    public boolean matches(String role) {
        return this.name().equalsIgnoreCase(role);
    }

    public static boolean isValid(String role) {
        if (role == null) return false;
        for (UserRole r : values()) {
            if (r.matches(role)) return true;
        }
        return false;
    }
}
