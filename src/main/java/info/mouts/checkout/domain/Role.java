package info.mouts.checkout.domain;

/**
 * Role forwarded by the upstream gateway in the {@code X-User-Role} header.
 */
public enum Role {
    USER,
    ADMIN;

    /**
     * Resolves a header value, falling back to {@link #USER} when the value is
     * missing or unknown.
     *
     * @param value The raw header value.
     * @return The matching role.
     */
    public static Role fromHeader(String value) {
        if (value == null || value.isBlank()) {
            return USER;
        }
        for (Role role : values()) {
            if (role.name().equalsIgnoreCase(value.trim())) {
                return role;
            }
        }
        return USER;
    }
}
