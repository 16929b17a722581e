package tech.gatehouse.platform.principal;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * An authenticatable identity.
 *
 * <p>Refresh tokens, login history and relationship edges are stored separately
 * and keyed by {@link #id}; a principal never holds references to them.
 *
 * <p>Lock state is derived from {@link #lockedUntil} (see {@link #isLockedAt(Instant)}).
 * The {@link #locked} flag is set when a lockout starts and cleared on the next
 * successful login, but decisions never read it.
 */
public class Principal {

    public String id;

    /**
     * Normalized (trimmed, lower-case) email used as login name.
     */
    public String email;

    public String name;

    /**
     * Argon2id hash in PHC format.
     */
    public String passwordHash;

    public boolean active = true;

    public boolean emailVerified;

    public boolean locked;

    public int failedLoginCount;

    public Instant lockedUntil;

    public Instant lastLoginAt;

    public Set<String> roleIds = new HashSet<>();

    /**
     * Attributes merged into the request context when policies are evaluated.
     */
    public Map<String, String> attributes = new HashMap<>();

    public Instant createdAt;

    public Instant updatedAt;

    public Principal() {
    }

    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    /**
     * Normalize an email for lookup: trimmed and lower-cased.
     */
    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
