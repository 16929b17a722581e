package tech.gatehouse.platform.principal;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Password hashing and verification using Argon2id.
 *
 * Parameters:
 * - Memory: 65536 KiB (64 MiB)
 * - Iterations: 3
 * - Parallelism: 4
 * - Hash length: 32 bytes
 */
@ApplicationScoped
public class PasswordService {

    private static final Logger LOG = Logger.getLogger(PasswordService.class);

    private static final int MEMORY_COST = 65536;  // 64 MiB in KiB
    private static final int ITERATIONS = 3;
    private static final int PARALLELISM = 4;
    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private final Argon2 argon2;

    public PasswordService() {
        this.argon2 = Argon2Factory.create(
            Argon2Factory.Argon2Types.ARGON2id,
            SALT_LENGTH,
            HASH_LENGTH
        );
    }

    /**
     * Hash a password using Argon2id.
     *
     * @param plainPassword The plain text password
     * @return The hash in PHC format ($argon2id$v=19$m=65536,t=3,p=4$...)
     */
    public String hashPassword(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        char[] chars = plainPassword.toCharArray();
        try {
            return argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Verify a password against a stored hash in constant time.
     *
     * @return true if the password matches; false on mismatch, missing input or a malformed hash
     */
    public boolean verifyPassword(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null) {
            return false;
        }
        char[] chars = plainPassword.toCharArray();
        try {
            return argon2.verify(passwordHash, chars);
        } catch (RuntimeException e) {
            LOG.warnf("Stored password hash could not be decoded: %s", e.getMessage());
            return false;
        } finally {
            argon2.wipeArray(chars);
        }
    }
}
