package tech.gatehouse.platform.principal.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for principals table.
 */
@Entity
@Table(name = "principals")
public class PrincipalEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "email", nullable = false, unique = true)
    public String email;

    @Column(name = "name")
    public String name;

    @Column(name = "password_hash")
    public String passwordHash;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "email_verified", nullable = false)
    public boolean emailVerified;

    @Column(name = "locked", nullable = false)
    public boolean locked;

    @Column(name = "failed_login_count", nullable = false)
    public int failedLoginCount;

    @Column(name = "locked_until")
    public Instant lockedUntil;

    @Column(name = "last_login_at")
    public Instant lastLoginAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public PrincipalEntity() {
    }
}
