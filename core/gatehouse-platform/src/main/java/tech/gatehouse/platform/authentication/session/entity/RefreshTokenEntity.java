package tech.gatehouse.platform.authentication.session.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for refresh_tokens table.
 */
@Entity
@Table(name = "refresh_tokens", indexes = {
    @Index(name = "idx_refresh_tokens_principal", columnList = "principal_id"),
    @Index(name = "idx_refresh_tokens_family", columnList = "family_id")
})
public class RefreshTokenEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64)
    public String tokenHash;

    @Column(name = "principal_id", nullable = false, length = 17)
    public String principalId;

    @Column(name = "family_id", nullable = false, length = 17)
    public String familyId;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "revoked_at")
    public Instant revokedAt;

    @Column(name = "replaced_by", length = 17)
    public String replacedBy;

    @Column(name = "created_by_ip", length = 45)
    public String createdByIp;

    public RefreshTokenEntity() {
    }
}
