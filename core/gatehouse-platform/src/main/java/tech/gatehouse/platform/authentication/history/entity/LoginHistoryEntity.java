package tech.gatehouse.platform.authentication.history.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import tech.gatehouse.platform.authentication.history.LoginOutcome;

import java.time.Instant;

/**
 * JPA entity for login_history table.
 */
@Entity
@Table(name = "login_history", indexes = {
    @Index(name = "idx_login_history_principal_time", columnList = "principal_id, attempted_at")
})
public class LoginHistoryEntity {

    @Id
    @Column(name = "id", length = 13)
    public String id;

    @Column(name = "principal_id", nullable = false, length = 17)
    public String principalId;

    @Column(name = "outcome", nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    public LoginOutcome outcome;

    @Column(name = "ip_address", length = 45)
    public String ipAddress;

    @Column(name = "user_agent", length = 500)
    public String userAgent;

    @Column(name = "attempted_at", nullable = false)
    public Instant attemptedAt;

    public LoginHistoryEntity() {
    }
}
