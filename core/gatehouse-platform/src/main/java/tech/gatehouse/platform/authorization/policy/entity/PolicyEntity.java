package tech.gatehouse.platform.authorization.policy.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import tech.gatehouse.platform.authorization.policy.PolicyEffect;

import java.time.Instant;

/**
 * JPA entity for policies table.
 */
@Entity
@Table(name = "policies")
public class PolicyEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "name", nullable = false, unique = true, length = 200)
    public String name;

    @Column(name = "description", length = 1000)
    public String description;

    @Column(name = "resource", nullable = false, length = 100)
    public String resource;

    @Column(name = "action", nullable = false, length = 100)
    public String action;

    @Column(name = "effect", nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    public PolicyEffect effect;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "conditions", columnDefinition = "jsonb")
    public String conditions;

    @Column(name = "priority", nullable = false)
    public int priority;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public PolicyEntity() {
    }
}
