package tech.gatehouse.platform.authorization.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for permissions table. (resource, action) is unique.
 */
@Entity
@Table(name = "permissions",
    uniqueConstraints = @UniqueConstraint(name = "uk_permissions_resource_action", columnNames = {"resource", "action"}))
public class PermissionEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "resource", nullable = false, length = 100)
    public String resource;

    @Column(name = "action", nullable = false, length = 100)
    public String action;

    @Column(name = "description", length = 500)
    public String description;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public PermissionEntity() {
    }
}
