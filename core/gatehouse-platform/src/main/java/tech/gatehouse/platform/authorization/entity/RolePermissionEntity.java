package tech.gatehouse.platform.authorization.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * JPA entity for role_permissions junction table.
 */
@Entity
@Table(name = "role_permissions")
@IdClass(RolePermissionEntity.RolePermissionId.class)
public class RolePermissionEntity {

    @Id
    @Column(name = "role_id", length = 17)
    public String roleId;

    @Id
    @Column(name = "permission_id", length = 17)
    public String permissionId;

    @Column(name = "granted_at", nullable = false)
    public Instant grantedAt;

    public RolePermissionEntity() {
    }

    /**
     * Composite primary key for role_permissions.
     */
    public static class RolePermissionId implements Serializable {
        public String roleId;
        public String permissionId;

        public RolePermissionId() {
        }

        public RolePermissionId(String roleId, String permissionId) {
            this.roleId = roleId;
            this.permissionId = permissionId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            RolePermissionId that = (RolePermissionId) o;
            return Objects.equals(roleId, that.roleId) &&
                   Objects.equals(permissionId, that.permissionId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(roleId, permissionId);
        }
    }
}
