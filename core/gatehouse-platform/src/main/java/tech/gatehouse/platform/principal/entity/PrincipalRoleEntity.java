package tech.gatehouse.platform.principal.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * JPA entity for principal_roles junction table.
 */
@Entity
@Table(name = "principal_roles")
@IdClass(PrincipalRoleEntity.PrincipalRoleId.class)
public class PrincipalRoleEntity {

    @Id
    @Column(name = "principal_id", length = 17)
    public String principalId;

    @Id
    @Column(name = "role_id", length = 17)
    public String roleId;

    @Column(name = "assigned_at", nullable = false)
    public Instant assignedAt;

    public PrincipalRoleEntity() {
    }

    /**
     * Composite primary key for principal_roles.
     */
    public static class PrincipalRoleId implements Serializable {
        public String principalId;
        public String roleId;

        public PrincipalRoleId() {
        }

        public PrincipalRoleId(String principalId, String roleId) {
            this.principalId = principalId;
            this.roleId = roleId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PrincipalRoleId that = (PrincipalRoleId) o;
            return Objects.equals(principalId, that.principalId) &&
                   Objects.equals(roleId, that.roleId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(principalId, roleId);
        }
    }
}
