package tech.gatehouse.platform.principal.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

import java.io.Serializable;
import java.util.Objects;

/**
 * JPA entity for principal_attributes table (one row per key).
 */
@Entity
@Table(name = "principal_attributes")
@IdClass(PrincipalAttributeEntity.PrincipalAttributeId.class)
public class PrincipalAttributeEntity {

    @Id
    @Column(name = "principal_id", length = 17)
    public String principalId;

    @Id
    @Column(name = "attribute_key", length = 100)
    public String attributeKey;

    @Column(name = "attribute_value", length = 1000)
    public String attributeValue;

    public PrincipalAttributeEntity() {
    }

    /**
     * Composite primary key for principal_attributes.
     */
    public static class PrincipalAttributeId implements Serializable {
        public String principalId;
        public String attributeKey;

        public PrincipalAttributeId() {
        }

        public PrincipalAttributeId(String principalId, String attributeKey) {
            this.principalId = principalId;
            this.attributeKey = attributeKey;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PrincipalAttributeId that = (PrincipalAttributeId) o;
            return Objects.equals(principalId, that.principalId) &&
                   Objects.equals(attributeKey, that.attributeKey);
        }

        @Override
        public int hashCode() {
            return Objects.hash(principalId, attributeKey);
        }
    }
}
